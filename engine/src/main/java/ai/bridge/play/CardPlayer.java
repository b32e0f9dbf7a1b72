package ai.bridge.play;

/**
 * Chooses a card for the seat whose turn it is in a play position.
 */
public interface CardPlayer {

    /**
     * Choose the next card.
     *
     * @param state the current position; {@link PlayState#getNextToPlay()} is the seat to act
     * @return a legal card and how it was chosen
     * @throws NoLegalCardException if the next seat has no card to play
     */
    CardDecision choose(PlayState state);
}
