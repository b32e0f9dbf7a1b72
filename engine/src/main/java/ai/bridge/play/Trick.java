package ai.bridge.play;

import ai.bridge.game.Suit;
import java.util.List;
import java.util.Optional;

/**
 * A completed trick of four cards.
 *
 * @param cards  the cards in playing order; the first was led
 * @param winner the card that won the trick
 */
public record Trick(List<PlayedCard> cards, PlayedCard winner) {

    public Trick {
        cards = List.copyOf(cards);
        if (cards.size() != 4) {
            throw new IllegalArgumentException("A trick has four cards: " + cards);
        }
    }

    public PlayedCard lead() {
        return cards.get(0);
    }

    /**
     * Finds the card currently winning a (possibly incomplete) trick: the highest trump if any
     * was played, otherwise the highest card of the suit led.
     *
     * @param cards the cards played so far, led card first
     * @param trump the trump suit, or empty at notrump
     * @return the winning card, or empty for an empty trick
     */
    public static Optional<PlayedCard> winning(List<PlayedCard> cards, Optional<Suit> trump) {
        if (cards.isEmpty()) {
            return Optional.empty();
        }
        PlayedCard best = cards.get(0);
        for (PlayedCard played : cards.subList(1, cards.size())) {
            if (beats(played, best, trump)) {
                best = played;
            }
        }
        return Optional.of(best);
    }

    private static boolean beats(PlayedCard challenger, PlayedCard current, Optional<Suit> trump) {
        Suit suit = challenger.card().getSuit();
        if (suit == current.card().getSuit()) {
            return challenger.card().beatsInSuit(current.card());
        }
        return trump.filter(t -> t == suit).isPresent();
    }

    @Override
    public String toString() {
        return cards + " won by " + winner.seat();
    }
}
