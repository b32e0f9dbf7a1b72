package ai.bridge.play;

/**
 * Raised when a card is requested for a position in which the next seat has nothing to play,
 * either because the hand is over or because the position is corrupt.
 */
public class NoLegalCardException extends IllegalStateException {

    public NoLegalCardException(String message) {
        super(message);
    }
}
