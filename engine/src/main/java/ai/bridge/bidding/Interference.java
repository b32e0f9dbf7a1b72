package ai.bridge.bidding;

import ai.bridge.auction.Bid;
import ai.bridge.game.Seat;

/**
 * Describes an opponent's action between partner's last call and the current turn.
 *
 * @param type what the opponent did
 * @param seat the interfering seat, {@code null} when there was none
 * @param bid  the interfering call, {@code null} when there was none
 */
public record Interference(Type type, Seat seat, Bid bid) {

    /** Kinds of interference. */
    public enum Type {
        NONE,
        SUIT_BID,
        NOTRUMP_BID,
        DOUBLE,
        REDOUBLE
    }

    public static final Interference NONE = new Interference(Type.NONE, null, null);

    /**
     * Classifies an opponent's call.
     *
     * @param seat the opponent
     * @param bid  the call they made
     * @return the interference, or {@link #NONE} for a pass
     */
    public static Interference of(Seat seat, Bid bid) {
        return switch (bid.type()) {
            case PASS -> NONE;
            case DOUBLE -> new Interference(Type.DOUBLE, seat, bid);
            case REDOUBLE -> new Interference(Type.REDOUBLE, seat, bid);
            case CONTRACT -> new Interference(
                    bid.strain().isNotrump() ? Type.NOTRUMP_BID : Type.SUIT_BID, seat, bid);
        };
    }

    public boolean isPresent() {
        return type != Type.NONE;
    }

    /**
     * Returns the level of an interfering contract bid.
     *
     * @return 1–7, or 0 when the interference was not a contract bid
     */
    public int level() {
        return bid != null && bid.isContract() ? bid.level() : 0;
    }
}
