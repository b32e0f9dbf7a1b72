package ai.bridge.auction;

import ai.bridge.game.Seat;
import java.util.Optional;

/**
 * Static helpers that decide whether a call is legal and repair illegal suggestions.
 * <p>
 * Legality is always checked for the seat whose turn it is in the auction:
 * <ul>
 *   <li>Pass is always legal.</li>
 *   <li>A contract bid must be strictly higher than the last contract bid.</li>
 *   <li>Double is legal when the last non-pass call is a contract bid by an opponent.</li>
 *   <li>Redouble is legal when the last non-pass call is an opponent's Double.</li>
 * </ul>
 */
public final class BidLegality {

    /** Default number of levels a suggestion may be raised during repair. */
    public static final int DEFAULT_MAX_REPAIR_LEVELS = 2;

    private BidLegality() {
        // Utility class.
    }

    /**
     * Checks whether a call is legal for the next seat to call.
     *
     * @param bid     the candidate call
     * @param auction the auction so far
     * @return {@code true} if the call may be made
     */
    public static boolean isLegal(Bid bid, Auction auction) {
        if (auction.isComplete()) {
            return false;
        }
        Seat caller = auction.nextSeat();
        return switch (bid.type()) {
            case PASS -> true;
            case CONTRACT -> auction.lastContractBid().map(bid::isHigherThan).orElse(true);
            case DOUBLE -> auction.lastNonPass()
                    .filter(call -> call.bid().isContract())
                    .filter(call -> call.seat().isOpponentOf(caller))
                    .isPresent();
            case REDOUBLE -> auction.lastNonPass()
                    .filter(call -> call.bid().isDouble())
                    .filter(call -> call.seat().isOpponentOf(caller))
                    .isPresent();
        };
    }

    /**
     * Returns the lowest legal contract bid in a strain.
     *
     * @param strain  the strain wanted
     * @param auction the auction so far
     * @return the cheapest legal bid in that strain, or empty if even 7 is too low
     */
    public static Optional<Bid> lowestLegal(Strain strain, Auction auction) {
        for (int level = 1; level <= 7; level++) {
            Bid candidate = Bid.of(level, strain);
            if (isLegal(candidate, auction)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Repairs a suggested call so that it is legal.
     * <p>
     * Legal calls are returned unchanged. An illegal contract bid becomes the lowest legal bid of the
     * same strain, provided that is at most {@code maxLevels} above the suggestion; otherwise the
     * repair gives up and returns Pass. An illegal Double or Redouble becomes Pass.
     *
     * @param suggested the raw suggestion
     * @param auction   the auction so far
     * @param maxLevels how far the level may be raised
     * @return a legal call
     */
    public static Bid repair(Bid suggested, Auction auction, int maxLevels) {
        if (isLegal(suggested, auction)) {
            return suggested;
        }
        if (!suggested.isContract()) {
            return Bid.PASS;
        }
        return lowestLegal(suggested.strain(), auction)
                .filter(bid -> bid.level() - suggested.level() <= maxLevels)
                .orElse(Bid.PASS);
    }

    public static Bid repair(Bid suggested, Auction auction) {
        return repair(suggested, auction, DEFAULT_MAX_REPAIR_LEVELS);
    }
}
