package ai.bridge.bidding;

import ai.bridge.auction.Bid;
import ai.bridge.config.BiddingProperties;
import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * Sanity checks for a bid that legality repair has pushed above what a module suggested.
 * <p>
 * A repaired slam needs the combined strength for that slam, and a repaired game in a major needs
 * at least three trumps in the bidder's hand. A repair that fails either check becomes Pass.
 */
public final class BidSafety {

    static final int MIN_MAJOR_GAME_TRUMPS = 3;

    private BidSafety() {
        // Utility class.
    }

    /**
     * Checks a repaired bid against the bidder's strength and trump holding.
     *
     * @param repaired   the bid after legality repair
     * @param features   the bidder's features
     * @param thresholds combined-point thresholds for slams
     * @return the reason the bid is unsafe, or empty if it may stand
     */
    public static Optional<String> check(Bid repaired, HandFeatures features, BiddingProperties.Slam thresholds) {
        if (!repaired.isContract()) {
            return Optional.empty();
        }
        int combined = features.getCombinedPoints();
        if (repaired.level() == 6 && combined < thresholds.getSmallSlam()) {
            return Optional.of("repaired to " + repaired + " with only " + combined + " combined points");
        }
        if (repaired.level() == 7 && combined < thresholds.getGrandSlam()) {
            return Optional.of("repaired to " + repaired + " with only " + combined + " combined points");
        }
        if (repaired.level() == 4 && repaired.strain().suit().filter(Suit::isMajor).isPresent()) {
            int trumps = features.length(repaired.strain().suit().get());
            if (trumps < MIN_MAJOR_GAME_TRUMPS) {
                return Optional.of("repaired to " + repaired + " holding only " + trumps + " trumps");
            }
        }
        return Optional.empty();
    }
}
