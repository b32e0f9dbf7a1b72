package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.BiddingHelper;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * Takeout doubles of an opponent's suit bid, plus the penalty double of a 1NT opening.
 * <p>
 * Classic shape: 12+ HCP, at most two cards in every suit the opponents have bid and three or more in
 * every unbid suit. Any hand with 19+ HCP doubles first regardless of shape. Doubles at the three level
 * or higher need 14+. In the balancing seat 8 HCP is enough.
 */
public class TakeoutDoubles implements ConventionModule {

    static final int MIN_HCP = 12;
    static final int BALANCING_MIN_HCP = 8;
    static final int HIGH_LEVEL_MIN_HCP = 14;
    static final int STRONG_HCP = 19;

    @Override
    public Convention convention() {
        return Convention.TAKEOUT_DOUBLES;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.COMPETITIVE
                || !features.getMyBids().isEmpty()
                || !features.getOurSuits().isEmpty()
                || !BiddingHelper.isLegal(Bid.DOUBLE, features)) {
            return Optional.empty();
        }
        Bid theirBid = features.getLastContractBid().orElseThrow();
        int hcp = features.getHcp();

        if (theirBid.strain().isNotrump()) {
            if (theirBid.level() == 1 && hcp >= 15) {
                return Suggestion.of(Bid.DOUBLE, "Penalty double of 1NT: " + hcp + " HCP");
            }
            return Optional.empty();
        }

        if (hcp >= STRONG_HCP) {
            return Suggestion.of(Bid.DOUBLE, "Strong takeout double: " + hcp + " HCP");
        }
        int needed = features.isBalancingSeat() ? BALANCING_MIN_HCP
                : theirBid.level() >= 3 ? HIGH_LEVEL_MIN_HCP : MIN_HCP;
        if (hcp < needed || !hasTakeoutShape(features)) {
            return Optional.empty();
        }
        String where = features.isBalancingSeat() ? " in the balancing seat" : "";
        return Suggestion.of(Bid.DOUBLE, "Takeout double" + where + ": " + hcp + " HCP, support for the unbid suits");
    }

    static boolean hasTakeoutShape(HandFeatures features) {
        for (Suit suit : Suit.values()) {
            boolean theirs = features.getTheirSuits().contains(suit);
            int length = features.length(suit);
            if (theirs && length > 2) {
                return false;
            }
            if (!theirs && length < 3) {
                return false;
            }
        }
        return true;
    }
}
