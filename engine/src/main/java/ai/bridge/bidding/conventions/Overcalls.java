package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.BiddingHelper;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Natural overcalls after the opponents open: 1NT (15-18 with a stopper), simple suit overcalls,
 * and weak jump overcalls.
 * <p>
 * In the balancing seat the requirements drop by about a king: 1NT shows 11-14 and a one-level
 * suit overcall needs only 7 HCP.
 */
public class Overcalls implements ConventionModule {

    @Override
    public Convention convention() {
        return Convention.OVERCALLS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.COMPETITIVE || features.getLastContractBid().isEmpty()) {
            return Optional.empty();
        }
        Bid theirBid = features.getLastContractBid().get();
        if (features.getLastContractBidder().map(seat -> !seat.isOpponentOf(features.getSeat())).orElse(true)) {
            return Optional.empty();
        }
        int hcp = features.getHcp();
        boolean balancing = features.isBalancingSeat();
        int discount = balancing ? 3 : 0;

        boolean stopped = features.getTheirSuits().stream().allMatch(s -> BiddingHelper.hasStopper(hand, s));
        if (theirBid.level() == 1 && !theirBid.strain().isNotrump() && features.isBalanced() && stopped
                && hcp >= 15 - discount && hcp <= 18 - discount) {
            String range = balancing ? "11-14 in the balancing seat" : "15-18";
            return Suggestion.of(Bid.of(1, Strain.NOTRUMP), "1NT overcall: " + range + " with a stopper");
        }

        Optional<Suit> suit = bestSuit(hand, features);
        if (suit.isEmpty()) {
            return Optional.empty();
        }
        Suit chosen = suit.get();
        int length = features.length(chosen);
        Optional<Bid> cheapest = BiddingHelper.cheapest(chosen, features);
        if (cheapest.isEmpty()) {
            return Optional.empty();
        }
        int level = cheapest.get().level();

        if (!balancing && theirBid.level() == 1 && length >= 6 && hcp >= 6 && hcp <= 10 && level <= 2) {
            Bid jump = Bid.of(level + 1, chosen);
            return Suggestion.of(jump, "Weak jump overcall: 6-card " + chosen + ", " + hcp + " HCP");
        }
        if (level == 1 && hcp >= 8 - (balancing ? 1 : 0) && hcp <= 17) {
            return Suggestion.of(cheapest.get(), "Overcall: " + length + "-card " + chosen + ", " + hcp + " HCP");
        }
        if (level == 2 && hcp >= 11 - discount && hcp <= 17
                && (length >= 6 || BiddingHelper.isGoodSuit(hand, chosen))) {
            return Suggestion.of(cheapest.get(), "Two-level overcall: " + length + "-card " + chosen + ", " + hcp + " HCP");
        }
        if (level == 3 && hcp >= 13 - discount && length >= 6 && BiddingHelper.isGoodSuit(hand, chosen)) {
            return Suggestion.of(cheapest.get(), "Three-level overcall with a good 6-card " + chosen);
        }
        return Optional.empty();
    }

    /**
     * Longest unbid five-card suit with at least one top honour, or any six-card suit.
     */
    private static Optional<Suit> bestSuit(Hand hand, HandFeatures features) {
        List<Suit> candidates = new ArrayList<>();
        for (Suit suit : Suit.values()) {
            int length = features.length(suit);
            if (features.getTheirSuits().contains(suit) || length < 5) {
                continue;
            }
            if (length >= 6 || BiddingHelper.topHonours(hand, suit) >= 1) {
                candidates.add(suit);
            }
        }
        return BiddingHelper.longestOf(features.getLengths(), candidates);
    }
}
