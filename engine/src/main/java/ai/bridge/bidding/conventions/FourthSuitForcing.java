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
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fourth suit forcing: after our side has bid three suits in an uncontested auction, responder bids
 * the fourth with 12+ HCP and no clear descriptive bid. Opener answers by raising responder's suit,
 * bidding notrump with a stopper, or rebidding a long suit.
 */
public class FourthSuitForcing implements ConventionModule {

    static final int MIN_HCP = 12;

    @Override
    public Convention convention() {
        return Convention.FOURTH_SUIT_FORCING;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (!features.getTheirSuits().isEmpty() || features.getLastContractBidder().isEmpty()) {
            return Optional.empty();
        }
        if (features.getState() == AuctionState.PARTNERSHIP_REBID) {
            return bidFourthSuit(hand, features);
        }
        if (features.getState() == AuctionState.OPENER_REBID) {
            return answerFourthSuit(hand, features);
        }
        return Optional.empty();
    }

    private Optional<Suggestion> bidFourthSuit(Hand hand, HandFeatures features) {
        List<Bid> partner = features.getPartnerCalls();
        List<Bid> mine = features.getMyBids();
        if (partner.size() != 2 || mine.size() != 1 || features.getHcp() < MIN_HCP) {
            return Optional.empty();
        }
        Optional<Suit> first = BiddingHelper.suitOf(partner.get(0));
        Optional<Suit> response = BiddingHelper.suitOf(mine.get(0));
        Optional<Suit> second = BiddingHelper.suitOf(partner.get(1));
        if (first.isEmpty() || response.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        Set<Suit> bid = EnumSet.of(first.get(), response.get(), second.get());
        if (bid.size() != 3) {
            return Optional.empty();
        }
        Suit fourth = EnumSet.complementOf(EnumSet.copyOf(bid)).iterator().next();
        if (features.length(second.get()) >= 4
                || (first.get().isMajor() && features.length(first.get()) >= 3)
                || features.length(response.get()) >= 6
                || (BiddingHelper.hasStopper(hand, fourth) && features.isBalanced())) {
            return Optional.empty();
        }
        return BiddingHelper.cheapest(fourth, features)
                .filter(b -> b.level() <= 3)
                .map(b -> new Suggestion(b, "Fourth suit forcing: " + features.getHcp() + " HCP, game forcing"));
    }

    private Optional<Suggestion> answerFourthSuit(Hand hand, HandFeatures features) {
        List<Bid> mine = features.getMyBids();
        List<Bid> partner = features.getPartnerCalls();
        if (mine.size() != 2 || partner.size() != 2) {
            return Optional.empty();
        }
        Optional<Suit> first = BiddingHelper.suitOf(mine.get(0));
        Optional<Suit> second = BiddingHelper.suitOf(mine.get(1));
        Optional<Suit> response = BiddingHelper.suitOf(partner.get(0));
        Optional<Suit> fourth = BiddingHelper.suitOf(partner.get(1));
        if (first.isEmpty() || second.isEmpty() || response.isEmpty() || fourth.isEmpty()) {
            return Optional.empty();
        }
        if (EnumSet.of(first.get(), second.get(), response.get(), fourth.get()).size() != 4) {
            return Optional.empty();
        }
        if (features.length(response.get()) >= 3) {
            return BiddingHelper.cheapest(response.get(), features)
                    .map(b -> new Suggestion(b, "Showing 3-card support for partner's " + response.get()));
        }
        if (BiddingHelper.hasStopper(hand, fourth.get())) {
            return BiddingHelper.cheapest(Strain.NOTRUMP, features)
                    .map(b -> new Suggestion(b, "Notrump with a stopper in " + fourth.get()));
        }
        if (features.length(first.get()) >= 6) {
            return BiddingHelper.cheapest(first.get(), features)
                    .map(b -> new Suggestion(b, "Rebidding the 6-card " + first.get()));
        }
        if (features.length(second.get()) >= 5) {
            return BiddingHelper.cheapest(second.get(), features)
                    .map(b -> new Suggestion(b, "Showing 5 cards in " + second.get()));
        }
        return BiddingHelper.cheapest(first.get(), features)
                .map(b -> new Suggestion(b, "No stopper in " + fourth.get() + "; rebidding " + first.get()));
    }
}
