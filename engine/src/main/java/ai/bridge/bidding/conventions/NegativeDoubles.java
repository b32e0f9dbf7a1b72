package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.BiddingHelper;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Interference;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * Negative doubles by responder after an overcall of partner's opening, and responsive doubles by
 * advancer after partner's takeout double is raised.
 * <p>
 * A negative double promises four cards in an unbid major and at least 6 HCP through the two level,
 * 8 at the three level and 12 higher up. A responsive double shows two unbid suits of four or more
 * cards each and no five-card major.
 */
public class NegativeDoubles implements ConventionModule {

    @Override
    public Convention convention() {
        return Convention.NEGATIVE_DOUBLES;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (!features.getMyBids().isEmpty() || !BiddingHelper.isLegal(Bid.DOUBLE, features)) {
            return Optional.empty();
        }
        if (features.getState() == AuctionState.PARTNERSHIP_RESPONSE) {
            return negativeDouble(features);
        }
        if (features.getState() == AuctionState.COMPETITIVE) {
            return responsiveDouble(features);
        }
        return Optional.empty();
    }

    static int minimumHcp(int level) {
        if (level <= 2) {
            return 6;
        }
        return level == 3 ? 8 : 12;
    }

    private Optional<Suggestion> negativeDouble(HandFeatures features) {
        Optional<Bid> opening = features.getOpeningBid();
        Interference interference = features.getInterference();
        if (opening.isEmpty() || opening.get().level() != 1 || opening.get().strain().isNotrump()
                || interference.type() != Interference.Type.SUIT_BID) {
            return Optional.empty();
        }
        int level = interference.level();
        if (features.getHcp() < minimumHcp(level)) {
            return Optional.empty();
        }
        for (Suit major : new Suit[] {Suit.HEARTS, Suit.SPADES}) {
            boolean unbid = !features.getOurSuits().contains(major) && !features.getTheirSuits().contains(major);
            if (!unbid || features.length(major) < 4) {
                continue;
            }
            boolean naturalBidBetter = features.length(major) >= 5
                    && BiddingHelper.cheapest(major, features).map(bid -> bid.level() == 1).orElse(false);
            if (!naturalBidBetter) {
                return Suggestion.of(Bid.DOUBLE, "Negative double: 4+ " + major + ", " + features.getHcp() + " HCP");
            }
        }
        return Optional.empty();
    }

    private Optional<Suggestion> responsiveDouble(HandFeatures features) {
        Optional<Bid> partnerCall = features.getPartnerLastCall();
        Optional<Bid> opening = features.getOpeningBid();
        Interference interference = features.getInterference();
        if (partnerCall.isEmpty() || !partnerCall.get().isDouble() || opening.isEmpty()
                || interference.type() != Interference.Type.SUIT_BID
                || interference.bid().strain() != opening.get().strain()) {
            return Optional.empty();
        }
        if (features.getHcp() < minimumHcp(interference.level())) {
            return Optional.empty();
        }
        int fourCardSuits = 0;
        for (Suit suit : Suit.values()) {
            if (features.getTheirSuits().contains(suit)) {
                continue;
            }
            if (suit.isMajor() && features.length(suit) >= 5) {
                return Optional.empty();
            }
            if (features.length(suit) >= 4) {
                fourCardSuits++;
            }
        }
        if (fourCardSuits >= 2) {
            return Suggestion.of(Bid.DOUBLE, "Responsive double: two unbid suits after the opponents raised");
        }
        return Optional.empty();
    }
}
