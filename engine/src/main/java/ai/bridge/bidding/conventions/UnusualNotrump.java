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
import java.util.List;
import java.util.Optional;

/**
 * Unusual 2NT: a jump to 2NT over a one-level major opening shows 5-5 or better in the minors,
 * either weak (6-11 HCP) or strong (17+). Partner picks the longer minor.
 */
public class UnusualNotrump implements ConventionModule {

    private static final Bid UNUSUAL = Bid.of(2, Strain.NOTRUMP);

    @Override
    public Convention convention() {
        return Convention.UNUSUAL_NOTRUMP;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.COMPETITIVE || features.getOpeningBid().isEmpty()) {
            return Optional.empty();
        }
        Bid opening = features.getOpeningBid().get();
        if (opening.level() != 1 || !opening.strain().isMajor()) {
            return Optional.empty();
        }
        if (features.getMyBids().isEmpty() && features.getPartnerCalls().isEmpty()) {
            return showMinors(features, opening);
        }
        if (features.getMyBids().isEmpty() && features.getPartnerCalls().equals(List.of(UNUSUAL))) {
            return pickMinor(features);
        }
        return Optional.empty();
    }

    private Optional<Suggestion> showMinors(HandFeatures features, Bid opening) {
        if (!features.getLastContractBid().equals(Optional.of(opening)) || !BiddingHelper.isLegal(UNUSUAL, features)) {
            return Optional.empty();
        }
        int hcp = features.getHcp();
        boolean shape = features.length(Suit.CLUBS) >= 5 && features.length(Suit.DIAMONDS) >= 5;
        boolean strength = (hcp >= 6 && hcp <= 11) || hcp >= 17;
        if (shape && strength) {
            return Suggestion.of(UNUSUAL, "Unusual 2NT: both minors, " + hcp + " HCP");
        }
        return Optional.empty();
    }

    private Optional<Suggestion> pickMinor(HandFeatures features) {
        Suit minor = features.length(Suit.DIAMONDS) > features.length(Suit.CLUBS) ? Suit.DIAMONDS : Suit.CLUBS;
        if (features.getHcp() >= 13 && features.length(minor) >= 4) {
            return Suggestion.of(Bid.of(5, minor), "Game in " + minor + " opposite the unusual 2NT");
        }
        return BiddingHelper.cheapest(minor, features)
                .map(bid -> new Suggestion(bid, "Choosing " + minor + " opposite the unusual 2NT"));
    }
}
