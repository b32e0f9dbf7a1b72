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
 * Michaels cuebid: a direct cuebid of the opponents' one-level suit showing two five-card suits.
 * <ul>
 *   <li>Over a minor: both majors.</li>
 *   <li>Over a major: the other major and an unspecified minor.</li>
 * </ul>
 * Also handles partner's advance and the 2NT ask for the minor.
 */
public class MichaelsCuebid implements ConventionModule {

    static final int MIN_HCP = 8;
    static final int MAX_HCP = 16;

    @Override
    public Convention convention() {
        return Convention.MICHAELS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.COMPETITIVE || features.getOpeningBid().isEmpty()) {
            return Optional.empty();
        }
        Bid opening = features.getOpeningBid().get();
        if (opening.level() != 1 || opening.strain().isNotrump()) {
            return Optional.empty();
        }
        Suit theirSuit = opening.strain().suit().orElseThrow();
        Bid cue = Bid.of(2, theirSuit);

        if (features.getMyBids().isEmpty() && features.getPartnerCalls().isEmpty()) {
            return makeCuebid(features, theirSuit, cue, opening);
        }
        if (features.getMyBids().isEmpty() && features.getPartnerCalls().equals(List.of(cue))) {
            return advance(features, theirSuit);
        }
        if (features.getMyBids().equals(List.of(cue))
                && features.getPartnerLastBid().equals(Optional.of(Bid.of(2, Strain.NOTRUMP)))
                && theirSuit.isMajor()) {
            Suit minor = features.length(Suit.CLUBS) >= features.length(Suit.DIAMONDS) ? Suit.CLUBS : Suit.DIAMONDS;
            return Suggestion.of(Bid.of(3, minor), "Showing the minor after Michaels: " + minor);
        }
        return Optional.empty();
    }

    private Optional<Suggestion> makeCuebid(HandFeatures features, Suit theirSuit, Bid cue, Bid opening) {
        if (!features.getLastContractBid().equals(Optional.of(opening)) || !BiddingHelper.isLegal(cue, features)) {
            return Optional.empty();
        }
        int hcp = features.getHcp();
        if (hcp < MIN_HCP || hcp > MAX_HCP) {
            return Optional.empty();
        }
        if (theirSuit.isMinor()) {
            if (features.length(Suit.HEARTS) >= 5 && features.length(Suit.SPADES) >= 5) {
                return Suggestion.of(cue, "Michaels: 5-5 in both majors");
            }
            return Optional.empty();
        }
        Suit otherMajor = theirSuit.partnerSuit();
        if (features.length(otherMajor) >= 5
                && (features.length(Suit.CLUBS) >= 5 || features.length(Suit.DIAMONDS) >= 5)) {
            return Suggestion.of(cue, "Michaels: 5-5 in " + otherMajor + " and a minor");
        }
        return Optional.empty();
    }

    private Optional<Suggestion> advance(HandFeatures features, Suit theirSuit) {
        int hcp = features.getHcp();
        if (theirSuit.isMinor()) {
            Suit major = features.length(Suit.SPADES) > features.length(Suit.HEARTS) ? Suit.SPADES : Suit.HEARTS;
            return raiseMajor(features, major);
        }
        Suit otherMajor = theirSuit.partnerSuit();
        if (features.length(otherMajor) >= 3) {
            return raiseMajor(features, otherMajor);
        }
        if (hcp >= 6) {
            return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Asking for partner's minor");
        }
        return BiddingHelper.cheapest(otherMajor, features)
                .map(bid -> new Suggestion(bid, "Forced preference to " + otherMajor));
    }

    private Optional<Suggestion> raiseMajor(HandFeatures features, Suit major) {
        int hcp = features.getHcp();
        int support = features.length(major);
        if (hcp >= 11 && support >= 4) {
            return Suggestion.of(Bid.of(4, major), "Game in " + major + " opposite Michaels");
        }
        if (hcp >= 9 && support >= 3) {
            return Suggestion.of(Bid.of(3, major), "Invitational raise in " + major + " opposite Michaels");
        }
        return BiddingHelper.cheapest(major, features)
                .map(bid -> new Suggestion(bid, "Choosing " + major + " opposite Michaels"));
    }
}
