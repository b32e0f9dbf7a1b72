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
 * Responder's second and later calls: placing the contract from combined strength, rebidding a
 * long suit opposite a 1NT rebid, and giving preference between opener's two suits.
 */
public class ResponderRebids implements ConventionModule {

    @Override
    public Convention convention() {
        return Convention.RESPONDER_REBIDS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.PARTNERSHIP_REBID) {
            return Optional.empty();
        }
        Optional<Bid> partnerLast = features.getPartnerLastBid();
        Optional<Bid> myFirst = features.getMyFirstBid();
        if (partnerLast.isEmpty() || myFirst.isEmpty()) {
            return Optional.empty();
        }

        if (partnerLast.get().equals(Bid.of(1, Strain.NOTRUMP)) && features.getPartnerCalls().size() >= 2) {
            Optional<Suit> mySuit = BiddingHelper.suitOf(myFirst.get());
            if (mySuit.isPresent() && features.length(mySuit.get()) >= 6) {
                return longSuitOverNotrumpRebid(features, mySuit.get());
            }
        }

        Optional<Suggestion> placed = ContractPlacement.place(hand, features);
        if (placed.isPresent() && !placed.get().bid().isPass()) {
            return placed;
        }
        if (isNewSuitByOpener(features, partnerLast.get())) {
            return preference(features);
        }
        return placed;
    }

    private Optional<Suggestion> longSuitOverNotrumpRebid(HandFeatures features, Suit suit) {
        int total = features.getTotalPoints();
        if (total >= 13) {
            Bid game = suit.isMajor() ? Bid.of(4, suit) : Bid.of(3, Strain.NOTRUMP);
            return Suggestion.of(game, "Game with a 6-card " + suit + " opposite a 1NT rebid");
        }
        if (total >= 10) {
            return Suggestion.of(Bid.of(3, suit), "Invitational jump rebid in " + suit);
        }
        return Suggestion.of(Bid.of(2, suit), "Signing off in the 6-card " + suit);
    }

    private static boolean isNewSuitByOpener(HandFeatures features, Bid partnerLast) {
        List<Bid> partnerCalls = features.getPartnerCalls();
        if (partnerCalls.size() < 2 || partnerLast.strain().isNotrump()) {
            return false;
        }
        for (int i = 0; i < partnerCalls.size() - 1; i++) {
            if (partnerCalls.get(i).isContract() && partnerCalls.get(i).strain() == partnerLast.strain()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Opener showed two suits: return to the first unless the second is longer in our hand.
     */
    private Optional<Suggestion> preference(HandFeatures features) {
        Bid first = features.getOpeningBid().orElseThrow();
        Bid second = features.getPartnerLastBid().orElseThrow();
        Optional<Suit> firstSuit = BiddingHelper.suitOf(first);
        Optional<Suit> secondSuit = BiddingHelper.suitOf(second);
        if (firstSuit.isEmpty() || secondSuit.isEmpty()) {
            return Suggestion.of(Bid.PASS, "No preference to give");
        }
        if (features.length(secondSuit.get()) > features.length(firstSuit.get())) {
            return Suggestion.of(Bid.PASS, "Passing partner's second suit with better length there");
        }
        return BiddingHelper.cheapest(firstSuit.get(), features)
                .map(bid -> new Suggestion(bid, "Preference to partner's first suit"));
    }
}
