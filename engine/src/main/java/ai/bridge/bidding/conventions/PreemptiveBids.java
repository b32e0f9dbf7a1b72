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
import ai.bridge.game.Rank;
import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * Weak two bids (2♦, 2♥, 2♠), three- and four-level preempts, and the weak-two opener's answer
 * to partner's 2NT feature ask.
 * <p>
 * All preempts need 6-10 HCP. A weak two needs a six-card suit with two of the top three honours,
 * no void and no four-card side major. Seven cards open at the three level, eight at the four level.
 * Nobody preempts in fourth seat.
 */
public class PreemptiveBids implements ConventionModule {

    static final int MIN_HCP = 6;
    static final int MAX_HCP = 10;

    @Override
    public Convention convention() {
        return Convention.PREEMPTS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() == AuctionState.OPENING) {
            return openingPreempt(hand, features);
        }
        if (features.getState() == AuctionState.OPENER_REBID) {
            return answerFeatureAsk(hand, features);
        }
        return Optional.empty();
    }

    private Optional<Suggestion> openingPreempt(Hand hand, HandFeatures features) {
        int hcp = features.getHcp();
        if (hcp < MIN_HCP || hcp > MAX_HCP || features.getAuction().size() == 3) {
            return Optional.empty();
        }
        Suit suit = BiddingHelper.longestSuit(features.getLengths());
        int length = features.length(suit);
        if (length >= 8) {
            return Suggestion.of(Bid.of(4, suit), "Preempt: " + length + "-card " + suit + " suit, " + hcp + " HCP");
        }
        if (length == 7 && honourCount(hand, suit) >= 2) {
            return Suggestion.of(Bid.of(3, suit), "Preempt: 7-card " + suit + " suit, " + hcp + " HCP");
        }
        if (length == 6 && suit != Suit.CLUBS && isWeakTwoHand(hand, features, suit)) {
            return Suggestion.of(Bid.of(2, suit), "Weak two: 6-card " + suit + " suit, " + hcp + " HCP");
        }
        return Optional.empty();
    }

    static boolean isWeakTwoHand(Hand hand, HandFeatures features, Suit suit) {
        for (Suit other : Suit.values()) {
            if (other == suit) {
                continue;
            }
            if (features.length(other) == 0) {
                return false;
            }
            if (other.isMajor() && features.length(other) >= 4) {
                return false;
            }
        }
        return BiddingHelper.topHonours(hand, suit) >= 2;
    }

    private static int honourCount(Hand hand, Suit suit) {
        return (int) hand.cardsIn(suit).stream().filter(card -> card.getRank().isHonour()).count();
    }

    /**
     * After 2x - 2NT: minimum rebids the suit, maximum shows an outside ace or king,
     * or bids 3NT with a solid AKQ suit.
     */
    private Optional<Suggestion> answerFeatureAsk(Hand hand, HandFeatures features) {
        Optional<Bid> opening = features.getOpeningBid();
        if (opening.isEmpty() || features.getMyBids().size() != 1
                || !features.getMyBids().get(0).equals(opening.get())
                || !isWeakTwo(opening.get())
                || !features.getPartnerLastBid().equals(Optional.of(Bid.of(2, Strain.NOTRUMP)))) {
            return Optional.empty();
        }
        Suit suit = opening.get().strain().suit().orElseThrow();
        if (features.getHcp() <= 8) {
            return Suggestion.of(Bid.of(3, suit), "Minimum weak two; rebidding " + suit);
        }
        if (BiddingHelper.topHonours(hand, suit) == 3) {
            return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Maximum weak two with a solid suit");
        }
        for (Suit other : Suit.values()) {
            if (other != suit && (hand.holds(Rank.ACE, other) || hand.holds(Rank.KING, other))) {
                return Suggestion.of(Bid.of(3, other), "Maximum weak two showing a feature in " + other);
            }
        }
        return Suggestion.of(Bid.of(3, suit), "Maximum weak two without an outside feature");
    }

    static boolean isWeakTwo(Bid bid) {
        return bid.isContract() && bid.level() == 2 && bid.strain() != Strain.CLUBS && !bid.strain().isNotrump();
    }
}
