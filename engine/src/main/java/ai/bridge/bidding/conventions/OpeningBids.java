package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * Natural SAYC opening bids: 1NT (15-17 balanced), 2NT (20-21 balanced), strong 2♣ (22+),
 * five-card majors and the better minor.
 * <p>
 * Hands with 12+ HCP, or that satisfy the Rule of 20, open at the one level. In fourth seat the
 * Rule of 15 (HCP plus spades) applies instead, so marginal hands pass the deal out.
 */
public class OpeningBids implements ConventionModule {

    @Override
    public Convention convention() {
        return Convention.OPENING_BIDS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.OPENING) {
            return Optional.empty();
        }
        int hcp = features.getHcp();
        boolean balanced = features.isBalanced();

        if (balanced && hcp >= 15 && hcp <= 17) {
            return Suggestion.of(Bid.of(1, Strain.NOTRUMP), "1NT opening: " + hcp + " HCP, balanced");
        }
        if (balanced && hcp >= 20 && hcp <= 21) {
            return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "2NT opening: " + hcp + " HCP, balanced");
        }
        if (hcp >= 22) {
            return Suggestion.of(Bid.of(2, Strain.CLUBS), "Strong artificial 2♣: " + hcp + " HCP");
        }

        boolean fourthSeat = features.getAuction().size() == 3;
        if (fourthSeat) {
            if (hcp + features.length(Suit.SPADES) < 15) {
                return Suggestion.of(Bid.PASS, "Rule of 15 not met in fourth seat; passing the deal out");
            }
        } else if (hcp < 12 && !ruleOfTwenty(features)) {
            return Suggestion.of(Bid.PASS, hcp + " HCP is not enough to open");
        }

        Suit suit = openingSuit(features);
        String reason = suit.isMajor()
                ? features.length(suit) + "-card major"
                : "longer minor";
        return Suggestion.of(Bid.of(1, suit), "1" + suit + " opening: " + hcp + " HCP, " + reason);
    }

    static boolean ruleOfTwenty(HandFeatures features) {
        int[] sorted = features.getLengths().values().stream().mapToInt(Integer::intValue).sorted().toArray();
        return features.getHcp() >= 10 && features.getHcp() + sorted[3] + sorted[2] >= 20;
    }

    /**
     * Longer five-card major (spades with 5-5), otherwise the longer minor: 1♣ with 3-3, 1♦ with 4-4.
     */
    static Suit openingSuit(HandFeatures features) {
        int spades = features.length(Suit.SPADES);
        int hearts = features.length(Suit.HEARTS);
        if (spades >= 5 || hearts >= 5) {
            return spades >= hearts ? Suit.SPADES : Suit.HEARTS;
        }
        int diamonds = features.length(Suit.DIAMONDS);
        int clubs = features.length(Suit.CLUBS);
        if (diamonds > clubs) {
            return Suit.DIAMONDS;
        }
        if (clubs > diamonds) {
            return Suit.CLUBS;
        }
        return clubs == 3 ? Suit.CLUBS : Suit.DIAMONDS;
    }
}
