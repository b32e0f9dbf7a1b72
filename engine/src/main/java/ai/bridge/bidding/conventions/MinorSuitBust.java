package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Relationship;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.List;
import java.util.Optional;

/**
 * Minor suit bust over partner's 1NT: a weak responder with a long minor relays with 2♠, opener
 * bids 3♣ by force, and responder passes with clubs or corrects to 3♦ with diamonds.
 * <p>
 * Responder needs 0-7 HCP, six or more cards in a minor and no four-card major.
 */
public class MinorSuitBust implements ConventionModule {

    static final Bid ONE_NOTRUMP = Bid.of(1, Strain.NOTRUMP);
    static final Bid RELAY = Bid.of(2, Strain.SPADES);
    static final Bid FORCED = Bid.of(3, Strain.CLUBS);
    static final Bid DIAMONDS = Bid.of(3, Strain.DIAMONDS);
    static final int MAX_HCP = 7;
    static final int MIN_LENGTH = 6;

    @Override
    public Convention convention() {
        return Convention.MINOR_SUIT_BUST;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (!features.getOpeningBid().equals(Optional.of(ONE_NOTRUMP)) || features.isContested()
                || features.getInterference().isPresent()) {
            return Optional.empty();
        }
        List<Bid> mine = features.getMyBids();
        Optional<Bid> partnerLast = features.getPartnerLastBid();
        if (features.getOpenerRelationship() == Relationship.SELF) {
            if (mine.equals(List.of(ONE_NOTRUMP)) && partnerLast.equals(Optional.of(RELAY))) {
                return Suggestion.of(FORCED, "Forced 3♣ after partner's minor suit relay");
            }
            if (mine.equals(List.of(ONE_NOTRUMP, FORCED)) && partnerLast.equals(Optional.of(DIAMONDS))) {
                return Suggestion.of(Bid.PASS, "Partner signed off in diamonds");
            }
            return Optional.empty();
        }
        if (features.getOpenerRelationship() != Relationship.PARTNER) {
            return Optional.empty();
        }
        if (mine.isEmpty() && features.getPartnerCalls().size() == 1) {
            return relay(features);
        }
        if (mine.equals(List.of(RELAY)) && partnerLast.equals(Optional.of(FORCED))) {
            if (features.length(Suit.CLUBS) >= MIN_LENGTH) {
                return Suggestion.of(Bid.PASS, "Playing 3♣ with " + features.length(Suit.CLUBS) + " clubs");
            }
            return Suggestion.of(DIAMONDS, "Correcting to 3♦ with " + features.length(Suit.DIAMONDS) + " diamonds");
        }
        return Optional.empty();
    }

    private Optional<Suggestion> relay(HandFeatures features) {
        if (features.getHcp() > MAX_HCP
                || features.length(Suit.HEARTS) >= 4 || features.length(Suit.SPADES) >= 4) {
            return Optional.empty();
        }
        int clubs = features.length(Suit.CLUBS);
        int diamonds = features.length(Suit.DIAMONDS);
        if (clubs < MIN_LENGTH && diamonds < MIN_LENGTH) {
            return Optional.empty();
        }
        Suit minor = clubs >= MIN_LENGTH ? Suit.CLUBS : Suit.DIAMONDS;
        return Suggestion.of(RELAY, "Minor suit bust: " + features.getHcp() + " HCP with " + features.length(minor)
                + " " + minor);
    }
}
