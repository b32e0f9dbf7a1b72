package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.BiddingHelper;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.config.BiddingProperties;
import ai.bridge.game.Hand;
import ai.bridge.game.Rank;
import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * Grand slam force: 5NT without a previous 4NT asks partner to bid seven of the agreed suit holding
 * two of the top three trump honours, otherwise six.
 * <p>
 * The asker holds exactly one of the ace, king and queen of trumps, controls every side suit with
 * an ace or a void, and has slam values.
 */
public class GrandSlamForce implements ConventionModule {

    static final Bid FORCE = Bid.of(5, Strain.NOTRUMP);
    static final Bid ACE_ASK = Bid.of(4, Strain.NOTRUMP);

    private final BiddingProperties.Slam thresholds;

    public GrandSlamForce(BiddingProperties.Slam thresholds) {
        this.thresholds = thresholds;
    }

    public GrandSlamForce() {
        this(new BiddingProperties.Slam());
    }

    @Override
    public Convention convention() {
        return Convention.GRAND_SLAM_FORCE;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() == AuctionState.OPENING || features.getState() == AuctionState.COMPETITIVE) {
            return Optional.empty();
        }
        Optional<Suit> trump = Blackwood.agreedTrump(features);
        if (trump.isEmpty()) {
            return Optional.empty();
        }
        Optional<Bid> partnerLast = features.getPartnerLastBid();
        if (partnerLast.equals(Optional.of(FORCE)) && !features.getPartnerCalls().contains(ACE_ASK)
                && !features.getMyBids().contains(ACE_ASK)) {
            return answer(hand, trump.get());
        }
        if (features.getMyLastBid().equals(Optional.of(FORCE)) && !features.getMyBids().contains(ACE_ASK)) {
            return partnerLast.filter(bid -> bid.strain() == Strain.of(trump.get()) && bid.level() >= 6)
                    .map(bid -> new Suggestion(Bid.PASS, "Partner answered the grand slam force"));
        }
        return ask(hand, features, trump.get());
    }

    private static Optional<Suggestion> answer(Hand hand, Suit trump) {
        int honours = BiddingHelper.topHonours(hand, trump);
        if (honours >= 2) {
            return Suggestion.of(Bid.of(7, trump), "Grand slam force: " + honours + " of the top three " + trump);
        }
        return Suggestion.of(Bid.of(6, trump), "Grand slam force: only " + honours + " of the top three " + trump);
    }

    private Optional<Suggestion> ask(Hand hand, HandFeatures features, Suit trump) {
        if (features.getMyBids().contains(FORCE) || features.getMyBids().contains(ACE_ASK)
                || features.getPartnerCalls().contains(ACE_ASK)
                || !BiddingHelper.isLegal(FORCE, features)
                || !Blackwood.isFitConfirmed(features, trump)) {
            return Optional.empty();
        }
        if (BiddingHelper.topHonours(hand, trump) != 1 || features.getCombinedPoints() < thresholds.getSmallSlam()) {
            return Optional.empty();
        }
        for (Suit suit : Suit.values()) {
            if (suit != trump && hand.length(suit) > 0 && !hand.holds(Rank.ACE, suit)) {
                return Optional.empty();
            }
        }
        return Suggestion.of(FORCE, "Grand slam force in " + trump + ": every side suit controlled");
    }
}
