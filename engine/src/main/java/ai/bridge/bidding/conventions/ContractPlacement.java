package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Call;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.BiddingHelper;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Suit;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Places the final contract once a partnership has exchanged enough information: game with 25+
 * combined points, an invitation with 23-24, otherwise stop in the current partscore.
 */
final class ContractPlacement {

    static final int GAME_POINTS = 25;
    static final int INVITE_POINTS = 23;

    private ContractPlacement() {
    }

    static Optional<Suggestion> place(Hand hand, HandFeatures features) {
        Optional<Bid> ourLast = ourLastBid(features);
        if (ourLast.isPresent() && isGameOrHigher(ourLast.get())) {
            return Suggestion.of(Bid.PASS, "Game already reached");
        }
        Optional<Suit> agreed = agreedSuit(features);
        int combined = features.getCombinedPoints();
        boolean stoppers = features.getTheirSuits().stream().allMatch(suit -> BiddingHelper.hasStopper(hand, suit));

        if (combined >= GAME_POINTS) {
            Bid target;
            if (agreed.isPresent() && agreed.get().isMajor()) {
                target = Bid.of(4, agreed.get());
            } else if (stoppers) {
                target = Bid.of(3, Strain.NOTRUMP);
            } else if (agreed.isPresent()) {
                target = Bid.of(5, agreed.get());
            } else {
                return Optional.empty();
            }
            if (BiddingHelper.isLegal(target, features)) {
                return Suggestion.of(target, "Game with about " + combined + " combined points");
            }
            return Optional.empty();
        }
        if (combined >= INVITE_POINTS) {
            Bid invite = agreed.map(suit -> Bid.of(3, suit))
                    .orElse(stoppers ? Bid.of(2, Strain.NOTRUMP) : null);
            if (invite != null && BiddingHelper.isLegal(invite, features)) {
                return Suggestion.of(invite, "Invitational with about " + combined + " combined points");
            }
        }
        return Suggestion.of(Bid.PASS, "No game with about " + combined + " combined points");
    }

    static boolean isGameOrHigher(Bid bid) {
        if (!bid.isContract()) {
            return false;
        }
        if (bid.strain().isNotrump()) {
            return bid.level() >= 3;
        }
        return bid.strain().isMajor() ? bid.level() >= 4 : bid.level() >= 5;
    }

    static Optional<Bid> ourLastBid(HandFeatures features) {
        Seat seat = features.getSeat();
        Bid last = null;
        for (Call call : features.getAuction().getCalls()) {
            if (call.bid().isContract() && call.seat().side() == seat.side()) {
                last = call.bid();
            }
        }
        return Optional.ofNullable(last);
    }

    /**
     * A suit both partners have bid, preferring majors, else the fit suit found by the extractor.
     */
    static Optional<Suit> agreedSuit(HandFeatures features) {
        Set<Suit> mine = EnumSet.noneOf(Suit.class);
        features.getMyBids().forEach(bid -> BiddingHelper.suitOf(bid).ifPresent(mine::add));
        Set<Suit> both = EnumSet.noneOf(Suit.class);
        features.getPartnerCalls().forEach(bid -> BiddingHelper.suitOf(bid).filter(mine::contains).ifPresent(both::add));
        if (both.contains(Suit.SPADES)) {
            return Optional.of(Suit.SPADES);
        }
        if (both.contains(Suit.HEARTS)) {
            return Optional.of(Suit.HEARTS);
        }
        if (!both.isEmpty()) {
            return Optional.of(both.iterator().next());
        }
        return features.getFitSuit();
    }
}
