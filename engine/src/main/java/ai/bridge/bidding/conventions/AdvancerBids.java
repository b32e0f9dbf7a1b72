package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Call;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.BiddingHelper;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Suit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Calls by the overcalling side after its first action: advancing partner's takeout double,
 * overcall or 1NT overcall, and competing again with a long suit in the balancing seat.
 */
public class AdvancerBids implements ConventionModule {

    private static final Bid ONE_NOTRUMP = Bid.of(1, Strain.NOTRUMP);
    static final int RUN_OUT_MAX_HCP = 4;
    static final int RUN_OUT_MIN_LENGTH = 6;

    @Override
    public Convention convention() {
        return Convention.ADVANCER_BIDS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.COMPETITIVE) {
            return Optional.empty();
        }
        Optional<Bid> partnerCall = features.getPartnerLastCall();
        if (features.getMyBids().isEmpty() && partnerCall.isPresent()) {
            if (partnerCall.get().isDouble()) {
                Optional<Bid> doubled = bidDoubledByPartner(features);
                if (doubled.filter(bid -> bid.equals(ONE_NOTRUMP)).isPresent()) {
                    return advancePenaltyDouble(features);
                }
                return advanceDouble(hand, features);
            }
            if (partnerCall.get().equals(ONE_NOTRUMP)) {
                return advanceNotrump(features);
            }
            if (partnerCall.get().isContract()) {
                return advanceOvercall(hand, features, partnerCall.get());
            }
        }
        if (!features.getMyBids().isEmpty()) {
            return rebid(hand, features);
        }
        return Optional.empty();
    }

    /**
     * Returns the contract bid standing when partner made their latest double.
     */
    static Optional<Bid> bidDoubledByPartner(HandFeatures features) {
        Seat partner = features.getSeat().partner();
        Bid current = null;
        Bid doubled = null;
        for (Call call : features.getAuction().getCalls()) {
            if (call.bid().isContract()) {
                current = call.bid();
            } else if (call.bid().isDouble() && call.seat() == partner) {
                doubled = current;
            }
        }
        return Optional.ofNullable(doubled);
    }

    /**
     * Partner's double of 1NT is for penalties. Leave it in unless very weak with a long suit; if the
     * opponents have run, double the runout with length in their suit.
     */
    private Optional<Suggestion> advancePenaltyDouble(HandFeatures features) {
        int hcp = features.getHcp();
        Bid standing = features.getLastContractBid().orElse(ONE_NOTRUMP);
        if (!standing.equals(ONE_NOTRUMP)) {
            Optional<Suit> runout = standing.strain().suit();
            if (runout.isPresent() && features.length(runout.get()) >= 4 && hcp >= 6
                    && BiddingHelper.isLegal(Bid.DOUBLE, features)) {
                return Suggestion.of(Bid.DOUBLE, "Penalty double of the runout to " + standing);
            }
            return Suggestion.of(Bid.PASS, "Opponents ran from 1NT doubled; leaving it to partner");
        }
        Suit longest = BiddingHelper.longestSuit(features.getLengths());
        if (hcp <= RUN_OUT_MAX_HCP && features.length(longest) >= RUN_OUT_MIN_LENGTH) {
            Optional<Bid> runOut = BiddingHelper.cheapest(longest, features).filter(bid -> bid.level() == 2);
            if (runOut.isPresent()) {
                return Suggestion.of(runOut.get(), "Running from 1NT doubled with " + features.length(longest)
                        + " " + longest + " and " + hcp + " HCP");
            }
        }
        return Suggestion.of(Bid.PASS, "Leaving partner's penalty double of 1NT in");
    }

    private Optional<Suggestion> advanceDouble(Hand hand, HandFeatures features) {
        int hcp = features.getHcp();
        boolean freeToPass = features.getInterference().isPresent();
        if (freeToPass && hcp < 6) {
            return Suggestion.of(Bid.PASS, "Opponents bid over partner's double; nothing to say");
        }
        List<Suit> unbid = new ArrayList<>();
        for (Suit suit : Suit.values()) {
            if (!features.getTheirSuits().contains(suit)) {
                unbid.add(suit);
            }
        }
        List<Suit> majors = new ArrayList<>();
        for (Suit suit : unbid) {
            if (suit.isMajor() && features.length(suit) >= 4) {
                majors.add(suit);
            }
        }
        Suit best = BiddingHelper.longestOf(features.getLengths(), majors.isEmpty() ? unbid : majors)
                .orElse(Suit.CLUBS);
        boolean stopped = features.getTheirSuits().stream().allMatch(s -> BiddingHelper.hasStopper(hand, s));

        if (hcp >= 12) {
            if (best.isMajor() && features.length(best) >= 4) {
                return Suggestion.of(Bid.of(4, best), "Game in " + best + " opposite a takeout double");
            }
            if (stopped) {
                return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "3NT with a stopper opposite a takeout double");
            }
        }
        Optional<Bid> cheapest = BiddingHelper.cheapest(best, features);
        if (cheapest.isEmpty()) {
            return Optional.empty();
        }
        if (hcp >= 9) {
            Bid jump = cheapest.get().raisedBy(1);
            if (jump != null) {
                return Suggestion.of(jump, "Jump advance in " + best + ": " + hcp + " HCP");
            }
        }
        if (hcp >= 6 && stopped && features.isBalanced() && (!best.isMajor() || features.length(best) < 4)) {
            Optional<Bid> nt = BiddingHelper.cheapest(Strain.NOTRUMP, features).filter(bid -> bid.level() == 1);
            if (nt.isPresent()) {
                return Suggestion.of(nt.get(), "1NT advance: 6-10 HCP with a stopper");
            }
        }
        return Suggestion.of(cheapest.get(), "Answering the takeout double in " + best);
    }

    private Optional<Suggestion> advanceNotrump(HandFeatures features) {
        int hcp = features.getHcp();
        if (hcp >= 10) {
            return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game opposite a 1NT overcall");
        }
        if (hcp >= 8) {
            return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Invitation opposite a 1NT overcall");
        }
        return Suggestion.of(Bid.PASS, "Too weak to advance the 1NT overcall");
    }

    private Optional<Suggestion> advanceOvercall(Hand hand, HandFeatures features, Bid overcall) {
        Optional<Suit> partnerSuit = overcall.strain().suit();
        if (partnerSuit.isEmpty()) {
            return Optional.empty();
        }
        Suit suit = partnerSuit.get();
        int support = features.length(suit);
        int supportPoints = features.getSupportPoints();
        int hcp = features.getHcp();

        if (support >= 3 && supportPoints >= 8) {
            if (supportPoints >= 13 && suit.isMajor()) {
                return Suggestion.of(Bid.of(4, suit), "Game raise of partner's overcall");
            }
            Optional<Bid> raise = BiddingHelper.cheapest(suit, features);
            if (raise.isPresent()) {
                Bid bid = supportPoints >= 11 && raise.get().level() < 4 ? raise.get().raisedBy(1) : raise.get();
                return Suggestion.of(bid, "Raising partner's overcall: " + supportPoints + " support points");
            }
        }
        Suit longest = BiddingHelper.longestSuit(features.getLengths());
        if (hcp >= 8 && longest != suit && features.length(longest) >= 5
                && !features.getTheirSuits().contains(longest)) {
            Optional<Bid> own = BiddingHelper.cheapest(longest, features).filter(bid -> bid.level() <= 2);
            if (own.isPresent()) {
                return Suggestion.of(own.get(), "Own 5-card " + longest + " suit");
            }
        }
        boolean stopped = features.getTheirSuits().stream().allMatch(s -> BiddingHelper.hasStopper(hand, s));
        if (stopped && hcp >= 8) {
            Optional<Bid> nt = BiddingHelper.cheapest(Strain.NOTRUMP, features);
            if (nt.isPresent() && hcp >= 12 && nt.get().level() <= 3) {
                return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "3NT with stoppers opposite the overcall");
            }
            if (nt.isPresent() && nt.get().level() <= 2) {
                return Suggestion.of(nt.get(), "Notrump advance with a stopper");
            }
        }
        return Suggestion.of(Bid.PASS, "Nothing to add to partner's overcall");
    }

    private Optional<Suggestion> rebid(Hand hand, HandFeatures features) {
        if (!features.getPartnerCalls().isEmpty()) {
            Optional<Suggestion> placed = ContractPlacement.place(hand, features);
            if (placed.isPresent()) {
                return placed;
            }
        }
        if (features.isBalancingSeat()) {
            Optional<Suit> mySuit = features.getMyBids().stream()
                    .map(BiddingHelper::suitOf)
                    .flatMap(Optional::stream)
                    .findFirst();
            if (mySuit.isPresent() && features.length(mySuit.get()) >= 6 && features.getTotalPoints() >= 10) {
                Optional<Bid> compete = BiddingHelper.cheapest(mySuit.get(), features).filter(bid -> bid.level() <= 3);
                if (compete.isPresent()) {
                    return Suggestion.of(compete.get(), "Competing again in the balancing seat with 6 " + mySuit.get());
                }
            }
        }
        return Optional.empty();
    }
}
