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
import java.util.Optional;

/**
 * Opener's natural rebids: describing strength after partner's raise, notrump or new-suit response,
 * answering a negative double, continuing after 2♣, and placing the contract on later rounds.
 */
public class OpenerRebids implements ConventionModule {

    @Override
    public Convention convention() {
        return Convention.OPENER_REBIDS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.OPENER_REBID || features.getOpeningBid().isEmpty()) {
            return Optional.empty();
        }
        Bid opening = features.getOpeningBid().get();
        Optional<Bid> partnerCall = features.getPartnerLastCall();
        if (partnerCall.isEmpty()) {
            return competeAlone(hand, features, opening);
        }
        if (partnerCall.get().isDouble()) {
            return answerNegativeDouble(hand, features, opening);
        }
        Bid response = partnerCall.get();
        if (opening.strain().isNotrump()) {
            return afterNotrumpOpening(features, opening, response);
        }
        if (opening.equals(Bid.of(2, Strain.CLUBS))) {
            return afterStrongTwo(hand, features, response);
        }
        if (opening.level() >= 2) {
            return Suggestion.of(Bid.PASS, "Preempt already described the hand");
        }
        if (features.getMyBids().size() > 1) {
            return ContractPlacement.place(hand, features);
        }
        Suit mine = opening.strain().suit().orElseThrow();
        if (response.strain() == opening.strain()) {
            return afterRaise(features, mine, response);
        }
        if (response.strain().isNotrump()) {
            return afterNotrumpResponse(hand, features, mine, response);
        }
        return afterNewSuit(hand, features, mine, response);
    }

    private Optional<Suggestion> competeAlone(Hand hand, HandFeatures features, Bid opening) {
        Optional<Suit> suit = opening.strain().suit();
        if (suit.isPresent() && features.length(suit.get()) >= 6 && features.getTotalPoints() >= 15) {
            Optional<Bid> rebid = BiddingHelper.cheapest(suit.get(), features).filter(bid -> bid.level() <= 3);
            if (rebid.isPresent()) {
                return Suggestion.of(rebid.get(), "Competing with a 6-card " + suit.get() + " suit");
            }
        }
        return Suggestion.of(Bid.PASS, "Nothing extra to show");
    }

    private Optional<Suggestion> answerNegativeDouble(Hand hand, HandFeatures features, Bid opening) {
        for (Suit major : new Suit[] {Suit.SPADES, Suit.HEARTS}) {
            if (features.length(major) >= 4 && !features.getTheirSuits().contains(major)
                    && !features.getOurSuits().contains(major)) {
                Optional<Bid> bid = BiddingHelper.cheapest(major, features);
                if (bid.isPresent()) {
                    return Suggestion.of(bid.get(), "Showing 4-card " + major + " after partner's negative double");
                }
            }
        }
        boolean stopped = features.getTheirSuits().stream().allMatch(s -> BiddingHelper.hasStopper(hand, s));
        if (stopped && features.isBalanced()) {
            Optional<Bid> nt = BiddingHelper.cheapest(Strain.NOTRUMP, features);
            if (nt.isPresent() && nt.get().level() <= 2) {
                return Suggestion.of(nt.get(), "Notrump with a stopper after a negative double");
            }
        }
        return opening.strain().suit()
                .flatMap(suit -> BiddingHelper.cheapest(suit, features))
                .map(bid -> new Suggestion(bid, "Rebidding the opened suit after a negative double"));
    }

    private Optional<Suggestion> afterNotrumpOpening(HandFeatures features, Bid opening, Bid response) {
        int hcp = features.getHcp();
        boolean oneNotrump = opening.level() == 1;
        if (response.equals(Bid.of(2, Strain.NOTRUMP)) && oneNotrump) {
            return hcp >= 16
                    ? Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Accepting the invitation with " + hcp + " HCP")
                    : Suggestion.of(Bid.PASS, "Declining the invitation with " + hcp + " HCP");
        }
        if (response.equals(Bid.of(4, Strain.NOTRUMP))) {
            int maximum = oneNotrump ? 17 : 21;
            return hcp >= maximum
                    ? Suggestion.of(Bid.of(6, Strain.NOTRUMP), "Accepting the quantitative invitation")
                    : Suggestion.of(Bid.PASS, "Declining the quantitative invitation");
        }
        if (response.level() == 3 && response.strain().isMajor()) {
            Suit suit = response.strain().suit().orElseThrow();
            return features.length(suit) >= 3
                    ? Suggestion.of(Bid.of(4, suit), "Raising partner's 5-card " + suit)
                    : Suggestion.of(Bid.of(3, Strain.NOTRUMP), "No fit for partner's " + suit);
        }
        return Suggestion.of(Bid.PASS, "Partner has placed the contract");
    }

    private Optional<Suggestion> afterStrongTwo(Hand hand, HandFeatures features, Bid response) {
        int hcp = features.getHcp();
        if (features.getMyBids().size() > 1) {
            return ContractPlacement.place(hand, features)
                    .filter(s -> !s.bid().isPass())
                    .or(() -> gameAfterStrongTwo(features));
        }
        Optional<Suit> partnerSuit = response.strain().suit();
        if (response.equals(Bid.of(2, Strain.DIAMONDS))) {
            if (features.isBalanced() && hcp <= 24) {
                return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "2♣ then 2NT: 22-24 balanced");
            }
            Suit longest = BiddingHelper.longestSuit(features.getLengths());
            return BiddingHelper.cheapest(longest, features)
                    .map(bid -> new Suggestion(bid, "Showing the long " + longest + " suit after 2♣"));
        }
        if (partnerSuit.isPresent() && features.length(partnerSuit.get()) >= 3) {
            return BiddingHelper.cheapest(partnerSuit.get(), features)
                    .map(bid -> new Suggestion(bid, "Supporting partner's positive response"));
        }
        if (features.isBalanced()) {
            return BiddingHelper.cheapest(Strain.NOTRUMP, features)
                    .map(bid -> new Suggestion(bid, "Balanced after a positive response"));
        }
        Suit longest = BiddingHelper.longestSuit(features.getLengths());
        return BiddingHelper.cheapest(longest, features)
                .map(bid -> new Suggestion(bid, "Showing the long " + longest + " suit"));
    }

    private Optional<Suggestion> gameAfterStrongTwo(HandFeatures features) {
        Optional<Bid> ourLast = ContractPlacement.ourLastBid(features);
        if (ourLast.isPresent() && ContractPlacement.isGameOrHigher(ourLast.get())) {
            return Suggestion.of(Bid.PASS, "Game reached after 2♣");
        }
        Bid target = ContractPlacement.agreedSuit(features)
                .filter(Suit::isMajor)
                .map(suit -> Bid.of(4, suit))
                .orElse(Bid.of(3, Strain.NOTRUMP));
        return Suggestion.of(target, "2♣ is forcing to game");
    }

    private Optional<Suggestion> afterRaise(HandFeatures features, Suit mine, Bid response) {
        int total = features.getTotalPoints();
        Bid game = mine.isMajor() ? Bid.of(4, mine) : Bid.of(3, Strain.NOTRUMP);
        if (response.level() == 2) {
            if (total >= 19) {
                return Suggestion.of(game, "Game opposite a simple raise: " + total + " points");
            }
            if (total >= 16) {
                return Suggestion.of(Bid.of(3, mine), "Invitational reraise: " + total + " points");
            }
            return Suggestion.of(Bid.PASS, "Minimum opening opposite a simple raise");
        }
        if (response.level() == 3) {
            return total >= 14
                    ? Suggestion.of(game, "Accepting the limit raise: " + total + " points")
                    : Suggestion.of(Bid.PASS, "Declining the limit raise");
        }
        return Suggestion.of(Bid.PASS, "Partner raised to game");
    }

    private Optional<Suggestion> afterNotrumpResponse(Hand hand, HandFeatures features, Suit mine, Bid response) {
        int hcp = features.getHcp();
        if (response.level() >= 3) {
            return Suggestion.of(Bid.PASS, "Partner chose game in notrump");
        }
        if (response.level() == 2) {
            if (mine.isMajor() && features.length(mine) >= 6) {
                return Suggestion.of(Bid.of(4, mine), "Game in the 6-card major");
            }
            return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game opposite the 2NT response");
        }
        if (features.length(mine) >= 6) {
            Bid rebid = hcp >= 16 ? Bid.of(3, mine) : Bid.of(2, mine);
            return Suggestion.of(rebid, "Rebidding a 6-card " + mine + " suit");
        }
        if (hcp >= 19) {
            return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game opposite 1NT with " + hcp + " HCP");
        }
        if (hcp >= 17 && features.isBalanced()) {
            return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Invitational with " + hcp + " HCP");
        }
        Optional<Suit> second = secondSuit(features, mine, true);
        if (second.isPresent()) {
            return Suggestion.of(Bid.of(2, second.get()), "Showing a second suit");
        }
        return Suggestion.of(Bid.PASS, "Minimum balanced opener opposite 1NT");
    }

    private Optional<Suggestion> afterNewSuit(Hand hand, HandFeatures features, Suit mine, Bid response) {
        Optional<Suit> theirs = response.strain().suit();
        if (theirs.isEmpty()) {
            return ContractPlacement.place(hand, features);
        }
        Suit partnerSuit = theirs.get();
        int total = features.getTotalPoints();
        int hcp = features.getHcp();
        int support = features.length(partnerSuit);

        if (support >= 4) {
            int supportPoints = features.getSupportPoints();
            Bid raise;
            if (supportPoints >= 19) {
                raise = partnerSuit.isMajor() ? Bid.of(4, partnerSuit) : Bid.of(3, Strain.NOTRUMP);
            } else if (supportPoints >= 16) {
                raise = Bid.of(response.level() + 1 + (response.level() == 1 ? 1 : 0), partnerSuit);
            } else {
                raise = BiddingHelper.cheapest(partnerSuit, features).orElse(Bid.PASS);
            }
            return Suggestion.of(raise, "Raising partner's " + partnerSuit + " with 4-card support");
        }

        if (response.level() == 1) {
            if (partnerSuit != Suit.SPADES && features.length(Suit.SPADES) >= 4 && mine != Suit.SPADES) {
                return Suggestion.of(Bid.of(1, Suit.SPADES), "Showing 4 spades at the one level");
            }
            if (features.isBalanced() && hcp <= 14) {
                return Suggestion.of(Bid.of(1, Strain.NOTRUMP), "1NT rebid: 12-14 balanced");
            }
            if (features.isBalanced() && hcp >= 18) {
                return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "2NT rebid: 18-19 balanced");
            }
        } else if (features.isBalanced()) {
            return hcp >= 18
                    ? Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game: 18-19 balanced")
                    : Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Minimum balanced after two-over-one");
        }

        if (features.length(mine) >= 6) {
            Optional<Bid> cheapest = BiddingHelper.cheapest(mine, features);
            if (cheapest.isPresent()) {
                Bid rebid = total >= 16 && cheapest.get().level() < 3
                        ? Bid.of(cheapest.get().level() + 1, mine) : cheapest.get();
                return Suggestion.of(rebid, "Rebidding a 6-card " + mine + " suit");
            }
        }
        Optional<Suit> second = secondSuit(features, mine, total < 17);
        if (second.isPresent()) {
            Optional<Bid> bid = BiddingHelper.cheapest(second.get(), features);
            if (bid.isPresent()) {
                return Suggestion.of(bid.get(), "Showing a second suit: " + second.get());
            }
        }
        return BiddingHelper.cheapest(mine, features)
                .map(bid -> new Suggestion(bid, "Rebidding " + mine));
    }

    /**
     * A second four-card suit. Without reversing values it must rank below the opened suit.
     */
    private static Optional<Suit> secondSuit(HandFeatures features, Suit mine, boolean lowerOnly) {
        for (Suit suit : new Suit[] {Suit.SPADES, Suit.HEARTS, Suit.DIAMONDS, Suit.CLUBS}) {
            if (suit == mine || features.length(suit) < 4 || features.getOurSuits().contains(suit)
                    || features.getTheirSuits().contains(suit)) {
                continue;
            }
            if (lowerOnly && suit.ordinal() > mine.ordinal()) {
                continue;
            }
            return Optional.of(suit);
        }
        return Optional.empty();
    }
}
