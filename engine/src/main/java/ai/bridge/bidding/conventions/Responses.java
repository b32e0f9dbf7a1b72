package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.BiddingHelper;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Interference;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Natural responses to partner's opening bid: raises, new suits, notrump responses, answers to 2♣
 * and to preempts.
 */
public class Responses implements ConventionModule {

    @Override
    public Convention convention() {
        return Convention.RESPONSES;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() != AuctionState.PARTNERSHIP_RESPONSE || features.getOpeningBid().isEmpty()) {
            return Optional.empty();
        }
        Bid opening = features.getOpeningBid().get();
        if (opening.strain().isNotrump()) {
            return opening.level() == 1 ? respondToOneNotrump(hand, features) : respondToTwoNotrump(features);
        }
        if (opening.equals(Bid.of(2, Strain.CLUBS))) {
            return respondToStrongTwo(hand, features);
        }
        if (opening.level() >= 2) {
            return respondToPreempt(hand, features, opening);
        }
        return respondToOneSuit(hand, features, opening.strain().suit().orElseThrow());
    }

    private Optional<Suggestion> respondToOneNotrump(Hand hand, HandFeatures features) {
        int hcp = features.getHcp();
        Interference interference = features.getInterference();
        if (interference.isPresent()) {
            Optional<Suit> theirs = BiddingHelper.suitOf(interference.bid());
            if (hcp >= 10 && theirs.map(s -> BiddingHelper.hasStopper(hand, s)).orElse(true)) {
                return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game values over interference with a stopper");
            }
            Suit longest = BiddingHelper.longestSuit(features.getLengths());
            if (hcp >= 8 && features.length(longest) >= 5 && !features.getTheirSuits().contains(longest)) {
                Optional<Bid> bid = BiddingHelper.cheapest(longest, features).filter(b -> b.level() <= 3);
                if (bid.isPresent()) {
                    return Suggestion.of(bid.get(), "Competing with a 5-card " + longest + " suit");
                }
            }
            return Suggestion.of(Bid.PASS, "Nothing to add after interference");
        }
        if (hcp <= 7) {
            return Suggestion.of(Bid.PASS, hcp + " HCP: no game opposite 1NT");
        }
        if (hcp <= 9) {
            return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Invitational: " + hcp + " HCP");
        }
        if (hcp <= 15) {
            return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game: " + hcp + " HCP opposite 15-17");
        }
        if (hcp <= 17) {
            return Suggestion.of(Bid.of(4, Strain.NOTRUMP), "Quantitative slam invitation: " + hcp + " HCP");
        }
        return Suggestion.of(Bid.of(6, Strain.NOTRUMP), "Small slam: " + hcp + " HCP opposite 15-17");
    }

    private Optional<Suggestion> respondToTwoNotrump(HandFeatures features) {
        int hcp = features.getHcp();
        if (hcp <= 3) {
            return Suggestion.of(Bid.PASS, "Too weak for game opposite 2NT");
        }
        if (hcp <= 10) {
            return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game opposite 20-21");
        }
        if (hcp <= 12) {
            return Suggestion.of(Bid.of(4, Strain.NOTRUMP), "Quantitative slam invitation");
        }
        return Suggestion.of(Bid.of(6, Strain.NOTRUMP), "Small slam opposite 20-21");
    }

    private Optional<Suggestion> respondToStrongTwo(Hand hand, HandFeatures features) {
        if (features.getInterference().isPresent()) {
            return Suggestion.of(Bid.PASS, "Passing after interference over 2♣");
        }
        int hcp = features.getHcp();
        if (hcp >= 8) {
            for (Suit suit : new Suit[] {Suit.SPADES, Suit.HEARTS, Suit.DIAMONDS, Suit.CLUBS}) {
                if (features.length(suit) >= 5 && BiddingHelper.topHonours(hand, suit) >= 2) {
                    int level = suit.isMajor() ? 2 : 3;
                    return Suggestion.of(Bid.of(level, suit), "Positive response: good 5-card " + suit + " suit");
                }
            }
            if (features.isBalanced()) {
                return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Positive response: " + hcp + " HCP, balanced");
            }
        }
        return Suggestion.of(Bid.of(2, Strain.DIAMONDS), "Waiting response to 2♣");
    }

    private Optional<Suggestion> respondToPreempt(Hand hand, HandFeatures features, Bid opening) {
        Suit suit = opening.strain().suit().orElseThrow();
        int support = features.length(suit);
        int hcp = features.getHcp();
        if (opening.level() == 2) {
            if (support >= 3 && hcp >= 16) {
                Bid game = suit.isMajor() ? Bid.of(4, suit) : Bid.of(3, Strain.NOTRUMP);
                return Suggestion.of(game, "Game opposite a weak two with " + support + "-card support");
            }
            if (support >= 3) {
                return Suggestion.of(Bid.of(3, suit), "Preemptive raise with " + support + "-card support");
            }
            if (hcp >= 15) {
                return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Feature ask: " + hcp + " HCP");
            }
            return Suggestion.of(Bid.PASS, "No fit for partner's weak two");
        }
        if (hcp >= 16 && support >= 2 && suit.isMajor() && opening.level() == 3) {
            return Suggestion.of(Bid.of(4, suit), "Raising the preempt to game");
        }
        if (hcp >= 16 && suit.isMinor() && opening.level() == 3
                && hasStoppersOutside(hand, suit)) {
            return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "3NT opposite a minor preempt");
        }
        return Suggestion.of(Bid.PASS, "Leaving partner's preempt alone");
    }

    private static boolean hasStoppersOutside(Hand hand, Suit suit) {
        for (Suit other : Suit.values()) {
            if (other != suit && !BiddingHelper.hasStopper(hand, other)) {
                return false;
            }
        }
        return true;
    }

    private Optional<Suggestion> respondToOneSuit(Hand hand, HandFeatures features, Suit opened) {
        int hcp = features.getHcp();
        Interference interference = features.getInterference();
        if (interference.type() == Interference.Type.DOUBLE && hcp >= 10) {
            return Suggestion.of(Bid.REDOUBLE, "Redouble shows 10+ HCP after a takeout double");
        }
        if (hcp < 6) {
            return Suggestion.of(Bid.PASS, hcp + " HCP is too weak to respond");
        }
        int supportPoints = features.getSupportPoints();
        boolean fit = features.getFitSuit().filter(s -> s == opened).isPresent();

        if (fit && opened.isMajor()) {
            return Suggestion.of(majorRaise(opened, supportPoints), raiseReason(supportPoints, opened));
        }

        Optional<Suggestion> oneLevel = newSuitAtOneLevel(features, opened);
        if (oneLevel.isPresent()) {
            return oneLevel;
        }

        if (fit) {
            if (supportPoints <= 9) {
                return Suggestion.of(Bid.of(2, opened), "Simple minor raise: " + supportPoints + " support points");
            }
            if (supportPoints <= 12) {
                return Suggestion.of(Bid.of(3, opened), "Limit raise in " + opened);
            }
        }

        if (hcp >= 10) {
            Optional<Suggestion> twoLevel = newSuitAtTwoLevel(features, opened);
            if (twoLevel.isPresent()) {
                return twoLevel;
            }
        }

        boolean stopped = features.getTheirSuits().stream().allMatch(s -> BiddingHelper.hasStopper(hand, s));
        if (hcp <= 10) {
            if (interference.isPresent() && !stopped) {
                return Suggestion.of(Bid.PASS, "No stopper in the opponents' suit");
            }
            return BiddingHelper.cheapest(Strain.NOTRUMP, features)
                    .filter(bid -> bid.level() == 1)
                    .map(bid -> new Suggestion(bid, "1NT response: " + hcp + " HCP"))
                    .or(() -> Optional.of(new Suggestion(Bid.PASS, "No convenient response")));
        }
        if (hcp <= 12) {
            return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Invitational 2NT: " + hcp + " HCP");
        }
        if (hcp <= 15 && features.isBalanced()) {
            return Suggestion.of(Bid.of(2, Strain.NOTRUMP), "2NT response: " + hcp + " HCP, balanced");
        }
        return Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game: " + hcp + " HCP");
    }

    private static Bid majorRaise(Suit suit, int supportPoints) {
        if (supportPoints <= 9) {
            return Bid.of(2, suit);
        }
        return supportPoints <= 12 ? Bid.of(3, suit) : Bid.of(4, suit);
    }

    private static String raiseReason(int supportPoints, Suit suit) {
        String kind = supportPoints <= 9 ? "Simple raise" : supportPoints <= 12 ? "Limit raise" : "Game raise";
        return kind + " in " + suit + ": " + supportPoints + " support points";
    }

    /**
     * Up the line with four-card suits, the higher of two five-card suits.
     */
    private Optional<Suggestion> newSuitAtOneLevel(HandFeatures features, Suit opened) {
        List<Suit> candidates = new ArrayList<>();
        for (Suit suit : Suit.values()) {
            if (suit.ordinal() > opened.ordinal() && features.length(suit) >= 4
                    && !features.getTheirSuits().contains(suit)) {
                candidates.add(suit);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (opened.isMinor()) {
            candidates.removeIf(suit -> suit == Suit.DIAMONDS
                    && (features.length(Suit.HEARTS) >= 4 || features.length(Suit.SPADES) >= 4)
                    && features.length(Suit.DIAMONDS) < 6);
        }
        Suit choice = candidates.get(0);
        for (Suit suit : candidates) {
            if (features.length(suit) >= 5 && features.length(suit) >= features.length(choice)) {
                choice = suit;
            }
        }
        final Suit chosen = choice;
        return BiddingHelper.cheapest(chosen, features)
                .filter(bid -> bid.level() == 1)
                .map(bid -> new Suggestion(bid, "New suit: " + features.length(chosen) + "-card " + chosen));
    }

    private Optional<Suggestion> newSuitAtTwoLevel(HandFeatures features, Suit opened) {
        List<Suit> candidates = new ArrayList<>();
        for (Suit suit : Suit.values()) {
            if (suit == opened || features.getTheirSuits().contains(suit)) {
                continue;
            }
            int needed = suit == Suit.HEARTS && opened == Suit.SPADES ? 5 : 4;
            if (features.length(suit) >= needed) {
                candidates.add(suit);
            }
        }
        return BiddingHelper.longestOf(features.getLengths(), candidates)
                .flatMap(suit -> BiddingHelper.cheapest(suit, features)
                        .filter(bid -> bid.level() == 2)
                        .map(bid -> new Suggestion(bid, "Two-over-one: 10+ HCP with " + features.length(suit) + " " + suit)));
    }
}
