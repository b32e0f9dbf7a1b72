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
import java.util.List;
import java.util.Optional;

/**
 * Stayman after partner's 1NT opening, together with opener's answer and both players' follow-ups.
 * <p>
 * Responder bids 2♣ with 8+ HCP, at least one four-card major and no five-card major. Opener answers
 * 2♥ (four hearts, possibly also spades), 2♠ (four spades) or 2♦ (no major). Responder then raises a
 * found fit (invite with 8-9, game with 10+) or bids notrump.
 */
public class Stayman implements ConventionModule {

    static final Bid ONE_NOTRUMP = Bid.of(1, Strain.NOTRUMP);
    static final Bid STAYMAN = Bid.of(2, Strain.CLUBS);
    static final int MIN_HCP = 8;

    @Override
    public Convention convention() {
        return Convention.STAYMAN;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (!features.getOpeningBid().equals(Optional.of(ONE_NOTRUMP))) {
            return Optional.empty();
        }
        return switch (features.getState()) {
            case PARTNERSHIP_RESPONSE -> ask(features);
            case OPENER_REBID -> openerContinues(features);
            case PARTNERSHIP_REBID -> responderContinues(features);
            default -> Optional.empty();
        };
    }

    private Optional<Suggestion> ask(HandFeatures features) {
        if (features.getInterference().isPresent() || features.getHcp() < MIN_HCP) {
            return Optional.empty();
        }
        int hearts = features.length(Suit.HEARTS);
        int spades = features.length(Suit.SPADES);
        if (hearts >= 5 || spades >= 5 || (hearts < 4 && spades < 4)) {
            return Optional.empty();
        }
        return Suggestion.of(STAYMAN, "Stayman: asking for a 4-card major with " + features.getHcp() + " HCP");
    }

    private Optional<Suggestion> openerContinues(HandFeatures features) {
        List<Bid> mine = features.getMyBids();
        List<Bid> partner = features.getPartnerCalls();
        if (partner.isEmpty() || !partner.get(0).equals(STAYMAN)) {
            return Optional.empty();
        }
        if (mine.size() == 1 && partner.size() == 1) {
            if (features.length(Suit.HEARTS) >= 4) {
                return Suggestion.of(Bid.of(2, Strain.HEARTS), "Stayman answer: 4 hearts");
            }
            if (features.length(Suit.SPADES) >= 4) {
                return Suggestion.of(Bid.of(2, Strain.SPADES), "Stayman answer: 4 spades");
            }
            return Suggestion.of(Bid.of(2, Strain.DIAMONDS), "Stayman answer: no 4-card major");
        }
        if (mine.size() != 2 || partner.size() != 2) {
            return Optional.empty();
        }
        Bid answer = mine.get(1);
        Bid followUp = partner.get(1);
        boolean maximum = features.getHcp() >= 16;
        if (followUp.level() == 3 && followUp.strain() == answer.strain()) {
            Suit major = answer.strain().suit().orElseThrow();
            return maximum
                    ? Suggestion.of(Bid.of(4, major), "Accepting the invitation in " + major)
                    : Suggestion.of(Bid.PASS, "Minimum: declining the invitation in " + major);
        }
        if (followUp.equals(Bid.of(2, Strain.NOTRUMP))) {
            if (answer.strain() == Strain.HEARTS && features.length(Suit.SPADES) >= 4) {
                Bid spades = maximum ? Bid.of(4, Strain.SPADES) : Bid.of(3, Strain.SPADES);
                return Suggestion.of(spades, "Partner holds spades; showing the spade fit");
            }
            return maximum
                    ? Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Accepting the notrump invitation")
                    : Suggestion.of(Bid.PASS, "Declining the notrump invitation");
        }
        if (followUp.equals(Bid.of(3, Strain.NOTRUMP)) && answer.strain() == Strain.HEARTS
                && features.length(Suit.SPADES) >= 4) {
            return Suggestion.of(Bid.of(4, Strain.SPADES), "Partner holds spades; correcting to 4♠");
        }
        return Suggestion.of(Bid.PASS, "Partner has placed the contract after Stayman");
    }

    private Optional<Suggestion> responderContinues(HandFeatures features) {
        List<Bid> mine = features.getMyBids();
        if (mine.size() != 1 || !mine.get(0).equals(STAYMAN) || features.getPartnerCalls().size() != 2) {
            return Optional.empty();
        }
        Bid answer = features.getPartnerCalls().get(1);
        int hcp = features.getHcp();
        Optional<Suit> shown = answer.strain().isMajor() ? answer.strain().suit() : Optional.empty();
        if (shown.isPresent() && features.length(shown.get()) >= 4) {
            Bid raise = hcp >= 10 ? Bid.of(4, shown.get()) : Bid.of(3, shown.get());
            return Suggestion.of(raise, "Major fit found in " + shown.get() + " with " + hcp + " HCP");
        }
        Bid notrump = hcp >= 10 ? Bid.of(3, Strain.NOTRUMP) : Bid.of(2, Strain.NOTRUMP);
        return Suggestion.of(notrump, "No major fit; " + (hcp >= 10 ? "game" : "invitation") + " in notrump");
    }
}
