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
import java.util.List;
import java.util.Optional;

/**
 * Gerber: 4♣ asks for aces directly over partner's natural notrump bid, 5♣ then asks for kings.
 * <p>
 * Answers are steps: 4♦ = 0 or 4, 4♥ = 1, 4♠ = 2, 4NT = 3 (one level higher for kings, with 5NT
 * showing three). The asker then signs off in 4NT with two or more aces missing, bids 6NT with one
 * missing, and with every ace asks for kings when combined strength reaches the grand-slam
 * threshold. Any bid other than 5♣ after the answer is to play.
 */
public class Gerber implements ConventionModule {

    static final Bid ACE_ASK = Bid.of(4, Strain.CLUBS);
    static final Bid KING_ASK = Bid.of(5, Strain.CLUBS);

    private static final List<Bid> ACE_STEPS = List.of(
            Bid.of(4, Strain.DIAMONDS), Bid.of(4, Strain.HEARTS), Bid.of(4, Strain.SPADES), Bid.of(4, Strain.NOTRUMP));
    private static final List<Bid> KING_STEPS = List.of(
            Bid.of(5, Strain.DIAMONDS), Bid.of(5, Strain.HEARTS), Bid.of(5, Strain.SPADES), Bid.of(5, Strain.NOTRUMP));

    private final BiddingProperties.Slam thresholds;

    public Gerber(BiddingProperties.Slam thresholds) {
        this.thresholds = thresholds;
    }

    public Gerber() {
        this(new BiddingProperties.Slam());
    }

    @Override
    public Convention convention() {
        return Convention.GERBER;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() == AuctionState.OPENING || features.getState() == AuctionState.COMPETITIVE
                || !features.isOpeningSide()) {
            return Optional.empty();
        }
        Optional<Bid> partnerLast = features.getPartnerLastBid();
        if (partnerLast.isEmpty()) {
            return Optional.empty();
        }
        Bid partners = partnerLast.get();
        List<Bid> mine = features.getMyBids();
        boolean iAsked = mine.contains(ACE_ASK);
        boolean iAnswered = mine.stream().anyMatch(ACE_STEPS::contains) && features.getPartnerCalls().contains(ACE_ASK);

        if (iAsked) {
            if (mine.contains(KING_ASK) && KING_STEPS.contains(partners)) {
                return afterKingAnswer(hand, partners);
            }
            if (ACE_STEPS.contains(partners) && !mine.contains(KING_ASK)) {
                return afterAceAnswer(hand, features, partners);
            }
            return Optional.empty();
        }
        if (iAnswered) {
            if (partners.equals(KING_ASK)) {
                return answer(BiddingHelper.kings(hand), KING_STEPS, "kings");
            }
            return Suggestion.of(Bid.PASS, "Partner placed the contract after Gerber");
        }
        if (partners.equals(ACE_ASK) && mine.size() > 0 && isNaturalNotrump(mine.get(mine.size() - 1))) {
            return answer(BiddingHelper.aces(hand), ACE_STEPS, "aces");
        }
        return ask(features, partners);
    }

    private Optional<Suggestion> ask(HandFeatures features, Bid partners) {
        if (!isNaturalNotrump(partners) || features.isContested()
                || !BiddingHelper.isLegal(ACE_ASK, features)) {
            return Optional.empty();
        }
        // Partner's notrump after our own notrump opening is a limit bid, not a slam base.
        if (features.getMyFirstBid().filter(bid -> bid.strain().isNotrump()).isPresent()) {
            return Optional.empty();
        }
        int combined = features.getHcp() + features.getPartnerMinimumPoints();
        if (combined < thresholds.getSmallSlam()) {
            return Optional.empty();
        }
        return Suggestion.of(ACE_ASK, "Gerber: " + combined + " combined points opposite partner's " + partners);
    }

    private static boolean isNaturalNotrump(Bid bid) {
        return bid.isContract() && bid.strain().isNotrump() && bid.level() <= 3;
    }

    private static Optional<Suggestion> answer(int count, List<Bid> steps, String what) {
        int index = count == 4 ? 0 : count;
        String shown = index == 0 ? "0 or 4" : String.valueOf(count);
        return Suggestion.of(steps.get(index), "Gerber answer: " + shown + " " + what);
    }

    /**
     * Decodes a step answer; the lowest step means 4 when we hold none ourselves, else 0.
     */
    static int decodeStep(Bid answer, List<Bid> steps, int held) {
        int index = steps.indexOf(answer);
        if (index == 0) {
            return held == 0 ? 4 : 0;
        }
        return index;
    }

    private Optional<Suggestion> afterAceAnswer(Hand hand, HandFeatures features, Bid answer) {
        int mine = BiddingHelper.aces(hand);
        int total = mine + decodeStep(answer, ACE_STEPS, mine);
        if (total <= 2) {
            return Suggestion.of(Bid.of(4, Strain.NOTRUMP), "Missing " + (4 - total) + " aces: signing off in 4NT");
        }
        if (total == 3) {
            return Suggestion.of(Bid.of(6, Strain.NOTRUMP), "Small slam: one ace missing");
        }
        int combined = features.getHcp() + features.getPartnerMinimumPoints();
        if (combined >= thresholds.getGrandSlam()) {
            return Suggestion.of(KING_ASK, "All aces held with " + combined + " combined points: asking for kings");
        }
        return Suggestion.of(Bid.of(6, Strain.NOTRUMP), "Small slam: all aces but only " + combined + " combined points");
    }

    private static Optional<Suggestion> afterKingAnswer(Hand hand, Bid answer) {
        int mine = BiddingHelper.kings(hand);
        int total = mine + decodeStep(answer, KING_STEPS, mine);
        if (total >= 3) {
            return Suggestion.of(Bid.of(7, Strain.NOTRUMP), "Grand slam: all aces and " + total + " kings");
        }
        return Suggestion.of(Bid.of(6, Strain.NOTRUMP), "Small slam: missing " + (4 - total) + " kings");
    }
}
