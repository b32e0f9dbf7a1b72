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
import ai.bridge.config.BiddingProperties;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Suit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blackwood ace ask (4NT) and king ask (5NT) with their answers and the final slam decision.
 * <p>
 * Answers use the step scale 5♣ = 0 or 4, 5♦ = 1, 5♥ = 2, 5♠ = 3 (one level higher for kings).
 * After the answer the asker places the contract deterministically:
 * <ul>
 *   <li>two or more aces missing: sign off at the five level of the agreed suit;</li>
 *   <li>one ace missing: small slam;</li>
 *   <li>no ace missing: ask for kings when combined strength reaches the grand-slam threshold,
 *       otherwise small slam.</li>
 * </ul>
 */
public class Blackwood implements ConventionModule {

    private static final Logger log = LoggerFactory.getLogger(Blackwood.class);

    static final Bid ACE_ASK = Bid.of(4, Strain.NOTRUMP);
    static final Bid KING_ASK = Bid.of(5, Strain.NOTRUMP);

    private final BiddingProperties.Slam thresholds;

    public Blackwood(BiddingProperties.Slam thresholds) {
        this.thresholds = thresholds;
    }

    public Blackwood() {
        this(new BiddingProperties.Slam());
    }

    @Override
    public Convention convention() {
        return Convention.BLACKWOOD;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (features.getState() == AuctionState.OPENING) {
            return Optional.empty();
        }
        Optional<Bid> partnerLast = features.getPartnerLastBid();
        Optional<Bid> myLast = features.getMyLastBid();

        if (partnerLast.equals(Optional.of(KING_ASK)) && features.getPartnerCalls().contains(ACE_ASK)) {
            return answer(BiddingHelper.kings(hand), 6, "kings");
        }
        if (partnerLast.equals(Optional.of(ACE_ASK)) && isAceAsk(features)) {
            return answer(BiddingHelper.aces(hand), 5, "aces");
        }
        if (myLast.equals(Optional.of(ACE_ASK)) && partnerLast.filter(bid -> isStep(bid, 5)).isPresent()) {
            return afterAceAnswer(hand, features, partnerLast.get());
        }
        if (myLast.equals(Optional.of(KING_ASK)) && partnerLast.filter(bid -> isStep(bid, 6)).isPresent()) {
            return afterKingAnswer(hand, features, partnerLast.get());
        }
        return ask(features);
    }

    private static boolean isStep(Bid bid, int level) {
        return bid.isContract() && bid.level() == level && !bid.strain().isNotrump();
    }

    private static Optional<Suggestion> answer(int count, int level, String what) {
        Suit step = switch (count) {
            case 1 -> Suit.DIAMONDS;
            case 2 -> Suit.HEARTS;
            case 3 -> Suit.SPADES;
            default -> Suit.CLUBS;
        };
        String shown = step == Suit.CLUBS ? "0 or 4" : String.valueOf(count);
        return Suggestion.of(Bid.of(level, step), "Blackwood answer: " + shown + " " + what);
    }

    /**
     * 4NT asks for aces when our side has bid a suit and it does not follow our own notrump bid
     * (which would make it quantitative).
     */
    private static boolean isAceAsk(HandFeatures features) {
        if (agreedTrump(features).isEmpty()) {
            return false;
        }
        Seat partner = features.getSeat().partner();
        Bid before = null;
        for (Call call : features.getAuction().getCalls()) {
            if (call.seat() == partner && call.bid().equals(ACE_ASK)) {
                break;
            }
            if (call.bid().isContract() && call.seat().side() == partner.side()) {
                before = call.bid();
            }
        }
        return before != null && !before.strain().isNotrump();
    }

    private Optional<Suggestion> ask(HandFeatures features) {
        if (features.getMyBids().contains(ACE_ASK) || !BiddingHelper.isLegal(ACE_ASK, features)) {
            return Optional.empty();
        }
        Optional<Bid> partnerLast = features.getPartnerLastBid();
        if (partnerLast.isEmpty() || partnerLast.get().strain().isNotrump()) {
            return Optional.empty();
        }
        Optional<Suit> trump = agreedTrump(features);
        if (trump.isEmpty() || !isFitConfirmed(features, trump.get())) {
            return Optional.empty();
        }
        int combined = features.getCombinedPoints();
        if (combined < thresholds.getSmallSlam()) {
            return Optional.empty();
        }
        return Suggestion.of(ACE_ASK, "Blackwood: " + combined + " combined points with " + trump.get() + " agreed");
    }

    /**
     * The fit must be established: partner raised our suit, we hold a fit for partner's suit after
     * describing our hand, or partner splintered in support.
     */
    static boolean isFitConfirmed(HandFeatures features, Suit trump) {
        boolean iBidIt = features.getMyBids().stream().anyMatch(bid -> BiddingHelper.suitOf(bid).equals(Optional.of(trump)));
        boolean partnerBidIt = features.getPartnerCalls().stream()
                .anyMatch(bid -> BiddingHelper.suitOf(bid).equals(Optional.of(trump)));
        if (iBidIt && partnerBidIt) {
            return true;
        }
        if (partnerBidIt && !features.getMyBids().isEmpty() && features.getFitSuit().equals(Optional.of(trump))) {
            return true;
        }
        Optional<Bid> myFirst = features.getMyFirstBid();
        return iBidIt && myFirst.isPresent() && features.getPartnerLastBid()
                .filter(bid -> SplinterBids.isSplinter(bid, myFirst.get()))
                .isPresent();
    }

    private Optional<Suggestion> afterAceAnswer(Hand hand, HandFeatures features, Bid answer) {
        int mine = BiddingHelper.aces(hand);
        int partners = decodeStep(answer, mine);
        int missing = 4 - (mine + partners);
        Optional<Suit> trump = agreedTrump(features);
        int combined = features.getCombinedPoints();
        if (log.isDebugEnabled()) {
            log.debug("Blackwood signoff: {} aces held, {} missing, trump {}, combined {}", mine + partners, missing, trump, combined);
        }
        Strain strain = trump.map(Strain::of).orElse(Strain.NOTRUMP);
        if (missing >= 2) {
            return signOff(features, strain, answer, missing);
        }
        if (missing == 1) {
            return Suggestion.of(Bid.of(6, strain), "Small slam: one ace missing");
        }
        if (combined >= thresholds.getGrandSlam()) {
            return Suggestion.of(KING_ASK, "All aces held with " + combined + " combined points: asking for kings");
        }
        return Suggestion.of(Bid.of(6, strain),
                "Small slam: all aces but only " + combined + " combined points (grand needs " + thresholds.getGrandSlam() + ")");
    }

    private Optional<Suggestion> signOff(HandFeatures features, Strain strain, Bid answer, int missing) {
        if (answer.strain() == strain) {
            return Suggestion.of(Bid.PASS, "Missing " + missing + " aces: partner's answer is our signoff");
        }
        Bid fiveLevel = Bid.of(5, strain);
        if (BiddingHelper.isLegal(fiveLevel, features)) {
            return Suggestion.of(fiveLevel, "Missing " + missing + " aces: signing off at the five level");
        }
        return Suggestion.of(Bid.PASS, "Missing " + missing + " aces and the five level is past; passing");
    }

    private Optional<Suggestion> afterKingAnswer(Hand hand, HandFeatures features, Bid answer) {
        int mine = BiddingHelper.kings(hand);
        int total = mine + decodeStep(answer, mine);
        Strain strain = agreedTrump(features).map(Strain::of).orElse(Strain.NOTRUMP);
        if (total >= 3) {
            return Suggestion.of(Bid.of(7, strain), "Grand slam: all aces and " + total + " kings");
        }
        return Suggestion.of(Bid.of(6, strain), "Small slam: missing " + (4 - total) + " kings");
    }

    /**
     * Decodes a step answer; the lowest step means 4 when we hold none ourselves, else 0.
     */
    static int decodeStep(Bid answer, int held) {
        return switch (answer.strain()) {
            case DIAMONDS -> 1;
            case HEARTS -> 2;
            case SPADES -> 3;
            default -> held == 0 ? 4 : 0;
        };
    }

    /**
     * The agreed trump suit: the most recent major named naturally by our side, else the most recent
     * minor. Ace and king asks, their answers, and splinters are ignored.
     */
    static Optional<Suit> agreedTrump(HandFeatures features) {
        Seat seat = features.getSeat();
        List<Call> calls = features.getAuction().getCalls();
        List<Suit> named = new ArrayList<>();
        Bid firstOwn = null;
        boolean asked = false;
        for (Call call : calls) {
            Bid bid = call.bid();
            if (!bid.isContract() || call.seat().side() != seat.side()) {
                continue;
            }
            if (bid.equals(ACE_ASK) || bid.equals(KING_ASK)) {
                asked = true;
                continue;
            }
            if (asked || (firstOwn != null && SplinterBids.isSplinter(bid, firstOwn))) {
                continue;
            }
            if (firstOwn == null) {
                firstOwn = bid;
            }
            bid.strain().suit().ifPresent(named::add);
        }
        for (int i = named.size() - 1; i >= 0; i--) {
            if (named.get(i).isMajor()) {
                return Optional.of(named.get(i));
            }
        }
        return named.isEmpty() ? Optional.empty() : Optional.of(named.get(named.size() - 1));
    }
}
