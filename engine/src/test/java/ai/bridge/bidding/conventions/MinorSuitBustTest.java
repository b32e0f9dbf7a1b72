package ai.bridge.bidding.conventions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.BidDecision;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.DecisionEngine;
import ai.bridge.bidding.FeatureExtractor;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.helpers.Hands;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MinorSuitBustTest {

    private static final String LONG_CLUBS = "♠32 ♥J52 ♦Q5 ♣J98643";
    private static final String LONG_DIAMONDS = "♠32 ♥J52 ♦Q98643 ♣J5";

    private final DecisionEngine engine = new DecisionEngine();

    private BidDecision decide(String hand, String calls) {
        return engine.decide(Hands.parse(hand), Hands.auction(Seat.NORTH, calls));
    }

    private static Optional<Suggestion> evaluate(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return new MinorSuitBust().evaluate(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)));
    }

    @Test
    void relaysWithAWeakHandAndALongMinor() {
        BidDecision decision = decide(LONG_CLUBS, "1NT P");

        assertEquals(Bid.of(2, Strain.SPADES), decision.bid());
        assertEquals(Convention.MINOR_SUIT_BUST, decision.convention());
    }

    @Test
    void openerBidsThreeClubs() {
        BidDecision decision = decide("♠AK3 ♥KQ2 ♦J54 ♣Q432", "1NT P 2♠ P");

        assertEquals(Bid.of(3, Strain.CLUBS), decision.bid());
        assertEquals(Convention.MINOR_SUIT_BUST, decision.convention());
    }

    @Test
    void responderPassesWithClubs() {
        assertEquals(Bid.PASS, decide(LONG_CLUBS, "1NT P 2♠ P 3♣ P").bid());
    }

    @Test
    void responderCorrectsToDiamonds() {
        BidDecision decision = decide(LONG_DIAMONDS, "1NT P 2♠ P 3♣ P");

        assertEquals(Bid.of(3, Strain.DIAMONDS), decision.bid());
        assertEquals(Convention.MINOR_SUIT_BUST, decision.convention());
    }

    @Test
    void openerPassesTheCorrection() {
        assertEquals(Bid.PASS, evaluate("♠AK3 ♥KQ2 ♦J54 ♣Q432", "1NT P 2♠ P 3♣ P 3♦ P").orElseThrow().bid());
    }

    @Test
    void notWithAFourCardMajor() {
        assertTrue(evaluate("♠J432 ♥5 ♦Q5 ♣J98643", "1NT P").isEmpty());
    }

    @Test
    void notWithNinePoints() {
        assertTrue(evaluate("♠32 ♥K52 ♦Q5 ♣KJ8643", "1NT P").isEmpty());
    }

    @Test
    void notAfterInterference() {
        assertTrue(evaluate(LONG_CLUBS, "1NT 2♥").isEmpty());
    }
}
