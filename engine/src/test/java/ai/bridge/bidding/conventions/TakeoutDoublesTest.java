package ai.bridge.bidding.conventions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Bid;
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

class TakeoutDoublesTest {

    private final DecisionEngine engine = new DecisionEngine();

    private BidDecision decide(String hand, String calls) {
        return engine.decide(Hands.parse(hand), Hands.auction(Seat.NORTH, calls));
    }

    private static Optional<Suggestion> evaluate(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return new TakeoutDoubles().evaluate(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)));
    }

    @Test
    void doublesWithShortnessInTheirSuit() {
        BidDecision decision = decide("♠KJ54 ♥5 ♦AQ54 ♣K432", "1♥");

        assertEquals(Bid.DOUBLE, decision.bid());
        assertEquals(Convention.TAKEOUT_DOUBLES, decision.convention());
    }

    @Test
    void doesNotDoubleWithLengthInTheirSuit() {
        assertTrue(evaluate("♠KJ5 ♥K54 ♦AQ54 ♣432", "1♥").isEmpty());
    }

    @Test
    void strongHandsDoubleRegardlessOfShape() {
        assertEquals(Bid.DOUBLE, evaluate("♠AKJ5 ♥K54 ♦AQ54 ♣K2", "1♥").orElseThrow().bid());
    }

    @Test
    void balancingSeatNeedsLess() {
        String hand = "♠KJ54 ♥5 ♦Q654 ♣K432";

        assertTrue(evaluate(hand, "1♥").isEmpty());
        assertEquals(Bid.DOUBLE, evaluate(hand, "1♥ P P").orElseThrow().bid());
    }

    @Test
    void penaltyDoubleOfOneNotrump() {
        assertEquals(Bid.DOUBLE, decide("♠AQ4 ♥KJ5 ♦AQ54 ♣J32", "1NT").bid());
        assertTrue(evaluate("♠AQ4 ♥KJ5 ♦Q654 ♣J32", "1NT").isEmpty());
    }
}
