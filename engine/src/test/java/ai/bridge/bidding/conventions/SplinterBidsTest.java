package ai.bridge.bidding.conventions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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

class SplinterBidsTest {

    private final DecisionEngine engine = new DecisionEngine();

    private BidDecision decide(String hand, String calls) {
        return engine.decide(Hands.parse(hand), Hands.auction(Seat.NORTH, calls));
    }

    private static Optional<Suggestion> evaluate(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return new SplinterBids().evaluate(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)));
    }

    @Test
    void splintersWithASingletonBelowTheMajor() {
        BidDecision decision = decide("♠KJ54 ♥A432 ♦K432 ♣2", "1♠ P");

        assertEquals(Bid.of(4, Strain.CLUBS), decision.bid());
        assertEquals(Convention.SPLINTERS, decision.convention());
    }

    @Test
    void splintersInSpadesOverHeartsAtTheThreeLevel() {
        assertEquals(Bid.of(3, Strain.SPADES), evaluate("♠2 ♥KJ54 ♦A432 ♣K432", "1♥ P").orElseThrow().bid());
    }

    @Test
    void needsShortness() {
        assertTrue(evaluate("♠KJ54 ♥A43 ♦K432 ♣32", "1♠ P").isEmpty());
    }

    @Test
    void tooStrongToSplinter() {
        assertTrue(evaluate("♠AKJ4 ♥AQ32 ♦K432 ♣2", "1♠ P").isEmpty());
    }

    @Test
    void openerSignsOffInGame() {
        assertEquals(Bid.of(4, Strain.SPADES), evaluate("♠AKJ52 ♥K32 ♦Q54 ♣32", "1♠ P 4♣ P").orElseThrow().bid());
    }

    @Test
    void recognisesDoubleJumps() {
        assertTrue(SplinterBids.isSplinter(Bid.of(3, Strain.SPADES), Bid.of(1, Strain.HEARTS)));
        assertFalse(SplinterBids.isSplinter(Bid.of(2, Strain.CLUBS), Bid.of(1, Strain.SPADES)));
        assertFalse(SplinterBids.isSplinter(Bid.of(4, Strain.CLUBS), Bid.of(1, Strain.DIAMONDS)));
    }
}
