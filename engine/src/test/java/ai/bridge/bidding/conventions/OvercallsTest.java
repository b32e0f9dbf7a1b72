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

class OvercallsTest {

    private final DecisionEngine engine = new DecisionEngine();

    private BidDecision decide(String hand, String calls) {
        return engine.decide(Hands.parse(hand), Hands.auction(Seat.NORTH, calls));
    }

    private static Optional<Suggestion> evaluate(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return new Overcalls().evaluate(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)));
    }

    @Test
    void overcallsAGoodFiveCardSuitAtTheOneLevel() {
        BidDecision decision = decide("♠AQJ54 ♥32 ♦54 ♣K432", "1♦");

        assertEquals(Bid.of(1, Strain.SPADES), decision.bid());
        assertEquals(Convention.OVERCALLS, decision.convention());
    }

    @Test
    void weakJumpWithASixCardSuit() {
        assertEquals(Bid.of(2, Strain.SPADES), evaluate("♠KQJ854 ♥32 ♦54 ♣432", "1♦").orElseThrow().bid());
    }

    @Test
    void notrumpOvercallWithAStopper() {
        assertEquals(Bid.of(1, Strain.NOTRUMP), evaluate("♠AQ4 ♥KJ5 ♦KQ54 ♣J32", "1♦").orElseThrow().bid());
    }

    @Test
    void twoLevelOvercallNeedsOpeningValues() {
        assertEquals(Bid.of(2, Strain.CLUBS), evaluate("♠32 ♥K2 ♦A54 ♣AQJ432", "1♠").orElseThrow().bid());
        assertTrue(evaluate("♠32 ♥82 ♦954 ♣QJT432", "1♠").isEmpty());
    }

    @Test
    void tooWeakToOvercall() {
        assertTrue(evaluate("♠K8654 ♥32 ♦54 ♣Q432", "1♦").isEmpty());
    }
}
