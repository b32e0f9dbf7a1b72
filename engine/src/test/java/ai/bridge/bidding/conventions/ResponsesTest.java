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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResponsesTest {

    private final DecisionEngine engine = new DecisionEngine();

    private BidDecision decide(String hand, String calls) {
        return engine.decide(Hands.parse(hand), Hands.auction(Seat.NORTH, calls));
    }

    private static Optional<Suggestion> evaluate(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return new Responses().evaluate(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)));
    }

    private static Bid respond(String hand, String calls) {
        return evaluate(hand, calls).orElseThrow().bid();
    }

    @Nested
    class OverOneOfASuit {

        @Test
        void simpleRaiseOfAMajor() {
            BidDecision decision = decide("♠K54 ♥Q32 ♦K543 ♣J32", "1♠ P");

            assertEquals(Bid.of(2, Strain.SPADES), decision.bid());
            assertEquals(Convention.RESPONSES, decision.convention());
        }

        @Test
        void limitRaiseWithTwelveSupportPoints() {
            assertEquals(Bid.of(3, Strain.SPADES), respond("♠K543 ♥Q32 ♦K54 ♣A32", "1♠ P"));
        }

        @Test
        void newSuitAtTheOneLevel() {
            assertEquals(Bid.of(1, Strain.SPADES), respond("♠KJ54 ♥32 ♦Q2 ♣J8542", "1♦ P"));
        }

        @Test
        void oneNotrumpWithoutAFitOrSuit() {
            assertEquals(Bid.of(1, Strain.NOTRUMP), respond("♠2 ♥Q532 ♦K543 ♣J532", "1♠ P"));
        }

        @Test
        void passesUnderSixPoints() {
            assertEquals(Bid.PASS, respond("♠2 ♥J532 ♦Q543 ♣J532", "1♠ P"));
        }

        @Test
        void redoublesWithTenAfterATakeoutDouble() {
            assertEquals(Bid.REDOUBLE, respond("♠2 ♥KJ32 ♦KQ43 ♣J532", "1♠ X"));
        }
    }

    @Nested
    class OverNotrump {

        @Test
        void invitesWithNine() {
            assertEquals(Bid.of(2, Strain.NOTRUMP), respond("♠K32 ♥Q32 ♦K543 ♣J32", "1NT P"));
        }

        @Test
        void bidsGameWithTwelve() {
            assertEquals(Bid.of(3, Strain.NOTRUMP), respond("♠K32 ♥Q32 ♦K543 ♣AJ3", "1NT P"));
        }

        @Test
        void slamValuesGoToSixOrThroughGerber() {
            String hand = "♠AK3 ♥KQ2 ♦AJ54 ♣J32";

            assertEquals(Bid.of(6, Strain.NOTRUMP), respond(hand, "1NT P"));
            assertEquals(Convention.GERBER, decide(hand, "1NT P").convention());
        }

        @Test
        void gameOppositeTwoNotrump() {
            assertEquals(Bid.of(3, Strain.NOTRUMP), respond("♠Q32 ♥J32 ♦K543 ♣432", "2NT P"));
        }
    }

    @Test
    void waitingResponseToTwoClubs() {
        assertEquals(Bid.of(2, Strain.DIAMONDS), respond("♠32 ♥J52 ♦Q5432 ♣J32", "2♣ P"));
    }

    @Test
    void raisesAWeakTwoWithSupport() {
        assertEquals(Bid.of(3, Strain.HEARTS), respond("♠32 ♥J52 ♦Q5432 ♣K32", "2♥ P"));
    }

    @Test
    void doesNotApplyToTheOpener() {
        assertTrue(evaluate("♠K54 ♥Q32 ♦K543 ♣J32", "").isEmpty());
    }
}
