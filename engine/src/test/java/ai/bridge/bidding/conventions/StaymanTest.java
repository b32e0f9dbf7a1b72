package ai.bridge.bidding.conventions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.BidDecision;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.DecisionEngine;
import ai.bridge.bidding.FeatureExtractor;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.helpers.Hands;
import org.junit.jupiter.api.Test;

class StaymanTest {

    private final DecisionEngine engine = new DecisionEngine();

    private BidDecision decide(String hand, String calls) {
        return engine.decide(Hands.parse(hand), Hands.auction(Seat.NORTH, calls));
    }

    @Test
    void asksWithAFourCardMajorAndValues() {
        BidDecision decision = decide("♠KJ54 ♥Q32 ♦K54 ♣J32", "1NT P");

        assertEquals(Bid.of(2, Strain.CLUBS), decision.bid());
        assertEquals(Convention.STAYMAN, decision.convention());
    }

    @Test
    void doesNotAskWhenTooWeak() {
        Hand weak = Hands.parse("♠Q854 ♥J32 ♦954 ♣J32");

        assertTrue(new Stayman().evaluate(weak,
                FeatureExtractor.extract(weak, Hands.auction(Seat.NORTH, "1NT P"))).isEmpty());
    }

    @Test
    void doesNotAskWithAFiveCardMajor() {
        BidDecision decision = decide("♠KJ854 ♥Q32 ♦K54 ♣J3", "1NT P");

        assertEquals(Convention.JACOBY_TRANSFERS, decision.convention());
    }

    @Test
    void openerShowsHearts() {
        assertEquals(Bid.of(2, Strain.HEARTS), decide("♠K32 ♥AQ54 ♦KJ3 ♣Q32", "1NT P 2♣ P").bid());
    }

    @Test
    void openerShowsSpades() {
        assertEquals(Bid.of(2, Strain.SPADES), decide("♠AQ54 ♥K32 ♦KJ3 ♣Q32", "1NT P 2♣ P").bid());
    }

    @Test
    void openerDeniesAMajor() {
        BidDecision decision = decide("♠K32 ♥AQ5 ♦KJ32 ♣Q32", "1NT P 2♣ P");

        assertEquals(Bid.of(2, Strain.DIAMONDS), decision.bid());
        assertEquals(Convention.STAYMAN, decision.convention());
    }

    @Test
    void responderRaisesTheFitToGame() {
        BidDecision decision = decide("♠KJ54 ♥Q32 ♦K54 ♣J32", "1NT P 2♣ P 2♠ P");

        assertEquals(Bid.of(4, Strain.SPADES), decision.bid());
    }

    @Test
    void responderBidsGameInNotrumpWithoutAFit() {
        BidDecision decision = decide("♠KJ54 ♥Q32 ♦K54 ♣J32", "1NT P 2♣ P 2♥ P");

        assertEquals(Bid.of(3, Strain.NOTRUMP), decision.bid());
    }
}
