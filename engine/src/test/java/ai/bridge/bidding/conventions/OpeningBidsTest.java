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

class OpeningBidsTest {

    private final DecisionEngine engine = new DecisionEngine();

    private BidDecision decide(String hand, String calls) {
        return engine.decide(Hands.parse(hand), Hands.auction(Seat.NORTH, calls));
    }

    private static Bid open(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return new OpeningBids().evaluate(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)))
                .orElseThrow()
                .bid();
    }

    @Test
    void opensAFiveCardMajor() {
        BidDecision decision = decide("♠AKJ52 ♥K32 ♦Q54 ♣32", "");

        assertEquals(Bid.of(1, Strain.SPADES), decision.bid());
        assertEquals(Convention.OPENING_BIDS, decision.convention());
    }

    @Test
    void opensTheLongerMinor() {
        assertEquals(Bid.of(1, Strain.DIAMONDS), open("♠K32 ♥A2 ♦KJ54 ♣Q543", ""));
        assertEquals(Bid.of(1, Strain.CLUBS), open("♠AQ32 ♥K54 ♦Q32 ♣J32", ""));
    }

    @Test
    void ruleOfTwentyOpensLightTwoSuiters() {
        assertEquals(Bid.of(1, Strain.SPADES), decide("♠AQ852 ♥KJ852 ♦3 ♣32", "").bid());
    }

    @Test
    void passesElevenFlat() {
        assertEquals(Bid.PASS, open("♠Q843 ♥Q52 ♦K54 ♣A43", ""));
    }

    @Test
    void opensTwoNotrumpWithTwentyOne() {
        assertEquals(Bid.of(2, Strain.NOTRUMP), open("♠AK2 ♥KQ3 ♦AQ54 ♣K32", ""));
    }

    @Test
    void fourthSeatAppliesTheRuleOfFifteen() {
        String hand = "♠32 ♥AQ52 ♦KJ54 ♣Q32";

        assertEquals(Bid.of(1, Strain.DIAMONDS), open(hand, ""));
        assertEquals(Bid.PASS, open(hand, "P P P"));
    }

    @Test
    void doesNotApplyAfterAnOpening() {
        Hand hand = Hands.parse("♠AKJ52 ♥K32 ♦Q54 ♣32");
        Optional<Suggestion> suggestion = new OpeningBids().evaluate(hand,
                FeatureExtractor.extract(hand, Hands.auction(Seat.NORTH, "1♥")));

        assertTrue(suggestion.isEmpty());
    }
}
