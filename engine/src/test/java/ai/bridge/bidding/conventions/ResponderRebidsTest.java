package ai.bridge.bidding.conventions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.FeatureExtractor;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.helpers.Hands;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ResponderRebidsTest {

    private static Optional<Suggestion> evaluate(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return new ResponderRebids().evaluate(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)));
    }

    private static Bid rebid(String hand, String calls) {
        return evaluate(hand, calls).orElseThrow().bid();
    }

    @Test
    void signsOffInASixCardSuitOverOneNotrump() {
        assertEquals(Bid.of(2, Strain.HEARTS), rebid("♠32 ♥KJ9854 ♦Q32 ♣32", "1♣ P 1♥ P 1NT P"));
    }

    @Test
    void invitesOrBidsGameWithTheLongSuit() {
        assertEquals(Bid.of(3, Strain.HEARTS), rebid("♠A2 ♥KJ9854 ♦Q32 ♣32", "1♣ P 1♥ P 1NT P"));
        assertEquals(Bid.of(4, Strain.HEARTS), rebid("♠A2 ♥KJ9854 ♦KQ2 ♣32", "1♣ P 1♥ P 1NT P"));
    }

    @Test
    void givesPreferenceToTheFirstSuit() {
        assertEquals(Bid.of(2, Strain.SPADES), rebid("♠Q32 ♥K854 ♦J2 ♣Q932", "1♠ P 1NT P 2♦ P"));
    }

    @Test
    void passesTheSecondSuitWithMoreLengthThere() {
        assertEquals(Bid.PASS, rebid("♠Q2 ♥K854 ♦J532 ♣Q93", "1♠ P 1NT P 2♦ P"));
    }

    @Test
    void bidsGameWithEnoughCombinedValues() {
        assertEquals(Bid.of(4, Strain.HEARTS), rebid("♠AK54 ♥K32 ♦K54 ♣J32", "1♥ P 1♠ P 2♥ P"));
    }

    @Test
    void doesNotApplyToTheFirstResponse() {
        assertTrue(evaluate("♠Q32 ♥K854 ♦J2 ♣Q932", "1♠ P").isEmpty());
    }
}
