package ai.bridge.bidding.conventions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.FeatureExtractor;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Suit;
import ai.bridge.helpers.Hands;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ContractPlacementTest {

    private static final String HEARTS_AGREED = "1♥ P 1♠ P 2♥ P";

    private static Bid place(String hand, String calls) {
        Hand parsed = Hands.parse(hand);
        return ContractPlacement.place(parsed, FeatureExtractor.extract(parsed, Hands.auction(Seat.NORTH, calls)))
                .orElseThrow()
                .bid();
    }

    @Test
    void gameInTheAgreedMajor() {
        assertEquals(Bid.of(4, Strain.HEARTS), place("♠AK54 ♥K32 ♦K54 ♣J32", HEARTS_AGREED));
    }

    @Test
    void invitesInTheAgreedSuit() {
        assertEquals(Bid.of(3, Strain.HEARTS), place("♠AK54 ♥K32 ♦854 ♣J32", HEARTS_AGREED));
    }

    @Test
    void stopsInThePartscore() {
        assertEquals(Bid.PASS, place("♠AJ54 ♥K32 ♦854 ♣832", HEARTS_AGREED));
    }

    @Test
    void threeNotrumpWithoutAFit() {
        assertEquals(Bid.of(3, Strain.NOTRUMP), place("♠AK54 ♥K32 ♦54 ♣KJ32", "1♦ P 1♠ P 1NT P"));
    }

    @Test
    void passesOnceGameIsReached() {
        assertEquals(Bid.PASS, place("♠AKJ52 ♥K32 ♦Q54 ♣32", "1♠ P 4♠ P"));
    }

    @Test
    void recognisesGameContracts() {
        assertTrue(ContractPlacement.isGameOrHigher(Bid.of(3, Strain.NOTRUMP)));
        assertTrue(ContractPlacement.isGameOrHigher(Bid.of(4, Strain.HEARTS)));
        assertTrue(ContractPlacement.isGameOrHigher(Bid.of(5, Strain.CLUBS)));
        assertFalse(ContractPlacement.isGameOrHigher(Bid.of(4, Strain.DIAMONDS)));
        assertFalse(ContractPlacement.isGameOrHigher(Bid.DOUBLE));
    }

    @Test
    void agreedSuitPrefersASuitBothPartnersBid() {
        Hand hand = Hands.parse("♠AK54 ♥K32 ♦K54 ♣J32");
        HandFeatures features = FeatureExtractor.extract(hand, Hands.auction(Seat.NORTH, "1♥ P 1♠ P 2♠ P"));

        assertEquals(Optional.of(Suit.SPADES), ContractPlacement.agreedSuit(features));
    }
}
