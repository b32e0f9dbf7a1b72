package ai.bridge.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Contract;
import ai.bridge.game.Side;
import ai.bridge.game.Vulnerability;
import ai.bridge.helpers.Hands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ScorerTest {

    private static HandScore score(String contract, int tricks, Vulnerability vulnerability) {
        return Scorer.score(Contract.parse(contract), tricks, vulnerability);
    }

    @Nested
    @DisplayName("Sign and credit")
    class SignAndCredit {

        @Test
        void defeatedContractCreditsDefenders() {
            HandScore result = score("3NT by N", 8, Vulnerability.NONE);

            assertFalse(result.made());
            assertEquals(-50, result.score());
            assertEquals(0, result.pointsFor(Side.NORTH_SOUTH));
            assertEquals(50, result.pointsFor(Side.EAST_WEST));
        }

        @Test
        void madeContractCreditsDeclarer() {
            HandScore result = score("4♠ by W", 10, Vulnerability.NONE);

            assertTrue(result.made());
            assertEquals(420, result.pointsFor(Side.EAST_WEST));
            assertEquals(0, result.pointsFor(Side.NORTH_SOUTH));
        }
    }

    @Nested
    @DisplayName("Made contracts")
    class Made {

        @Test
        void partScores() {
            assertEquals(90, score("1NT by S", 7, Vulnerability.NONE).score());
            assertEquals(110, score("2♥ by S", 8, Vulnerability.NONE).score());
            assertEquals(130, score("3♦ by S", 10, Vulnerability.NONE).score());
        }

        @Test
        void games() {
            assertEquals(400, score("3NT by S", 9, Vulnerability.NONE).score());
            assertEquals(630, score("3NT by S", 10, Vulnerability.BOTH).score());
            assertEquals(600, score("5♣ by S", 11, Vulnerability.NORTH_SOUTH).score());
        }

        @Test
        void slams() {
            assertEquals(1430, score("6♥ by N", 12, Vulnerability.BOTH).score());
            assertEquals(1520, score("7NT by N", 13, Vulnerability.NONE).score());
        }

        @Test
        void doubledAndRedoubledMakes() {
            assertEquals(590, score("4♠X by N", 10, Vulnerability.NONE).score());
            assertEquals(470, score("2♥X by N", 8, Vulnerability.NONE).score());
            assertEquals(140, score("1♣X by N", 7, Vulnerability.NONE).score());
            assertEquals(1000, score("3NTXX by N", 10, Vulnerability.NONE).score());
            assertEquals(870, score("2♠X by E", 9, Vulnerability.EAST_WEST).score());
        }
    }

    @Nested
    @DisplayName("Undertricks")
    class Undertricks {

        @Test
        void undoubled() {
            assertEquals(-150, score("4♠ by N", 7, Vulnerability.NONE).score());
            assertEquals(-200, score("4♠ by N", 8, Vulnerability.BOTH).score());
        }

        @Test
        void doubledNotVulnerable() {
            assertEquals(-100, score("4♠X by N", 9, Vulnerability.NONE).score());
            assertEquals(-500, score("4♠X by N", 7, Vulnerability.NONE).score());
            assertEquals(-800, score("4♠X by N", 6, Vulnerability.NONE).score());
        }

        @Test
        void doubledVulnerable() {
            assertEquals(-200, score("4♠X by N", 9, Vulnerability.NORTH_SOUTH).score());
            assertEquals(-800, score("4♠X by N", 7, Vulnerability.NORTH_SOUTH).score());
        }

        @Test
        void redoubledIsTwiceDoubled() {
            assertEquals(-200, score("1NTXX by E", 6, Vulnerability.NONE).score());
            assertEquals(-1000, score("1NTXX by E", 4, Vulnerability.NONE).score());
        }
    }

    @Test
    void honoursGoToTheSideHoldingThem() {
        Contract contract = Contract.parse("4♠ by N");
        var deal = Hands.deal(
                "♠AKQJ2 ♥K32 ♦Q54 ♣J2",
                "♠T98 ♥QJT ♦KJT ♣KQT9",
                "♠7654 ♥A54 ♦A32 ♣A43",
                "♠3 ♥9876 ♦9876 ♣8765");

        HandScore withHonours = Scorer.score(contract, 10, Vulnerability.NONE, deal);

        assertEquals(100, withHonours.honours());
        assertEquals(520, withHonours.score());
    }

    @Test
    void fourAcesAtNotrumpHeldByDefender() {
        Contract contract = Contract.parse("3NT by S");
        var deal = Hands.deal(
                "♠KQJ2 ♥KQ2 ♦KQ54 ♣K2",
                "♠A43 ♥A543 ♦A32 ♣A54",
                "♠T98 ♥JT9 ♦JT9 ♣QJT9",
                "♠765 ♥876 ♦876 ♣8763");

        HandScore result = Scorer.score(contract, 9, Vulnerability.NONE, deal);

        assertEquals(-150, result.honours());
        assertEquals(250, result.score());
    }

    @Test
    void trickCountIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> score("1NT by N", 14, Vulnerability.NONE));
    }
}
