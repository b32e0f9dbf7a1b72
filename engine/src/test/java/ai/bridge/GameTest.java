package ai.bridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Contract;
import ai.bridge.bidding.DecisionEngine;
import ai.bridge.config.PlayProperties;
import ai.bridge.game.Deck;
import ai.bridge.game.Seat;
import ai.bridge.game.Vulnerability;
import ai.bridge.play.Difficulty;
import ai.bridge.play.ai.dds.DoubleDummyClient;
import ai.bridge.scoring.HandScore;
import org.junit.jupiter.api.Test;

class GameTest {

    private static Game game() {
        PlayProperties properties = new PlayProperties();
        properties.setDifficulty(Difficulty.INTERMEDIATE);
        properties.getSolver().setEnabled(false);
        BridgeEngine engine = new BridgeEngine(new DecisionEngine(), properties,
                new DoubleDummyClient("http://127.0.0.1:1", 200));
        return new Game(engine, properties);
    }

    @Test
    void playsACompleteBoard() {
        Game.GameResult result = game().play(new Deck(42L), Seat.NORTH, Vulnerability.NONE);

        assertTrue(result.getAuction().isComplete());
        if (result.isPassedOut()) {
            assertTrue(result.getScore().isEmpty());
            return;
        }
        Contract contract = result.getContract().orElseThrow();
        HandScore score = result.getScore().orElseThrow();
        assertTrue(result.getDeclarerTricks() >= 0 && result.getDeclarerTricks() <= 13);
        assertEquals(contract, score.contract());
        assertEquals(result.getDeclarerTricks(), score.tricksTaken());
        assertTrue(result.getDurationNanos() > 0);
    }

    @Test
    void sameSeedPlaysTheSameBoard() {
        Game.GameResult first = game().play(new Deck(7L), Seat.EAST, Vulnerability.BOTH);
        Game.GameResult second = game().play(new Deck(7L), Seat.EAST, Vulnerability.BOTH);

        assertEquals(first.getAuction(), second.getAuction());
        assertEquals(first.getDeclarerTricks(), second.getDeclarerTricks());
        assertEquals(first.getScore().map(HandScore::score), second.getScore().map(HandScore::score));
    }

    @Test
    void dealerRotatesWithTheBoard() {
        assertEquals(Seat.NORTH, Game.dealerFor(1));
        assertEquals(Seat.EAST, Game.dealerFor(2));
        assertEquals(Seat.WEST, Game.dealerFor(4));
        assertEquals(Seat.NORTH, Game.dealerFor(5));
    }
}
