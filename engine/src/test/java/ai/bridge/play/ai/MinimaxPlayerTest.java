package ai.bridge.play.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Contract;
import ai.bridge.game.Card;
import ai.bridge.game.Deck;
import ai.bridge.game.Seat;
import ai.bridge.helpers.DealBuilder;
import ai.bridge.play.CardDecision;
import ai.bridge.play.NoLegalCardException;
import ai.bridge.play.PlayState;
import org.junit.jupiter.api.Test;

class MinimaxPlayerTest {

    @Test
    void discardsTheLowCardRatherThanAnHonour() {
        PlayState state = DealBuilder.contract("3NT by S")
                .north("♣K2")
                .east("♠K3")
                .south("♥A2")
                .west("♠Q")
                .leader(Seat.WEST)
                .played("A♠")
                .build();

        CardDecision decision = new MinimaxPlayer(4).choose(state);

        assertEquals(Card.parse("2♣"), decision.card());
        assertEquals(CardDecision.Source.SEARCH, decision.source());
        assertTrue(decision.statistics().nodes() > 0);
    }

    @Test
    void cashesTheAceBeforeTheQueen() {
        PlayState state = DealBuilder.contract("3NT by S")
                .north("♣32")
                .east("♣54")
                .south("♥AQ")
                .west("♥K ♠3")
                .leader(Seat.SOUTH)
                .tricks(7, 4)
                .build();

        CardDecision decision = new MinimaxPlayer(8).choose(state);

        assertEquals(Card.parse("A♥"), decision.card());
        assertEquals(5.0, decision.statistics().bestScore(), 1e-9);
    }

    @Test
    void singleLegalCardIsPlayedWithoutSearching() {
        PlayState state = DealBuilder.contract("3NT by S")
                .north("♣K")
                .east("♠K")
                .south("♥A")
                .west("♠Q")
                .leader(Seat.WEST)
                .tricks(6, 6)
                .build();

        CardDecision decision = new MinimaxPlayer(3).choose(state);

        assertEquals(Card.parse("Q♠"), decision.card());
        assertEquals("Only legal card", decision.reason());
        assertEquals(0, decision.statistics().nodes());
    }

    @Test
    void alwaysPlaysALegalCard() {
        MinimaxPlayer player = new MinimaxPlayer(3);
        for (long seed = 1; seed <= 3; seed++) {
            PlayState state = PlayState.start(Contract.parse("4♠ by N"), new Deck(seed).deal(Seat.NORTH));
            for (int ply = 0; ply < 12; ply++) {
                Card card = player.choose(state).card();
                assertTrue(state.isLegal(card), card + " is not legal in " + state);
                state = state.play(card);
            }
        }
    }

    @Test
    void rejectsFinishedHands() {
        PlayState done = DealBuilder.contract("3NT by S").tricks(9, 4).build();

        assertThrows(NoLegalCardException.class, () -> new MinimaxPlayer(2).choose(done));
    }

    @Test
    void depthMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new MinimaxPlayer(0));
        assertEquals(6, new MinimaxPlayer(6).getDepth());
    }
}
