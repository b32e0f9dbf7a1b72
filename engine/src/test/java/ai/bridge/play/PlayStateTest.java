package ai.bridge.play;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Contract;
import ai.bridge.game.Card;
import ai.bridge.game.Deck;
import ai.bridge.game.Seat;
import ai.bridge.game.Side;
import ai.bridge.game.Suit;
import ai.bridge.helpers.DealBuilder;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PlayStateTest {

    @Test
    void openingLeadComesFromDeclarersLeft() {
        PlayState state = PlayState.start(Contract.parse("3NT by S"), new Deck(7L).deal(Seat.NORTH));

        assertEquals(Seat.WEST, state.getNextToPlay());
        assertEquals(Seat.NORTH, state.getDummy());
        assertEquals(13, state.tricksRemaining());
        assertEquals(13, state.legalCards().size());
        assertEquals(Optional.empty(), state.getTrump());
    }

    @Test
    void mustFollowSuit() {
        PlayState state = DealBuilder.contract("3NT by S")
                .north("♠32 ♣K")
                .east("♠K54")
                .south("♥A32")
                .west("♠QJ")
                .leader(Seat.WEST)
                .played("A♠")
                .build();

        assertEquals(Seat.NORTH, state.getNextToPlay());
        assertEquals(Optional.of(Suit.SPADES), state.getLedSuit());
        assertEquals(List.of(Card.parse("3♠"), Card.parse("2♠")), state.legalCards());
        assertFalse(state.isLegal(Card.parse("K♣")));
        assertThrows(IllegalArgumentException.class, () -> state.play(Card.parse("K♣")));
    }

    @Test
    void anyCardWhenVoid() {
        PlayState state = DealBuilder.contract("3NT by S")
                .north("♣K2")
                .east("♠K3")
                .south("♥A2")
                .west("♠Q")
                .leader(Seat.WEST)
                .played("A♠")
                .build();

        assertEquals(2, state.legalCards().size());
    }

    @Test
    void ruffWinsTheTrickAndLeadsNext() {
        PlayState state = DealBuilder.contract("4♥ by S")
                .north("♥2 ♣3")
                .east("♠3 ♣4")
                .south("♠4 ♣5")
                .west("♠AK")
                .leader(Seat.WEST)
                .tricks(6, 5)
                .build();

        PlayState after = state.play(Card.parse("A♠"))
                .play(Card.parse("2♥"))
                .play(Card.parse("3♠"))
                .play(Card.parse("4♠"));

        assertEquals(Seat.NORTH, after.getNextToPlay());
        assertEquals(7, after.getDeclarerTricks());
        assertEquals(7, after.getTricksWon(Side.NORTH_SOUTH));
        assertEquals(1, after.getTrickHistory().size());
        assertEquals(Seat.NORTH, after.getTrickHistory().get(0).winner().seat());
        assertTrue(after.getCurrentTrick().isEmpty());
    }

    @Test
    void highestOfLedSuitWinsAtNotrump() {
        PlayState state = DealBuilder.contract("1NT by N")
                .north("♦A")
                .east("♥A")
                .south("♥2")
                .west("♥K")
                .leader(Seat.EAST)
                .tricks(6, 6)
                .build();

        PlayState done = state.play(Card.parse("A♥")).play(Card.parse("2♥"))
                .play(Card.parse("K♥")).play(Card.parse("A♦"));

        assertTrue(done.isComplete());
        assertEquals(7, done.getDefenderTricks());
        assertEquals(6, done.getDeclarerTricks());
        assertTrue(done.legalCards().isEmpty());
        assertThrows(NoLegalCardException.class, () -> done.play(Card.parse("A♦")));
    }

    @Test
    void currentWinnerTracksTheTrickInProgress() {
        PlayState state = DealBuilder.contract("4♠ by N")
                .north("♥Q3 ♦2")
                .east("♥J4")
                .south("♥K2 ♦3")
                .west("♥A ♠2 ♦4")
                .leader(Seat.EAST)
                .played("5♥")
                .build();

        assertEquals(Seat.EAST, state.currentWinner().orElseThrow().seat());
        PlayState covered = state.play(Card.parse("K♥"));
        assertEquals(Seat.SOUTH, covered.currentWinner().orElseThrow().seat());
    }

    @Test
    void rejectsInconsistentPositions() {
        assertThrows(IllegalArgumentException.class, () -> DealBuilder.contract("3NT by S")
                .north("♣K2")
                .east("♠K3")
                .south("♥A")
                .west("♠Q2")
                .build());
        assertThrows(IllegalArgumentException.class, () -> DealBuilder.contract("3NT by S")
                .north("♣K")
                .east("♠K")
                .south("♥A")
                .west("♣K")
                .build());
        assertThrows(IllegalArgumentException.class, () -> DealBuilder.contract("3NT by S")
                .north("♣K")
                .east("♠K")
                .south("♥A")
                .west("♠Q")
                .tricks(10, 3)
                .build());
    }
}
