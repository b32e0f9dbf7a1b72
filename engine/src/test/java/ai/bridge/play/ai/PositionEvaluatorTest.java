package ai.bridge.play.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.auction.Contract;
import ai.bridge.game.Card;
import ai.bridge.game.Deck;
import ai.bridge.game.Rank;
import ai.bridge.game.Seat;
import ai.bridge.game.Side;
import ai.bridge.helpers.DealBuilder;
import ai.bridge.play.PlayState;
import org.junit.jupiter.api.Test;

class PositionEvaluatorTest {

    private final PositionEvaluator evaluator = new PositionEvaluator();

    @Test
    void scoresAreAntisymmetric() {
        for (long seed = 1; seed <= 5; seed++) {
            PlayState state = PlayState.start(Contract.parse("4♥ by E"), new Deck(seed).deal(Seat.NORTH));
            PlayState later = state.play(state.legalCards().get(0));

            assertEquals(evaluator.evaluate(state, Side.NORTH_SOUTH), -evaluator.evaluate(state, Side.EAST_WEST), 1e-9);
            assertEquals(evaluator.evaluate(later, Side.EAST_WEST), -evaluator.evaluate(later, Side.NORTH_SOUTH), 1e-9);
        }
    }

    @Test
    void finishedHandScoresTheTrickDifference() {
        PlayState done = DealBuilder.contract("3NT by S").tricks(9, 4).build();

        assertEquals(5.0, evaluator.evaluate(done, Side.NORTH_SOUTH), 1e-9);
        assertEquals(-5.0, evaluator.evaluate(done, Side.EAST_WEST), 1e-9);
    }

    @Test
    void topCardsFavourTheirOwners() {
        PlayState state = DealBuilder.contract("3NT by S")
                .north("♠AK")
                .east("♠QJ")
                .south("♠32")
                .west("♠T9")
                .leader(Seat.SOUTH)
                .tricks(5, 6)
                .build();

        assertTrue(evaluator.evaluate(state, Side.NORTH_SOUTH) > 0.0);
        assertTrue(evaluator.evaluate(state, Side.EAST_WEST) < 0.0);
    }

    @Test
    void sureWinnersStopAtTheFirstOpposingCard() {
        Seat[] holders = new Seat[Rank.ACE.getValue() + 1];
        holders[Rank.ACE.getValue()] = Seat.NORTH;
        holders[Rank.KING.getValue()] = Seat.SOUTH;
        holders[Rank.QUEEN.getValue()] = Seat.EAST;
        holders[Rank.JACK.getValue()] = Seat.NORTH;

        assertEquals(2, PositionEvaluator.sureWinners(holders, Side.NORTH_SOUTH, 5));
        assertEquals(1, PositionEvaluator.sureWinners(holders, Side.NORTH_SOUTH, 1));
        assertEquals(0, PositionEvaluator.sureWinners(holders, Side.EAST_WEST, 5));
    }

    @Test
    void playedCardsPromoteLowerOnes() {
        Seat[] holders = new Seat[Rank.ACE.getValue() + 1];
        holders[Rank.KING.getValue()] = Seat.EAST;
        holders[Rank.QUEEN.getValue()] = Seat.WEST;
        holders[Rank.TWO.getValue()] = Seat.NORTH;

        assertEquals(2, PositionEvaluator.sureWinners(holders, Side.EAST_WEST, 3));
    }

    @Test
    void discardPenaltyByRank() {
        PlayState state = DealBuilder.contract("3NT by S")
                .north("♣AK ♦QJ ♥T9")
                .east("♠K32 ♦432")
                .south("♥A32 ♦AK5")
                .west("♠QJ ♥QJ ♦T")
                .leader(Seat.WEST)
                .played("A♠")
                .build();

        assertEquals(2.0, PositionEvaluator.discardPenalty(state, Card.parse("A♣")), 1e-9);
        assertEquals(1.5, PositionEvaluator.discardPenalty(state, Card.parse("K♣")), 1e-9);
        assertEquals(1.0, PositionEvaluator.discardPenalty(state, Card.parse("Q♦")), 1e-9);
        assertEquals(0.5, PositionEvaluator.discardPenalty(state, Card.parse("J♦")), 1e-9);
        assertEquals(0.2, PositionEvaluator.discardPenalty(state, Card.parse("T♥")), 1e-9);
        assertEquals(0.0, PositionEvaluator.discardPenalty(state, Card.parse("9♥")), 1e-9);
    }

    @Test
    void noPenaltyForLeadsFollowsOrRuffs() {
        PlayState ruffing = DealBuilder.contract("4♣ by S")
                .north("♣K2")
                .east("♠K3")
                .south("♥A2")
                .west("♠Q")
                .leader(Seat.WEST)
                .played("A♠")
                .build();
        PlayState onLead = DealBuilder.contract("3NT by S")
                .north("♣K2")
                .east("♠K3")
                .south("♥A2")
                .west("♠AQ")
                .leader(Seat.WEST)
                .build();

        assertEquals(0.0, PositionEvaluator.discardPenalty(ruffing, Card.parse("K♣")), 1e-9);
        assertEquals(0.0, PositionEvaluator.discardPenalty(onLead, Card.parse("A♠")), 1e-9);
    }

    @Test
    void underruffCostsLikeADiscard() {
        PlayState underruff = DealBuilder.contract("4♣ by S")
                .north("♥2")
                .east("♣Q ♦2")
                .south("♥A3")
                .west("♠Q")
                .leader(Seat.WEST)
                .played("A♠", "K♣")
                .build();
        PlayState overruff = DealBuilder.contract("4♣ by S")
                .north("♥2")
                .east("♣A ♦2")
                .south("♥K3")
                .west("♠Q")
                .leader(Seat.WEST)
                .played("A♠", "K♣")
                .build();

        assertEquals(1.0, PositionEvaluator.discardPenalty(underruff, Card.parse("Q♣")), 1e-9);
        assertEquals(0.0, PositionEvaluator.discardPenalty(overruff, Card.parse("A♣")), 1e-9);
    }
}
