package ai.bridge.play.ai;

import ai.bridge.game.Card;
import ai.bridge.game.Hand;
import ai.bridge.game.Rank;
import ai.bridge.game.Seat;
import ai.bridge.game.Side;
import ai.bridge.game.Suit;
import ai.bridge.play.PlayState;
import ai.bridge.play.PlayedCard;
import java.util.Optional;

/**
 * Static evaluation of a play position, measured in tricks.
 *
 * The score for one side is the exact negation of the score for the other. It combines:
 * - tricks already won (full weight)
 * - sure winners: the unbroken top sequence of the partnership's combined holding in each suit,
 *   counting cards already played as gone, capped by the longer hand's length
 * - master winners: sure winners are worth more when the opponents hold no trumps and so cannot
 *   ruff them (always the case at notrump)
 * - high cards weighted by suit length
 * - entries: winners in one hand that the partner can reach with a card in the same suit
 *
 * Discards are not scored here; {@link #discardPenalty(PlayState, Card)} is applied by the search
 * at the root, where it outweighs any entry bonus.
 */
public class PositionEvaluator {

    static final double TRICK_WEIGHT = 1.0;
    static final double SURE_WINNER_WEIGHT = 0.3;
    static final double MASTER_WINNER_WEIGHT = 0.5;
    static final double HIGH_CARD_WEIGHT = 0.01;
    static final double ENTRY_WEIGHT = 0.05;

    /**
     * Scores a position for one partnership.
     *
     * @param state the position
     * @param side  the side whose view is taken
     * @return positive when the position favours {@code side}
     */
    public double evaluate(PlayState state, Side side) {
        double tricks = state.getTricksWon(side) - state.getTricksWon(side.opponent());
        if (state.isComplete()) {
            return tricks;
        }
        Seat[][] owners = owners(state);
        return TRICK_WEIGHT * tricks + potential(state, owners, side) - potential(state, owners, side.opponent());
    }

    private double potential(PlayState state, Seat[][] owners, Side side) {
        Seat first = side == Side.NORTH_SOUTH ? Seat.NORTH : Seat.EAST;
        Hand one = state.getHand(first);
        Hand two = state.getHand(first.partner());
        double winnerWeight = opponentsHoldTrumps(state, side) ? SURE_WINNER_WEIGHT : MASTER_WINNER_WEIGHT;

        double score = 0.0;
        int entries = 0;
        for (Suit suit : Suit.values()) {
            Seat[] holders = owners[suit.ordinal()];
            int cap = Math.max(one.length(suit), two.length(suit));
            score += winnerWeight * sureWinners(holders, side, cap);
            score += HIGH_CARD_WEIGHT * (one.hcp(suit) * one.length(suit) + two.hcp(suit) * two.length(suit));
            Seat master = masterHolder(holders);
            if (master != null && master.side() == side && state.getHand(master.partner()).length(suit) > 0) {
                entries++;
            }
        }
        return score + ENTRY_WEIGHT * entries;
    }

    /**
     * Maps every card still held to its holder: {@code owners[suit][rank value]}, null once played.
     */
    private static Seat[][] owners(PlayState state) {
        Seat[][] owners = new Seat[Suit.values().length][Rank.ACE.getValue() + 1];
        for (Seat seat : Seat.values()) {
            for (Card card : state.getHand(seat).getCards()) {
                owners[card.getSuit().ordinal()][card.getRank().getValue()] = seat;
            }
        }
        return owners;
    }

    /**
     * Counts the unbroken top sequence held by a side in one suit. Played cards are skipped; the
     * count stops at the first card an opponent holds and never exceeds {@code cap}.
     */
    static int sureWinners(Seat[] holders, Side side, int cap) {
        int winners = 0;
        for (int value = Rank.ACE.getValue(); value >= Rank.TWO.getValue() && winners < cap; value--) {
            Seat holder = holders[value];
            if (holder == null) {
                continue;
            }
            if (holder.side() != side) {
                break;
            }
            winners++;
        }
        return winners;
    }

    private static Seat masterHolder(Seat[] holders) {
        for (int value = Rank.ACE.getValue(); value >= Rank.TWO.getValue(); value--) {
            if (holders[value] != null) {
                return holders[value];
            }
        }
        return null;
    }

    private static boolean opponentsHoldTrumps(PlayState state, Side side) {
        Optional<Suit> trump = state.getTrump();
        if (trump.isEmpty()) {
            return false;
        }
        for (Seat seat : Seat.values()) {
            if (seat.side() != side && state.getHand(seat).length(trump.get()) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Penalty for throwing away a card: playing off-suit to a trick without taking the lead in it.
     * A trump that cannot beat a higher trump already on the trick is an underruff and counts as a
     * discard.
     *
     * @param state the position before the card is played
     * @param card  the candidate card
     * @return the trick-equivalent cost (A 2.0, K 1.5, Q 1.0, J 0.5, T 0.2), or 0 when the card
     *         is not a discard
     */
    public static double discardPenalty(PlayState state, Card card) {
        Optional<Suit> led = state.getLedSuit();
        if (led.isEmpty() || card.getSuit() == led.get() || isWinningRuff(state, card)) {
            return 0.0;
        }
        return switch (card.getRank()) {
            case ACE -> 2.0;
            case KING -> 1.5;
            case QUEEN -> 1.0;
            case JACK -> 0.5;
            case TEN -> 0.2;
            default -> 0.0;
        };
    }

    private static boolean isWinningRuff(PlayState state, Card card) {
        if (state.getTrump().filter(t -> t == card.getSuit()).isEmpty()) {
            return false;
        }
        return state.currentWinner()
                .map(PlayedCard::card)
                .filter(winning -> winning.getSuit() == card.getSuit())
                .map(card::beatsInSuit)
                .orElse(true);
    }
}
