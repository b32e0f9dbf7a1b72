package ai.bridge.play.ai;

import ai.bridge.game.Card;
import ai.bridge.game.Side;
import ai.bridge.play.CardDecision;
import ai.bridge.play.CardPlayer;
import ai.bridge.play.NoLegalCardException;
import ai.bridge.play.PlayState;
import ai.bridge.play.SearchStatistics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-limited alpha-beta search over card plays, written in negamax form.
 *
 * Every seat maximises the evaluation for its own partnership. Because partners play in turn
 * as often as opponents do, a child's score is negated (and the window flipped) only when the
 * side to move changes; partner's move keeps the same sign and window.
 *
 * At the root every candidate is searched with a full window so scores are exact and ties can be
 * broken deliberately:
 * - a discard is charged {@link PositionEvaluator#discardPenalty}
 * - among equal scores the lowest card wins, since candidates are tried low-first
 *
 * Depth is counted in single card plays. The player keeps no state between calls; statistics come
 * back inside each {@link CardDecision}.
 */
public class MinimaxPlayer implements CardPlayer {

    private static final Logger log = LoggerFactory.getLogger(MinimaxPlayer.class);

    private static final double EPSILON = 1e-9;

    private static final Comparator<Card> LOW_FIRST =
            Comparator.comparing(Card::getRank).thenComparing(Card::getSuit);

    private final int depth;
    private final PositionEvaluator evaluator;

    public MinimaxPlayer(int depth) {
        this(depth, new PositionEvaluator());
    }

    public MinimaxPlayer(int depth, PositionEvaluator evaluator) {
        if (depth < 1) {
            throw new IllegalArgumentException("Search depth must be at least 1: " + depth);
        }
        this.depth = depth;
        this.evaluator = evaluator;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public CardDecision choose(PlayState state) {
        List<Card> legal = state.legalCards();
        if (legal.isEmpty()) {
            throw new NoLegalCardException("No legal card for " + state.getNextToPlay() + " in " + state);
        }
        long start = System.nanoTime();
        if (legal.size() == 1) {
            return new CardDecision(legal.get(0), CardDecision.Source.SEARCH, "Only legal card",
                    new SearchStatistics(depth, 0, 0, 0, 0, 0.0));
        }

        Side mover = state.getNextToPlay().side();
        Counters counters = new Counters();
        Card best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Card card : ordered(legal)) {
            double score = childValue(state.play(card), mover, depth - 1,
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, counters);
            score -= PositionEvaluator.discardPenalty(state, card);
            if (log.isDebugEnabled()) {
                log.debug("{} considers {}: {}", state.getNextToPlay(), card, String.format("%+.3f", score));
            }
            if (score > bestScore + EPSILON) {
                bestScore = score;
                best = card;
            }
        }
        long elapsed = (System.nanoTime() - start) / 1_000_000L;
        SearchStatistics stats = new SearchStatistics(depth, counters.nodes, counters.leaves, counters.pruned,
                elapsed, bestScore);
        if (log.isDebugEnabled()) {
            log.debug("{} plays {} ({})", state.getNextToPlay(), best, stats);
        }
        String reason = String.format("Searched %d positions to depth %d; evaluation %+.2f tricks",
                counters.nodes, depth, bestScore);
        return new CardDecision(best, CardDecision.Source.SEARCH, reason, stats);
    }

    private double childValue(PlayState child, Side side, int remaining, double alpha, double beta,
                              Counters counters) {
        if (child.isComplete() || child.getNextToPlay().side() == side) {
            return negamax(child, side, remaining, alpha, beta, counters);
        }
        return -negamax(child, side.opponent(), remaining, -beta, -alpha, counters);
    }

    /**
     * Returns the value of a position for {@code side}, the side to move.
     */
    private double negamax(PlayState state, Side side, int remaining, double alpha, double beta,
                           Counters counters) {
        counters.nodes++;
        if (remaining <= 0 || state.isComplete()) {
            counters.leaves++;
            return evaluator.evaluate(state, side);
        }
        double best = Double.NEGATIVE_INFINITY;
        for (Card card : ordered(state.legalCards())) {
            double value = childValue(state.play(card), side, remaining - 1, alpha, beta, counters);
            if (value > best) {
                best = value;
            }
            if (value > alpha) {
                alpha = value;
            }
            if (alpha >= beta) {
                counters.pruned++;
                break;
            }
        }
        return best;
    }

    private static List<Card> ordered(List<Card> cards) {
        List<Card> sorted = new ArrayList<>(cards);
        sorted.sort(LOW_FIRST);
        return sorted;
    }

    private static final class Counters {
        private long nodes;
        private long leaves;
        private long pruned;
    }

    @Override
    public String toString() {
        return "MinimaxPlayer(depth=" + depth + ")";
    }
}
