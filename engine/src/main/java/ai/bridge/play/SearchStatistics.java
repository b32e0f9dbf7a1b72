package ai.bridge.play;

/**
 * Figures from a single card choice. Players return a fresh instance with every decision and keep
 * nothing between calls.
 *
 * @param depth         the search depth in plies
 * @param nodes         positions visited
 * @param leafNodes     positions scored by the evaluator
 * @param prunedBranches alpha-beta cutoffs
 * @param elapsedMillis wall-clock time of the search
 * @param bestScore     the chosen card's score, in tricks, from the mover's side
 */
public record SearchStatistics(int depth, long nodes, long leafNodes, long prunedBranches,
                               long elapsedMillis, double bestScore) {

    public static final SearchStatistics NONE = new SearchStatistics(0, 0, 0, 0, 0, 0.0);

    @Override
    public String toString() {
        return String.format("depth=%d nodes=%d leaves=%d pruned=%d time=%dms score=%+.2f",
                depth, nodes, leafNodes, prunedBranches, elapsedMillis, bestScore);
    }
}
