package ai.bridge.play;

import ai.bridge.game.Card;
import java.util.Objects;

/**
 * The card a player chose, with where the choice came from.
 *
 * @param card       the card to play
 * @param source     which engine produced it
 * @param reason     a human-readable explanation; for fallbacks, why the solver was not used
 * @param statistics search figures, or {@link SearchStatistics#NONE} for solver answers
 */
public record CardDecision(Card card, Source source, String reason, SearchStatistics statistics) {

    public enum Source {
        /** Depth-limited alpha-beta search. */
        SEARCH,
        /** The external double-dummy solver. */
        SOLVER,
        /** Search used because the solver could not answer. */
        SEARCH_FALLBACK
    }

    public CardDecision {
        Objects.requireNonNull(card, "card");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(statistics, "statistics");
    }

    /**
     * Marks a search decision as a fallback from the solver.
     *
     * @param why the solver failure
     * @return a copy with {@link Source#SEARCH_FALLBACK}
     */
    public CardDecision asFallback(String why) {
        return new CardDecision(card, Source.SEARCH_FALLBACK, why + "; " + reason, statistics);
    }
}
