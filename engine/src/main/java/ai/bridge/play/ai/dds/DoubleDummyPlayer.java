package ai.bridge.play.ai.dds;

import ai.bridge.game.Card;
import ai.bridge.play.CardDecision;
import ai.bridge.play.CardPlayer;
import ai.bridge.play.NoLegalCardException;
import ai.bridge.play.PlayState;
import ai.bridge.play.SearchStatistics;
import ai.bridge.play.ai.MinimaxPlayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expert player backed by the double-dummy solver service.
 *
 * The solver's card is checked against the play rules before it is used. When the solver is
 * disabled, the platform is unsupported, or the call fails in any way, the choice falls back to the
 * alpha-beta search; the fallback is logged at WARN and marked
 * {@link CardDecision.Source#SEARCH_FALLBACK} with the reason.
 */
public class DoubleDummyPlayer implements CardPlayer {

    private static final Logger log = LoggerFactory.getLogger(DoubleDummyPlayer.class);

    private final DoubleDummyClient client;
    private final MinimaxPlayer fallback;
    private final boolean enabled;
    private final boolean unsupportedPlatform;

    /**
     * @param client              the solver client
     * @param fallback            search used whenever the solver cannot answer
     * @param enabled             whether the solver may be called at all
     * @param unsupportedPlatform whether the solver is known not to work on this machine
     */
    public DoubleDummyPlayer(DoubleDummyClient client, MinimaxPlayer fallback, boolean enabled,
                             boolean unsupportedPlatform) {
        this.client = client;
        this.fallback = fallback;
        this.enabled = enabled;
        this.unsupportedPlatform = unsupportedPlatform;
    }

    @Override
    public CardDecision choose(PlayState state) {
        if (state.legalCards().isEmpty()) {
            throw new NoLegalCardException("No legal card for " + state.getNextToPlay() + " in " + state);
        }
        try {
            Card card = solve(state);
            return new CardDecision(card, CardDecision.Source.SOLVER, "Double-dummy best card", SearchStatistics.NONE);
        } catch (DoubleDummyException e) {
            log.warn("Solver unavailable for {} ({}); falling back to depth {} search",
                    state.getNextToPlay(), e.getMessage(), fallback.getDepth());
            return fallback.choose(state).asFallback("Solver unavailable: " + e.getMessage());
        }
    }

    private Card solve(PlayState state) {
        if (!enabled) {
            throw new DoubleDummyException("solver disabled by configuration");
        }
        if (unsupportedPlatform) {
            throw new DoubleDummyException("solver not supported on this platform");
        }
        DoubleDummyResponse response = client.solve(DoubleDummyRequest.from(state));
        Card card;
        try {
            card = Card.fromPbn(response.getCard());
        } catch (IllegalArgumentException e) {
            throw new DoubleDummyException("solver returned unreadable card " + response.getCard(), e);
        }
        if (!state.isLegal(card)) {
            throw new DoubleDummyException("solver returned illegal card " + card);
        }
        return card;
    }
}
