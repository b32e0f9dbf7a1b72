package ai.bridge.bidding;

import ai.bridge.game.Hand;
import java.util.Optional;

/**
 * A bidding convention or natural-bidding module.
 * <p>
 * Modules are stateless. An empty result means the module does not apply to this auction; it never
 * means Pass. A module that wants to pass returns a present suggestion of {@code Bid.PASS}.
 */
public interface ConventionModule {

    /**
     * Identifies this module.
     *
     * @return the convention implemented
     */
    Convention convention();

    /**
     * Proposes a call for the given hand and auction context.
     *
     * @param hand     the caller's hand
     * @param features features extracted for the caller
     * @return a suggestion, or empty if the module does not apply
     */
    Optional<Suggestion> evaluate(Hand hand, HandFeatures features);
}
