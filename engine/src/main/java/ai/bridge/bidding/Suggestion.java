package ai.bridge.bidding;

import ai.bridge.auction.Bid;
import java.util.Objects;
import java.util.Optional;

/**
 * A raw bid proposed by a convention module, before legality checking.
 *
 * @param bid       the proposed call
 * @param rationale a human-readable explanation
 */
public record Suggestion(Bid bid, String rationale) {

    public Suggestion {
        Objects.requireNonNull(bid, "bid");
        Objects.requireNonNull(rationale, "rationale");
    }

    /**
     * Convenience for modules: wraps a bid and rationale in a present Optional.
     *
     * @param bid       the proposed call
     * @param rationale the explanation
     * @return the suggestion
     */
    public static Optional<Suggestion> of(Bid bid, String rationale) {
        return Optional.of(new Suggestion(bid, rationale));
    }
}
