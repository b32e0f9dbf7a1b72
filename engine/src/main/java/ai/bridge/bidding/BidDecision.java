package ai.bridge.bidding;

import ai.bridge.auction.Bid;

/**
 * The decision engine's final, legal call.
 *
 * @param bid        the call to make
 * @param rationale  the explanation shown to users
 * @param convention the module that produced the call
 * @param repaired   whether the module's suggestion had to be changed to make it legal
 */
public record BidDecision(Bid bid, String rationale, Convention convention, boolean repaired) {

    @Override
    public String toString() {
        return bid + " (" + convention + ": " + rationale + ")";
    }
}
