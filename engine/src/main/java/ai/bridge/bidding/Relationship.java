package ai.bridge.bidding;

/**
 * Relationship of the seat about to call to the player who opened the bidding.
 */
public enum Relationship {
    /** The caller opened. */
    SELF,
    /** The caller's partner opened. */
    PARTNER,
    /** An opponent opened. */
    OPPONENT,
    /** Nobody has opened yet. */
    NONE
}
