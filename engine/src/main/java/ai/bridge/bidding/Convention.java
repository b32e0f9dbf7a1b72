package ai.bridge.bidding;

/**
 * The closed set of bidding modules the decision engine can consult.
 */
public enum Convention {
    OPENING_BIDS("Opening bids"),
    PREEMPTS("Preemptive bids"),
    RESPONSES("Responses"),
    OPENER_REBIDS("Opener rebids"),
    RESPONDER_REBIDS("Responder rebids"),
    OVERCALLS("Overcalls"),
    ADVANCER_BIDS("Advancer bids"),
    STAYMAN("Stayman"),
    JACOBY_TRANSFERS("Jacoby transfers"),
    MINOR_SUIT_BUST("Minor suit bust"),
    BLACKWOOD("Blackwood"),
    GERBER("Gerber"),
    GRAND_SLAM_FORCE("Grand slam force"),
    TAKEOUT_DOUBLES("Takeout doubles"),
    NEGATIVE_DOUBLES("Negative and responsive doubles"),
    MICHAELS("Michaels cuebid"),
    UNUSUAL_NOTRUMP("Unusual notrump"),
    SPLINTERS("Splinter bids"),
    FOURTH_SUIT_FORCING("Fourth suit forcing"),
    /** No module applied; the engine passed by default. */
    DEFAULT_PASS("Default pass");

    private final String displayName;

    Convention(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
