package ai.bridge.auction;

/**
 * Whether a contract was left undoubled, doubled or redoubled.
 */
public enum DoubledState {
    NONE(1, ""),
    DOUBLED(2, "X"),
    REDOUBLED(4, "XX");

    private final int multiplier;
    private final String suffix;

    DoubledState(int multiplier, String suffix) {
        this.multiplier = multiplier;
        this.suffix = suffix;
    }

    /**
     * Returns the factor applied to contract trick points (1, 2 or 4).
     *
     * @return the multiplier
     */
    public int getMultiplier() {
        return multiplier;
    }

    public String getSuffix() {
        return suffix;
    }
}
