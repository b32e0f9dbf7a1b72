package ai.bridge.game;

/**
 * Enumeration representing the 13 ranks of a bridge deck, lowest first.
 * <p>
 * Each rank carries a numeric value (2–14) used for trick comparison, a short label
 * ("T" for the ten, as in PBN) and its Milton Work high-card point value.
 */
public enum Rank {
    /** Two – rank value 2. */
    TWO(2, "2", 0),
    /** Three – rank value 3. */
    THREE(3, "3", 0),
    /** Four – rank value 4. */
    FOUR(4, "4", 0),
    /** Five – rank value 5. */
    FIVE(5, "5", 0),
    /** Six – rank value 6. */
    SIX(6, "6", 0),
    /** Seven – rank value 7. */
    SEVEN(7, "7", 0),
    /** Eight – rank value 8. */
    EIGHT(8, "8", 0),
    /** Nine – rank value 9. */
    NINE(9, "9", 0),
    /** Ten – rank value 10. */
    TEN(10, "T", 0),
    /** Jack – rank value 11, one high-card point. */
    JACK(11, "J", 1),
    /** Queen – rank value 12, two high-card points. */
    QUEEN(12, "Q", 2),
    /** King – rank value 13, three high-card points. */
    KING(13, "K", 3),
    /** Ace – the highest rank (value 14), four high-card points. */
    ACE(14, "A", 4);

    /** The numeric value of this rank (2–14). */
    private final int value;
    /** The short label of this rank (e.g., "A", "T", "7"). */
    private final String label;
    /** High-card points contributed by this rank. */
    private final int hcp;

    Rank(int value, String label, int hcp) {
        this.value = value;
        this.label = label;
        this.hcp = hcp;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return the rank value (2 for Two, 14 for Ace)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the high-card point value (A=4, K=3, Q=2, J=1, others 0).
     *
     * @return the HCP value of this rank
     */
    public int getHcp() {
        return hcp;
    }

    /**
     * Checks whether this rank is one of the five honours (T, J, Q, K, A).
     *
     * @return {@code true} for Ten and above
     */
    public boolean isHonour() {
        return value >= TEN.value;
    }

    /**
     * Parses a rank label. Accepts "T" and "10" for the ten, case-insensitive.
     *
     * @param label the label to parse
     * @return the matching rank
     * @throws IllegalArgumentException if the label is not a rank
     */
    public static Rank fromLabel(String label) {
        String trimmed = label == null ? "" : label.trim().toUpperCase();
        if ("10".equals(trimmed)) {
            return TEN;
        }
        for (Rank rank : values()) {
            if (rank.label.equals(trimmed)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank: " + label);
    }

    /**
     * Returns the short label for this rank.
     *
     * @return the label (e.g., "A", "K", "T")
     */
    @Override
    public String toString() {
        return label;
    }
}
