package ai.bridge.play;

/**
 * Card-play strength tiers. The first three search to a configured depth; expert asks the
 * double-dummy solver and falls back to the advanced search.
 */
public enum Difficulty {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT;

    public boolean usesSolver() {
        return this == EXPERT;
    }

    /**
     * Parses a difficulty name, ignoring case.
     *
     * @param text the name, e.g. "advanced"
     * @return the difficulty
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Difficulty fromText(String text) {
        return valueOf(text.trim().toUpperCase());
    }
}
