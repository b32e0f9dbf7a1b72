package ai.bridge.game;

/**
 * Enumeration representing the four suits of a bridge deck in ascending bidding rank.
 * <p>
 * Declaration order matters: clubs and diamonds are the minors, hearts and spades the majors,
 * and {@link #ordinal()} gives the bidding rank used when comparing bids of the same level.
 */
public enum Suit {
    /** Clubs (♣) – lowest-ranking minor suit. */
    CLUBS("♣", 'C', false),
    /** Diamonds (♦) – higher-ranking minor suit. */
    DIAMONDS("♦", 'D', false),
    /** Hearts (♥) – lower-ranking major suit. */
    HEARTS("♥", 'H', true),
    /** Spades (♠) – highest-ranking suit. */
    SPADES("♠", 'S', true);

    /** The Unicode symbol for this suit. */
    private final String symbol;
    /** Single-letter code used in PBN and plain-text input. */
    private final char letter;
    /** Whether this suit is a major. */
    private final boolean major;

    Suit(String symbol, char letter, boolean major) {
        this.symbol = symbol;
        this.letter = letter;
        this.major = major;
    }

    /**
     * Returns the Unicode symbol for this suit.
     *
     * @return the suit symbol (e.g., "♠", "♥")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the single-letter code for this suit (C, D, H, S).
     *
     * @return the letter code
     */
    public char getLetter() {
        return letter;
    }

    /**
     * Checks whether this suit is a major (hearts or spades).
     *
     * @return {@code true} for hearts and spades
     */
    public boolean isMajor() {
        return major;
    }

    /**
     * Checks whether this suit is a minor (clubs or diamonds).
     *
     * @return {@code true} for clubs and diamonds
     */
    public boolean isMinor() {
        return !major;
    }

    /**
     * Returns the other major, or the other minor.
     *
     * @return spades for hearts, diamonds for clubs and so on
     */
    public Suit partnerSuit() {
        return switch (this) {
            case CLUBS -> DIAMONDS;
            case DIAMONDS -> CLUBS;
            case HEARTS -> SPADES;
            case SPADES -> HEARTS;
        };
    }

    /**
     * Parses a suit from its symbol or letter.
     *
     * @param text "♠", "S", "s" and so on
     * @return the matching suit
     * @throws IllegalArgumentException if the text names no suit
     */
    public static Suit fromText(String text) {
        String trimmed = text == null ? "" : text.trim();
        for (Suit suit : values()) {
            if (suit.symbol.equals(trimmed) || trimmed.equalsIgnoreCase(String.valueOf(suit.letter))) {
                return suit;
            }
        }
        throw new IllegalArgumentException("Unknown suit: " + text);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
