package ai.bridge.auction;

import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * The five denominations a contract can be played in, in ascending bidding rank.
 */
public enum Strain {
    CLUBS("♣", "C"),
    DIAMONDS("♦", "D"),
    HEARTS("♥", "H"),
    SPADES("♠", "S"),
    NOTRUMP("NT", "NT");

    private final String symbol;
    private final String code;

    Strain(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the plain-text code of this strain (C, D, H, S, NT).
     *
     * @return the code
     */
    public String getCode() {
        return code;
    }

    public boolean isNotrump() {
        return this == NOTRUMP;
    }

    public boolean isMajor() {
        return this == HEARTS || this == SPADES;
    }

    public boolean isMinor() {
        return this == CLUBS || this == DIAMONDS;
    }

    /**
     * Returns the suit this strain names, or empty for notrump.
     *
     * @return the trump suit, if any
     */
    public Optional<Suit> suit() {
        return switch (this) {
            case CLUBS -> Optional.of(Suit.CLUBS);
            case DIAMONDS -> Optional.of(Suit.DIAMONDS);
            case HEARTS -> Optional.of(Suit.HEARTS);
            case SPADES -> Optional.of(Suit.SPADES);
            case NOTRUMP -> Optional.empty();
        };
    }

    public static Strain of(Suit suit) {
        return switch (suit) {
            case CLUBS -> CLUBS;
            case DIAMONDS -> DIAMONDS;
            case HEARTS -> HEARTS;
            case SPADES -> SPADES;
        };
    }

    /**
     * Parses a strain from a symbol or code ("♠", "S", "NT", "N").
     *
     * @param text the text to parse
     * @return the strain
     * @throws IllegalArgumentException if nothing matches
     */
    public static Strain fromText(String text) {
        String trimmed = text == null ? "" : text.trim().toUpperCase();
        if ("N".equals(trimmed) || "NT".equals(trimmed)) {
            return NOTRUMP;
        }
        for (Strain strain : values()) {
            if (strain.symbol.equals(trimmed) || strain.code.equals(trimmed)) {
                return strain;
            }
        }
        throw new IllegalArgumentException("Unknown strain: " + text);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
