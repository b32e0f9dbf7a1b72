package ai.bridge.auction;

import ai.bridge.game.Suit;
import java.util.Objects;

/**
 * A single call in the auction: a contract bid (level and strain) or one of
 * Pass, Double and Redouble.
 * <p>
 * Contract bids are totally ordered by level, then by strain rank (♣ &lt; ♦ &lt; ♥ &lt; ♠ &lt; NT).
 * Non-contract calls carry level 0 and no strain; they sort below every contract bid, in the order
 * Pass, Double, Redouble.
 *
 * @param type   the kind of call
 * @param level  1–7 for contract bids, 0 otherwise
 * @param strain the strain for contract bids, {@code null} otherwise
 */
public record Bid(Type type, int level, Strain strain) implements Comparable<Bid> {

    /** The kinds of call. */
    public enum Type {
        PASS,
        DOUBLE,
        REDOUBLE,
        CONTRACT
    }

    public static final Bid PASS = new Bid(Type.PASS, 0, null);
    public static final Bid DOUBLE = new Bid(Type.DOUBLE, 0, null);
    public static final Bid REDOUBLE = new Bid(Type.REDOUBLE, 0, null);

    public Bid {
        Objects.requireNonNull(type, "type");
        if (type == Type.CONTRACT) {
            Objects.requireNonNull(strain, "strain");
            if (level < 1 || level > 7) {
                throw new IllegalArgumentException("Bid level must be 1-7: " + level);
            }
        } else if (level != 0 || strain != null) {
            throw new IllegalArgumentException(type + " carries no level or strain");
        }
    }

    public static Bid of(int level, Strain strain) {
        return new Bid(Type.CONTRACT, level, strain);
    }

    public static Bid of(int level, Suit suit) {
        return new Bid(Type.CONTRACT, level, Strain.of(suit));
    }

    /**
     * Parses a call such as "1♠", "3NT", "2H", "Pass", "P", "X" or "XX".
     *
     * @param text the call text
     * @return the parsed bid
     * @throws IllegalArgumentException if the text is not a call
     */
    public static Bid parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        String upper = trimmed.toUpperCase();
        switch (upper) {
            case "P", "PASS" -> {
                return PASS;
            }
            case "X", "DBL", "DOUBLE" -> {
                return DOUBLE;
            }
            case "XX", "RDBL", "REDOUBLE" -> {
                return REDOUBLE;
            }
            default -> {
                if (trimmed.length() < 2 || !Character.isDigit(trimmed.charAt(0))) {
                    throw new IllegalArgumentException("Not a bid: " + text);
                }
                int level = trimmed.charAt(0) - '0';
                return of(level, Strain.fromText(trimmed.substring(1)));
            }
        }
    }

    public boolean isPass() {
        return type == Type.PASS;
    }

    public boolean isDouble() {
        return type == Type.DOUBLE;
    }

    public boolean isRedouble() {
        return type == Type.REDOUBLE;
    }

    public boolean isContract() {
        return type == Type.CONTRACT;
    }

    /**
     * Returns the position of a contract bid in the ladder 1♣ (0) … 7NT (34).
     *
     * @return the ladder index
     * @throws IllegalStateException for non-contract calls
     */
    public int ladderIndex() {
        if (!isContract()) {
            throw new IllegalStateException(this + " is not a contract bid");
        }
        return (level - 1) * Strain.values().length + strain.ordinal();
    }

    /**
     * Checks whether this contract bid outranks another contract bid.
     *
     * @param other the bid to compare with
     * @return {@code true} if this bid is strictly higher
     */
    public boolean isHigherThan(Bid other) {
        return ladderIndex() > other.ladderIndex();
    }

    /**
     * Returns the same strain the given number of levels higher, if such a bid exists.
     *
     * @param levels how many levels to add
     * @return the raised bid, or {@code null} past the 7-level
     */
    public Bid raisedBy(int levels) {
        int target = level + levels;
        return target > 7 ? null : of(target, strain);
    }

    @Override
    public int compareTo(Bid o) {
        return Integer.compare(sortKey(), o.sortKey());
    }

    private int sortKey() {
        return switch (type) {
            case PASS -> -3;
            case DOUBLE -> -2;
            case REDOUBLE -> -1;
            case CONTRACT -> ladderIndex();
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case PASS -> "Pass";
            case DOUBLE -> "X";
            case REDOUBLE -> "XX";
            case CONTRACT -> level + strain.getSymbol();
        };
    }
}
