package ai.bridge.game;

import java.util.Comparator;
import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Cards are immutable and uniquely identified by rank and suit. The natural order sorts by
 * suit (clubs first), then by rank (two first).
 */
public final class Card implements Comparable<Card> {

    private static final Comparator<Card> ORDER =
            Comparator.comparing(Card::getSuit).thenComparing(Card::getRank);

    /** The rank (Two through Ace) of this card. */
    private final Rank rank;
    /** The suit of this card. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /**
     * Parses a short card name such as "A♠", "T♥", "10♦" or "QC".
     *
     * @param name the card name, rank first
     * @return the parsed card
     * @throws IllegalArgumentException if the name is not a card
     */
    public static Card parse(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.length() < 2) {
            throw new IllegalArgumentException("Not a card: " + name);
        }
        String rankPart = trimmed.substring(0, trimmed.length() - 1);
        String suitPart = trimmed.substring(trimmed.length() - 1);
        return new Card(Rank.fromLabel(rankPart), Suit.fromText(suitPart));
    }

    /**
     * Parses a PBN-style card name, suit letter first (e.g., "SQ", "DT").
     *
     * @param name the PBN name
     * @return the parsed card
     * @throws IllegalArgumentException if the name is not a card
     */
    public static Card fromPbn(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.length() != 2) {
            throw new IllegalArgumentException("Not a PBN card: " + name);
        }
        return new Card(Rank.fromLabel(trimmed.substring(1)), Suit.fromText(trimmed.substring(0, 1)));
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Checks whether this card beats another card of the same suit.
     *
     * @param other the card to compare against
     * @return {@code true} if both cards share a suit and this one ranks higher
     */
    public boolean beatsInSuit(Card other) {
        return suit == other.suit && rank.getValue() > other.rank.getValue();
    }

    /**
     * Returns the short name of this card (e.g., "Q♠", "T♦").
     *
     * @return the rank label followed by the suit symbol
     */
    public String shortName() {
        return rank.toString() + suit.getSymbol();
    }

    /**
     * Returns the PBN-style name of this card (e.g., "SQ", "DT").
     *
     * @return the suit letter followed by the rank label
     */
    public String pbnName() {
        return suit.getLetter() + rank.toString();
    }

    @Override
    public int compareTo(Card o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return shortName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
