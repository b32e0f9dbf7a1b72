package ai.bridge.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * An immutable set of up to 13 unique cards held by one seat.
 * <p>
 * A hand used for bidding holds exactly 13 cards. During play cards are removed one at a time
 * through {@link #without(Card)}, which returns a new hand and leaves this one untouched.
 */
public final class Hand {

    /** Cards in a full hand. */
    public static final int FULL_SIZE = 13;

    /** Cards in ascending {@link Card} order. */
    private final List<Card> cards;

    private Hand(List<Card> sortedCards) {
        this.cards = Collections.unmodifiableList(sortedCards);
    }

    /**
     * Creates a hand from the given cards.
     *
     * @param cards the cards (no duplicates, at most 13)
     * @return the new hand
     * @throws IllegalArgumentException on duplicates or more than 13 cards
     */
    public static Hand of(Collection<Card> cards) {
        Objects.requireNonNull(cards, "cards");
        TreeSet<Card> unique = new TreeSet<>(cards);
        if (unique.size() != cards.size()) {
            throw new IllegalArgumentException("Hand contains duplicate cards: " + cards);
        }
        if (unique.size() > FULL_SIZE) {
            throw new IllegalArgumentException("Hand has " + unique.size() + " cards");
        }
        return new Hand(new ArrayList<>(unique));
    }

    /**
     * Parses a hand written suit by suit, in either of two forms:
     * <ul>
     *   <li>symbol groups: {@code "♠AKQ2 ♥K32 ♦Q54 ♣J2"} (a suit may be omitted when void)</li>
     *   <li>PBN dotted form, spades first: {@code "AKQ2.K32.Q54.J2"}</li>
     * </ul>
     *
     * @param text the hand description
     * @return the parsed hand
     * @throws IllegalArgumentException if the text is malformed
     */
    public static Hand parse(String text) {
        Objects.requireNonNull(text, "text");
        List<Card> parsed = new ArrayList<>();
        String trimmed = text.trim();
        if (trimmed.contains(".")) {
            String[] groups = trimmed.split("\\.", -1);
            if (groups.length != 4) {
                throw new IllegalArgumentException("PBN hand needs four suits: " + text);
            }
            Suit[] order = {Suit.SPADES, Suit.HEARTS, Suit.DIAMONDS, Suit.CLUBS};
            for (int i = 0; i < 4; i++) {
                addRanks(parsed, order[i], groups[i].trim());
            }
            return of(parsed);
        }
        for (String group : trimmed.split("\\s+")) {
            if (group.isEmpty()) {
                continue;
            }
            Suit suit = Suit.fromText(group.substring(0, 1));
            String ranks = group.substring(1);
            if ("-".equals(ranks)) {
                continue;
            }
            addRanks(parsed, suit, ranks);
        }
        return of(parsed);
    }

    private static void addRanks(List<Card> out, Suit suit, String ranks) {
        String normalised = ranks.replace("10", "T");
        for (char c : normalised.toCharArray()) {
            if (c == '-') {
                continue;
            }
            out.add(new Card(Rank.fromLabel(String.valueOf(c)), suit));
        }
    }

    /**
     * Returns all cards, sorted by suit then rank.
     *
     * @return an unmodifiable list of cards
     */
    public List<Card> getCards() {
        return cards;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Returns a new hand with the given card removed.
     *
     * @param card a card held in this hand
     * @return the smaller hand
     * @throws IllegalArgumentException if the card is not held
     */
    public Hand without(Card card) {
        if (!cards.contains(card)) {
            throw new IllegalArgumentException(card + " is not in hand " + this);
        }
        List<Card> remaining = new ArrayList<>(cards);
        remaining.remove(card);
        return new Hand(remaining);
    }

    /**
     * Returns the cards held in a suit, highest first.
     *
     * @param suit the suit to list
     * @return the cards of that suit, descending by rank
     */
    public List<Card> cardsIn(Suit suit) {
        List<Card> result = new ArrayList<>();
        for (int i = cards.size() - 1; i >= 0; i--) {
            Card card = cards.get(i);
            if (card.getSuit() == suit) {
                result.add(card);
            }
        }
        return result;
    }

    public int length(Suit suit) {
        int count = 0;
        for (Card card : cards) {
            if (card.getSuit() == suit) {
                count++;
            }
        }
        return count;
    }

    public boolean holds(Rank rank, Suit suit) {
        return cards.contains(new Card(rank, suit));
    }

    /**
     * Returns the length of every suit.
     *
     * @return suit lengths keyed by suit
     */
    public Map<Suit, Integer> suitLengths() {
        Map<Suit, Integer> lengths = new EnumMap<>(Suit.class);
        for (Suit suit : Suit.values()) {
            lengths.put(suit, length(suit));
        }
        return lengths;
    }

    /**
     * Returns the high-card points (A=4, K=3, Q=2, J=1) in this hand.
     *
     * @return total HCP
     */
    public int hcp() {
        int total = 0;
        for (Card card : cards) {
            total += card.getRank().getHcp();
        }
        return total;
    }

    /**
     * Returns the high-card points held in one suit.
     *
     * @param suit the suit
     * @return HCP in that suit
     */
    public int hcp(Suit suit) {
        int total = 0;
        for (Card card : cards) {
            if (card.getSuit() == suit) {
                total += card.getRank().getHcp();
            }
        }
        return total;
    }

    public int count(Rank rank) {
        int total = 0;
        for (Card card : cards) {
            if (card.getRank() == rank) {
                total++;
            }
        }
        return total;
    }

    public Optional<Card> highest(Suit suit) {
        List<Card> inSuit = cardsIn(suit);
        return inSuit.isEmpty() ? Optional.empty() : Optional.of(inSuit.get(0));
    }

    public Optional<Card> lowest(Suit suit) {
        List<Card> inSuit = cardsIn(suit);
        return inSuit.isEmpty() ? Optional.empty() : Optional.of(inSuit.get(inSuit.size() - 1));
    }

    /**
     * Returns the PBN dotted form of this hand, spades first (e.g., "AKQ2.K32.Q54.J2").
     *
     * @return the PBN representation
     */
    public String toPbn() {
        StringBuilder sb = new StringBuilder();
        Suit[] order = {Suit.SPADES, Suit.HEARTS, Suit.DIAMONDS, Suit.CLUBS};
        for (int i = 0; i < order.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            for (Card card : cardsIn(order[i])) {
                sb.append(card.getRank());
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Suit suit : new Suit[] {Suit.SPADES, Suit.HEARTS, Suit.DIAMONDS, Suit.CLUBS}) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(suit.getSymbol());
            List<Card> inSuit = cardsIn(suit);
            if (inSuit.isEmpty()) {
                sb.append('-');
            }
            for (Card card : inSuit) {
                sb.append(card.getRank());
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hand)) {
            return false;
        }
        return cards.equals(((Hand) o).cards);
    }

    @Override
    public int hashCode() {
        return cards.hashCode();
    }
}
