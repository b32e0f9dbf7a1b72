package ai.bridge.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * A standard 52-card deck that can be shuffled and dealt to the four seats.
 * <p>
 * The deck is initialised with all 52 cards (13 ranks × 4 suits) and shuffled on construction.
 * Supplying a seed makes the shuffle, and therefore the deal, reproducible.
 */
public class Deck {
    /** The list of cards currently in the deck. */
    private final List<Card> cards = new ArrayList<>();
    private final Random random;

    /**
     * Constructs a new randomly shuffled deck.
     */
    public Deck() {
        this(new Random());
    }

    /**
     * Constructs a new deck shuffled with a fixed seed.
     *
     * @param seed the shuffle seed
     */
    public Deck(long seed) {
        this(new Random(seed));
    }

    private Deck(Random random) {
        this.random = random;
        reset();
    }

    public void shuffle() {
        Collections.shuffle(cards, random);
    }

    public int size() {
        return cards.size();
    }

    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Deals the whole deck, one card at a time clockwise starting with the seat after the dealer.
     *
     * @param dealer the dealing seat
     * @return four 13-card hands keyed by seat
     * @throws IllegalStateException if the deck is not full
     */
    public Map<Seat, Hand> deal(Seat dealer) {
        if (cards.size() != 52) {
            throw new IllegalStateException("Cannot deal from a deck of " + cards.size());
        }
        Map<Seat, List<Card>> piles = new EnumMap<>(Seat.class);
        for (Seat seat : Seat.values()) {
            piles.put(seat, new ArrayList<>());
        }
        Seat seat = dealer.next();
        for (Card card : cards) {
            piles.get(seat).add(card);
            seat = seat.next();
        }
        Map<Seat, Hand> hands = new EnumMap<>(Seat.class);
        piles.forEach((s, pile) -> hands.put(s, Hand.of(pile)));
        return hands;
    }

    /**
     * Restores all 52 cards and shuffles them.
     */
    public final void reset() {
        cards.clear();
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(rank, suit));
            }
        }
        shuffle();
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
