package ai.bridge.play;

import ai.bridge.auction.Contract;
import ai.bridge.game.Card;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Side;
import ai.bridge.game.Suit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable card-play position: the remaining hands, the trick in progress, the completed
 * tricks and the tricks each side has won.
 * <p>
 * {@link #play(Card)} returns a new state; the receiver is never changed, which lets search code
 * share positions freely.
 */
public final class PlayState {

    private final Contract contract;
    private final Map<Seat, Hand> hands;
    private final List<PlayedCard> currentTrick;
    private final List<Trick> history;
    private final Map<Side, Integer> tricksWon;
    private final Seat nextToPlay;

    private PlayState(Contract contract, Map<Seat, Hand> hands, List<PlayedCard> currentTrick,
                      List<Trick> history, Map<Side, Integer> tricksWon, Seat nextToPlay) {
        this.contract = contract;
        this.hands = hands;
        this.currentTrick = currentTrick;
        this.history = history;
        this.tricksWon = tricksWon;
        this.nextToPlay = nextToPlay;
    }

    /**
     * Creates the position before the opening lead.
     *
     * @param contract the contract being played
     * @param hands    all four hands, of equal size
     * @return the starting position, with declarer's left-hand opponent on lead
     */
    public static PlayState start(Contract contract, Map<Seat, Hand> hands) {
        return of(contract, hands, contract.openingLeader(), List.of(), 0, 0);
    }

    /**
     * Creates an arbitrary position, for example an end position or a trick in progress.
     *
     * @param contract       the contract being played
     * @param hands          the cards each seat still holds
     * @param leader         the seat that led (or will lead) the current trick
     * @param currentTrick   cards already played to the current trick, in order from the leader
     * @param declarerTricks tricks already won by declarer's side
     * @param defenderTricks tricks already won by the defenders
     * @return the position
     * @throws IllegalArgumentException if the cards do not add up to a consistent position
     */
    public static PlayState of(Contract contract, Map<Seat, Hand> hands, Seat leader,
                               List<PlayedCard> currentTrick, int declarerTricks, int defenderTricks) {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(leader, "leader");
        Map<Seat, Hand> copy = new EnumMap<>(Seat.class);
        for (Seat seat : Seat.values()) {
            Hand hand = hands.get(seat);
            if (hand == null) {
                throw new IllegalArgumentException("Missing hand for " + seat);
            }
            copy.put(seat, hand);
        }
        if (currentTrick.size() > 3) {
            throw new IllegalArgumentException("A trick in progress holds at most three cards");
        }
        Set<Card> seen = new HashSet<>();
        Seat expected = leader;
        for (PlayedCard played : currentTrick) {
            if (played.seat() != expected) {
                throw new IllegalArgumentException("Expected " + expected + " to play, not " + played);
            }
            if (!seen.add(played.card())) {
                throw new IllegalArgumentException("Duplicate card " + played.card());
            }
            expected = expected.next();
        }
        int remaining = copy.get(leader).size() + (currentTrick.isEmpty() ? 0 : 1);
        Seat seat = leader;
        for (int i = 0; i < 4; i++) {
            int size = copy.get(seat).size() + (i < currentTrick.size() ? 1 : 0);
            if (size != remaining) {
                throw new IllegalArgumentException("Hand sizes do not match: " + seat + " holds " + copy.get(seat).size());
            }
            for (Card card : copy.get(seat).getCards()) {
                if (!seen.add(card)) {
                    throw new IllegalArgumentException("Duplicate card " + card);
                }
            }
            seat = seat.next();
        }
        if (declarerTricks + defenderTricks + remaining > 13) {
            throw new IllegalArgumentException("More than 13 tricks in the deal");
        }
        Map<Side, Integer> won = new EnumMap<>(Side.class);
        won.put(contract.declaringSide(), declarerTricks);
        won.put(contract.declaringSide().opponent(), defenderTricks);
        return new PlayState(contract, Collections.unmodifiableMap(copy), List.copyOf(currentTrick), List.of(),
                Collections.unmodifiableMap(won), expected);
    }

    public Contract getContract() {
        return contract;
    }

    public Optional<Suit> getTrump() {
        return contract.trump();
    }

    public Seat getDeclarer() {
        return contract.declarer();
    }

    public Seat getDummy() {
        return contract.dummy();
    }

    public Hand getHand(Seat seat) {
        return hands.get(seat);
    }

    public Map<Seat, Hand> getHands() {
        return hands;
    }

    public List<PlayedCard> getCurrentTrick() {
        return currentTrick;
    }

    /**
     * Returns the completed tricks in the order they were played.
     *
     * @return the trick history
     */
    public List<Trick> getTrickHistory() {
        return history;
    }

    public Seat getNextToPlay() {
        return nextToPlay;
    }

    public int getTricksWon(Side side) {
        return tricksWon.get(side);
    }

    public int getDeclarerTricks() {
        return getTricksWon(contract.declaringSide());
    }

    public int getDefenderTricks() {
        return getTricksWon(contract.declaringSide().opponent());
    }

    /**
     * Returns the suit led to the current trick.
     *
     * @return the led suit, or empty when the next card is a lead
     */
    public Optional<Suit> getLedSuit() {
        return currentTrick.isEmpty() ? Optional.empty() : Optional.of(currentTrick.get(0).card().getSuit());
    }

    public boolean isComplete() {
        return currentTrick.isEmpty() && hands.values().stream().allMatch(Hand::isEmpty);
    }

    public int tricksRemaining() {
        return hands.get(nextToPlay).size();
    }

    /**
     * Returns the cards the next seat may play: any card on lead, otherwise a card of the led suit
     * when it holds one.
     *
     * @return legal cards in the hand's order; empty once the hand is over
     */
    public List<Card> legalCards() {
        Hand hand = hands.get(nextToPlay);
        Optional<Suit> led = getLedSuit();
        if (led.isPresent() && hand.length(led.get()) > 0) {
            return hand.cardsIn(led.get());
        }
        return hand.getCards();
    }

    public boolean isLegal(Card card) {
        return legalCards().contains(card);
    }

    /**
     * Plays a card for the next seat.
     *
     * @param card the card to play
     * @return the position after the card; when it completes a trick, the winner is on lead
     * @throws IllegalArgumentException if the card is not legal here
     * @throws NoLegalCardException     if the hand is already over
     */
    public PlayState play(Card card) {
        if (isComplete()) {
            throw new NoLegalCardException("All 13 tricks have been played");
        }
        if (!isLegal(card)) {
            throw new IllegalArgumentException(nextToPlay + " may not play " + card + " here; legal: " + legalCards());
        }
        Map<Seat, Hand> nextHands = new EnumMap<>(hands);
        nextHands.put(nextToPlay, hands.get(nextToPlay).without(card));
        List<PlayedCard> trick = new ArrayList<>(currentTrick);
        trick.add(new PlayedCard(nextToPlay, card));
        if (trick.size() < 4) {
            return new PlayState(contract, Collections.unmodifiableMap(nextHands), List.copyOf(trick), history,
                    tricksWon, nextToPlay.next());
        }
        PlayedCard winner = Trick.winning(trick, getTrump()).orElseThrow();
        List<Trick> nextHistory = new ArrayList<>(history);
        nextHistory.add(new Trick(trick, winner));
        Map<Side, Integer> nextWon = new EnumMap<>(tricksWon);
        nextWon.merge(winner.seat().side(), 1, Integer::sum);
        return new PlayState(contract, Collections.unmodifiableMap(nextHands), List.of(),
                Collections.unmodifiableList(nextHistory), Collections.unmodifiableMap(nextWon), winner.seat());
    }

    /**
     * Returns the card currently winning the trick in progress.
     *
     * @return the winning card, or empty before the lead
     */
    public Optional<PlayedCard> currentWinner() {
        return Trick.winning(currentTrick, getTrump());
    }

    @Override
    public String toString() {
        return contract + ", " + nextToPlay + " to play, trick " + currentTrick
                + ", NS " + tricksWon.get(Side.NORTH_SOUTH) + " EW " + tricksWon.get(Side.EAST_WEST);
    }
}
