package ai.bridge.auction;

import ai.bridge.game.Seat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable, ordered sequence of calls starting with the dealer and rotating clockwise.
 * <p>
 * The auction is complete after three consecutive passes that follow any non-pass call, or after
 * four opening passes (a passed-out deal). Adding a call returns a new auction; illegal calls are
 * rejected with {@link IllegalArgumentException}.
 */
public final class Auction {

    private final Seat dealer;
    private final List<Call> calls;

    private Auction(Seat dealer, List<Call> calls) {
        this.dealer = dealer;
        this.calls = Collections.unmodifiableList(calls);
    }

    /**
     * Starts an empty auction.
     *
     * @param dealer the seat that calls first
     * @return an auction with no calls
     */
    public static Auction start(Seat dealer) {
        return new Auction(Objects.requireNonNull(dealer, "dealer"), new ArrayList<>());
    }

    /**
     * Builds an auction from call texts, applying legality checks to each.
     *
     * @param dealer the dealer
     * @param bids   the calls in order, e.g. "1♠", "Pass", "4♠", "X"
     * @return the resulting auction
     */
    public static Auction of(Seat dealer, String... bids) {
        Auction auction = start(dealer);
        for (String bid : bids) {
            auction = auction.with(Bid.parse(bid));
        }
        return auction;
    }

    public static Auction of(Seat dealer, List<Bid> bids) {
        Auction auction = start(dealer);
        for (Bid bid : bids) {
            auction = auction.with(bid);
        }
        return auction;
    }

    /**
     * Returns a new auction with the given call appended for the seat whose turn it is.
     *
     * @param bid the call to make
     * @return the extended auction
     * @throws IllegalArgumentException if the call is illegal or the auction is over
     */
    public Auction with(Bid bid) {
        Objects.requireNonNull(bid, "bid");
        if (isComplete()) {
            throw new IllegalArgumentException("Auction is complete; cannot add " + bid);
        }
        if (!BidLegality.isLegal(bid, this)) {
            throw new IllegalArgumentException(bid + " is not legal after " + this);
        }
        List<Call> next = new ArrayList<>(calls);
        next.add(new Call(nextSeat(), bid));
        return new Auction(dealer, next);
    }

    public Seat getDealer() {
        return dealer;
    }

    public List<Call> getCalls() {
        return calls;
    }

    public int size() {
        return calls.size();
    }

    public boolean isEmpty() {
        return calls.isEmpty();
    }

    /**
     * Returns the seat due to call next.
     *
     * @return the next caller
     */
    public Seat nextSeat() {
        Seat seat = dealer;
        for (int i = 0; i < calls.size(); i++) {
            seat = seat.next();
        }
        return seat;
    }

    /**
     * Checks whether bidding has ended.
     *
     * @return {@code true} after four opening passes or three passes following any other call
     */
    public boolean isComplete() {
        if (calls.size() < 4) {
            return false;
        }
        if (isPassedOut()) {
            return true;
        }
        int n = calls.size();
        return calls.get(n - 1).bid().isPass()
                && calls.get(n - 2).bid().isPass()
                && calls.get(n - 3).bid().isPass()
                && lastNonPass().isPresent();
    }

    /**
     * Checks whether the auction consisted of four passes.
     *
     * @return {@code true} for a passed-out deal
     */
    public boolean isPassedOut() {
        if (calls.size() != 4) {
            return false;
        }
        for (Call call : calls) {
            if (!call.bid().isPass()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the most recent contract bid.
     *
     * @return the last contract call, if any
     */
    public Optional<Call> lastContractCall() {
        for (int i = calls.size() - 1; i >= 0; i--) {
            if (calls.get(i).bid().isContract()) {
                return Optional.of(calls.get(i));
            }
        }
        return Optional.empty();
    }

    public Optional<Bid> lastContractBid() {
        return lastContractCall().map(Call::bid);
    }

    /**
     * Returns the most recent call that was not a pass.
     *
     * @return the last non-pass call, if any
     */
    public Optional<Call> lastNonPass() {
        for (int i = calls.size() - 1; i >= 0; i--) {
            if (!calls.get(i).bid().isPass()) {
                return Optional.of(calls.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns every call made by one seat, in order.
     *
     * @param seat the seat
     * @return that seat's calls
     */
    public List<Bid> callsBy(Seat seat) {
        List<Bid> result = new ArrayList<>();
        for (Call call : calls) {
            if (call.seat() == seat) {
                result.add(call.bid());
            }
        }
        return result;
    }

    /**
     * Returns the number of passes at the end of the auction.
     *
     * @return trailing pass count
     */
    public int trailingPasses() {
        int count = 0;
        for (int i = calls.size() - 1; i >= 0 && calls.get(i).bid().isPass(); i--) {
            count++;
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < calls.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(calls.get(i).bid());
        }
        return sb.append("] dealer ").append(dealer).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Auction)) {
            return false;
        }
        Auction other = (Auction) o;
        return dealer == other.dealer && calls.equals(other.calls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dealer, calls);
    }
}
