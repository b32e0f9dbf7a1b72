package ai.bridge.auction;

import ai.bridge.game.Seat;
import ai.bridge.game.Side;
import ai.bridge.game.Suit;
import java.util.Objects;
import java.util.Optional;

/**
 * The final contract of an auction.
 *
 * @param level    the contract level (1–7)
 * @param strain   the denomination
 * @param declarer the seat that plays the hand
 * @param doubled  the doubled state, which affects scoring only
 */
public record Contract(int level, Strain strain, Seat declarer, DoubledState doubled) {

    public Contract {
        Objects.requireNonNull(strain, "strain");
        Objects.requireNonNull(declarer, "declarer");
        Objects.requireNonNull(doubled, "doubled");
        if (level < 1 || level > 7) {
            throw new IllegalArgumentException("Contract level must be 1-7: " + level);
        }
    }

    public static Contract of(int level, Strain strain, Seat declarer) {
        return new Contract(level, strain, declarer, DoubledState.NONE);
    }

    /**
     * Parses a contract such as "4♠X by N" or "3NT by S".
     *
     * @param text the contract text
     * @return the parsed contract
     * @throws IllegalArgumentException if the text is malformed
     */
    public static Contract parse(String text) {
        String[] parts = text.trim().split("\\s+by\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected '<bid> by <seat>': " + text);
        }
        String bidPart = parts[0].trim();
        DoubledState doubled = DoubledState.NONE;
        if (bidPart.toUpperCase().endsWith("XX")) {
            doubled = DoubledState.REDOUBLED;
            bidPart = bidPart.substring(0, bidPart.length() - 2);
        } else if (bidPart.toUpperCase().endsWith("X")) {
            doubled = DoubledState.DOUBLED;
            bidPart = bidPart.substring(0, bidPart.length() - 1);
        }
        Bid bid = Bid.parse(bidPart);
        return new Contract(bid.level(), bid.strain(), Seat.fromText(parts[1]), doubled);
    }

    public Seat dummy() {
        return declarer.partner();
    }

    public Side declaringSide() {
        return declarer.side();
    }

    public Optional<Suit> trump() {
        return strain.suit();
    }

    /**
     * Returns the number of tricks declarer needs (level + 6).
     *
     * @return tricks required to make the contract
     */
    public int tricksRequired() {
        return level + 6;
    }

    /**
     * Returns the seat that makes the opening lead (declarer's left-hand opponent).
     *
     * @return the opening leader
     */
    public Seat openingLeader() {
        return declarer.next();
    }

    @Override
    public String toString() {
        return level + strain.getSymbol() + doubled.getSuffix() + " by " + declarer;
    }
}
