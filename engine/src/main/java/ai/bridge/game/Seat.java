package ai.bridge.game;

/**
 * The four seats at the table, in clockwise order of play.
 */
public enum Seat {
    NORTH('N'),
    EAST('E'),
    SOUTH('S'),
    WEST('W');

    private final char letter;

    Seat(char letter) {
        this.letter = letter;
    }

    public char getLetter() {
        return letter;
    }

    /**
     * Returns the seat to the left, which calls or plays next.
     *
     * @return the next seat clockwise
     */
    public Seat next() {
        return values()[(ordinal() + 1) % 4];
    }

    /**
     * Returns the seat to the right, which called or played last.
     *
     * @return the previous seat clockwise
     */
    public Seat previous() {
        return values()[(ordinal() + 3) % 4];
    }

    public Seat partner() {
        return values()[(ordinal() + 2) % 4];
    }

    public Side side() {
        return (this == NORTH || this == SOUTH) ? Side.NORTH_SOUTH : Side.EAST_WEST;
    }

    public boolean isPartnerOf(Seat other) {
        return other != this && other.side() == side();
    }

    public boolean isOpponentOf(Seat other) {
        return other.side() != side();
    }

    /**
     * Parses a seat from its first letter or full name.
     *
     * @param text "N", "north", "NORTH" and so on
     * @return the matching seat
     * @throws IllegalArgumentException if no seat matches
     */
    public static Seat fromText(String text) {
        String trimmed = text == null ? "" : text.trim().toUpperCase();
        for (Seat seat : values()) {
            if (seat.name().equals(trimmed) || String.valueOf(seat.letter).equals(trimmed)) {
                return seat;
            }
        }
        throw new IllegalArgumentException("Unknown seat: " + text);
    }

    @Override
    public String toString() {
        return String.valueOf(letter);
    }
}
