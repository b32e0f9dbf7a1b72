package ai.bridge.game;

/**
 * A partnership: North-South or East-West.
 */
public enum Side {
    NORTH_SOUTH("NS"),
    EAST_WEST("EW");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    public Side opponent() {
        return this == NORTH_SOUTH ? EAST_WEST : NORTH_SOUTH;
    }

    public boolean contains(Seat seat) {
        return seat.side() == this;
    }

    @Override
    public String toString() {
        return label;
    }
}
