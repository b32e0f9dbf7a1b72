package ai.bridge.game;

/**
 * Board vulnerability: which partnerships, if any, are vulnerable.
 */
public enum Vulnerability {
    NONE,
    NORTH_SOUTH,
    EAST_WEST,
    BOTH;

    /**
     * Checks whether the given side is vulnerable on this board.
     *
     * @param side the partnership
     * @return {@code true} if the side is vulnerable
     */
    public boolean isVulnerable(Side side) {
        return switch (this) {
            case NONE -> false;
            case BOTH -> true;
            case NORTH_SOUTH -> side == Side.NORTH_SOUTH;
            case EAST_WEST -> side == Side.EAST_WEST;
        };
    }

    /**
     * Returns the vulnerability of a board number under the standard 16-board rotation.
     *
     * @param boardNumber the board number, starting at 1
     * @return the board's vulnerability
     */
    public static Vulnerability forBoard(int boardNumber) {
        if (boardNumber < 1) {
            throw new IllegalArgumentException("Board numbers start at 1: " + boardNumber);
        }
        Vulnerability[] rotation = {
            NONE, NORTH_SOUTH, EAST_WEST, BOTH,
            NORTH_SOUTH, EAST_WEST, BOTH, NONE,
            EAST_WEST, BOTH, NONE, NORTH_SOUTH,
            BOTH, NONE, NORTH_SOUTH, EAST_WEST
        };
        return rotation[(boardNumber - 1) % 16];
    }
}
