package ai.bridge.auction;

import ai.bridge.game.Seat;

/**
 * A bid together with the seat that made it.
 *
 * @param seat the calling seat
 * @param bid  the call
 */
public record Call(Seat seat, Bid bid) {

    @Override
    public String toString() {
        return seat + ":" + bid;
    }
}
