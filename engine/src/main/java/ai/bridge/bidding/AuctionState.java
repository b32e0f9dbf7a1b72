package ai.bridge.bidding;

import ai.bridge.auction.Auction;
import ai.bridge.auction.Call;
import ai.bridge.game.Seat;
import java.util.Optional;

/**
 * Where the auction stands from the point of view of the seat about to call.
 * <p>
 * The state depends only on who opened and on whether the caller has already made a non-pass call.
 */
public enum AuctionState {
    /** Nobody has opened; the caller may open. */
    OPENING,
    /** The opponents opened. */
    COMPETITIVE,
    /** Partner opened and the caller has not yet bid. */
    PARTNERSHIP_RESPONSE,
    /** Partner opened and the caller has already bid at least once. */
    PARTNERSHIP_REBID,
    /** The caller opened. */
    OPENER_REBID;

    /**
     * Classifies the auction for the seat whose turn it is.
     *
     * @param auction the auction so far
     * @return the state for {@link Auction#nextSeat()}
     */
    public static AuctionState classify(Auction auction) {
        Seat caller = auction.nextSeat();
        Optional<Call> opening = FeatureExtractor.openingCall(auction);
        if (opening.isEmpty()) {
            return OPENING;
        }
        Seat opener = opening.get().seat();
        if (opener == caller) {
            return OPENER_REBID;
        }
        if (opener.isOpponentOf(caller)) {
            return COMPETITIVE;
        }
        boolean callerHasBid = auction.callsBy(caller).stream().anyMatch(bid -> !bid.isPass());
        return callerHasBid ? PARTNERSHIP_REBID : PARTNERSHIP_RESPONSE;
    }
}
