package ai.bridge.auction;

import ai.bridge.game.Seat;
import ai.bridge.game.Side;
import java.util.List;
import java.util.Optional;

/**
 * Turns a completed auction into its final contract.
 * <p>
 * The final contract bid fixes level and strain. Declarer is the member of the side that made the
 * final bid who first named that strain during the auction. Doubles and redoubles made after the
 * final bid set the doubled state and nothing else.
 */
public final class ContractResolver {

    private ContractResolver() {
        // Utility class.
    }

    /**
     * Resolves the contract of an auction.
     *
     * @param auction the auction
     * @return the contract, or empty if the auction is incomplete or was passed out
     */
    public static Optional<Contract> resolve(Auction auction) {
        if (!auction.isComplete() || auction.isPassedOut()) {
            return Optional.empty();
        }
        Optional<Call> finalCall = auction.lastContractCall();
        if (finalCall.isEmpty()) {
            return Optional.empty();
        }
        Bid finalBid = finalCall.get().bid();
        Side side = finalCall.get().seat().side();
        List<Call> calls = auction.getCalls();

        Seat declarer = finalCall.get().seat();
        for (Call call : calls) {
            if (call.bid().isContract() && call.bid().strain() == finalBid.strain() && side.contains(call.seat())) {
                declarer = call.seat();
                break;
            }
        }

        DoubledState doubled = DoubledState.NONE;
        int finalIndex = calls.lastIndexOf(finalCall.get());
        for (int i = finalIndex + 1; i < calls.size(); i++) {
            Bid bid = calls.get(i).bid();
            if (bid.isDouble()) {
                doubled = DoubledState.DOUBLED;
            } else if (bid.isRedouble()) {
                doubled = DoubledState.REDOUBLED;
            }
        }
        return Optional.of(new Contract(finalBid.level(), finalBid.strain(), declarer, doubled));
    }
}
