package ai.bridge.play.ai.dds;

import ai.bridge.auction.Strain;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.play.PlayState;
import ai.bridge.play.PlayedCard;
import java.util.ArrayList;
import java.util.List;

/**
 * DTO sent to the double-dummy service's /solve endpoint.
 *
 * The deal uses PBN notation with the remaining cards only, starting from North:
 * {@code "N:AK2.QJ..T9 ..."}. Cards already played to the current trick are listed separately in
 * PBN card form ("SA", "HT") so the solver can finish the trick.
 */
public class DoubleDummyRequest {

    /** Remaining cards of all four hands, e.g. "N:AKQ.432.AKQ2.432 ...". */
    private String deal;

    /** Trump strain code: "S", "H", "D", "C" or "NT". */
    private String trump;

    /** Seat letter of the player who led the current trick. */
    private String leader;

    /** Cards already in the current trick, in playing order. */
    private List<String> currentTrick = new ArrayList<>();

    /** Seat letter of the player to move. */
    private String nextToPlay;

    public DoubleDummyRequest() {
        // Default constructor for JSON binding.
    }

    /**
     * Build a request from a play position.
     *
     * @param state the position to solve
     * @return the request
     */
    public static DoubleDummyRequest from(PlayState state) {
        DoubleDummyRequest request = new DoubleDummyRequest();
        StringBuilder deal = new StringBuilder("N:");
        Seat seat = Seat.NORTH;
        for (int i = 0; i < 4; i++) {
            if (i > 0) {
                deal.append(' ');
            }
            Hand hand = state.getHand(seat);
            deal.append(hand.toPbn());
            seat = seat.next();
        }
        request.setDeal(deal.toString());
        Strain strain = state.getContract().strain();
        request.setTrump(strain.getCode());
        List<PlayedCard> trick = state.getCurrentTrick();
        Seat leader = trick.isEmpty() ? state.getNextToPlay() : trick.get(0).seat();
        request.setLeader(String.valueOf(leader.getLetter()));
        for (PlayedCard played : trick) {
            request.getCurrentTrick().add(played.card().pbnName());
        }
        request.setNextToPlay(String.valueOf(state.getNextToPlay().getLetter()));
        return request;
    }

    public String getDeal() {
        return deal;
    }

    public void setDeal(String deal) {
        this.deal = deal;
    }

    public String getTrump() {
        return trump;
    }

    public void setTrump(String trump) {
        this.trump = trump;
    }

    public String getLeader() {
        return leader;
    }

    public void setLeader(String leader) {
        this.leader = leader;
    }

    public List<String> getCurrentTrick() {
        return currentTrick;
    }

    public void setCurrentTrick(List<String> currentTrick) {
        this.currentTrick = currentTrick;
    }

    public String getNextToPlay() {
        return nextToPlay;
    }

    public void setNextToPlay(String nextToPlay) {
        this.nextToPlay = nextToPlay;
    }
}
