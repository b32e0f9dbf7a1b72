package ai.bridge.helpers;

import ai.bridge.auction.Contract;
import ai.bridge.game.Card;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.play.PlayState;
import ai.bridge.play.PlayedCard;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for play positions, including end positions and tricks in progress.
 *
 * <pre>{@code
 * PlayState state = DealBuilder.contract("3NT by S")
 *     .north("♣K2")
 *     .east("♠K3")
 *     .south("♥A2")
 *     .west("♠Q")
 *     .leader(Seat.WEST)
 *     .played("A♠")
 *     .build();
 * }</pre>
 *
 * Hands hold the cards still unplayed; cards in the current trick are listed with
 * {@link #played(String...)} in order from the leader. Seats left unset hold no cards.
 */
public final class DealBuilder {

    private final Contract contract;
    private final Map<Seat, Hand> hands = new EnumMap<>(Seat.class);
    private final List<String> played = new ArrayList<>();
    private Seat leader;
    private int declarerTricks;
    private int defenderTricks;

    private DealBuilder(Contract contract) {
        this.contract = contract;
        for (Seat seat : Seat.values()) {
            hands.put(seat, Hand.parse(""));
        }
    }

    public static DealBuilder contract(String contract) {
        return new DealBuilder(Contract.parse(contract));
    }

    public DealBuilder north(String cards) {
        return hand(Seat.NORTH, cards);
    }

    public DealBuilder east(String cards) {
        return hand(Seat.EAST, cards);
    }

    public DealBuilder south(String cards) {
        return hand(Seat.SOUTH, cards);
    }

    public DealBuilder west(String cards) {
        return hand(Seat.WEST, cards);
    }

    public DealBuilder hand(Seat seat, String cards) {
        hands.put(seat, Hand.parse(cards));
        return this;
    }

    public DealBuilder leader(Seat seat) {
        this.leader = seat;
        return this;
    }

    public DealBuilder played(String... cards) {
        played.addAll(List.of(cards));
        return this;
    }

    public DealBuilder tricks(int declarer, int defenders) {
        this.declarerTricks = declarer;
        this.defenderTricks = defenders;
        return this;
    }

    public PlayState build() {
        Seat first = leader == null ? contract.openingLeader() : leader;
        List<PlayedCard> trick = new ArrayList<>();
        Seat seat = first;
        for (String card : played) {
            trick.add(new PlayedCard(seat, Card.parse(card)));
            seat = seat.next();
        }
        return PlayState.of(contract, hands, first, trick, declarerTricks, defenderTricks);
    }
}
