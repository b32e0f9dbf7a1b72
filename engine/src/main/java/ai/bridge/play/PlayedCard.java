package ai.bridge.play;

import ai.bridge.game.Card;
import ai.bridge.game.Seat;
import java.util.Objects;

/**
 * A card played to a trick and the seat that played it.
 */
public record PlayedCard(Seat seat, Card card) {

    public PlayedCard {
        Objects.requireNonNull(seat, "seat");
        Objects.requireNonNull(card, "card");
    }

    @Override
    public String toString() {
        return seat + ":" + card;
    }
}
