package ai.bridge.play.ai.dds;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * DTO returned by the double-dummy service: the best card for the player to move and the number
 * of tricks that player's side takes from here with best play.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DoubleDummyResponse {

    /** Best card in PBN form, e.g. "SQ". */
    private String card;

    /** Tricks the mover's side takes from the current position. */
    private int tricks;

    public DoubleDummyResponse() {
        // Default constructor for JSON binding.
    }

    public String getCard() {
        return card;
    }

    public void setCard(String card) {
        this.card = card;
    }

    public int getTricks() {
        return tricks;
    }

    public void setTricks(int tricks) {
        this.tricks = tricks;
    }
}
