package ai.bridge;

import ai.bridge.auction.Auction;
import ai.bridge.auction.Call;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.scoring.HandScore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits one structured JSON line per finished deal, for offline analysis of bidding and play.
 *
 * <p>Lines are prefixed with "DEAL_RECORD " so they can be filtered out of mixed logs. Enable with
 * {@code -Dlog.deals=true}.</p>
 */
public class DealLogger {
    private static final Logger log = LoggerFactory.getLogger(DealLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.deals");

    private DealLogger() {
    }

    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Builds the JSON record of a deal.
     *
     * @param hands   the hands as dealt
     * @param auction the finished auction
     * @param score   the score, or null when the deal was passed out
     * @return the JSON object
     */
    static ObjectNode toJson(Map<Seat, Hand> hands, Auction auction, HandScore score) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("type", "deal");
        root.put("dealer", auction.getDealer().toString());
        ObjectNode deal = root.putObject("hands");
        for (Seat seat : Seat.values()) {
            deal.put(seat.toString(), hands.get(seat).toPbn());
        }
        ArrayNode calls = root.putArray("auction");
        for (Call call : auction.getCalls()) {
            calls.add(call.bid().toString());
        }
        if (score == null) {
            root.putNull("contract");
        } else {
            root.put("contract", score.contract().toString());
            root.put("tricks", score.tricksTaken());
            root.put("score", score.score());
        }
        return root;
    }

    /**
     * Logs a deal record when enabled. Failures are logged and never reach the game loop.
     */
    public static void logDeal(Map<Seat, Hand> hands, Auction auction, HandScore score) {
        if (!ENABLED) {
            return;
        }
        try {
            log.info("DEAL_RECORD {}", OBJECT_MAPPER.writeValueAsString(toJson(hands, auction, score)));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialise deal record: {}", e.toString());
        }
    }
}
