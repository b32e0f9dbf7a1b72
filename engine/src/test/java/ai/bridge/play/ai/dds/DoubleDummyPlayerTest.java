package ai.bridge.play.ai.dds;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.game.Card;
import ai.bridge.game.Seat;
import ai.bridge.helpers.DealBuilder;
import ai.bridge.play.CardDecision;
import ai.bridge.play.PlayState;
import ai.bridge.play.ai.MinimaxPlayer;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs the solver player against a local stub of the solver service.
 */
class DoubleDummyPlayerTest {

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"card\":\"C2\",\"tricks\":0}";

    @BeforeEach
    void startSolverStub() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/solve", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopSolverStub() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private DoubleDummyPlayer player(boolean enabled, boolean unsupported) {
        return new DoubleDummyPlayer(new DoubleDummyClient(baseUrl(), 2000), new MinimaxPlayer(4), enabled, unsupported);
    }

    private static PlayState discardPosition() {
        return DealBuilder.contract("3NT by S")
                .north("♣K2")
                .east("♠K3")
                .south("♥A2")
                .west("♠Q")
                .leader(Seat.WEST)
                .played("A♠")
                .build();
    }

    @Test
    void usesTheSolversCard() {
        responseBody = "{\"card\":\"CK\",\"tricks\":0,\"elapsed\":3}";

        CardDecision decision = player(true, false).choose(discardPosition());

        assertEquals(Card.parse("K♣"), decision.card());
        assertEquals(CardDecision.Source.SOLVER, decision.source());
        assertTrue(requestBody.get().contains("\"deal\":\"N:...K2 K3... .A2.. Q...\""), requestBody.get());
        assertTrue(requestBody.get().contains("\"trump\":\"NT\""), requestBody.get());
        assertTrue(requestBody.get().contains("\"leader\":\"W\""), requestBody.get());
        assertTrue(requestBody.get().contains("\"nextToPlay\":\"N\""), requestBody.get());
        assertTrue(requestBody.get().contains("\"currentTrick\":[\"SA\"]"), requestBody.get());
    }

    @Test
    void fallsBackWhenTheSolverAnswersWithAnIllegalCard() {
        responseBody = "{\"card\":\"HA\",\"tricks\":1}";

        CardDecision decision = player(true, false).choose(discardPosition());

        assertEquals(CardDecision.Source.SEARCH_FALLBACK, decision.source());
        assertEquals(Card.parse("2♣"), decision.card());
        assertTrue(decision.reason().startsWith("Solver unavailable"), decision.reason());
    }

    @Test
    void fallsBackOnServerError() {
        status = 500;
        responseBody = "{\"error\":\"boom\"}";

        CardDecision decision = player(true, false).choose(discardPosition());

        assertEquals(CardDecision.Source.SEARCH_FALLBACK, decision.source());
        assertTrue(decision.reason().contains("HTTP 500"), decision.reason());
    }

    @Test
    void fallsBackOnMalformedAnswer() {
        responseBody = "not json";

        assertEquals(CardDecision.Source.SEARCH_FALLBACK, player(true, false).choose(discardPosition()).source());
    }

    @Test
    void fallsBackWhenNobodyListens() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);
        DoubleDummyPlayer offline = new DoubleDummyPlayer(
                new DoubleDummyClient("http://127.0.0.1:" + port, 500), new MinimaxPlayer(4), true, false);

        CardDecision decision = offline.choose(discardPosition());

        assertEquals(CardDecision.Source.SEARCH_FALLBACK, decision.source());
        assertEquals(Card.parse("2♣"), decision.card());
    }

    @Test
    void disabledSolverIsNeverCalled() {
        CardDecision decision = player(false, false).choose(discardPosition());

        assertEquals(CardDecision.Source.SEARCH_FALLBACK, decision.source());
        assertTrue(decision.reason().contains("disabled"), decision.reason());
        assertNull(requestBody.get());
    }

    @Test
    void unsupportedPlatformIsNeverCalled() {
        CardDecision decision = player(true, true).choose(discardPosition());

        assertEquals(CardDecision.Source.SEARCH_FALLBACK, decision.source());
        assertNull(requestBody.get());
    }

    @Test
    void clientReportsEmptyBodies() {
        responseBody = "";
        DoubleDummyClient client = new DoubleDummyClient(baseUrl(), 2000);

        assertThrows(DoubleDummyException.class, () -> client.solve(DoubleDummyRequest.from(discardPosition())));
    }

    @Test
    void platformListMatching() {
        assertTrue(DoubleDummyClient.isUnsupportedPlatform("Mac OS X/aarch64, windows 11/amd64", "Mac OS X", "aarch64"));
        assertTrue(DoubleDummyClient.isUnsupportedPlatform("mac os x/aarch64", "MAC OS X", "AARCH64"));
        assertFalse(DoubleDummyClient.isUnsupportedPlatform("mac os x/aarch64", "Linux", "amd64"));
        assertFalse(DoubleDummyClient.isUnsupportedPlatform("", "Linux", "amd64"));
        assertFalse(DoubleDummyClient.isUnsupportedPlatform(null, "Linux", "amd64"));
    }
}
