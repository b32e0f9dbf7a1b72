package ai.bridge.play.ai.dds;

import ai.bridge.config.PlayProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Thin HTTP client for the external double-dummy solver service.
 *
 * Sends the remaining deal and the trick in progress to {@code POST /solve} and reads back the best
 * card. Each call is bounded by the configured connect and read timeout.
 *
 * Every failure (no service, timeout, non-2xx status, empty or malformed body) surfaces as a
 * {@link DoubleDummyException}; the player catches it and falls back to search.
 */
@Component
public class DoubleDummyClient {

    private static final Logger log = LoggerFactory.getLogger(DoubleDummyClient.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final URI solveUri;
    private final int timeoutMillis;

    /**
     * Default constructor using localhost:8010 and a five second timeout.
     */
    public DoubleDummyClient() {
        this("http://127.0.0.1:8010", 5000);
    }

    @Autowired
    public DoubleDummyClient(PlayProperties properties) {
        this(properties.getSolver().getUrl(), properties.getSolver().getTimeoutMillis());
    }

    /**
     * Constructor with custom base URL.
     *
     * @param baseUrl       the base URL of the solver (e.g., "http://127.0.0.1:8010")
     * @param timeoutMillis connect and read timeout
     */
    public DoubleDummyClient(String baseUrl, int timeoutMillis) {
        this.solveUri = URI.create(baseUrl + "/solve");
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Ask the solver for the best card in a position.
     *
     * @param request the position
     * @return the parsed answer, never null
     * @throws DoubleDummyException if no usable answer arrives
     */
    public DoubleDummyResponse solve(DoubleDummyRequest request) {
        long startNanos = System.nanoTime();
        if (log.isDebugEnabled()) {
            log.debug("Calling solver at {} for {} to play, deal {}", solveUri, request.getNextToPlay(), request.getDeal());
        }
        String responseBody;
        int statusCode;
        try {
            byte[] body = OBJECT_MAPPER.writeValueAsBytes(request);

            HttpURLConnection conn = (HttpURLConnection) solveUri.toURL().openConnection();
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setConnectTimeout(timeoutMillis);
            conn.setReadTimeout(timeoutMillis);
            conn.setRequestProperty("Content-Type", "application/json");
            conn.setRequestProperty("Accept", "application/json");
            conn.setRequestProperty("Connection", "close");
            conn.setFixedLengthStreamingMode(body.length);

            conn.connect();
            try (OutputStream os = conn.getOutputStream()) {
                os.write(body);
                os.flush();
            }

            statusCode = conn.getResponseCode();
            InputStream is = statusCode >= 200 && statusCode < 300
                    ? conn.getInputStream()
                    : conn.getErrorStream();
            responseBody = "";
            if (is != null) {
                try (InputStream in = is) {
                    responseBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            long durationMillis = (System.nanoTime() - startNanos) / 1_000_000L;
            throw new DoubleDummyException("Solver at " + solveUri + " failed after " + durationMillis + " ms: " + e, e);
        }

        if (statusCode < 200 || statusCode >= 300) {
            throw new DoubleDummyException("Solver returned HTTP " + statusCode + ": " + responseBody);
        }
        if (responseBody.isBlank()) {
            throw new DoubleDummyException("Solver returned an empty body");
        }
        DoubleDummyResponse response;
        try {
            response = OBJECT_MAPPER.readValue(responseBody, DoubleDummyResponse.class);
        } catch (JsonProcessingException parseError) {
            throw new DoubleDummyException("Malformed solver response: " + parseError.getOriginalMessage(), parseError);
        }
        if (response == null || response.getCard() == null) {
            throw new DoubleDummyException("Solver response has no card: " + responseBody);
        }
        if (log.isDebugEnabled()) {
            long durationMillis = (System.nanoTime() - startNanos) / 1_000_000L;
            log.debug("Solver responded in {} ms with card={} tricks={}", durationMillis, response.getCard(), response.getTricks());
        }
        return response;
    }

    /**
     * Checks a platform against a comma-separated list of {@code os.name/os.arch} pairs.
     *
     * @param unsupported the configured list, e.g. "mac os x/aarch64"
     * @param osName      the value of {@code os.name}
     * @param osArch      the value of {@code os.arch}
     * @return {@code true} if the solver must not be called on this platform
     */
    public static boolean isUnsupportedPlatform(String unsupported, String osName, String osArch) {
        if (unsupported == null || unsupported.isBlank()) {
            return false;
        }
        String platform = (osName + "/" + osArch).toLowerCase(Locale.ROOT);
        return Arrays.stream(unsupported.split(","))
                .map(entry -> entry.trim().toLowerCase(Locale.ROOT))
                .anyMatch(platform::equals);
    }

    @Override
    public String toString() {
        return "DoubleDummyClient(" + solveUri + ")";
    }
}
