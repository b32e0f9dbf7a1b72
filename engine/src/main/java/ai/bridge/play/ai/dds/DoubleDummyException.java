package ai.bridge.play.ai.dds;

/**
 * Any failure to get a usable answer from the double-dummy solver: connection problems, timeouts,
 * error statuses, malformed or illegal answers, and unsupported platforms.
 */
public class DoubleDummyException extends RuntimeException {

    public DoubleDummyException(String message) {
        super(message);
    }

    public DoubleDummyException(String message, Throwable cause) {
        super(message, cause);
    }
}
