package in.shopwire.domain.common;

/**
 * Stable error codes surfaced to clients in error and close frames.
 *
 * {@code retryable} tells the client reconnector whether backing off and trying
 * again can succeed. Terminal codes mean the credential or the client itself is
 * at fault.
 */
public enum ErrorCode {
    // Admission / authentication
    UNAUTHENTICATED("Invalid authentication", false, 1008),
    SESSION_EXPIRED("Session expired", false, 1008),
    SESSION_REVOKED("Session is no longer valid", false, 1008),
    AUTH_TIMEOUT("Authentication timed out", true, 1008),
    NOT_AUTHENTICATED("Authenticate before sending this frame", false, 1008),
    ADMISSION_REJECTED("Connection could not be admitted", true, 1008),
    CAPACITY_EXCEEDED("Maximum connections reached", true, 1013),
    ORIGIN_NOT_ALLOWED("Origin not allowed", false, 1008),

    // Per-frame
    RATE_LIMITED("Rate limit exceeded", true, 1008),
    INVALID_NAMESPACE("Unknown namespace", false, 1008),
    FORBIDDEN_NAMESPACE("No permission for namespace", false, 1008),
    UNKNOWN_EVENT_TYPE("Unknown event type", false, 1008),
    UNKNOWN_CONNECTION("Unknown connection", false, 1008),
    PAYLOAD_TOO_LARGE("Payload exceeds the maximum frame size", false, 1009),
    INVALID_FRAME("Malformed frame", false, 1003),
    POLICY_VIOLATION("Too many protocol violations", false, 1008),

    // Lifecycle
    HEARTBEAT_TIMEOUT("No pong received before the deadline", true, 1001),
    SHUTTING_DOWN("Server shutting down", true, 1001);

    private final String defaultMessage;
    private final boolean retryable;
    private final int closeCode;

    ErrorCode(String defaultMessage, boolean retryable, int closeCode) {
        this.defaultMessage = defaultMessage;
        this.retryable = retryable;
        this.closeCode = closeCode;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * WebSocket close code used when this error terminates a connection.
     */
    public int closeCode() {
        return closeCode;
    }

    public static ErrorCode fromWire(String code) {
        if (code == null) {
            return null;
        }
        try {
            return ErrorCode.valueOf(code);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
