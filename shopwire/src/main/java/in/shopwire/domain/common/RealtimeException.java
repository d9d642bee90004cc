package in.shopwire.domain.common;

/**
 * Failure inside the realtime core, tagged with a stable {@link ErrorCode}.
 */
public class RealtimeException extends RuntimeException {

    private final ErrorCode code;

    public RealtimeException(ErrorCode code) {
        super(code.defaultMessage());
        this.code = code;
    }

    public RealtimeException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RealtimeException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
