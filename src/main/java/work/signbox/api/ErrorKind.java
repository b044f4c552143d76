package work.signbox.api;

import java.util.Locale;

/**
 * Failure taxonomy surfaced to callers. {@link #retryable()} separates transient conditions
 * from request or configuration problems that a retry will not fix.
 */
public enum ErrorKind {
    INVALID_REQUEST(false, 400),
    NO_RULE_MATCHED(false, 422),
    SERVICE_UNAVAILABLE(true, 503),
    CANCELLED(true, 503),
    SCRIPT_INVALID(false, 422),
    SANDBOX_BUILD_ERROR(false, 500),
    INVOCATION_TIMEOUT(true, 504),
    SCRIPT_RUNTIME_ERROR(true, 500),
    ENTRY_POINT_NOT_FOUND(false, 500),
    INTERNAL(false, 500);

    private final boolean retryable;
    private final int httpStatus;

    ErrorKind(boolean retryable, int httpStatus) {
        this.retryable = retryable;
        this.httpStatus = httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Wire name, e.g. {@code invocation_timeout}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
