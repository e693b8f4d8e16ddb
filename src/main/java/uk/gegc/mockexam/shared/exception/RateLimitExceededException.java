package uk.gegc.mockexam.shared.exception;

import java.util.Map;

public class RateLimitExceededException extends LlmServiceException {
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds, Throwable cause) {
        super(ErrorKind.RATE_LIMIT, message, Map.of("retryAfter", Math.max(1, retryAfterSeconds)), cause);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public RateLimitExceededException(String message, Throwable cause) {
        this(message, 60, cause); // Default 1 minute
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
