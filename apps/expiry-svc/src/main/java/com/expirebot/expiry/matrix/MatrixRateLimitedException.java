package com.expirebot.expiry.matrix;

public class MatrixRateLimitedException extends MatrixRequestException {

    private final long retryAfterMs;

    public MatrixRateLimitedException(String message, long retryAfterMs) {
        super(message, 429, "M_LIMIT_EXCEEDED");
        this.retryAfterMs = retryAfterMs;
    }

    /** Server hint in milliseconds, 0 when the homeserver did not send one. */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
