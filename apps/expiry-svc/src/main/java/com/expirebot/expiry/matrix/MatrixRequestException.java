package com.expirebot.expiry.matrix;

/**
 * A homeserver call that failed for a reason other than rate limiting. Not retried.
 */
public class MatrixRequestException extends RuntimeException {

    private final int status;
    private final String errcode;

    public MatrixRequestException(String message, int status, String errcode) {
        super(message);
        this.status = status;
        this.errcode = errcode;
    }

    public MatrixRequestException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.errcode = null;
    }

    /** HTTP status, or 0 when the homeserver could not be reached. */
    public int getStatus() {
        return status;
    }

    public String getErrcode() {
        return errcode;
    }
}
