package com.motionflow.orchestrator.claude;

/**
 * A model call failed. {@code statusCode} is the HTTP status, or -1 when the
 * request never got a response (timeout, connection refused, bad payload).
 */
public class ExternalCallException extends RuntimeException {

    private final int statusCode;

    public ExternalCallException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExternalCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() {
        return statusCode;
    }

    /** 429 rate limited or 529 overloaded: wait for capacity rather than burn a retry. */
    public boolean isCapacity() {
        return statusCode == 429 || statusCode == 529;
    }
}
