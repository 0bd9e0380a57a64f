package com.pocketclaw.sdk.exceptions;

/**
 * Exception thrown when no response arrives for a request before its deadline.
 */
public class RequestTimeoutException extends GatewayException {

    private final String method;

    public RequestTimeoutException(String method) {
        super("Request timed out: " + method);
        this.method = method;
    }

    /**
     * Returns the RPC method that timed out.
     */
    public String getMethod() {
        return method;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
