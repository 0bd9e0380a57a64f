package com.pocketclaw.sdk.exceptions;

/**
 * Exception thrown when the socket cannot be opened or is lost during the handshake.
 */
public class ConnectionFailedException extends GatewayException {

    public ConnectionFailedException(String message) {
        super(message);
    }

    public ConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
