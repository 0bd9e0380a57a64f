package com.pocketclaw.sdk.exceptions;

/**
 * Exception thrown when the connect handshake is rejected.
 */
public class AuthenticationException extends GatewayException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
