package com.pocketclaw.sdk.exceptions;

/**
 * Exception thrown when a frame or payload has an unusable shape.
 */
public class DecodingException extends GatewayException {

    public DecodingException(String message) {
        super(message);
    }

    public DecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
