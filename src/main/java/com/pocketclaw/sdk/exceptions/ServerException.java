package com.pocketclaw.sdk.exceptions;

import com.pocketclaw.sdk.protocol.ResponseError;

/**
 * Exception thrown when the server answers a request with {@code ok=false}.
 */
public class ServerException extends GatewayException {

    public ServerException(String message) {
        super(message);
    }

    public ServerException(ResponseError error) {
        super(error);
    }
}
