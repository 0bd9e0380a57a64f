package com.pocketclaw.sdk.exceptions;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketclaw.sdk.protocol.ResponseError;

/**
 * Base exception for all gateway client errors.
 */
public class GatewayException extends RuntimeException {

    private final String errorCode;
    private final JsonNode details;

    public GatewayException(String message) {
        super(message);
        this.errorCode = null;
        this.details = null;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = null;
        this.details = null;
    }

    public GatewayException(ResponseError error) {
        super(error.getMessage() != null ? error.getMessage() : "Unknown error");
        this.errorCode = error.getCode();
        this.details = error.getDetails();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public JsonNode getDetails() {
        return details;
    }

    /**
     * Returns true when repeating the failed operation may succeed.
     */
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
        if (errorCode != null) {
            sb.append("errorCode='").append(errorCode).append("', ");
        }
        sb.append("message='").append(getMessage()).append('\'');
        sb.append('}');
        return sb.toString();
    }
}
