package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Server reply to a request, matched by {@code id}.
 */
public class ResponseFrame {

    public static final String TYPE = "res";

    private final String id;
    private final boolean ok;
    private final JsonNode payload;
    private final ResponseError error;

    @JsonCreator
    public ResponseFrame(@JsonProperty(value = "id", required = true) String id,
                         @JsonProperty(value = "ok", required = true) boolean ok,
                         @JsonProperty("payload") JsonNode payload,
                         @JsonProperty("error") ResponseError error) {
        this.id = id;
        this.ok = ok;
        this.payload = payload;
        this.error = error;
    }

    public String getId() {
        return id;
    }

    public boolean isOk() {
        return ok;
    }

    /**
     * Returns the payload, or null when absent or JSON null.
     */
    public JsonNode getPayload() {
        return payload == null || payload.isNull() ? null : payload;
    }

    public ResponseError getError() {
        return error;
    }

    /**
     * Returns the server error message, if any.
     */
    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }

    @Override
    public String toString() {
        return "ResponseFrame{" +
                "id='" + id + '\'' +
                ", ok=" + ok +
                (error != null ? ", error=" + error : "") +
                '}';
    }
}
