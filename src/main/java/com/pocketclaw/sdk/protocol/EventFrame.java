package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Server pushed event. Events carry no request id.
 */
public class EventFrame {

    public static final String TYPE = "event";

    private final String event;
    private final JsonNode payload;

    @JsonCreator
    public EventFrame(@JsonProperty(value = "event", required = true) String event,
                      @JsonProperty("payload") JsonNode payload) {
        this.event = event;
        this.payload = payload;
    }

    public String getEvent() {
        return event;
    }

    public JsonNode getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "EventFrame{event='" + event + "'}";
    }
}
