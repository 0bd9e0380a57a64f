package com.pocketclaw.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload of the primary {@code chat} narration event.
 */
public class ChatEvent {

    public static final String NAME = "chat";

    @JsonProperty("state")
    private ChatEventState state = ChatEventState.UNKNOWN;

    @JsonProperty("sessionKey")
    private String sessionKey;

    @JsonProperty("runId")
    private String runId;

    @JsonProperty("delta")
    private String delta;

    @JsonProperty("message")
    private JsonNode message;

    @JsonProperty("errorMessage")
    private String errorMessage;

    // Default constructor for Jackson
    public ChatEvent() {}

    public ChatEventState getState() {
        return state != null ? state : ChatEventState.UNKNOWN;
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Returns the incremental text of a {@code delta} event.
     */
    public String getDelta() {
        return delta;
    }

    public JsonNode getMessage() {
        return message;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "ChatEvent{" +
                "state=" + state +
                ", sessionKey='" + sessionKey + '\'' +
                ", delta='" + (delta != null && delta.length() > 20 ? delta.substring(0, 20) + "..." : delta) + '\'' +
                '}';
    }
}
