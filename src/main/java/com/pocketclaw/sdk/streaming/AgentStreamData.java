package com.pocketclaw.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The nested {@code data} block of an agent event.
 */
public class AgentStreamData {

    @JsonProperty("delta")
    private String delta;

    @JsonProperty("text")
    private String text;

    @JsonProperty("phase")
    private String phase;

    @JsonProperty("error")
    private String error;

    // Default constructor for Jackson
    public AgentStreamData() {}

    public String getDelta() {
        return delta;
    }

    /**
     * Returns the text accumulated so far by the agent; informational only.
     */
    public String getText() {
        return text;
    }

    public String getPhase() {
        return phase;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "AgentStreamData{" +
                "phase='" + phase + '\'' +
                ", delta='" + (delta != null && delta.length() > 20 ? delta.substring(0, 20) + "..." : delta) + '\'' +
                '}';
    }
}
