package com.pocketclaw.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the secondary {@code agent} narration event.
 */
public class AgentEvent {

    public static final String NAME = "agent";

    public static final String PHASE_START = "start";
    public static final String PHASE_END = "end";
    public static final String PHASE_ERROR = "error";

    @JsonProperty("stream")
    private AgentStreamKind stream = AgentStreamKind.UNKNOWN;

    @JsonProperty("sessionKey")
    private String sessionKey;

    @JsonProperty("runId")
    private String runId;

    @JsonProperty("seq")
    private Integer seq;

    @JsonProperty("data")
    private AgentStreamData data;

    // Default constructor for Jackson
    public AgentEvent() {}

    public AgentStreamKind getStream() {
        return stream != null ? stream : AgentStreamKind.UNKNOWN;
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public String getRunId() {
        return runId;
    }

    public Integer getSeq() {
        return seq;
    }

    public AgentStreamData getData() {
        return data;
    }

    /**
     * Returns the chunk text of an assistant or thinking event.
     */
    public String getDelta() {
        return data != null ? data.getDelta() : null;
    }

    public String getPhase() {
        return data != null ? data.getPhase() : null;
    }

    @Override
    public String toString() {
        return "AgentEvent{" +
                "stream=" + stream +
                ", sessionKey='" + sessionKey + '\'' +
                ", data=" + data +
                '}';
    }
}
