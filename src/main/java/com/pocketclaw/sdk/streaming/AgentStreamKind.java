package com.pocketclaw.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sub-streams of the {@code agent} event.
 */
public enum AgentStreamKind {
    ASSISTANT("assistant"),
    THINKING("thinking"),
    LIFECYCLE("lifecycle"),
    TOOL("tool"),
    UNKNOWN("unknown");

    private final String value;

    AgentStreamKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AgentStreamKind fromValue(String value) {
        for (AgentStreamKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
