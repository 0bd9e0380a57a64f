package com.pocketclaw.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * States carried by the {@code chat} event.
 */
public enum ChatEventState {
    DELTA("delta"),
    FINAL("final"),
    ABORTED("aborted"),
    ERROR("error"),
    UNKNOWN("unknown");

    private final String value;

    ChatEventState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ChatEventState fromValue(String value) {
        for (ChatEventState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        return UNKNOWN;
    }
}
