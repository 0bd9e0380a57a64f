package com.pocketclaw.sdk.streaming;

/**
 * Which narration channel owns the current turn.
 */
public enum StreamSource {
    /** No chunk accepted yet this turn. */
    NONE,
    /** The {@code chat} event channel. */
    PRIMARY,
    /** The {@code agent} event channel. */
    SECONDARY
}
