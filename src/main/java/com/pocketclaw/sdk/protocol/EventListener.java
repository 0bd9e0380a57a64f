package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives server events. Invoked on the socket reader thread, so implementations
 * must return promptly and must not block on a request issued through the same client.
 */
@FunctionalInterface
public interface EventListener {

    /**
     * @param event   event name, e.g. {@code chat}
     * @param payload event payload; an empty object when the frame carried none
     */
    void onEvent(String event, JsonNode payload);
}
