package com.pocketclaw.sdk.client;

/**
 * Observes connection state transitions.
 */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChanged(ConnectionState state);
}
