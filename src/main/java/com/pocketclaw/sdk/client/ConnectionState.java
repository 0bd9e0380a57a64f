package com.pocketclaw.sdk.client;

import java.util.Objects;

/**
 * Connection lifecycle state. {@code ERROR} carries a reason.
 */
public final class ConnectionState {

    /**
     * Connection lifecycle phases.
     */
    public enum Status {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        ERROR
    }

    public static final ConnectionState DISCONNECTED = new ConnectionState(Status.DISCONNECTED, null);
    public static final ConnectionState CONNECTING = new ConnectionState(Status.CONNECTING, null);
    public static final ConnectionState CONNECTED = new ConnectionState(Status.CONNECTED, null);

    private final Status status;
    private final String message;

    private ConnectionState(Status status, String message) {
        this.status = status;
        this.message = message;
    }

    public static ConnectionState error(String message) {
        return new ConnectionState(Status.ERROR, Objects.requireNonNull(message, "message must not be null"));
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Returns the error reason, or null for non-error states.
     */
    public String getMessage() {
        return message;
    }

    public boolean isConnected() {
        return status == Status.CONNECTED;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public String getDisplayText() {
        switch (status) {
            case CONNECTING:
                return "Connecting...";
            case CONNECTED:
                return "Connected";
            case ERROR:
                return "Error: " + message;
            default:
                return "Disconnected";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectionState that = (ConnectionState) o;
        return status == that.status && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, message);
    }

    @Override
    public String toString() {
        return status == Status.ERROR ? "ERROR(" + message + ")" : status.name();
    }
}
