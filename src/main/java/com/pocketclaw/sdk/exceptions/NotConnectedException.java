package com.pocketclaw.sdk.exceptions;

/**
 * Thrown when an RPC is attempted before the handshake completes or after a disconnect.
 */
public class NotConnectedException extends GatewayException {

    public NotConnectedException() {
        super("Not connected to server");
    }
}
