package com.pocketclaw.sdk.protocol;

/**
 * Result of decoding one inbound frame: a response, an event, or unknown.
 */
public final class InboundFrame {

    /**
     * Frame kinds the client distinguishes.
     */
    public enum Kind {
        RESPONSE,
        EVENT,
        UNKNOWN
    }

    private static final InboundFrame UNKNOWN = new InboundFrame(Kind.UNKNOWN, null, null);

    private final Kind kind;
    private final ResponseFrame response;
    private final EventFrame event;

    private InboundFrame(Kind kind, ResponseFrame response, EventFrame event) {
        this.kind = kind;
        this.response = response;
        this.event = event;
    }

    public static InboundFrame response(ResponseFrame response) {
        return new InboundFrame(Kind.RESPONSE, response, null);
    }

    public static InboundFrame event(EventFrame event) {
        return new InboundFrame(Kind.EVENT, null, event);
    }

    public static InboundFrame unknown() {
        return UNKNOWN;
    }

    public Kind getKind() {
        return kind;
    }

    public ResponseFrame getResponse() {
        return response;
    }

    public EventFrame getEvent() {
        return event;
    }

    @Override
    public String toString() {
        switch (kind) {
            case RESPONSE:
                return "InboundFrame{" + response + '}';
            case EVENT:
                return "InboundFrame{" + event + '}';
            default:
                return "InboundFrame{UNKNOWN}";
        }
    }
}
