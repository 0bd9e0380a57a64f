package com.pocketclaw.sdk.streaming;

import java.util.UUID;

/**
 * Mutable accumulation state for the turn currently streaming in one conversation.
 * Not thread-safe; owned by a {@link ChatStreamReconciler}.
 */
public class StreamingSession {

    private final String sessionKey;
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private StreamSource activeSource = StreamSource.NONE;
    private boolean open;
    private boolean secondaryEnded;
    private String draftId;
    private String runId;

    public StreamingSession(String sessionKey) {
        this.sessionKey = sessionKey;
        this.draftId = newDraftId();
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public StreamSource getActiveSource() {
        return activeSource;
    }

    public String getText() {
        return text.toString();
    }

    public String getReasoning() {
        return reasoning.toString();
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * True once the agent channel reported its lifecycle end for this turn.
     */
    public boolean isSecondaryEnded() {
        return secondaryEnded;
    }

    public String getDraftId() {
        return draftId;
    }

    public String getRunId() {
        return runId;
    }

    public boolean hasContent() {
        return text.length() > 0 || reasoning.length() > 0;
    }

    void open() {
        open = true;
    }

    void startSecondary() {
        open = true;
        secondaryEnded = false;
    }

    void claim(StreamSource source) {
        activeSource = source;
        open = true;
    }

    void appendText(String chunk) {
        text.append(chunk);
    }

    void appendReasoning(String chunk) {
        reasoning.append(chunk);
    }

    void markSecondaryEnded() {
        secondaryEnded = true;
    }

    void setRunId(String runId) {
        if (this.runId == null && runId != null) {
            this.runId = runId;
        }
    }

    void reset() {
        activeSource = StreamSource.NONE;
        text.setLength(0);
        reasoning.setLength(0);
        open = false;
        secondaryEnded = false;
        runId = null;
        draftId = newDraftId();
    }

    private static String newDraftId() {
        return "draft-" + UUID.randomUUID();
    }

    @Override
    public String toString() {
        return "StreamingSession{" +
                "sessionKey='" + sessionKey + '\'' +
                ", activeSource=" + activeSource +
                ", open=" + open +
                ", textLength=" + text.length() +
                '}';
    }
}
