package com.pocketclaw.sdk.streaming;

import com.pocketclaw.sdk.models.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Detects synthetic liveness content the gateway injects into conversations.
 *
 * <p>Matching is a case-insensitive substring test against a fixed pattern list. The
 * same filter is applied to streamed chunks and to loaded history.</p>
 */
public class HeartbeatFilter {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "HEARTBEAT_OK",
            "READ HEARTBEAT.MD",
            "# HEARTBEAT - EVENT-DRIVEN STATUS"
    );

    private final List<String> patterns;

    public HeartbeatFilter() {
        this(DEFAULT_PATTERNS);
    }

    public HeartbeatFilter(List<String> patterns) {
        List<String> normalized = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isEmpty()) {
                normalized.add(pattern.toUpperCase(Locale.ROOT));
            }
        }
        this.patterns = Collections.unmodifiableList(normalized);
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public boolean isHeartbeat(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (upper.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    public boolean isHeartbeat(Message message) {
        return message != null && isHeartbeat(message.getContent());
    }

    /**
     * A message is displayable when it is not heartbeat noise and has text or reasoning.
     */
    public boolean isVisible(Message message) {
        return message != null && !message.isEmpty() && !isHeartbeat(message);
    }

    /**
     * Returns the visible messages in order. Applying it to its own output is a no-op.
     */
    public List<Message> filter(List<Message> messages) {
        List<Message> visible = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (isVisible(message)) {
                visible.add(message);
            }
        }
        return visible;
    }
}
