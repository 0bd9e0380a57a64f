package com.pocketclaw.sdk.models;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Projects server message payloads into {@link Message} instances.
 *
 * <p>A payload is either the message itself ({@code {id, role, content}}) or a wrapper
 * holding it under {@code message} next to fields like {@code runId}. Content may be a
 * plain string, an array of typed blocks, or an object.</p>
 */
public final class MessageParser {

    private MessageParser() {}

    /**
     * Text and reasoning extracted from a structured content value.
     */
    public static final class ExtractedContent {
        private final String text;
        private final String reasoning;

        ExtractedContent(String text, String reasoning) {
            this.text = text;
            this.reasoning = reasoning;
        }

        public String getText() {
            return text;
        }

        /**
         * Returns concatenated thinking blocks, or null when there were none.
         */
        public String getReasoning() {
            return reasoning;
        }
    }

    public static Message fromServerPayload(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return null;
        }
        JsonNode msg = raw.path("message").isObject() ? raw.get("message") : raw;

        MessageRole role = MessageRole.fromValue(text(msg, "role"));
        String id = firstNonNull(text(msg, "id"), text(raw, "runId"));
        if (id == null) {
            id = "history-" + UUID.randomUUID();
        }

        ExtractedContent content = extractContent(msg.get("content"));
        String reasoning = content.getReasoning();
        if (reasoning == null) {
            reasoning = text(msg, "thinking");
        }

        return Message.builder()
                .id(id)
                .role(role)
                .content(content.getText())
                .reasoning(reasoning)
                .timestamp(firstNonNull(
                        timestamp(msg.get("timestamp")),
                        timestamp(raw.get("timestamp")),
                        timestamp(msg.get("ts")),
                        timestamp(raw.get("ts"))))
                .build();
    }

    /**
     * Extracts display text and reasoning. Only {@code text} and {@code thinking} blocks
     * contribute; other block types (tool calls, images) are skipped.
     */
    public static ExtractedContent extractContent(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return new ExtractedContent("", null);
        }
        if (content.isTextual()) {
            return new ExtractedContent(content.asText(), null);
        }
        if (content.isArray()) {
            StringBuilder text = new StringBuilder();
            StringBuilder thinking = null;
            for (JsonNode block : content) {
                String type = text(block, "type");
                if ("text".equals(type) && block.path("text").isTextual()) {
                    text.append(block.get("text").asText());
                } else if ("thinking".equals(type) && block.path("thinking").isTextual()) {
                    if (thinking == null) {
                        thinking = new StringBuilder();
                    }
                    thinking.append(block.get("thinking").asText());
                }
            }
            return new ExtractedContent(text.toString(), thinking != null ? thinking.toString() : null);
        }
        if (content.isObject()) {
            String text = firstNonNull(text(content, "text"), text(content, "content"));
            return new ExtractedContent(text != null ? text : content.toString(), null);
        }
        return new ExtractedContent(content.asText(), null);
    }

    static Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isTextual() ? value.asText() : null;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
