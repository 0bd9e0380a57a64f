package com.pocketclaw.sdk.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable chat message. Draft messages produced while a turn streams and the
 * finalized message share this type; a draft is simply superseded by the next one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Message {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("role")
    private final MessageRole role;

    @JsonProperty("content")
    private final String content;

    @JsonProperty("reasoning")
    private final String reasoning;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonCreator
    public Message(@JsonProperty("id") String id,
                   @JsonProperty("role") MessageRole role,
                   @JsonProperty("content") String content,
                   @JsonProperty("reasoning") String reasoning,
                   @JsonProperty("timestamp") Instant timestamp) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.role = role != null ? role : MessageRole.ASSISTANT;
        this.content = content != null ? content : "";
        this.reasoning = reasoning == null || reasoning.isEmpty() ? null : reasoning;
        this.timestamp = timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    /**
     * Returns the model's reasoning ("thinking") text, or null.
     */
    public String getReasoning() {
        return reasoning;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public boolean isUser() {
        return role == MessageRole.USER;
    }

    @JsonIgnore
    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }

    @JsonIgnore
    public boolean isSystem() {
        return role == MessageRole.SYSTEM;
    }

    /**
     * True when the message has neither text nor reasoning.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return content.isEmpty() && reasoning == null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .role(role)
                .content(content)
                .reasoning(reasoning)
                .timestamp(timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message message = (Message) o;
        return id.equals(message.id)
                && role == message.role
                && content.equals(message.content)
                && Objects.equals(reasoning, message.reasoning)
                && Objects.equals(timestamp, message.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, role, content, reasoning, timestamp);
    }

    @Override
    public String toString() {
        return "Message{" +
                "id='" + id + '\'' +
                ", role=" + role +
                ", content='" + (content.length() > 50 ? content.substring(0, 50) + "..." : content) + '\'' +
                (reasoning != null ? ", reasoning=" + reasoning.length() + " chars" : "") +
                '}';
    }

    /**
     * Builder for creating Message instances.
     */
    public static class Builder {
        private String id;
        private MessageRole role = MessageRole.ASSISTANT;
        private String content = "";
        private String reasoning;
        private Instant timestamp;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder role(MessageRole role) {
            this.role = role;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Message build() {
            return new Message(id, role, content, reasoning, timestamp);
        }
    }
}
