package com.pocketclaw.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pocketclaw.sdk.exceptions.GatewayException;
import com.pocketclaw.sdk.exceptions.RequestTimeoutException;
import com.pocketclaw.sdk.models.Message;
import com.pocketclaw.sdk.models.MessageParser;
import com.pocketclaw.sdk.models.MessageRole;
import com.pocketclaw.sdk.streaming.ChatStreamReconciler;
import com.pocketclaw.sdk.streaming.StreamHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The transcript of one conversation, kept current by a {@link ChatStreamReconciler}.
 *
 * <p>Drafts replace the previous draft in place, the finalized message replaces the
 * draft, and streaming errors are appended as system messages. Callbacks are forwarded
 * to the caller's {@link StreamHandler} after the transcript is updated.</p>
 *
 * <p>{@link #send(String)} and {@link #abort()} block on the gateway's acknowledgement and
 * must not be called from an event listener.</p>
 */
public class ChatConversation implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChatConversation.class);

    static final String HISTORY_METHOD = "chat.history";
    static final String SEND_METHOD = "chat.send";
    static final String ABORT_METHOD = "chat.abort";

    private final GatewayClient client;
    private final String sessionKey;
    private final StreamHandler handler;
    private final ChatStreamReconciler reconciler;

    private final Object lock = new Object();
    private final List<Message> messages = new ArrayList<>();
    private String draftId;

    ChatConversation(GatewayClient client, String sessionKey, StreamHandler handler) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.sessionKey = Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        this.handler = handler != null ? handler : new StreamHandler() {};
        this.reconciler = new ChatStreamReconciler(sessionKey, client.getHeartbeatFilter(),
                new TranscriptHandler(), client.getObjectMapper());
        client.addEventListener(reconciler.listenerId(), reconciler);
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public boolean isStreaming() {
        return reconciler.isStreaming();
    }

    /**
     * Returns an immutable snapshot of the transcript.
     */
    public List<Message> getMessages() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(messages));
        }
    }

    public List<Message> loadHistory() {
        return loadHistory(null);
    }

    /**
     * Replaces the transcript with the server's history for this conversation.
     * Heartbeat and empty messages are left out.
     *
     * @param limit maximum number of messages to request, or null for the server default
     * @return the loaded transcript
     */
    public List<Message> loadHistory(Integer limit) {
        ObjectNode params = client.getObjectMapper().createObjectNode();
        params.put("sessionKey", sessionKey);
        if (limit != null) {
            params.put("limit", limit);
        }
        JsonNode payload = client.sendRequestPayload(HISTORY_METHOD, params);

        JsonNode entries = payload.isArray() ? payload : payload.path("messages");
        List<Message> parsed = new ArrayList<>();
        if (entries.isArray()) {
            for (JsonNode entry : entries) {
                if (entry.isObject()) {
                    parsed.add(MessageParser.fromServerPayload(entry));
                }
            }
        }
        List<Message> visible = client.getHeartbeatFilter().filter(parsed);
        logger.debug("Loaded {} of {} history message(s) for {}", visible.size(), parsed.size(), sessionKey);

        synchronized (lock) {
            messages.clear();
            messages.addAll(visible);
            draftId = null;
        }
        return getMessages();
    }

    /**
     * Appends the user's message and asks the gateway to run a turn. The reply arrives
     * as events; a timed-out acknowledgement is expected while the agent works and is
     * not treated as a failure.
     *
     * @return the user message appended to the transcript
     * @throws GatewayException if the gateway rejects the request
     */
    public Message send(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Message userMessage = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.USER)
                .content(text)
                .timestamp(Instant.now())
                .build();
        synchronized (lock) {
            messages.add(userMessage);
        }
        reconciler.begin();

        ObjectNode params = client.getObjectMapper().createObjectNode();
        params.put("sessionKey", sessionKey);
        params.put("message", text);
        params.put("idempotencyKey", UUID.randomUUID().toString());
        try {
            client.sendRequestPayload(SEND_METHOD, params);
        } catch (RequestTimeoutException e) {
            logger.debug("{} not acknowledged in time for {}; waiting for stream events", SEND_METHOD, sessionKey);
        } catch (GatewayException e) {
            promote(reconciler.abandon());
            throw e;
        }
        return userMessage;
    }

    /**
     * Asks the gateway to stop the running turn and keeps whatever was streamed so far.
     */
    public void abort() {
        ObjectNode params = client.getObjectMapper().createObjectNode();
        params.put("sessionKey", sessionKey);
        try {
            client.sendRequestPayload(ABORT_METHOD, params);
        } finally {
            promote(reconciler.abandon());
        }
    }

    /**
     * Stops listening for this conversation's events.
     */
    @Override
    public void close() {
        client.removeEventListener(reconciler.listenerId());
    }

    private void promote(Optional<Message> draft) {
        draft.ifPresent(this::replaceDraft);
        synchronized (lock) {
            draftId = null;
        }
    }

    private void replaceDraft(Message message) {
        synchronized (lock) {
            int index = draftId != null ? indexOf(draftId) : -1;
            if (index < 0) {
                index = indexOf(message.getId());
            }
            if (index >= 0) {
                messages.set(index, message);
            } else {
                messages.add(message);
            }
        }
    }

    private int indexOf(String id) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private class TranscriptHandler implements StreamHandler {

        @Override
        public void onDraft(Message draft) {
            replaceDraft(draft);
            synchronized (lock) {
                draftId = draft.getId();
            }
            handler.onDraft(draft);
        }

        @Override
        public void onFinal(Message message) {
            replaceDraft(message);
            synchronized (lock) {
                draftId = null;
            }
            handler.onFinal(message);
        }

        @Override
        public void onError(String error) {
            Message notice = Message.builder()
                    .id("error-" + UUID.randomUUID())
                    .role(MessageRole.SYSTEM)
                    .content(error)
                    .timestamp(Instant.now())
                    .build();
            synchronized (lock) {
                messages.add(notice);
            }
            handler.onError(error);
        }

        @Override
        public void onTurnEnd() {
            synchronized (lock) {
                draftId = null;
            }
            handler.onTurnEnd();
        }
    }
}
