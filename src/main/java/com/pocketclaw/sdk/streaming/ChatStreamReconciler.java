package com.pocketclaw.sdk.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketclaw.sdk.models.Message;
import com.pocketclaw.sdk.models.MessageParser;
import com.pocketclaw.sdk.models.MessageRole;
import com.pocketclaw.sdk.protocol.EventListener;
import com.pocketclaw.sdk.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Merges the {@code chat} and {@code agent} narration of one conversation into a single
 * growing message.
 *
 * <p>The gateway may narrate the same assistant turn on both channels. Whichever channel
 * delivers the first chunk of a turn owns it until the turn ends; chunks from the other
 * channel are dropped. Events are applied in dispatch order, which is wire order, so two
 * first chunks can never tie.</p>
 *
 * <p>A turn ends on the {@code chat} terminal event ({@code final}, {@code aborted} or
 * {@code error}). The agent lifecycle {@code end} only closes the agent channel; the chat
 * terminal event supplies the message id and timestamp. When the terminal event carries
 * no usable text, the accumulated draft is promoted instead of being dropped.</p>
 *
 * <p>Register one instance per conversation with
 * {@link com.pocketclaw.sdk.client.GatewayClient#addEventListener(String, EventListener)}.</p>
 */
public class ChatStreamReconciler implements EventListener {

    private static final Logger logger = LoggerFactory.getLogger(ChatStreamReconciler.class);

    private final String sessionKey;
    private final HeartbeatFilter heartbeatFilter;
    private final StreamHandler handler;
    private final ObjectMapper objectMapper;
    private final StreamingSession session;

    public ChatStreamReconciler(String sessionKey, HeartbeatFilter heartbeatFilter, StreamHandler handler) {
        this(sessionKey, heartbeatFilter, handler, FrameCodec.defaultObjectMapper());
    }

    public ChatStreamReconciler(String sessionKey, HeartbeatFilter heartbeatFilter, StreamHandler handler,
                                ObjectMapper objectMapper) {
        this.sessionKey = Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        this.heartbeatFilter = Objects.requireNonNull(heartbeatFilter, "heartbeatFilter must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.session = new StreamingSession(sessionKey);
    }

    public String getSessionKey() {
        return sessionKey;
    }

    /**
     * Listener id used when registering this reconciler with a client.
     */
    public String listenerId() {
        return "chat-stream:" + sessionKey;
    }

    public synchronized StreamSource getActiveSource() {
        return session.getActiveSource();
    }

    public synchronized boolean isStreaming() {
        return session.isOpen();
    }

    /**
     * Opens the session for a turn the caller is about to request. A previous turn that
     * never received its terminal event is finalized from its draft first.
     */
    public synchronized void begin() {
        if (session.getActiveSource() != StreamSource.NONE) {
            logger.debug("Promoting unfinished turn for {} before a new request", sessionKey);
            complete(null);
        }
        session.open();
    }

    /**
     * Stops listening to the current turn and resets the session.
     *
     * @return the draft accumulated so far, if it had visible content
     */
    public synchronized Optional<Message> abandon() {
        Optional<Message> draft = Optional.ofNullable(buildDraft());
        boolean wasOpen = session.isOpen();
        session.reset();
        if (wasOpen) {
            handler.onTurnEnd();
        }
        return draft;
    }

    @Override
    public void onEvent(String event, JsonNode payload) {
        if (!ChatEvent.NAME.equals(event) && !AgentEvent.NAME.equals(event)) {
            return;
        }
        String key = payload.path("sessionKey").asText(null);
        if (key == null && AgentEvent.NAME.equals(event)) {
            // agent payloads may omit the key; match them by the run this session is following
            if (!isCurrentRun(payload.path("runId").asText(null))) {
                return;
            }
        } else if (!sessionKey.equals(key)) {
            return;
        }
        try {
            if (ChatEvent.NAME.equals(event)) {
                onChatEvent(objectMapper.treeToValue(payload, ChatEvent.class));
            } else {
                onAgentEvent(objectMapper.treeToValue(payload, AgentEvent.class));
            }
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed {} event for {}: {}", event, sessionKey, e.getOriginalMessage());
        }
    }

    public synchronized void onChatEvent(ChatEvent event) {
        session.setRunId(event.getRunId());
        switch (event.getState()) {
            case DELTA:
                acceptChunk(StreamSource.PRIMARY, event.getDelta(), false);
                break;
            case FINAL:
                finish(event);
                break;
            case ABORTED:
                logger.debug("Turn aborted for {}", sessionKey);
                finish(event);
                break;
            case ERROR:
                handler.onError(event.getErrorMessage() != null ? event.getErrorMessage() : "Chat failed");
                finish(event);
                break;
            default:
                logger.debug("Ignoring chat event in state {}", event.getState());
        }
    }

    public synchronized void onAgentEvent(AgentEvent event) {
        if (event.getStream() == AgentStreamKind.LIFECYCLE && AgentEvent.PHASE_START.equals(event.getPhase())) {
            startRun(event.getRunId());
        }
        session.setRunId(event.getRunId());
        switch (event.getStream()) {
            case ASSISTANT:
                acceptChunk(StreamSource.SECONDARY, event.getDelta(), false);
                break;
            case THINKING:
                acceptChunk(StreamSource.SECONDARY, event.getDelta(), true);
                break;
            case LIFECYCLE:
                onLifecycle(event);
                break;
            default:
                break;
        }
    }

    private void onLifecycle(AgentEvent event) {
        String phase = event.getPhase();
        if (AgentEvent.PHASE_END.equals(phase) || AgentEvent.PHASE_ERROR.equals(phase)) {
            // the chat terminal event finalizes the turn
            if (session.isOpen()) {
                session.markSecondaryEnded();
            }
            if (AgentEvent.PHASE_ERROR.equals(phase)) {
                String error = event.getData() != null ? event.getData().getError() : null;
                handler.onError(error != null ? error : "Agent run failed");
            }
        }
    }

    private synchronized boolean isCurrentRun(String runId) {
        return runId != null && runId.equals(session.getRunId());
    }

    /**
     * A new agent run while a turn is still owned means that turn's terminal event was lost;
     * its draft is finalized so the runs do not merge.
     */
    private void startRun(String runId) {
        boolean owned = session.getActiveSource() != StreamSource.NONE;
        boolean otherRun = runId != null && session.getRunId() != null && !runId.equals(session.getRunId());
        if (owned && (session.isSecondaryEnded() || otherRun)) {
            logger.debug("Promoting unfinished turn for {} on start of run {}", sessionKey, runId);
            complete(null);
        }
        session.startSecondary();
    }

    private void acceptChunk(StreamSource source, String chunk, boolean reasoning) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        StreamSource active = session.getActiveSource();
        if (active != StreamSource.NONE && active != source) {
            logger.trace("Dropping {} chunk for {}: {} owns the turn", source, sessionKey, active);
            return;
        }
        if (source == StreamSource.SECONDARY && session.isSecondaryEnded()) {
            return;
        }
        session.claim(source);
        if (heartbeatFilter.isHeartbeat(chunk)) {
            return;
        }
        if (reasoning) {
            session.appendReasoning(chunk);
        } else {
            session.appendText(chunk);
        }
        Message draft = buildDraft();
        if (draft != null) {
            handler.onDraft(draft);
        }
    }

    private void finish(ChatEvent event) {
        complete(event.getMessage());
    }

    private void complete(JsonNode payload) {
        Message message = buildFinal(payload);
        session.reset();
        if (message != null) {
            handler.onFinal(message);
        }
        handler.onTurnEnd();
    }

    private Message buildFinal(JsonNode payload) {
        Message parsed = payload != null && payload.isObject() ? MessageParser.fromServerPayload(payload) : null;

        String text = "";
        String reasoning = null;
        if (parsed != null && session.getActiveSource() != StreamSource.SECONDARY) {
            text = parsed.getContent();
            reasoning = parsed.getReasoning();
        }
        if (heartbeatFilter.isHeartbeat(text)) {
            text = "";
        }
        if (text.isEmpty() && !heartbeatFilter.isHeartbeat(session.getText())) {
            text = session.getText();
        }
        if (reasoning == null && !session.getReasoning().isEmpty()) {
            reasoning = session.getReasoning();
        }
        if (text.isEmpty() && reasoning == null) {
            return null;
        }

        String id = payload != null ? payload.path("id").asText(null) : null;
        if (id == null) {
            id = session.getRunId() != null ? session.getRunId() : session.getDraftId();
        }
        return Message.builder()
                .id(id)
                .role(parsed != null ? parsed.getRole() : MessageRole.ASSISTANT)
                .content(text)
                .reasoning(reasoning)
                .timestamp(parsed != null ? parsed.getTimestamp() : null)
                .build();
    }

    private Message buildDraft() {
        String text = session.getText();
        if (heartbeatFilter.isHeartbeat(text)) {
            return null;
        }
        if (!session.hasContent()) {
            return null;
        }
        return Message.builder()
                .id(session.getDraftId())
                .role(MessageRole.ASSISTANT)
                .content(text)
                .reasoning(session.getReasoning())
                .build();
    }
}
