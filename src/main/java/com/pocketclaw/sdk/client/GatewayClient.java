package com.pocketclaw.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pocketclaw.sdk.exceptions.*;
import com.pocketclaw.sdk.models.ClientInfo;
import com.pocketclaw.sdk.protocol.*;
import com.pocketclaw.sdk.streaming.HeartbeatFilter;
import com.pocketclaw.sdk.streaming.StreamHandler;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client for the OpenClaw gateway WebSocket protocol.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * // Create client with a gateway token
 * GatewayClient client = GatewayClient.builder()
 *     .url("wss://gateway.local:18789")
 *     .token("your-token")
 *     .build();
 *
 * // Open the socket and complete the challenge/connect/hello-ok handshake
 * client.connect();
 *
 * // Issue an RPC
 * JsonNode sessions = client.sendRequestPayload("sessions.list", null);
 *
 * // Stream a conversation
 * ChatConversation chat = client.conversation("agent:main:main", new StreamHandler() {
 *     public void onFinal(Message message) {
 *         System.out.println(message.getContent());
 *     }
 * });
 * chat.send("Hello!");
 *
 * // Close the client when done
 * client.close();
 * }</pre>
 *
 * <p>Frames are read on OkHttp's reader thread, one at a time: responses are routed to
 * their pending request, events are fanned out to the registered listeners. Listeners
 * therefore run on that thread and must not block on a request issued through this client.</p>
 */
public class GatewayClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GatewayClient.class);

    static final String CHALLENGE_EVENT = "connect.challenge";
    static final String CONNECT_METHOD = "connect";
    static final String HELLO_OK = "hello-ok";
    private static final String CHALLENGE_LISTENER_ID = "connect.challenge-watch";
    private static final int GOING_AWAY = 1001;
    private static final int NORMAL_CLOSURE = 1000;

    private final GatewayClientConfig config;
    private final OkHttpClient httpClient;
    private final FrameCodec codec;
    private final ObjectMapper objectMapper;
    private final RpcCorrelator correlator = new RpcCorrelator();
    private final EventDispatcher dispatcher = new EventDispatcher();
    private final HeartbeatFilter heartbeatFilter;

    private final Object stateLock = new Object();
    private final Object connectLock = new Object();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Link link;
    private volatile ConnectionStateListener stateListener;

    private GatewayClient(GatewayClientConfig config) {
        this.config = config;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                // a socket read blocks until the next frame arrives
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .writeTimeout(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
        this.codec = new FrameCodec();
        this.objectMapper = codec.getObjectMapper();
        this.heartbeatFilter = new HeartbeatFilter(config.getHeartbeatPatterns());
    }

    /**
     * Creates a new client builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static GatewayClient create(GatewayClientConfig config) {
        return new GatewayClient(config);
    }

    /**
     * Creates a new client that authenticates with a gateway token.
     */
    public static GatewayClient withToken(String url, String token) {
        return builder()
                .url(url)
                .token(token)
                .build();
    }

    /**
     * Creates a new client that authenticates with a gateway password.
     */
    public static GatewayClient withPassword(String url, String password) {
        return builder()
                .url(url)
                .password(password)
                .build();
    }

    public GatewayClientConfig getConfig() {
        return config;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public HeartbeatFilter getHeartbeatFilter() {
        return heartbeatFilter;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state.isConnected();
    }

    public int pendingRequestCount() {
        return correlator.pendingCount();
    }

    // ================================
    // Listeners
    // ================================

    public void setConnectionStateListener(ConnectionStateListener listener) {
        this.stateListener = listener;
    }

    /**
     * Sets the primary event handler, invoked before the keyed listeners.
     */
    public void setEventHandler(EventListener handler) {
        dispatcher.setPrimaryHandler(handler);
    }

    /**
     * Adds a named event listener, replacing any listener registered under the same id.
     * Listeners survive disconnects and reconnects until removed.
     *
     * @return the listener id, for removal
     */
    public String addEventListener(String id, EventListener listener) {
        return dispatcher.addListener(id, listener);
    }

    /**
     * Removes a previously added event listener by id.
     */
    public boolean removeEventListener(String id) {
        return dispatcher.removeListener(id);
    }

    /**
     * Opens a streaming transcript for one conversation.
     */
    public ChatConversation conversation(String sessionKey, StreamHandler handler) {
        return new ChatConversation(this, sessionKey, handler);
    }

    // ================================
    // Connection
    // ================================

    /**
     * Opens the socket and runs the authentication handshake. Returns once the state is
     * {@code CONNECTED}. Any live connection is torn down first.
     *
     * @throws ConnectionFailedException if the socket fails or no challenge arrives in time
     * @throws AuthenticationException   if the server rejects the connect request
     */
    public void connect() {
        synchronized (connectLock) {
            if (link != null) {
                disconnect();
            }

            AtomicBoolean challenged = new AtomicBoolean();
            dispatcher.addListenerFirst(CHALLENGE_LISTENER_ID, (event, payload) -> {
                if (CHALLENGE_EVENT.equals(event)) {
                    challenged.set(true);
                }
            });

            Link current = new Link();
            synchronized (stateLock) {
                link = current;
                setState(ConnectionState.CONNECTING);
            }

            try {
                Request request;
                try {
                    request = new Request.Builder().url(config.getUrl()).build();
                } catch (IllegalArgumentException e) {
                    throw new ConnectionFailedException("Invalid server URL: " + config.getUrl(), e);
                }
                logger.info("Connecting to {}", config.getUrl());
                current.socket = httpClient.newWebSocket(request, current);

                try {
                    awaitChallenge(current, challenged);
                } finally {
                    dispatcher.removeListener(CHALLENGE_LISTENER_ID);
                }
                authenticate(current);

                synchronized (stateLock) {
                    if (link != current || current.failure != null) {
                        throw new ConnectionFailedException(
                                current.failure != null ? current.failure : "Connection lost");
                    }
                    setState(ConnectionState.CONNECTED);
                }
                logger.info("Connected to {}", config.getUrl());
            } catch (GatewayException e) {
                dispatcher.removeListener(CHALLENGE_LISTENER_ID);
                abort(current, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Runs {@link #connect()} on the common pool.
     */
    public CompletableFuture<Void> connectAsync() {
        return CompletableFuture.runAsync(this::connect);
    }

    /**
     * Connects, retrying retryable failures with capped exponential backoff.
     * Authentication failures are never retried.
     */
    public void connectWithRetry() {
        int maxAttempts = config.getMaxReconnectAttempts();

        // If retries are disabled, just connect once
        if (maxAttempts < 0) {
            connect();
            return;
        }

        GatewayException lastException = null;

        for (int attempt = 0; attempt <= maxAttempts; attempt++) {
            try {
                if (attempt > 0) {
                    Thread.sleep(calculateBackoff(attempt));
                }
                connect();
                return;
            } catch (GatewayException e) {
                lastException = e;
                if (!e.isRetryable()) {
                    throw e;
                }
                logger.warn("Connect failed (attempt {}/{}): {}", attempt + 1, maxAttempts + 1, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionFailedException("Connect interrupted", e);
            }
        }

        throw new ConnectionFailedException("Max reconnect attempts exceeded: " + lastException.getMessage(),
                lastException);
    }

    /**
     * Reconnects unless already connected or connecting.
     *
     * @return true if a reconnect was performed
     */
    public boolean reconnectIfNeeded() {
        ConnectionState.Status status = state.getStatus();
        if (status == ConnectionState.Status.CONNECTED || status == ConnectionState.Status.CONNECTING) {
            return false;
        }
        connectWithRetry();
        return true;
    }

    /**
     * Closes the socket, fails every pending request with {@link NotConnectedException}
     * and moves to {@code DISCONNECTED}. Event listeners are kept.
     */
    public void disconnect() {
        Link current;
        synchronized (stateLock) {
            current = link;
            link = null;
            if (current != null) {
                current.cancelled = true;
            }
            setState(ConnectionState.DISCONNECTED);
        }
        if (current != null && current.socket != null) {
            current.socket.close(GOING_AWAY, "Client disconnect");
        }
        int cancelled = correlator.cancelAll(NotConnectedException::new);
        if (cancelled > 0) {
            logger.info("Disconnected with {} pending request(s) cancelled", cancelled);
        }
    }

    long calculateBackoff(int attempt) {
        long minDelay = config.getReconnectMinDelay().toMillis();
        long maxDelay = config.getReconnectMaxDelay().toMillis();
        long delay = minDelay * (1L << Math.min(attempt - 1, 30));
        return Math.min(delay, maxDelay);
    }

    // ================================
    // Requests
    // ================================

    /**
     * Sends a request and waits for its response using the configured request timeout.
     *
     * @throws NotConnectedException   if the handshake has not completed
     * @throws RequestTimeoutException if no response arrives in time
     */
    public ResponseFrame sendRequest(String method, Object params) {
        return sendRequest(method, params, config.getRequestTimeout());
    }

    public ResponseFrame sendRequest(String method, Object params, Duration timeout) {
        return await(sendRequestAsync(method, params, timeout));
    }

    public CompletableFuture<ResponseFrame> sendRequestAsync(String method, Object params) {
        return sendRequestAsync(method, params, config.getRequestTimeout());
    }

    /**
     * Sends a request without blocking. The future completes exactly once: with the
     * response, or exceptionally with a {@link GatewayException}.
     */
    public CompletableFuture<ResponseFrame> sendRequestAsync(String method, Object params, Duration timeout) {
        Link current = link;
        if (current == null || !state.isConnected()) {
            return CompletableFuture.failedFuture(new NotConnectedException());
        }
        return send(current, method, params, timeout);
    }

    /**
     * Sends a request and returns its payload; an absent payload yields an empty object.
     *
     * @throws ServerException if the server answered {@code ok=false}
     */
    public JsonNode sendRequestPayload(String method, Object params) {
        ResponseFrame response = sendRequest(method, params);
        if (!response.isOk()) {
            throw response.getError() != null
                    ? new ServerException(response.getError())
                    : new ServerException("Unknown error");
        }
        JsonNode payload = response.getPayload();
        return payload != null ? payload : objectMapper.createObjectNode();
    }

    /**
     * Sends a request and binds its payload to the given type.
     */
    public <T> T call(String method, Object params, Class<T> responseType) {
        JsonNode payload = sendRequestPayload(method, params);
        try {
            return objectMapper.treeToValue(payload, responseType);
        } catch (JsonProcessingException e) {
            throw new DecodingException("Cannot decode " + method + " payload: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T call(String method, Object params, TypeReference<T> responseType) {
        JsonNode payload = sendRequestPayload(method, params);
        try {
            return objectMapper.convertValue(payload, responseType);
        } catch (IllegalArgumentException e) {
            throw new DecodingException("Cannot decode " + method + " payload: " + e.getMessage(), e);
        }
    }

    // ================================
    // Internal Methods
    // ================================

    private CompletableFuture<ResponseFrame> send(Link target, String method, Object params, Duration timeout) {
        JsonNode tree = codec.toTree(params);
        return correlator.send(method, tree, timeout, frame -> write(target, frame));
    }

    private void write(Link target, RequestFrame frame) {
        String text = codec.encode(frame);
        WebSocket socket = target.socket;
        if (socket == null || target.cancelled || target.failure != null || !socket.send(text)) {
            throw new NotConnectedException();
        }
        logger.debug("Sent request {} ({})", frame.getId(), frame.getMethod());
    }

    private ResponseFrame await(CompletableFuture<ResponseFrame> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Request interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GatewayException) {
                throw (GatewayException) cause;
            }
            throw new GatewayException("Request failed: " + cause.getMessage(), cause);
        }
    }

    private void awaitChallenge(Link current, AtomicBoolean challenged) {
        long pollMillis = Math.max(1, config.getChallengePollInterval().toMillis());
        long deadline = System.nanoTime() + config.getChallengeTimeout().toNanos();
        while (!challenged.get()) {
            if (current.cancelled) {
                throw new ConnectionFailedException("Connection cancelled");
            }
            if (current.failure != null) {
                throw new ConnectionFailedException(current.failure);
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new ConnectionFailedException("Server did not send challenge");
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionFailedException("Connect interrupted", e);
            }
        }
        logger.debug("Received {}", CHALLENGE_EVENT);
    }

    private void authenticate(Link current) {
        ResponseFrame response;
        try {
            response = await(send(current, CONNECT_METHOD, connectParams(), config.getRequestTimeout()));
        } catch (RequestTimeoutException e) {
            throw new AuthenticationException("Authentication failed", e);
        } catch (NotConnectedException e) {
            throw new ConnectionFailedException(current.failure != null ? current.failure : "Connection lost", e);
        }

        if (!response.isOk()) {
            String message = response.getErrorMessage();
            throw new AuthenticationException(message != null ? message : "Authentication failed");
        }

        JsonNode payload = response.getPayload();
        String type = payload != null ? payload.path("type").asText(null) : null;
        if (!HELLO_OK.equals(type)) {
            throw new AuthenticationException("Unexpected response type: " + (type != null ? type : "nil"));
        }
    }

    ObjectNode connectParams() {
        ClientInfo client = config.getClientInfo();
        ObjectNode params = objectMapper.createObjectNode();
        params.put("minProtocol", config.getProtocolVersion());
        params.put("maxProtocol", config.getProtocolVersion());
        params.put("role", client.getRole());
        params.set("client", objectMapper.valueToTree(client));

        ObjectNode auth = params.putObject("auth");
        if (config.getToken() != null && !config.getToken().isEmpty()) {
            auth.put("token", config.getToken());
        } else if (config.getPassword() != null && !config.getPassword().isEmpty()) {
            auth.put("password", config.getPassword());
        }
        return params;
    }

    private void abort(Link current, String failure) {
        String reason = failure != null ? failure : "Connection failed";
        synchronized (stateLock) {
            boolean wasCurrent = link == current && !current.cancelled;
            if (link == current) {
                link = null;
            }
            current.cancelled = true;
            if (wasCurrent) {
                setState(ConnectionState.error(reason));
            }
        }
        if (current.socket != null) {
            current.socket.close(NORMAL_CLOSURE, null);
        }
        correlator.cancelAll(NotConnectedException::new);
        logger.warn("Connection to {} failed: {}", config.getUrl(), reason);
    }

    private void receive(InboundFrame frame) {
        try {
            switch (frame.getKind()) {
                case RESPONSE:
                    correlator.resolve(frame.getResponse());
                    break;
                case EVENT:
                    EventFrame event = frame.getEvent();
                    dispatcher.dispatch(event.getEvent(), event.getPayload());
                    break;
                default:
                    break;
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to handle inbound frame {}: {}", frame, e.getMessage(), e);
        }
    }

    private void connectionLost(Link source, String reason) {
        boolean wasConnected;
        synchronized (stateLock) {
            if (link != source || source.cancelled) {
                return;
            }
            wasConnected = state.isConnected();
            if (wasConnected) {
                link = null;
                setState(ConnectionState.error("Connection lost"));
            }
        }
        if (wasConnected) {
            logger.warn("Connection to {} lost: {}", config.getUrl(), reason);
        }
        // a handshake in progress sees the failure through its pending connect request
        correlator.cancelAll(NotConnectedException::new);
    }

    private void setState(ConnectionState newState) {
        ConnectionState previous = state;
        state = newState;
        if (previous.equals(newState)) {
            return;
        }
        logger.debug("Connection state {} -> {}", previous, newState);
        ConnectionStateListener listener = stateListener;
        if (listener != null) {
            try {
                listener.onStateChanged(newState);
            } catch (RuntimeException e) {
                logger.warn("Connection state listener failed: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        disconnect();
        correlator.close();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    /**
     * One socket generation. Callbacks from a generation that is no longer current are ignored.
     */
    private final class Link extends WebSocketListener {
        private volatile WebSocket socket;
        private volatile boolean cancelled;
        private volatile String failure;

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            logger.debug("Socket open ({})", response.code());
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            if (!cancelled) {
                receive(codec.decode(text));
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            if (!cancelled) {
                receive(codec.decode(bytes.utf8()));
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
            lost("Connection closed by server (" + code + ")");
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            lost("Connection closed (" + code + ")");
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            lost("Connection failed: " + (t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName()));
        }

        private void lost(String reason) {
            if (failure == null) {
                failure = reason;
            }
            connectionLost(this, reason);
        }
    }

    /**
     * Builder for creating GatewayClient instances.
     */
    public static class Builder {
        private final GatewayClientConfig.Builder configBuilder = GatewayClientConfig.builder();

        public Builder url(String url) {
            configBuilder.url(url);
            return this;
        }

        public Builder token(String token) {
            configBuilder.token(token);
            return this;
        }

        public Builder password(String password) {
            configBuilder.password(password);
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            configBuilder.requestTimeout(requestTimeout);
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            configBuilder.connectTimeout(connectTimeout);
            return this;
        }

        public Builder challengeTimeout(Duration challengeTimeout) {
            configBuilder.challengeTimeout(challengeTimeout);
            return this;
        }

        public Builder challengePollInterval(Duration challengePollInterval) {
            configBuilder.challengePollInterval(challengePollInterval);
            return this;
        }

        public Builder protocolVersion(int protocolVersion) {
            configBuilder.protocolVersion(protocolVersion);
            return this;
        }

        public Builder clientInfo(ClientInfo clientInfo) {
            configBuilder.clientInfo(clientInfo);
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            configBuilder.maxReconnectAttempts(maxReconnectAttempts);
            return this;
        }

        public Builder reconnectMinDelay(Duration reconnectMinDelay) {
            configBuilder.reconnectMinDelay(reconnectMinDelay);
            return this;
        }

        public Builder reconnectMaxDelay(Duration reconnectMaxDelay) {
            configBuilder.reconnectMaxDelay(reconnectMaxDelay);
            return this;
        }

        public Builder heartbeatPatterns(List<String> heartbeatPatterns) {
            configBuilder.heartbeatPatterns(heartbeatPatterns);
            return this;
        }

        public GatewayClient build() {
            return new GatewayClient(configBuilder.build());
        }
    }
}
