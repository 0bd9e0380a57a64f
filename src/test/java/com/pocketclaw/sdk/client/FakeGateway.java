package com.pocketclaw.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pocketclaw.sdk.protocol.FrameCodec;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Scripted gateway served through MockWebServer's WebSocket upgrade.
 * Replies to {@code connect} with hello-ok unless told otherwise; other methods are
 * answered only when a responder is registered.
 */
class FakeGateway extends WebSocketListener {

    final ObjectMapper objectMapper = FrameCodec.defaultObjectMapper();
    final BlockingQueue<JsonNode> requests = new LinkedBlockingQueue<>();

    private final Map<String, Function<JsonNode, String>> responders = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private volatile WebSocket socket;
    private volatile boolean sendChallenge = true;
    private volatile long challengeDelayMillis;

    FakeGateway() {
        respond("connect", request -> ok(request, "{\"type\":\"hello-ok\",\"protocol\":3}"));
    }

    MockResponse upgrade() {
        return new MockResponse().withWebSocketUpgrade(this);
    }

    FakeGateway withoutChallenge() {
        this.sendChallenge = false;
        return this;
    }

    FakeGateway challengeAfter(long delayMillis) {
        this.challengeDelayMillis = delayMillis;
        return this;
    }

    FakeGateway respond(String method, Function<JsonNode, String> responder) {
        responders.put(method, responder);
        return this;
    }

    /**
     * Takes the next request the client sent, skipping the handshake.
     */
    JsonNode takeRequest(String method) throws InterruptedException {
        while (true) {
            JsonNode request = requests.poll(5, TimeUnit.SECONDS);
            if (request == null) {
                throw new AssertionError("No " + method + " request received");
            }
            if (method.equals(request.path("method").asText())) {
                return request;
            }
        }
    }

    void sendEvent(String event, String payloadJson) {
        socket.send("{\"type\":\"event\",\"event\":\"" + event + "\",\"payload\":" + payloadJson + "}");
    }

    void sendRaw(String text) {
        socket.send(text);
    }

    void closeFromServer() {
        socket.close(1000, "bye");
    }

    void shutdown() {
        scheduler.shutdownNow();
    }

    String ok(JsonNode request, String payloadJson) {
        return "{\"type\":\"res\",\"id\":\"" + request.path("id").asText() + "\",\"ok\":true,\"payload\":"
                + payloadJson + "}";
    }

    String error(JsonNode request, String code, String message) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "res");
        frame.put("id", request.path("id").asText());
        frame.put("ok", false);
        ObjectNode error = frame.putObject("error");
        error.put("code", code);
        if (message != null) {
            error.put("message", message);
        }
        return frame.toString();
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
        this.socket = webSocket;
        if (!sendChallenge) {
            return;
        }
        String challenge = "{\"type\":\"event\",\"event\":\"connect.challenge\",\"payload\":{\"nonce\":\"n-1\",\"ts\":1}}";
        if (challengeDelayMillis > 0) {
            scheduler.schedule(() -> webSocket.send(challenge), challengeDelayMillis, TimeUnit.MILLISECONDS);
        } else {
            webSocket.send(challenge);
        }
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
        JsonNode request;
        try {
            request = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Client sent invalid JSON: " + text, e);
        }
        requests.add(request);
        Function<JsonNode, String> responder = responders.get(request.path("method").asText());
        if (responder != null) {
            String reply = responder.apply(request);
            if (reply != null) {
                webSocket.send(reply);
            }
        }
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
        webSocket.close(1000, null);
    }
}
