package com.pocketclaw.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketclaw.sdk.exceptions.ServerException;
import com.pocketclaw.sdk.models.Message;
import com.pocketclaw.sdk.models.MessageRole;
import com.pocketclaw.sdk.streaming.StreamHandler;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChatConversationTest {

    private static final String SESSION = "agent:main:main";

    private MockWebServer mockServer;
    private FakeGateway gateway;
    private GatewayClient client;
    private LatchHandler handler;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        gateway = new FakeGateway();
        mockServer.enqueue(gateway.upgrade());
        client = GatewayClient.builder()
                .url(mockServer.url("/").toString().replaceFirst("^http", "ws"))
                .token("secret")
                .challengePollInterval(Duration.ofMillis(20))
                .requestTimeout(Duration.ofMillis(300))
                .maxReconnectAttempts(-1)
                .build();
        client.connect();
        handler = new LatchHandler();
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        gateway.shutdown();
        mockServer.shutdown();
    }

    @Test
    void testLoadHistoryFiltersHeartbeatsAndEmptyMessages() throws Exception {
        gateway.respond("chat.history", request -> gateway.ok(request, "{\"messages\":[" +
                "{\"id\":\"1\",\"role\":\"user\",\"content\":\"What time is it?\"}," +
                "{\"id\":\"2\",\"role\":\"assistant\",\"content\":\"HEARTBEAT_OK\"}," +
                "{\"id\":\"3\",\"role\":\"assistant\",\"content\":[{\"type\":\"thinking\",\"thinking\":\"clock\"}," +
                "{\"type\":\"text\",\"text\":\"Noon.\"}]}," +
                "{\"id\":\"4\",\"role\":\"assistant\",\"content\":\"\"}]}"));
        ChatConversation chat = client.conversation(SESSION, handler);

        List<Message> messages = chat.loadHistory(50);

        assertEquals(2, messages.size());
        assertEquals(MessageRole.USER, messages.get(0).getRole());
        assertEquals("Noon.", messages.get(1).getContent());
        assertEquals("clock", messages.get(1).getReasoning());
        assertEquals(messages, chat.getMessages());

        JsonNode params = gateway.takeRequest("chat.history").get("params");
        assertEquals(SESSION, params.get("sessionKey").asText());
        assertEquals(50, params.get("limit").asInt());
    }

    @Test
    void testLoadHistoryAcceptsTopLevelArray() {
        gateway.respond("chat.history", request -> gateway.ok(request,
                "[{\"message\":{\"id\":\"a\",\"role\":\"user\",\"content\":\"hi\"}},\"junk\"]"));
        ChatConversation chat = client.conversation(SESSION, handler);

        List<Message> messages = chat.loadHistory();

        assertEquals(1, messages.size());
        assertEquals("a", messages.get(0).getId());
    }

    @Test
    void testSendTimeoutIsNotFatal() throws Exception {
        ChatConversation chat = client.conversation(SESSION, handler);

        Message sent = chat.send("Hello?");

        assertEquals(MessageRole.USER, sent.getRole());
        assertTrue(chat.isStreaming());
        JsonNode params = gateway.takeRequest("chat.send").get("params");
        assertEquals(SESSION, params.get("sessionKey").asText());
        assertEquals("Hello?", params.get("message").asText());
        assertFalse(params.get("idempotencyKey").asText().isEmpty());

        gateway.sendEvent("chat", "{\"sessionKey\":\"" + SESSION + "\",\"state\":\"delta\",\"delta\":\"Hi \"}");
        gateway.sendEvent("chat", "{\"sessionKey\":\"" + SESSION + "\",\"state\":\"delta\",\"delta\":\"there\"}");
        gateway.sendEvent("chat", "{\"sessionKey\":\"" + SESSION + "\",\"state\":\"final\",\"runId\":\"run-1\"," +
                "\"message\":{\"role\":\"assistant\",\"content\":\"Hi there\"}}");

        assertTrue(handler.turnEnded.await(5, TimeUnit.SECONDS));
        List<Message> messages = chat.getMessages();
        assertEquals(2, messages.size());
        assertEquals(sent, messages.get(0));
        assertEquals("Hi there", messages.get(1).getContent());
        assertEquals("run-1", messages.get(1).getId());
        assertFalse(chat.isStreaming());
    }

    @Test
    void testSendRejectedByServer() {
        gateway.respond("chat.send", request -> gateway.error(request, "BUSY", "agent is busy"));
        ChatConversation chat = client.conversation(SESSION, handler);

        ServerException e = assertThrows(ServerException.class, () -> chat.send("Hello?"));

        assertEquals("agent is busy", e.getMessage());
        assertFalse(chat.isStreaming());
        assertEquals(1, chat.getMessages().size());
    }

    @Test
    void testStreamingErrorAppendsSystemMessage() throws Exception {
        gateway.respond("chat.send", request -> gateway.ok(request, "{\"runId\":\"run-2\"}"));
        ChatConversation chat = client.conversation(SESSION, handler);
        chat.send("Hello?");

        gateway.sendEvent("chat", "{\"sessionKey\":\"" + SESSION + "\",\"state\":\"delta\",\"delta\":\"Work\"}");
        gateway.sendEvent("chat", "{\"sessionKey\":\"" + SESSION + "\",\"state\":\"error\"," +
                "\"errorMessage\":\"model overloaded\"}");

        assertTrue(handler.turnEnded.await(5, TimeUnit.SECONDS));
        List<Message> messages = chat.getMessages();
        assertEquals(3, messages.size());
        assertEquals("Work", messages.get(1).getContent());
        assertEquals(MessageRole.SYSTEM, messages.get(2).getRole());
        assertEquals("model overloaded", messages.get(2).getContent());
    }

    @Test
    void testAbortKeepsDraft() throws Exception {
        gateway.respond("chat.send", request -> gateway.ok(request, "{}"));
        gateway.respond("chat.abort", request -> gateway.ok(request, "{\"aborted\":true}"));
        ChatConversation chat = client.conversation(SESSION, handler);
        chat.send("Write a long essay");

        gateway.sendEvent("agent", "{\"sessionKey\":\"" + SESSION + "\",\"stream\":\"assistant\"," +
                "\"data\":{\"delta\":\"Once upon\"}}");
        assertTrue(handler.drafted.await(5, TimeUnit.SECONDS));

        chat.abort();

        assertFalse(chat.isStreaming());
        List<Message> messages = chat.getMessages();
        assertEquals(2, messages.size());
        assertEquals("Once upon", messages.get(1).getContent());
        assertEquals(SESSION, gateway.takeRequest("chat.abort").get("params").get("sessionKey").asText());
    }

    @Test
    void testSendKeepsReplyWhoseTurnNeverEnded() throws Exception {
        gateway.respond("chat.send", request -> gateway.ok(request, "{}"));
        CountDownLatch drafted = new CountDownLatch(1);
        CountDownLatch finals = new CountDownLatch(2);
        ChatConversation chat = client.conversation(SESSION, new StreamHandler() {
            @Override
            public void onDraft(Message draft) {
                drafted.countDown();
            }

            @Override
            public void onFinal(Message message) {
                finals.countDown();
            }
        });

        chat.send("first");
        gateway.sendEvent("agent", "{\"sessionKey\":\"" + SESSION + "\",\"runId\":\"run-1\"," +
                "\"stream\":\"assistant\",\"data\":{\"delta\":\"one\"}}");
        assertTrue(drafted.await(5, TimeUnit.SECONDS));

        chat.send("second");
        gateway.sendEvent("agent", "{\"sessionKey\":\"" + SESSION + "\",\"runId\":\"run-2\"," +
                "\"stream\":\"assistant\",\"data\":{\"delta\":\"three\"}}");
        gateway.sendEvent("chat", "{\"sessionKey\":\"" + SESSION + "\",\"state\":\"final\",\"runId\":\"run-2\"}");
        assertTrue(finals.await(5, TimeUnit.SECONDS));

        List<Message> messages = chat.getMessages();
        assertEquals(4, messages.size());
        assertEquals("first", messages.get(0).getContent());
        assertEquals("one", messages.get(1).getContent());
        assertEquals("second", messages.get(2).getContent());
        assertEquals("three", messages.get(3).getContent());
        assertFalse(chat.isStreaming());
    }

    @Test
    void testCloseStopsListening() throws Exception {
        ChatConversation chat = client.conversation(SESSION, handler);
        chat.close();

        CountDownLatch seen = new CountDownLatch(1);
        client.addEventListener("observer", (event, payload) -> seen.countDown());
        gateway.sendEvent("chat", "{\"sessionKey\":\"" + SESSION + "\",\"state\":\"delta\",\"delta\":\"x\"}");

        assertTrue(seen.await(5, TimeUnit.SECONDS));
        assertTrue(chat.getMessages().isEmpty());
    }

    private static class LatchHandler implements StreamHandler {
        final CountDownLatch drafted = new CountDownLatch(1);
        final CountDownLatch turnEnded = new CountDownLatch(1);

        @Override
        public void onDraft(Message draft) {
            drafted.countDown();
        }

        @Override
        public void onTurnEnd() {
            turnEnded.countDown();
        }
    }
}
