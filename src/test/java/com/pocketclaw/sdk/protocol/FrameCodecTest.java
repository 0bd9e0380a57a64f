package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FrameCodecTest {

    private FrameCodec codec;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        codec = new FrameCodec();
        objectMapper = codec.getObjectMapper();
    }

    @Test
    void testEncodeRequestWithParams() throws Exception {
        JsonNode params = codec.toTree(Map.of("sessionKey", "agent:main:main"));

        String json = codec.encode(new RequestFrame("7", "chat.history", params));
        JsonNode tree = objectMapper.readTree(json);

        assertEquals("req", tree.get("type").asText());
        assertEquals("7", tree.get("id").asText());
        assertEquals("chat.history", tree.get("method").asText());
        assertEquals("agent:main:main", tree.get("params").get("sessionKey").asText());
    }

    @Test
    void testEncodeOmitsEmptyParams() throws Exception {
        assertFalse(objectMapper.readTree(codec.encode(new RequestFrame("1", "health"))).has("params"));
        assertFalse(objectMapper.readTree(codec.encode(
                new RequestFrame("2", "health", objectMapper.createObjectNode()))).has("params"));
        assertFalse(objectMapper.readTree(codec.encode(
                new RequestFrame("3", "health", codec.toTree(List.of())))).has("params"));
        assertFalse(objectMapper.readTree(codec.encode(
                new RequestFrame("4", "health", objectMapper.nullNode()))).has("params"));
    }

    @Test
    void testEncodeKeepsArrayParams() throws Exception {
        JsonNode tree = objectMapper.readTree(codec.encode(
                new RequestFrame("5", "batch", codec.toTree(List.of(1, 2)))));

        assertTrue(tree.get("params").isArray());
        assertEquals(2, tree.get("params").size());
    }

    @Test
    void testDecodeSuccessResponse() {
        InboundFrame frame = codec.decode("{\"type\":\"res\",\"id\":\"3\",\"ok\":true,\"payload\":{\"type\":\"hello-ok\"}}");

        assertEquals(InboundFrame.Kind.RESPONSE, frame.getKind());
        ResponseFrame response = frame.getResponse();
        assertEquals("3", response.getId());
        assertTrue(response.isOk());
        assertEquals("hello-ok", response.getPayload().get("type").asText());
        assertNull(response.getError());
    }

    @Test
    void testDecodeErrorResponse() {
        InboundFrame frame = codec.decode("{\"type\":\"res\",\"id\":\"4\",\"ok\":false," +
                "\"error\":{\"code\":\"UNAUTHORIZED\",\"message\":\"bad token\",\"details\":{\"hint\":\"rotate\"}}}");

        ResponseFrame response = frame.getResponse();
        assertFalse(response.isOk());
        assertNull(response.getPayload());
        assertEquals("UNAUTHORIZED", response.getError().getCode());
        assertEquals("bad token", response.getErrorMessage());
        assertEquals("rotate", response.getError().getDetails().get("hint").asText());
    }

    @Test
    void testDecodeNullPayloadIsAbsent() {
        InboundFrame frame = codec.decode("{\"type\":\"res\",\"id\":\"9\",\"ok\":true,\"payload\":null}");

        assertEquals(InboundFrame.Kind.RESPONSE, frame.getKind());
        assertNull(frame.getResponse().getPayload());
    }

    @Test
    void testDecodeEvent() {
        InboundFrame frame = codec.decode(
                "{\"type\":\"event\",\"event\":\"chat\",\"payload\":{\"state\":\"delta\",\"delta\":\"Hi\"},\"seq\":12}");

        assertEquals(InboundFrame.Kind.EVENT, frame.getKind());
        assertEquals("chat", frame.getEvent().getEvent());
        assertEquals("Hi", frame.getEvent().getPayload().get("delta").asText());
    }

    @Test
    void testDecodeBinaryAsUtf8() {
        byte[] data = "{\"type\":\"event\",\"event\":\"tick\"}".getBytes(StandardCharsets.UTF_8);

        InboundFrame frame = codec.decode(data);

        assertEquals(InboundFrame.Kind.EVENT, frame.getKind());
        assertEquals("tick", frame.getEvent().getEvent());
    }

    @Test
    void testDecodeUnknownFrames() {
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("{\"type\":\"ping\"}").getKind());
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("{\"id\":\"1\",\"ok\":true}").getKind());
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("{\"type\":42}").getKind());
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("[1,2,3]").getKind());
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("not json").getKind());
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("").getKind());
    }

    @Test
    void testDecodeMalformedKnownFrames() {
        // response without id, event without name
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("{\"type\":\"res\",\"ok\":true}").getKind());
        assertEquals(InboundFrame.Kind.UNKNOWN, codec.decode("{\"type\":\"event\",\"payload\":{}}").getKind());
    }
}
