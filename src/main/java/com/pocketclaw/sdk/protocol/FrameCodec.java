package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pocketclaw.sdk.exceptions.DecodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Encodes request frames and decodes inbound response/event frames.
 *
 * <p>Decoding first reads only the {@code type} discriminator, then binds the full
 * frame for {@code res} and {@code event}. Anything else, and any failure at either
 * stage, yields {@link InboundFrame#unknown()}; {@link #decode(String)} never throws.</p>
 */
public class FrameCodec {

    private static final Logger logger = LoggerFactory.getLogger(FrameCodec.class);

    private final ObjectMapper objectMapper;

    public FrameCodec() {
        this(defaultObjectMapper());
    }

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the mapper shared by the codec and the client.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Serializes a request frame to its JSON text form.
     */
    public String encode(RequestFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new DecodingException("Failed to encode request " + frame.getMethod() + ": " + e.getMessage(), e);
        }
    }

    public InboundFrame decode(byte[] data) {
        return decode(new String(data, StandardCharsets.UTF_8));
    }

    public InboundFrame decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unparseable frame: {}", e.getOriginalMessage());
            return InboundFrame.unknown();
        }
        if (root == null || !root.isObject()) {
            return InboundFrame.unknown();
        }

        JsonNode type = root.get("type");
        if (type == null || !type.isTextual()) {
            return InboundFrame.unknown();
        }

        try {
            switch (type.asText()) {
                case ResponseFrame.TYPE:
                    return InboundFrame.response(objectMapper.treeToValue(root, ResponseFrame.class));
                case EventFrame.TYPE:
                    return InboundFrame.event(objectMapper.treeToValue(root, EventFrame.class));
                default:
                    logger.debug("Ignoring frame of type {}", type.asText());
                    return InboundFrame.unknown();
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Dropping malformed {} frame: {}", type.asText(), e.getMessage());
            return InboundFrame.unknown();
        }
    }

    /**
     * Converts an arbitrary params object (map, POJO, or node) into a JSON tree.
     */
    public JsonNode toTree(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new DecodingException("Cannot convert params to JSON: " + e.getMessage(), e);
        }
    }
}
