package com.redarm.api.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Encodes task envelopes as base64(JSON) and decodes whatever shape the
 * transport delivers: an already parsed envelope, base64 JSON, or plain JSON.
 */
@Component
public class QueueCodec {

    private final ObjectMapper objectMapper;

    public QueueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(JobTaskMessage message) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(message);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize queue message", e);
        }
    }

    /**
     * @throws QueueMessageDecodeException if the input is neither an envelope nor JSON text
     */
    public JobTaskMessage decode(Object raw) {
        if (raw == null) {
            throw new QueueMessageDecodeException("Queue message is empty");
        }
        if (raw instanceof JobTaskMessage) {
            return (JobTaskMessage) raw;
        }
        if (raw instanceof Map || raw instanceof JsonNode) {
            try {
                return objectMapper.convertValue(raw, JobTaskMessage.class);
            } catch (IllegalArgumentException e) {
                throw new QueueMessageDecodeException("Queue message is not a task envelope", e);
            }
        }
        if (raw instanceof byte[]) {
            return decodeText(new String((byte[]) raw, StandardCharsets.UTF_8));
        }
        if (raw instanceof String) {
            return decodeText((String) raw);
        }
        throw new QueueMessageDecodeException("Unsupported queue message type: " + raw.getClass().getSimpleName());
    }

    private JobTaskMessage decodeText(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new QueueMessageDecodeException("Queue message is empty");
        }
        JobTaskMessage fromBase64 = tryBase64(trimmed);
        if (fromBase64 != null) {
            return fromBase64;
        }
        JobTaskMessage fromJson = tryJson(trimmed);
        if (fromJson != null) {
            return fromJson;
        }
        throw new QueueMessageDecodeException("Queue message is neither base64 JSON nor JSON");
    }

    private JobTaskMessage tryBase64(String text) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            return null;
        }
        return tryJson(new String(decoded, StandardCharsets.UTF_8));
    }

    private JobTaskMessage tryJson(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || !node.isObject()) {
                return null;
            }
            return objectMapper.treeToValue(node, JobTaskMessage.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
