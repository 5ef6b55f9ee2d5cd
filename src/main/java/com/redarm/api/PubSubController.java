package com.redarm.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redarm.processing.JobWorker;
import com.redarm.processing.QueueMessageDispatcher;
import com.redarm.shared.error.AuthException;
import com.redarm.shared.error.NotFoundException;
import io.swagger.v3.oas.annotations.Hidden;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Receives Pub/Sub push deliveries and hands the message to the queue's
 * worker.
 *
 * 204 tells Pub/Sub the message is done, which includes dropped poison
 * messages. A worker error propagates as 500 so Pub/Sub redelivers.
 */
@RestController
@RequestMapping("/internal/pubsub")
@Hidden
public class PubSubController {

    private static final Logger logger = LoggerFactory.getLogger(PubSubController.class);

    private final PubSubTokenVerifier tokenVerifier;
    private final QueueMessageDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public PubSubController(PubSubTokenVerifier tokenVerifier, QueueMessageDispatcher dispatcher,
                            ObjectMapper objectMapper) {
        this.tokenVerifier = tokenVerifier;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/{queue}")
    public ResponseEntity<Void> handlePush(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("queue") String queue,
            @RequestBody(required = false) String envelope) throws IOException {
        if (!tokenVerifier.verifyToken(authorization)) {
            throw AuthException.unauthenticated("Invalid push token");
        }
        JobWorker worker = dispatcher.workerFor(queue)
                .orElseThrow(() -> new NotFoundException("Unknown queue"));

        worker.handle(messageData(envelope));
        return ResponseEntity.noContent().build();
    }

    /**
     * Extracts message.data from the push envelope. Anything that is not a
     * well-formed envelope yields the raw text, which the worker drops as
     * poison if it cannot decode it.
     */
    String messageData(String envelope) {
        if (envelope == null || envelope.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(envelope);
            JsonNode message = root.path("message");
            String messageId = message.path("messageId").asText("");
            String data = message.path("data").asText("");
            logger.info("Received Pub/Sub push message {} ({} chars)", messageId, data.length());
            try {
                return new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                return data;
            }
        } catch (JsonProcessingException e) {
            logger.warn("Pub/Sub push body is not JSON: {}", e.getOriginalMessage());
            return envelope;
        }
    }
}
