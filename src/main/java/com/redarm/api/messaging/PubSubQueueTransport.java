package com.redarm.api.messaging;

import com.google.api.core.ApiFuture;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Publishes queue messages to Google Cloud Pub/Sub, one topic per queue.
 * Supports both real Pub/Sub and local emulator (via PUBSUB_EMULATOR_HOST).
 * Only loads when app.messaging.mode=pubsub.
 */
@Service
@ConditionalOnProperty(name = "app.messaging.mode", havingValue = "pubsub")
public class PubSubQueueTransport implements QueueTransport {

    private static final Logger logger = LoggerFactory.getLogger(PubSubQueueTransport.class);

    private final String projectId;
    private final Map<String, Publisher> publishers = new ConcurrentHashMap<>();

    public PubSubQueueTransport(
            @Value("${app.pubsub.project-id:#{T(java.lang.System).getenv('GOOGLE_CLOUD_PROJECT')}}") String projectId) {
        this.projectId = projectId != null && !projectId.isEmpty() ? projectId : "local-project";

        String emulatorHost = System.getenv("PUBSUB_EMULATOR_HOST");
        if (emulatorHost != null && !emulatorHost.isEmpty()) {
            logger.info("Using Pub/Sub emulator at: {}", emulatorHost);
        } else {
            logger.info("Using real Pub/Sub (Application Default Credentials or service account)");
        }
    }

    @Override
    public void sendQueueMessage(String queueName, String payload) {
        PubsubMessage message = PubsubMessage.newBuilder()
                .setData(ByteString.copyFromUtf8(payload))
                .putAttributes("queue", queueName)
                .build();

        try {
            ApiFuture<String> future = publisherFor(queueName).publish(message);
            String messageId = future.get(10, TimeUnit.SECONDS);
            logger.info("Published message {} to topic {}", messageId, queueName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueuePublishException("Interrupted while publishing to " + queueName, e);
        } catch (Exception e) {
            logger.error("Failed to publish message to topic {}", queueName, e);
            throw new QueuePublishException("Failed to publish message to " + queueName, e);
        }
    }

    private Publisher publisherFor(String queueName) {
        return publishers.computeIfAbsent(queueName, name -> {
            try {
                // Publisher picks up PUBSUB_EMULATOR_HOST if set
                Publisher publisher = Publisher.newBuilder(TopicName.of(projectId, name)).build();
                logger.info("Pub/Sub publisher initialized for topic: projects/{}/topics/{}", projectId, name);
                return publisher;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        publishers.forEach((name, publisher) -> {
            try {
                publisher.shutdown();
                publisher.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while shutting down publisher for {}", name);
            }
        });
        logger.info("Pub/Sub publishers shut down");
    }
}
