package com.redarm.processing;

import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Pulls messages from one Pub/Sub subscription per work queue
 * ({@code <queue>-sub}). Acks once the worker returns, including when it
 * drops a poison message; nacks when the worker throws.
 * Only loads when app.worker.pull.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "app.worker.pull.enabled", havingValue = "true", matchIfMissing = false)
public class PubSubQueueListener {

    private static final Logger logger = LoggerFactory.getLogger(PubSubQueueListener.class);

    private final QueueMessageDispatcher dispatcher;
    private final String projectId;
    private final List<Subscriber> subscribers = new ArrayList<>();

    public PubSubQueueListener(
            QueueMessageDispatcher dispatcher,
            @Value("${app.pubsub.project-id:#{T(java.lang.System).getenv('GOOGLE_CLOUD_PROJECT')}}") String projectId) {
        this.dispatcher = dispatcher;
        this.projectId = projectId != null && !projectId.isEmpty() ? projectId : "local-project";
    }

    @PostConstruct
    public void start() {
        for (String queue : dispatcher.queueNames()) {
            ProjectSubscriptionName subscription = ProjectSubscriptionName.of(projectId, subscriptionName(queue));
            Subscriber subscriber = Subscriber.newBuilder(subscription, receiverFor(queue)).build();
            subscriber.startAsync().awaitRunning();
            subscribers.add(subscriber);
            logger.info("Listening on Pub/Sub subscription {}", subscription);
        }
    }

    MessageReceiver receiverFor(String queue) {
        return (PubsubMessage message, AckReplyConsumer consumer) -> {
            try {
                dispatcher.dispatch(queue, message.getData().toStringUtf8());
                consumer.ack();
            } catch (Exception e) {
                logger.error("Failed to process message {} from queue {}, nacking", message.getMessageId(), queue, e);
                consumer.nack();
            }
        };
    }

    static String subscriptionName(String queue) {
        return queue + "-sub";
    }

    @PreDestroy
    public void shutdown() {
        for (Subscriber subscriber : subscribers) {
            try {
                subscriber.stopAsync().awaitTerminated(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                logger.warn("Pub/Sub subscriber did not stop cleanly", e);
            }
        }
        logger.info("Pub/Sub queue listener stopped");
    }
}
