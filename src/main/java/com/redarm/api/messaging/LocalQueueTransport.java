package com.redarm.api.messaging;

import com.redarm.processing.QueueMessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * In-process queue for local development: each message is handed to the
 * application task executor and dispatched to its worker. There is no
 * redelivery, so worker failures are only logged.
 * Only loads when app.messaging.mode=local (or when property is missing, as it's the default).
 */
@Service
@ConditionalOnProperty(name = "app.messaging.mode", havingValue = "local", matchIfMissing = true)
public class LocalQueueTransport implements QueueTransport {

    private static final Logger logger = LoggerFactory.getLogger(LocalQueueTransport.class);

    private final TaskExecutor taskExecutor;
    private final QueueMessageDispatcher dispatcher;

    public LocalQueueTransport(@Qualifier("applicationTaskExecutor") TaskExecutor taskExecutor,
                               QueueMessageDispatcher dispatcher) {
        this.taskExecutor = taskExecutor;
        this.dispatcher = dispatcher;
        logger.info("Using in-process queue transport");
    }

    @Override
    public void sendQueueMessage(String queueName, String payload) {
        if (dispatcher.workerFor(queueName).isEmpty()) {
            throw new QueuePublishException("No worker registered for queue: " + queueName, null);
        }
        String requestId = MDC.get("request_id");
        taskExecutor.execute(() -> {
            if (requestId != null) {
                MDC.put("request_id", requestId);
            }
            try {
                dispatcher.dispatch(queueName, payload);
            } catch (Exception e) {
                logger.error("Local worker failed for queue {}", queueName, e);
            } finally {
                MDC.remove("request_id");
            }
        });
        logger.debug("Queued local message on {}", queueName);
    }
}
