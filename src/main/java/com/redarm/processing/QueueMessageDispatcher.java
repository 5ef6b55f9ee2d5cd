package com.redarm.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes delivered queue messages to the worker that owns the queue.
 */
@Component
public class QueueMessageDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(QueueMessageDispatcher.class);

    private final Map<String, JobWorker> workersByQueue;

    public QueueMessageDispatcher(List<JobWorker> workers) {
        Map<String, JobWorker> byQueue = new HashMap<>();
        for (JobWorker worker : workers) {
            JobWorker previous = byQueue.put(worker.getQueueName(), worker);
            if (previous != null) {
                throw new IllegalStateException("Queue " + worker.getQueueName() + " has more than one worker");
            }
            logger.info("Registered {} worker for queue {}", worker.getJobType(), worker.getQueueName());
        }
        this.workersByQueue = Collections.unmodifiableMap(byQueue);
    }

    public Optional<JobWorker> workerFor(String queueName) {
        return Optional.ofNullable(workersByQueue.get(queueName));
    }

    public Iterable<String> queueNames() {
        return workersByQueue.keySet();
    }

    /**
     * @throws IllegalArgumentException if no worker consumes the queue
     * @throws IOException if the worker failed; the job is already marked failed
     */
    public void dispatch(String queueName, Object raw) throws IOException {
        JobWorker worker = workerFor(queueName)
                .orElseThrow(() -> new IllegalArgumentException("No worker registered for queue: " + queueName));
        worker.handle(raw);
    }
}
