package com.redarm.api.messaging;

/**
 * Producer side of the work queues. Implementations may publish to Pub/Sub
 * or dispatch in-process for local development.
 */
public interface QueueTransport {

    /**
     * Sends an already encoded message to the named queue.
     *
     * @param queueName queue (topic) name
     * @param payload   message produced by {@link QueueCodec#encode}
     * @throws QueuePublishException if the transport did not accept the message
     */
    void sendQueueMessage(String queueName, String payload);
}
