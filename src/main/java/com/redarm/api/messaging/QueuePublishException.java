package com.redarm.api.messaging;

/**
 * Thrown when a message could not be handed to the queue transport.
 */
public class QueuePublishException extends RuntimeException {

    public QueuePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
