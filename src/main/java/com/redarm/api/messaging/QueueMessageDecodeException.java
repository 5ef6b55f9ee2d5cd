package com.redarm.api.messaging;

/**
 * Thrown when a queue message cannot be turned into a task envelope.
 */
public class QueueMessageDecodeException extends RuntimeException {

    public QueueMessageDecodeException(String message) {
        super(message);
    }

    public QueueMessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
