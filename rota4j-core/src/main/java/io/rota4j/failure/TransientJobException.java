package io.rota4j.failure;

/**
 * Thrown by a worker to request a retry regardless of the message content.
 */
public class TransientJobException extends RuntimeException {

    public TransientJobException(String message) {
        super(message);
    }

    public TransientJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
