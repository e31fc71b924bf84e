package io.rota4j.failure;

/**
 * Thrown by a worker when retrying cannot help: invalid input, missing template, rejected credentials.
 * The job is discarded after the current attempt.
 */
public class PermanentJobException extends RuntimeException {

    public PermanentJobException(String message) {
        super(message);
    }

    public PermanentJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
