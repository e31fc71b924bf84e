package io.rota4j.recurrence;

/**
 * The entity insert collided with an existing record's time range under an exclusion rule.
 */
public class OverlapConflictException extends Exception {

    public OverlapConflictException(String message) {
        super(message);
    }

    public OverlapConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
