package io.rota4j.recurrence;

import io.rota4j.failure.PermanentJobException;

/**
 * The recurrence rule cannot be evaluated. Retrying will not help.
 */
public class RecurrenceRuleException extends PermanentJobException {

    public RecurrenceRuleException(String message) {
        super(message);
    }

    public RecurrenceRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
