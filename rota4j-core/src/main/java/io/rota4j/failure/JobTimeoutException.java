package io.rota4j.failure;

import java.time.Duration;

/**
 * Raised by the runner when a worker exceeds its deadline.
 */
public class JobTimeoutException extends TransientJobException {

    public JobTimeoutException(String kind, Duration timeout) {
        super("job timeout: kind=" + kind + " exceeded " + timeout);
    }
}
