package io.rota4j.failure;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Default failure policy.
 *
 * <p>Order of evaluation, walking the whole cause chain:
 * <ol>
 *   <li>explicit {@link PermanentJobException} / {@link TransientJobException} win</li>
 *   <li>well-known network exception types are transient</li>
 *   <li>messages containing a transient marker (timeout, connection, rate limit, ...) are transient</li>
 *   <li>messages containing a permanent marker (invalid, not found, template, ...) are permanent</li>
 *   <li>anything else is transient, so ambiguous failures are retried rather than dropped</li>
 * </ol>
 */
public class KeywordFailureClassifier implements FailureClassifier {

    public static final List<String> DEFAULT_TRANSIENT_MARKERS = List.of(
            "timeout",
            "timed out",
            "connection",
            "rate limit",
            "throttl",
            "temporary",
            "temporarily",
            "unavailable",
            "network",
            "dial",
            "refused"
    );

    public static final List<String> DEFAULT_PERMANENT_MARKERS = List.of(
            "invalid",
            "not found",
            "template",
            "malformed",
            "bounce",
            "complaint",
            "suppression",
            "authentication failed",
            "bad credentials",
            "unauthorized",
            "forbidden"
    );

    private final List<String> transientMarkers;
    private final List<String> permanentMarkers;

    public KeywordFailureClassifier() {
        this(DEFAULT_TRANSIENT_MARKERS, DEFAULT_PERMANENT_MARKERS);
    }

    public KeywordFailureClassifier(List<String> transientMarkers, List<String> permanentMarkers) {
        this.transientMarkers = List.copyOf(Objects.requireNonNull(transientMarkers, "transientMarkers must not be null"));
        this.permanentMarkers = List.copyOf(Objects.requireNonNull(permanentMarkers, "permanentMarkers must not be null"));
    }

    @Override
    public FailureKind classify(Throwable error) {
        if (error == null) {
            return FailureKind.TRANSIENT;
        }

        StringBuilder messages = new StringBuilder();
        int depth = 0;
        for (Throwable cur = error; cur != null && depth < 16; cur = cur.getCause(), depth++) {
            if (cur instanceof PermanentJobException) {
                return FailureKind.PERMANENT;
            }
            if (cur instanceof TransientJobException) {
                return FailureKind.TRANSIENT;
            }
            if (cur instanceof SocketTimeoutException
                    || cur instanceof ConnectException
                    || cur instanceof TimeoutException
                    || cur instanceof InterruptedIOException) {
                return FailureKind.TRANSIENT;
            }
            if (cur.getMessage() != null) {
                messages.append(cur.getMessage()).append('\n');
            }
        }

        String text = messages.toString().toLowerCase(Locale.ROOT);
        if (containsAny(text, transientMarkers)) {
            return FailureKind.TRANSIENT;
        }
        if (containsAny(text, permanentMarkers)) {
            return FailureKind.PERMANENT;
        }
        return FailureKind.TRANSIENT;
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
