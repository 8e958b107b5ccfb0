package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.domain.backend.BackendException;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Default classification of transient backend failures.
 *
 * Retryable when any of the following holds for the error or one of its causes:
 * - the message mentions timeout, connection or network
 * - a {@link BackendException} carries status 429 or {@code >= 500}
 * - a {@link BackendException} carries a transient provider error category
 * - it is a {@link TimeoutException} or an {@link IOException}
 *
 * A {@link CircuitOpenException} is never retried.
 */
public final class DefaultRetryableErrors implements Predicate<Throwable> {

    public static final DefaultRetryableErrors INSTANCE = new DefaultRetryableErrors();

    private static final Pattern TRANSIENT_MESSAGE =
            Pattern.compile("timeout|connection|network", Pattern.CASE_INSENSITIVE);

    private static final Set<String> TRANSIENT_CATEGORIES =
            Set.of("server_error", "rate_limit_exceeded", "service_unavailable");

    private DefaultRetryableErrors() {
    }

    @Override
    public boolean test(Throwable error) {
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (current instanceof CircuitOpenException) {
                return false;
            }
            if (isTransient(current)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTransient(Throwable error) {
        if (error instanceof TimeoutException || error instanceof IOException) {
            return true;
        }
        if (error.getMessage() != null && TRANSIENT_MESSAGE.matcher(error.getMessage()).find()) {
            return true;
        }
        if (error instanceof BackendException backendError) {
            int status = backendError.getStatusCode();
            if (status == 429 || status >= 500) {
                return true;
            }
            String category = backendError.getErrorCategory();
            return category != null && TRANSIENT_CATEGORIES.contains(category);
        }
        return false;
    }

    private static Throwable nextCause(Throwable error) {
        Throwable cause = error.getCause();
        return cause != error ? cause : null;
    }
}
