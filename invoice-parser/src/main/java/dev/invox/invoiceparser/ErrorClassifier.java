package dev.invox.invoiceparser;

import dev.invox.invoiceparser.googleai.GeminiApiException;
import dev.invox.invoiceparser.usage.DailyRateLimitExceededException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Decides whether an extraction error is worth retrying against another model.
 */
final class ErrorClassifier {

    static final int TOO_MANY_REQUESTS = 429;

    private ErrorClassifier() {
    }

    static FailureClassification classify(Throwable error) {
        if (error == null) {
            return FailureClassification.OTHER;
        }
        if (isRateLimitLike(error)) {
            return FailureClassification.RATE_LIMITED;
        }
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (current instanceof TimeoutException) {
                return FailureClassification.TIMED_OUT;
            }
        }
        return FailureClassification.OTHER;
    }

    static boolean isRateLimitLike(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (current instanceof DailyRateLimitExceededException) {
                return true;
            }
            if (current instanceof GeminiApiException apiException && apiException.getStatusCode() == TOO_MANY_REQUESTS) {
                return true;
            }
            if (current instanceof RestClientResponseException responseException
                && responseException.getStatusCode().value() == TOO_MANY_REQUESTS) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("rate limit") || lower.contains("quota")) {
                    return true;
                }
            }
        }
        return false;
    }

    static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
