package com.example.investigator.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps whatever a model client threw onto a {@link FailureKind}. Walks the cause chain because
 * Spring AI and the HTTP layer wrap the interesting exception several levels deep.
 */
public final class ReasoningFailureClassifier {

    private static final int TOO_MANY_REQUESTS = 429;

    private ReasoningFailureClassifier() {}

    public static FailureKind classify(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof RestClientResponseException http) {
                int status = http.getStatusCode().value();
                if (status == TOO_MANY_REQUESTS) {
                    return FailureKind.RATE_LIMITED;
                }
                return http.getStatusCode().is5xxServerError()
                        ? FailureKind.TRANSIENT
                        : FailureKind.UNAVAILABLE;
            }
            // Spring AI's response error handler reports "<status> - <body>"
            if (t instanceof NonTransientAiException || t instanceof TransientAiException) {
                if (startsWithStatus(t.getMessage(), TOO_MANY_REQUESTS)) {
                    return FailureKind.RATE_LIMITED;
                }
                return t instanceof TransientAiException
                        ? FailureKind.TRANSIENT
                        : FailureKind.UNAVAILABLE;
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return FailureKind.UNAVAILABLE;
            }
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return FailureKind.TRANSIENT;
            }
            if (t instanceof JsonProcessingException) {
                return FailureKind.TRANSIENT;
            }
        }
        return FailureKind.UNAVAILABLE;
    }

    private static boolean startsWithStatus(String message, int status) {
        return message != null && message.trim().startsWith(Integer.toString(status));
    }
}
