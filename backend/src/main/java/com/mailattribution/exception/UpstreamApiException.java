package com.mailattribution.exception;

import java.time.Duration;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A failed call to the tracking network or the sending platform.
 *
 * <p>No status means the call never got an answer (timeout, connection reset) and counts as
 * transient.
 */
@Getter
public class UpstreamApiException extends RuntimeException {

    private final HttpStatus status;
    private final String upstream;
    private final String operation;

    public UpstreamApiException(String message) {
        this(message, null, null, null, null);
    }

    public UpstreamApiException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public UpstreamApiException(String message, HttpStatus status, String upstream, String operation) {
        this(message, status, upstream, operation, null);
    }

    private UpstreamApiException(
            String message, HttpStatus status, String upstream, String operation, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.upstream = upstream;
        this.operation = operation;
    }

    public static UpstreamApiException timedOut(
            String upstream, String operation, Duration timeout, Throwable cause) {
        return new UpstreamApiException(
                upstream + " " + operation + " timed out after " + timeout, null, upstream, operation, cause);
    }

    /** Throttling, request timeouts, 5xx and unanswered calls; any other 4xx is final. */
    public boolean isRetryable() {
        if (status == null) {
            return true;
        }
        if (status == HttpStatus.TOO_MANY_REQUESTS || status == HttpStatus.REQUEST_TIMEOUT) {
            return true;
        }
        return status.is5xxServerError();
    }
}
