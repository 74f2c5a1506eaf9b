package com.mailattribution.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;

/** Thrown when an upstream platform answers 429 */
public class RateLimitException extends UpstreamApiException {

    private final Duration retryAfter;

    public RateLimitException(String upstream, String operation) {
        this(upstream, operation, null);
    }

    public RateLimitException(String upstream, String operation, Duration retryAfter) {
        super(
                "Rate limited by " + upstream + " on " + operation,
                HttpStatus.TOO_MANY_REQUESTS,
                upstream,
                operation);
        this.retryAfter = retryAfter;
    }

    /** Server supplied Retry-After, or null */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
