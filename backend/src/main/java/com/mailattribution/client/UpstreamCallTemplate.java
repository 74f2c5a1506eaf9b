package com.mailattribution.client;

import com.mailattribution.exception.UpstreamApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs calls to one upstream platform through its circuit breaker and retry, each attempt bounded
 * by a per-call timeout.
 */
@Slf4j
public class UpstreamCallTemplate {

    private final String upstream;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final Duration callTimeout;
    private final Executor executor;

    public UpstreamCallTemplate(
            String upstream,
            CircuitBreaker circuitBreaker,
            Retry retry,
            Duration callTimeout,
            Executor executor) {
        this.upstream = upstream;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.callTimeout = callTimeout;
        this.executor = executor;
    }

    public <T> T call(String operation, Supplier<T> call) {
        return circuitBreaker.executeSupplier(
                () -> retry.executeSupplier(() -> withTimeout(operation, call)));
    }

    /** Single attempt under the timeout, bypassing retry; the caller handles failures itself. */
    public <T> T callOnce(String operation, Supplier<T> call) {
        return circuitBreaker.executeSupplier(() -> withTimeout(operation, call));
    }

    public void run(String operation, Runnable call) {
        call(
                operation,
                () -> {
                    call.run();
                    return null;
                });
    }

    /** A timed-out attempt is cancelled with an interrupt so the executor thread is freed. */
    private <T> T withTimeout(String operation, Supplier<T> call) {
        FutureTask<T> task = new FutureTask<>(call::get);
        executor.execute(task);
        try {
            return task.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw UpstreamApiException.timedOut(upstream, operation, callTimeout, e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled =
                    new CancellationException(upstream + " " + operation + " interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new UpstreamApiException(upstream + " " + operation + " failed", cause);
        }
    }

    public String getUpstream() {
        return upstream;
    }
}
