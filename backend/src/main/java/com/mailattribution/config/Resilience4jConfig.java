package com.mailattribution.config;

import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.exception.UpstreamApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j configuration for the two upstream platforms.
 *
 * <p>Both retries use capped exponential backoff with jitter. Only transient failures are retried:
 * timeouts, 408, 429, 5xx and failures without an HTTP status.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String TRACKING_NETWORK = "tracking-network";
    public static final String SENDING_PLATFORM = "sending-platform";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();

        // Report endpoints are slow; only long calls count as slow
        CircuitBreakerConfig trackingConfig =
                CircuitBreakerConfig.custom()
                        .failureRateThreshold(50.0f)
                        .slowCallRateThreshold(80.0f)
                        .slowCallDurationThreshold(Duration.ofSeconds(90))
                        .waitDurationInOpenState(Duration.ofMinutes(1))
                        .minimumNumberOfCalls(5)
                        .slidingWindowSize(20)
                        .permittedNumberOfCallsInHalfOpenState(2)
                        .automaticTransitionFromOpenToHalfOpenEnabled(true)
                        .build();

        registry.circuitBreaker(TRACKING_NETWORK, trackingConfig);

        CircuitBreakerConfig sendingConfig =
                CircuitBreakerConfig.custom()
                        .failureRateThreshold(60.0f)
                        .slowCallRateThreshold(80.0f)
                        .slowCallDurationThreshold(Duration.ofSeconds(30))
                        .waitDurationInOpenState(Duration.ofSeconds(30))
                        .minimumNumberOfCalls(10)
                        .slidingWindowSize(30)
                        .permittedNumberOfCallsInHalfOpenState(3)
                        .automaticTransitionFromOpenToHalfOpenEnabled(true)
                        .ignoreExceptions(IllegalArgumentException.class)
                        .build();

        registry.circuitBreaker(SENDING_PLATFORM, sendingConfig);

        addCircuitBreakerEventListeners(registry);

        return registry;
    }

    @Bean
    public RetryRegistry retryRegistry(AppProperties appProperties) {
        AppProperties.Resilience resilience = appProperties.getResilience();
        RetryRegistry registry = RetryRegistry.ofDefaults();

        IntervalFunction backoff =
                IntervalFunction.ofExponentialRandomBackoff(
                        resilience.getInitialInterval(),
                        resilience.getMultiplier(),
                        resilience.getRandomizationFactor(),
                        resilience.getMaxInterval());

        RetryConfig upstreamRetryConfig =
                RetryConfig.custom()
                        .maxAttempts(resilience.getMaxAttempts())
                        .intervalFunction(backoff)
                        .retryOnException(Resilience4jConfig::isTransient)
                        .build();

        registry.retry(TRACKING_NETWORK, upstreamRetryConfig);
        registry.retry(SENDING_PLATFORM, upstreamRetryConfig);

        addRetryEventListeners(registry);

        return registry;
    }

    @Bean
    public CircuitBreaker trackingNetworkCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(TRACKING_NETWORK);
    }

    @Bean
    public CircuitBreaker sendingPlatformCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(SENDING_PLATFORM);
    }

    @Bean
    public Retry trackingNetworkRetry(RetryRegistry registry) {
        return registry.retry(TRACKING_NETWORK);
    }

    @Bean
    public Retry sendingPlatformRetry(RetryRegistry registry) {
        return registry.retry(SENDING_PLATFORM);
    }

    @Bean
    public UpstreamCallTemplate trackingNetworkCalls(
            @Qualifier("trackingNetworkCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("trackingNetworkRetry") Retry retry,
            @Qualifier("upstreamCallExecutor") Executor executor,
            AppProperties appProperties) {
        return new UpstreamCallTemplate(
                TRACKING_NETWORK,
                circuitBreaker,
                retry,
                appProperties.getTracking().getCallTimeout(),
                executor);
    }

    @Bean
    public UpstreamCallTemplate sendingPlatformCalls(
            @Qualifier("sendingPlatformCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("sendingPlatformRetry") Retry retry,
            @Qualifier("upstreamCallExecutor") Executor executor,
            AppProperties appProperties) {
        return new UpstreamCallTemplate(
                SENDING_PLATFORM,
                circuitBreaker,
                retry,
                appProperties.getSending().getCallTimeout(),
                executor);
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof UpstreamApiException) {
            return ((UpstreamApiException) throwable).isRetryable();
        }
        return throwable instanceof TimeoutException
                || throwable.getCause() instanceof TimeoutException
                || throwable instanceof java.io.IOException
                || throwable instanceof java.io.UncheckedIOException;
    }

    private void addCircuitBreakerEventListeners(CircuitBreakerRegistry registry) {
        registry.getAllCircuitBreakers()
                .forEach(
                        circuitBreaker ->
                                circuitBreaker
                                        .getEventPublisher()
                                        .onStateTransition(
                                                event ->
                                                        log.info(
                                                                "Circuit breaker {} state"
                                                                        + " transition: {} -> {}",
                                                                event.getCircuitBreakerName(),
                                                                event.getStateTransition()
                                                                        .getFromState(),
                                                                event.getStateTransition()
                                                                        .getToState()))
                                        .onCallNotPermitted(
                                                event ->
                                                        log.debug(
                                                                "Circuit breaker {} rejected call",
                                                                event.getCircuitBreakerName())));
    }

    private void addRetryEventListeners(RetryRegistry registry) {
        registry.getAllRetries()
                .forEach(
                        retry ->
                                retry.getEventPublisher()
                                        .onRetry(
                                                event ->
                                                        log.debug(
                                                                "Retry {} attempt {} after: {}",
                                                                event.getName(),
                                                                event.getNumberOfRetryAttempts(),
                                                                event.getLastThrowable()
                                                                        .getMessage()))
                                        .onError(
                                                event ->
                                                        log.warn(
                                                                "Retry {} gave up after {}"
                                                                        + " attempts: {}",
                                                                event.getName(),
                                                                event.getNumberOfRetryAttempts(),
                                                                event.getLastThrowable()
                                                                        .getMessage())));
    }
}
