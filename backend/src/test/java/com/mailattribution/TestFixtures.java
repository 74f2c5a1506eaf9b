package com.mailattribution;

import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.codec.PartnerCatalog;
import com.mailattribution.codec.PropertyCatalog;
import com.mailattribution.config.AppProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;

/** Shared builders for unit tests. */
public final class TestFixtures {

    public static final String ZONE = "America/Los_Angeles";

    private TestFixtures() {}

    /** Default properties with every pause set to zero and backoffs at their minimum. */
    public static AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        properties.getTracking().setReportSpacing(Duration.ZERO);
        properties.getTracking().setRetryBackoff(Duration.ZERO);
        properties.getTracking().setConversionDaySpacing(Duration.ZERO);
        properties.getEnrichment().setLookupSpacing(Duration.ZERO);
        properties.getVolume().getExport().setPollInterval(Duration.ZERO);
        properties.getVolume().getExport().setRateLimitBackoff(Duration.ofMillis(1));
        return properties;
    }

    public static IdentifierCodec identifierCodec() {
        AppProperties properties = new AppProperties();
        return new IdentifierCodec(new PropertyCatalog(properties), new PartnerCatalog(properties));
    }

    /** Single-attempt call template running on the calling thread. */
    public static UpstreamCallTemplate directCalls(String upstream) {
        return new UpstreamCallTemplate(
                upstream,
                CircuitBreaker.ofDefaults(upstream),
                Retry.of(upstream, RetryConfig.custom().maxAttempts(1).build()),
                Duration.ofSeconds(5),
                Runnable::run);
    }
}
