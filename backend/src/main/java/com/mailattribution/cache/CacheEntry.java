package com.mailattribution.cache;

import java.time.Duration;
import java.time.Instant;
import lombok.Value;

/** A cached value with the instant it was stored and its time to live. */
@Value
public class CacheEntry<V> {
    V value;
    Instant storedAt;
    Duration ttl;

    public boolean isExpired(Instant now) {
        return !now.isBefore(storedAt.plus(ttl));
    }

    public Duration age(Instant now) {
        return Duration.between(storedAt, now);
    }
}
