package com.mailattribution.volume;

import com.mailattribution.cache.DateRange;
import java.util.Optional;

/**
 * One source of per-data-set send volume. Strategies are tried in order and the first non-empty
 * result wins; a strategy returns empty when its source is unavailable or yields too few codes.
 */
public interface VolumeStrategy {

    String name();

    Optional<VolumeResult> resolve(DateRange range);
}
