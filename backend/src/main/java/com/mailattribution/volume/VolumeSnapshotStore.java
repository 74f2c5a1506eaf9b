package com.mailattribution.volume;

import com.mailattribution.cache.DateRange;
import java.util.Optional;

/** Durable copy of exact volume results, so a restart does not trigger a new export. */
public interface VolumeSnapshotStore {

    void save(DateRange range, VolumeResult result);

    Optional<VolumeResult> load(DateRange range);
}
