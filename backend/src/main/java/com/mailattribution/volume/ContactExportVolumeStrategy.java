package com.mailattribution.volume;

import com.mailattribution.cache.DateRange;
import com.mailattribution.cache.InFlightRegistry;
import com.mailattribution.cache.ReportCaches;
import com.mailattribution.config.AppProperties;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Exact per-data-set volume from a contact-activity export.
 *
 * <p>The export takes minutes, so it never runs on the caller's thread: a request either finds a
 * fresh persisted snapshot or launches a background export (at most one per window) and returns
 * empty so the next strategy answers meanwhile. A completed export lands in the volume cache with
 * the exact TTL and in the snapshot store.
 */
@Slf4j
@Component
@Order(1)
public class ContactExportVolumeStrategy implements VolumeStrategy {

    private final ContactActivityExporter exporter;
    private final VolumeSnapshotStore snapshotStore;
    private final ReportCaches reportCaches;
    private final AsyncTaskExecutor exportExecutor;
    private final AppProperties.Volume volumeProperties;
    private final Clock clock;
    private final InFlightRegistry<String> inFlight = new InFlightRegistry<>("contact-export");

    public ContactExportVolumeStrategy(
            ContactActivityExporter exporter,
            VolumeSnapshotStore snapshotStore,
            ReportCaches reportCaches,
            @Qualifier("volumeExportExecutor") AsyncTaskExecutor exportExecutor,
            AppProperties appProperties,
            Clock clock) {
        this.exporter = exporter;
        this.snapshotStore = snapshotStore;
        this.reportCaches = reportCaches;
        this.exportExecutor = exportExecutor;
        this.volumeProperties = appProperties.getVolume();
        this.clock = clock;
    }

    @Override
    public String name() {
        return "contact-export";
    }

    @Override
    public Optional<VolumeResult> resolve(DateRange range) {
        if (!volumeProperties.getExport().isEnabled()) {
            return Optional.empty();
        }

        Optional<VolumeResult> snapshot = snapshotStore.load(range).filter(this::isUsableSnapshot);
        if (snapshot.isPresent()) {
            log.info(
                    "Using persisted volume snapshot for {} ({} data sets)",
                    range,
                    snapshot.get().size());
            return snapshot;
        }

        try {
            launch(range)
                    .ifPresent(
                            job -> log.info("Launched background contact export for {}", range));
        } catch (TaskRejectedException e) {
            log.warn("Contact export for {} rejected, export pool is full: {}", range, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Launches a background export for the window unless one is already running.
     *
     * @return the export's future, or empty when an export for the window is in flight
     */
    public Optional<CompletableFuture<VolumeResult>> launch(DateRange range) {
        return inFlight.launch(range.key(), () -> submit(range));
    }

    public boolean isInFlight(DateRange range) {
        return inFlight.isInFlight(range.key());
    }

    private CompletableFuture<VolumeResult> submit(DateRange range) {
        CompletableFuture<VolumeResult> result = new CompletableFuture<>();
        Future<?> task =
                exportExecutor.submit(
                        () -> {
                            try {
                                result.complete(runExport(range));
                            } catch (RuntimeException e) {
                                log.warn("Contact export for {} failed: {}", range, e.getMessage());
                                result.completeExceptionally(e);
                            }
                        });
        result.whenComplete(
                (ignored, error) -> {
                    if (result.isCancelled()) {
                        task.cancel(true);
                    }
                });
        return result;
    }

    private VolumeResult runExport(DateRange range) {
        VolumeResult exported = exporter.export(range);
        if (exported.size() <= volumeProperties.getMinDistinctIdentifiers()) {
            log.warn(
                    "Discarding contact export for {}: only {} data sets",
                    range,
                    exported.size());
            return exported;
        }
        snapshotStore.save(range, exported);
        reportCaches.volume().put(range.key(), exported, volumeProperties.getExactTtl());
        return exported;
    }

    private boolean isUsableSnapshot(VolumeResult snapshot) {
        return snapshot.getResolvedAt() != null
                && snapshot.size() > volumeProperties.getMinDistinctIdentifiers()
                && clock.instant()
                        .isBefore(snapshot.getResolvedAt().plus(volumeProperties.getExactTtl()));
    }
}
