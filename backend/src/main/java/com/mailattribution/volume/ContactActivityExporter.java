package com.mailattribution.volume;

import com.mailattribution.cache.DateRange;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.sending.ContactActivityRequest;
import com.mailattribution.client.sending.ContactActivityStatus;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.codec.DataSetCodes;
import com.mailattribution.config.AppProperties;
import com.mailattribution.exception.RateLimitException;
import com.mailattribution.exception.UpstreamApiException;
import com.mailattribution.exception.VolumeExportException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import io.github.resilience4j.core.IntervalFunction;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Produces exact sends per data-set code from a sending-platform contact-activity report.
 *
 * <p>Lifecycle: create the report, poll its status until completed, export the CSV, sum the
 * {@code sent} column per {@code data_set} value, then delete the report. Deletion is always
 * submitted to the cleanup executor, also when polling failed, timed out or was cancelled.
 * Cancellation (thread interrupt) is observed between polls.
 */
@Slf4j
@Component
public class ContactActivityExporter {

    static final String DATA_SET_FIELD = "data_set";
    static final String SENT_FIELD = "sent";

    private final SendingPlatformClient sendingPlatformClient;
    private final UpstreamCallTemplate sendingPlatformCalls;
    private final Executor cleanupExecutor;
    private final AppProperties.Volume.Export exportProperties;
    private final ZoneId zoneId;
    private final Clock clock;
    private final IntervalFunction rateLimitBackoff;

    public ContactActivityExporter(
            SendingPlatformClient sendingPlatformClient,
            @Qualifier("sendingPlatformCalls") UpstreamCallTemplate sendingPlatformCalls,
            @Qualifier("exportCleanupExecutor") Executor cleanupExecutor,
            AppProperties appProperties,
            Clock clock) {
        this.sendingPlatformClient = sendingPlatformClient;
        this.sendingPlatformCalls = sendingPlatformCalls;
        this.cleanupExecutor = cleanupExecutor;
        this.exportProperties = appProperties.getVolume().getExport();
        this.zoneId = ZoneId.of(appProperties.getTracking().getZoneId());
        this.clock = clock;
        this.rateLimitBackoff =
                IntervalFunction.ofExponentialRandomBackoff(
                        exportProperties.getRateLimitBackoff(),
                        2.0,
                        0.5,
                        exportProperties.getMaxRateLimitBackoff());
    }

    /**
     * Runs one export to completion on the calling thread.
     *
     * @throws VolumeExportException when the report fails, times out or cannot be parsed
     * @throws CancellationException when the calling thread is interrupted between polls
     */
    public VolumeResult export(DateRange range) {
        ContactActivityRequest request =
                ContactActivityRequest.builder()
                        .title("Volume by data set " + range.key())
                        .selectedField(DATA_SET_FIELD)
                        .selectedField(SENT_FIELD)
                        .filterField(DATA_SET_FIELD)
                        .fromDate(range.getFrom().atStartOfDay(zoneId).toInstant())
                        .toDate(range.getTo().plusDays(1).atStartOfDay(zoneId).toInstant())
                        .build();

        String reportId =
                sendingPlatformCalls.call(
                        "createContactActivityReport",
                        () -> sendingPlatformClient.createContactActivityReport(request));
        log.info("Created contact activity report {} for {}", reportId, range);

        try {
            awaitCompletion(reportId);
            byte[] csv =
                    sendingPlatformCalls.call(
                            "exportContactActivityCsv",
                            () -> sendingPlatformClient.exportContactActivityCsv(reportId));
            Map<String, Long> sends = aggregateSends(csv);
            log.info(
                    "Contact activity report {} yielded {} data sets for {}",
                    reportId,
                    sends.size(),
                    range);
            return VolumeResult.builder()
                    .sendsByDataSet(sends)
                    .source(VolumeSource.CONTACT_EXPORT)
                    .exact(true)
                    .perPartnerUsable(true)
                    .resolvedAt(clock.instant())
                    .build();
        } finally {
            scheduleCleanup(reportId);
        }
    }

    private void awaitCompletion(String reportId) {
        Instant deadline = clock.instant().plus(exportProperties.getMaxWait());
        int rateLimitAttempt = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Contact activity export " + reportId + " cancelled");
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new VolumeExportException(
                        "Contact activity report "
                                + reportId
                                + " not completed within "
                                + exportProperties.getMaxWait());
            }

            ContactActivityStatus status;
            try {
                status =
                        sendingPlatformCalls.callOnce(
                                "getContactActivityStatus",
                                () -> sendingPlatformClient.getContactActivityStatus(reportId));
            } catch (RateLimitException e) {
                rateLimitAttempt++;
                Duration wait = rateLimitWait(rateLimitAttempt, e.getRetryAfter());
                log.warn(
                        "Rate limited polling report {}, backing off {} ms (attempt {})",
                        reportId,
                        wait.toMillis(),
                        rateLimitAttempt);
                sleep(wait, reportId);
                continue;
            } catch (UpstreamApiException e) {
                if (!e.isRetryable()) {
                    throw new VolumeExportException(
                            "Contact activity report " + reportId + " status check failed", e);
                }
                log.warn("Transient error polling report {}: {}", reportId, e.getMessage());
                sleep(exportProperties.getPollInterval(), reportId);
                continue;
            }

            if (status == ContactActivityStatus.COMPLETED) {
                return;
            }
            log.debug("Contact activity report {} status {}", reportId, status);
            sleep(exportProperties.getPollInterval(), reportId);
        }
    }

    Duration rateLimitWait(int attempt, Duration retryAfter) {
        Duration backoff = Duration.ofMillis(rateLimitBackoff.apply(attempt));
        if (retryAfter != null && retryAfter.compareTo(backoff) > 0) {
            backoff = retryAfter;
        }
        Duration max = exportProperties.getMaxRateLimitBackoff();
        return backoff.compareTo(max) > 0 ? max : backoff;
    }

    private void sleep(Duration duration, String reportId) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled =
                    new CancellationException("Contact activity export " + reportId + " cancelled");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    CompletableFuture<Void> scheduleCleanup(String reportId) {
        return CompletableFuture.runAsync(
                        () ->
                                sendingPlatformCalls.run(
                                        "deleteContactActivityReport",
                                        () ->
                                                sendingPlatformClient.deleteContactActivityReport(
                                                        reportId)),
                        cleanupExecutor)
                .orTimeout(
                        exportProperties.getCleanupTimeout().toMillis(),
                        TimeUnit.MILLISECONDS)
                .whenComplete(
                        (ignored, error) -> {
                            if (error != null) {
                                log.warn(
                                        "Failed to delete contact activity report {}: {}",
                                        reportId,
                                        error.getMessage());
                            } else {
                                log.debug("Deleted contact activity report {}", reportId);
                            }
                        });
    }

    /** Sums the {@code sent} column per upper-cased {@code data_set} value. */
    Map<String, Long> aggregateSends(byte[] csv) {
        Map<String, Long> sends = new LinkedHashMap<>();
        try (CSVReader reader =
                new CSVReader(
                        new InputStreamReader(
                                new ByteArrayInputStream(csv), StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) {
                return sends;
            }
            int dataSetIdx = indexOf(header, DATA_SET_FIELD);
            int sentIdx = indexOf(header, SENT_FIELD);
            if (dataSetIdx < 0 || sentIdx < 0) {
                throw new VolumeExportException(
                        "Contact activity CSV lacks data_set/sent columns: "
                                + String.join(",", header));
            }

            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length <= Math.max(dataSetIdx, sentIdx)) {
                    continue;
                }
                String code =
                        DataSetCodes.trimTrailingUnderscores(row[dataSetIdx].trim())
                                .toUpperCase(Locale.ROOT);
                if (code.isEmpty() || !DataSetCodes.isValidVolumeKey(code)) {
                    continue;
                }
                long sent = parseCount(row[sentIdx]);
                if (sent > 0) {
                    sends.merge(code, sent, Long::sum);
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new VolumeExportException("Unreadable contact activity CSV", e);
        }
        return Collections.unmodifiableMap(sends);
    }

    private static int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            // Exported headers may carry a UTF-8 BOM
            String name = header[i].replace("\uFEFF", "").trim();
            if (name.equalsIgnoreCase(column)) {
                return i;
            }
        }
        return -1;
    }

    private static long parseCount(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        try {
            return new BigDecimal(trimmed).longValue();
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric sent value '{}'", value);
            return 0;
        }
    }
}
