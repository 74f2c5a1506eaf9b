package com.mailattribution.collector;

import com.mailattribution.attribution.AttributionEngine;
import com.mailattribution.attribution.DataPartnerAnalyticsService;
import com.mailattribution.attribution.PeriodRollups;
import com.mailattribution.attribution.TrackingRecordProcessor;
import com.mailattribution.cache.CacheStore;
import com.mailattribution.cache.DateRange;
import com.mailattribution.cache.ReportCaches;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.tracking.ConversionPage;
import com.mailattribution.client.tracking.ConversionRecord;
import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.client.tracking.EntityReportRow;
import com.mailattribution.client.tracking.ReportDimension;
import com.mailattribution.client.tracking.TrackingNetworkClient;
import com.mailattribution.config.AppProperties;
import com.mailattribution.model.AttributionSnapshot;
import com.mailattribution.model.CampaignRevenue;
import com.mailattribution.model.Click;
import com.mailattribution.model.Conversion;
import com.mailattribution.model.DailyPerformance;
import com.mailattribution.model.DataPartnerAnalytics;
import com.mailattribution.model.EspRevenuePerformance;
import com.mailattribution.model.OfferPerformance;
import com.mailattribution.model.PeriodPerformance;
import com.mailattribution.model.PropertyPerformance;
import com.mailattribution.model.ReconciliationReport;
import com.mailattribution.model.RevenueBreakdown;
import com.mailattribution.model.TodaySummary;
import com.mailattribution.monitoring.AttributionMetrics;
import com.mailattribution.state.TrackingData;
import com.mailattribution.state.TrackingDataStore;
import com.mailattribution.util.MoneyUtils;
import com.mailattribution.util.Pauses;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Collects tracking-network reports and conversions and publishes attribution snapshots.
 *
 * <p>The first cycle fetches the whole lookback window; later cycles refresh today's figures and
 * the partner reports, until {@code fullRefreshInterval} forces another full fetch. A report that
 * fails after its retry keeps its previous value.
 */
@Slf4j
@Service
public class TrackingNetworkCollector {

    private final TrackingNetworkClient trackingNetworkClient;
    private final UpstreamCallTemplate trackingNetworkCalls;
    private final TrackingRecordProcessor recordProcessor;
    private final AttributionEngine attributionEngine;
    private final TrackingDataStore trackingDataStore;
    private final ReportCaches reportCaches;
    private final DataPartnerAnalyticsService partnerAnalyticsService;
    private final AttributionMetrics metrics;
    private final AppProperties.Tracking trackingProperties;
    private final Clock clock;
    private final ZoneId zoneId;

    private final AtomicReference<CollectorState> state = new AtomicReference<>(CollectorState.IDLE);
    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile Instant lastFullFetch;

    public TrackingNetworkCollector(
            TrackingNetworkClient trackingNetworkClient,
            @Qualifier("trackingNetworkCalls") UpstreamCallTemplate trackingNetworkCalls,
            TrackingRecordProcessor recordProcessor,
            AttributionEngine attributionEngine,
            TrackingDataStore trackingDataStore,
            ReportCaches reportCaches,
            DataPartnerAnalyticsService partnerAnalyticsService,
            AttributionMetrics metrics,
            AppProperties appProperties,
            Clock clock) {
        this.trackingNetworkClient = trackingNetworkClient;
        this.trackingNetworkCalls = trackingNetworkCalls;
        this.recordProcessor = recordProcessor;
        this.attributionEngine = attributionEngine;
        this.trackingDataStore = trackingDataStore;
        this.reportCaches = reportCaches;
        this.partnerAnalyticsService = partnerAnalyticsService;
        this.metrics = metrics;
        this.trackingProperties = appProperties.getTracking();
        this.clock = clock;
        this.zoneId = ZoneId.of(trackingProperties.getZoneId());
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping tracking network collector");
        state.set(CollectorState.STOPPED);
    }

    /** One scheduled cycle; skipped when a cycle is already running or the collector is stopped. */
    public void runCycle() {
        if (state.get() == CollectorState.STOPPED) {
            log.debug("Collector stopped, skipping cycle");
            return;
        }
        if (!cycleLock.tryLock()) {
            log.info("Previous collection cycle still running, skipping");
            return;
        }
        try {
            if (needsFullFetch()) {
                fetchFull();
            } else {
                fetchIncremental();
            }
        } finally {
            cycleLock.unlock();
        }
    }

    boolean needsFullFetch() {
        Instant last = lastFullFetch;
        if (last == null || !trackingDataStore.getData().isFetched()) {
            return true;
        }
        return Duration.between(last, clock.instant()).compareTo(trackingProperties.getFullRefreshInterval())
                >= 0;
    }

    /** Fetches every report and all conversions for the lookback window. */
    public void fetchFull() {
        if (!transition(CollectorState.FETCHING_FULL)) {
            return;
        }
        Timer.Sample sample = metrics.startCycleTimer();
        String outcome = "success";
        try {
            TrackingData previous = trackingDataStore.getData();
            LocalDate today = today();
            DateRange window = DateRange.lastDays(today, trackingProperties.getLookbackDays());
            log.info("Starting full tracking fetch for {}", window);

            EntityReport dateReport =
                    fetchReport("date", window, List.of(ReportDimension.DATE), previous.getDateReport());
            EntityReport offerReport =
                    fetchReport("offer", window, List.of(ReportDimension.OFFER), previous.getOfferReport());
            pause("report spacing");
            EntityReport sub1Report =
                    fetchReport("sub1", window, List.of(ReportDimension.SUB1), previous.getSub1Report());
            pause("report spacing");
            EntityReport sub2Report =
                    fetchReport("sub2", window, List.of(ReportDimension.SUB2), previous.getSub2Report());
            pause("report spacing");
            EntityReport offerPartnerReport =
                    fetchReport(
                            "offer x sub2",
                            window,
                            List.of(ReportDimension.OFFER, ReportDimension.SUB2),
                            previous.getOfferPartnerReport());

            List<Conversion> conversions = fetchConversions(window, previous.getConversions());

            List<Click> clicks = List.of();
            if (sub1Report == null || sub1Report.isEmpty()) {
                clicks = fetchClicks(window, previous.getClicks());
            }

            TrackingData data =
                    TrackingData.builder()
                            .dateReport(dateReport)
                            .offerReport(offerReport)
                            .sub1Report(sub1Report)
                            .sub2Report(sub2Report)
                            .offerPartnerReport(offerPartnerReport)
                            .conversions(conversions)
                            .clicks(clicks)
                            .window(window)
                            .fetchedAt(clock.instant())
                            .build();
            publish(data, today);
            lastFullFetch = data.getFetchedAt();

            log.info(
                    "Full tracking fetch complete: {} conversions, {} revenue",
                    conversions.size(),
                    getTotalRevenue());
        } catch (CancellationException e) {
            outcome = "cancelled";
            log.warn("Full tracking fetch cancelled: {}", e.getMessage());
        } catch (RuntimeException e) {
            outcome = "failure";
            log.error("Full tracking fetch failed: {}", e.getMessage(), e);
        } finally {
            metrics.recordCycleTime(sample);
            metrics.recordCycle("full", outcome);
            transition(CollectorState.IDLE);
        }
        refreshPartnerAnalytics();
    }

    /**
     * Refreshes today's date-report row, the partner reports and today's conversions. Stale
     * conversions for today are replaced, not appended to.
     */
    public void fetchIncremental() {
        if (!transition(CollectorState.FETCHING_INCREMENTAL)) {
            return;
        }
        Timer.Sample sample = metrics.startCycleTimer();
        String outcome = "success";
        try {
            TrackingData previous = trackingDataStore.getData();
            LocalDate today = today();
            DateRange todayRange = DateRange.of(today, today);
            DateRange window = DateRange.lastDays(today, trackingProperties.getLookbackDays());
            log.info("Starting incremental tracking fetch for {}", today);

            EntityReport todayReport = fetchReportOnce("date (today)", todayRange, List.of(ReportDimension.DATE));
            EntityReport dateReport = mergeToday(previous.getDateReport(), todayReport, today);

            EntityReport sub2Report =
                    fetchReportOnce("sub2", window, List.of(ReportDimension.SUB2));
            pause("report spacing");
            EntityReport offerPartnerReport =
                    fetchReportOnce(
                            "offer x sub2", window, List.of(ReportDimension.OFFER, ReportDimension.SUB2));

            List<Conversion> conversions = previous.getConversions();
            Optional<List<Conversion>> todayConversions = fetchConversionsForDay(today);
            if (todayConversions.isPresent()) {
                conversions = replaceDay(previous.getConversions(), todayConversions.get(), today);
            }

            TrackingData data =
                    previous.toBuilder()
                            .dateReport(dateReport)
                            .sub2Report(sub2Report != null ? sub2Report : previous.getSub2Report())
                            .offerPartnerReport(
                                    offerPartnerReport != null
                                            ? offerPartnerReport
                                            : previous.getOfferPartnerReport())
                            .conversions(conversions)
                            .window(window)
                            .fetchedAt(clock.instant())
                            .build();
            publish(data, today);

            TodaySummary summary = getToday();
            log.info(
                    "Incremental fetch complete: today {} clicks, {} conversions, {} revenue",
                    summary == null ? 0 : summary.getClicks(),
                    summary == null ? 0 : summary.getConversions(),
                    summary == null ? BigDecimal.ZERO : summary.getRevenue());
        } catch (CancellationException e) {
            outcome = "cancelled";
            log.warn("Incremental tracking fetch cancelled: {}", e.getMessage());
        } catch (RuntimeException e) {
            outcome = "failure";
            log.error("Incremental tracking fetch failed: {}", e.getMessage(), e);
        } finally {
            metrics.recordCycleTime(sample);
            metrics.recordCycle("incremental", outcome);
            transition(CollectorState.IDLE);
        }
        refreshPartnerAnalytics();
    }

    private void publish(TrackingData data, LocalDate today) {
        AttributionSnapshot snapshot = attributionEngine.build(data, today);
        trackingDataStore.publish(data, snapshot);
        reportCaches.conversions().clear();
        if (data.getWindow() != null) {
            // Range queries for the lookback window see the reports just published
            String windowKey = data.getWindow().key();
            replaceRangeReport(reportCaches.partnerClicks(), windowKey, data.getSub2Report());
            replaceRangeReport(reportCaches.offerPartnerClicks(), windowKey, data.getOfferPartnerReport());
        }
        reportCaches.evictExpired();
        metrics.recordSnapshot(snapshot, data.getConversions().size());
    }

    private static void replaceRangeReport(
            CacheStore<String, EntityReport> cache, String windowKey, EntityReport report) {
        cache.invalidate(windowKey);
        if (report != null) {
            cache.put(windowKey, report);
        }
    }

    private void refreshPartnerAnalytics() {
        if (state.get() == CollectorState.STOPPED || !trackingDataStore.getData().isFetched()) {
            return;
        }
        try {
            partnerAnalyticsService.refreshCache();
        } catch (CancellationException e) {
            log.warn("Partner analytics refresh cancelled: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Partner analytics refresh failed: {}", e.getMessage(), e);
        }
    }

    /** Fetches a report with one retry after {@code retryBackoff}; returns {@code previous} on failure. */
    private EntityReport fetchReport(
            String name, DateRange window, List<ReportDimension> dimensions, EntityReport previous) {
        try {
            return logReport(name, callReport(name, window, dimensions));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn(
                    "Error fetching {} report: {}, retrying in {}",
                    name,
                    e.getMessage(),
                    trackingProperties.getRetryBackoff());
        }
        Pauses.pause(trackingProperties.getRetryBackoff(), name + " report retry");
        try {
            return logReport(name, callReport(name, window, dimensions));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Retry also failed for {} report, keeping previous: {}", name, e.getMessage());
            metrics.recordReportFailure(name);
            return previous;
        }
    }

    /** Single attempt; null on failure so the caller keeps what it had. */
    private EntityReport fetchReportOnce(String name, DateRange window, List<ReportDimension> dimensions) {
        try {
            return logReport(name, callReport(name, window, dimensions));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Error refreshing {} report, keeping previous: {}", name, e.getMessage());
            metrics.recordReportFailure(name);
            return null;
        }
    }

    private EntityReport callReport(String name, DateRange window, List<ReportDimension> dimensions) {
        return trackingNetworkCalls.callOnce(
                "getEntityReport(" + name + ")",
                () -> trackingNetworkClient.getEntityReport(window.getFrom(), window.getTo(), dimensions));
    }

    private static EntityReport logReport(String name, EntityReport report) {
        log.info("Got {} report with {} rows", name, report == null ? 0 : report.getTable().size());
        return report;
    }

    /**
     * Approved conversions day by day. A day that fails keeps the conversions previously held for
     * that day.
     */
    private List<Conversion> fetchConversions(DateRange window, List<Conversion> previous) {
        List<Conversion> all = new ArrayList<>();
        for (LocalDate day : window.days()) {
            Optional<List<Conversion>> fetched = fetchConversionsForDay(day);
            if (fetched.isPresent()) {
                all.addAll(fetched.get());
            } else {
                previous.stream().filter(c -> day.equals(c.getConversionDate())).forEach(all::add);
            }
            pause(trackingProperties.getConversionDaySpacing(), "conversion day spacing");
        }
        return all;
    }

    private Optional<List<Conversion>> fetchConversionsForDay(LocalDate day) {
        List<ConversionRecord> records = new ArrayList<>();
        int page = 1;
        try {
            while (true) {
                int current = page;
                ConversionPage result =
                        trackingNetworkCalls.call(
                                "getConversions",
                                () ->
                                        trackingNetworkClient.getConversions(
                                                day,
                                                day,
                                                true,
                                                current,
                                                trackingProperties.getConversionPageSize()));
                records.addAll(result.getConversions());
                if (!result.hasNext()) {
                    break;
                }
                page++;
            }
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Error fetching conversions for {} (page {}): {}", day, page, e.getMessage());
            return Optional.empty();
        }
        List<Conversion> conversions = recordProcessor.processConversions(records);
        log.debug("Got {} conversions for {}", conversions.size(), day);
        return Optional.of(conversions);
    }

    private List<Click> fetchClicks(DateRange window, List<Click> previous) {
        log.info("No sub1 report available, fetching raw clicks for {}", window);
        try {
            return recordProcessor.processClicks(
                    trackingNetworkCalls.call(
                            "getClicks",
                            () -> trackingNetworkClient.getClicks(window.getFrom(), window.getTo())));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Error fetching raw clicks for {}: {}", window, e.getMessage());
            return previous;
        }
    }

    static List<Conversion> replaceDay(List<Conversion> existing, List<Conversion> fresh, LocalDate day) {
        List<Conversion> merged =
                existing.stream()
                        .filter(c -> !day.equals(c.getConversionDate()))
                        .collect(Collectors.toCollection(ArrayList::new));
        merged.addAll(fresh);
        return merged;
    }

    /** Replaces today's rows of the window date report with the rows of today's report. */
    EntityReport mergeToday(EntityReport windowReport, EntityReport todayReport, LocalDate today) {
        if (todayReport == null || todayReport.isEmpty()) {
            return windowReport;
        }
        if (windowReport == null) {
            return todayReport;
        }
        List<EntityReportRow> rows = new ArrayList<>();
        for (EntityReportRow row : windowReport.getTable()) {
            if (!today.equals(rowDate(row))) {
                rows.add(row);
            }
        }
        rows.addAll(todayReport.getTable());
        return EntityReport.builder().table(rows).summary(windowReport.getSummary()).build();
    }

    private LocalDate rowDate(EntityReportRow row) {
        String id = row.id(ReportDimension.DATE);
        try {
            return Instant.ofEpochSecond(Long.parseLong(id)).atZone(zoneId).toLocalDate();
        } catch (NumberFormatException e) {
            log.debug("Date row with non-numeric id '{}' kept as is", id);
            return null;
        }
    }

    private boolean transition(CollectorState next) {
        CollectorState current = state.get();
        while (current != CollectorState.STOPPED) {
            if (state.compareAndSet(current, next)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    private void pause(String activity) {
        pause(trackingProperties.getReportSpacing(), activity);
    }

    private void pause(Duration duration, String activity) {
        Pauses.pause(duration, activity);
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zoneId));
    }

    // Accessors

    public List<CampaignRevenue> getCampaigns() {
        return trackingDataStore.getSnapshot().getCampaigns();
    }

    public Optional<CampaignRevenue> getCampaign(String mailingId) {
        return getCampaigns().stream().filter(c -> c.getMailingId().equals(mailingId)).findFirst();
    }

    public List<PropertyPerformance> getProperties() {
        return trackingDataStore.getSnapshot().getProperties();
    }

    public Optional<PropertyPerformance> getProperty(String propertyCode) {
        return getProperties().stream()
                .filter(p -> p.getPropertyCode().equalsIgnoreCase(propertyCode))
                .findFirst();
    }

    public List<OfferPerformance> getOffers() {
        return trackingDataStore.getSnapshot().getOffers();
    }

    public List<DailyPerformance> getDaily() {
        return trackingDataStore.getSnapshot().getDaily();
    }

    public List<DailyPerformance> getDaily(DateRange range) {
        return getDaily().stream().filter(d -> range.contains(d.getDate())).collect(Collectors.toList());
    }

    public List<PeriodPerformance> getWeekly() {
        return PeriodRollups.weekly(getDaily());
    }

    public List<PeriodPerformance> getMonthly() {
        return PeriodRollups.monthly(getDaily());
    }

    public List<EspRevenuePerformance> getEspRevenue() {
        return trackingDataStore.getSnapshot().getEspRevenue();
    }

    public RevenueBreakdown getRevenueBreakdown() {
        return trackingDataStore.getSnapshot().getRevenueBreakdown();
    }

    public ReconciliationReport getReconciliation() {
        return trackingDataStore.getSnapshot().getReconciliation();
    }

    public TodaySummary getToday() {
        return trackingDataStore.getSnapshot().getToday();
    }

    public List<Conversion> getRecentConversions() {
        return trackingDataStore.getSnapshot().getRecentConversions();
    }

    public BigDecimal getTotalRevenue() {
        return MoneyUtils.sum(getDaily(), DailyPerformance::getRevenue);
    }

    public BigDecimal getTotalRevenue(DateRange range) {
        return MoneyUtils.sum(getDaily(range), DailyPerformance::getRevenue);
    }

    /** Cached analytics for the lookback window, computed on demand when none are cached yet. */
    public DataPartnerAnalytics getDataPartnerAnalytics() {
        return partnerAnalyticsService.getCached().orElseGet(partnerAnalyticsService::refreshCache);
    }

    public DataPartnerAnalytics getDataPartnerAnalytics(DateRange range) {
        return partnerAnalyticsService.build(range);
    }

    public Optional<Instant> getLastFetch() {
        return Optional.ofNullable(trackingDataStore.getData().getFetchedAt());
    }

    public CollectorState getState() {
        return state.get();
    }
}
