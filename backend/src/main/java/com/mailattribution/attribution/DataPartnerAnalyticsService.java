package com.mailattribution.attribution;

import com.mailattribution.cache.CacheStore;
import com.mailattribution.cache.DateRange;
import com.mailattribution.cache.ReportCaches;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.client.tracking.EntityReportRow;
import com.mailattribution.client.tracking.ReportDimension;
import com.mailattribution.client.tracking.TrackingNetworkClient;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.codec.OfferType;
import com.mailattribution.codec.ParsedSub2;
import com.mailattribution.codec.PartnerCatalog;
import com.mailattribution.codec.PartnerGroup;
import com.mailattribution.config.AppProperties;
import com.mailattribution.model.AttributionSnapshot;
import com.mailattribution.model.Conversion;
import com.mailattribution.model.DataPartnerAnalytics;
import com.mailattribution.model.DataPartnerPerformance;
import com.mailattribution.model.DataSetMetrics;
import com.mailattribution.model.EspRevenuePerformance;
import com.mailattribution.model.MonthOverMonthComparison;
import com.mailattribution.model.OfferPartnerBreakdown;
import com.mailattribution.model.OfferPartnerMetrics;
import com.mailattribution.model.OfferPerformance;
import com.mailattribution.model.PartnerDailyMetrics;
import com.mailattribution.model.PartnerShare;
import com.mailattribution.model.PeriodSummary;
import com.mailattribution.state.TrackingData;
import com.mailattribution.state.TrackingDataStore;
import com.mailattribution.util.MoneyUtils;
import com.mailattribution.volume.PartnerVolumeView;
import com.mailattribution.volume.VolumeFigure;
import com.mailattribution.volume.VolumeResolver;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Data-partner analytics: CPA revenue from conversions, CPM revenue by click share, partner
 * clicks from the sub2 report and sends per partner and data set from the volume resolver.
 *
 * <p>Range queries use range-specific reports where the tracking network returns them and fall
 * back to the periodic reports of the last collection cycle.
 */
@Slf4j
@Service
public class DataPartnerAnalyticsService {

    private static final DateTimeFormatter RANGE_START = DateTimeFormatter.ofPattern("MMM d", Locale.US);
    private static final DateTimeFormatter RANGE_END =
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);
    private static final DateTimeFormatter MONTH_LABEL =
            DateTimeFormatter.ofPattern("MMMM yyyy", Locale.US);

    private final TrackingDataStore trackingDataStore;
    private final ReportCaches reportCaches;
    private final TrackingNetworkClient trackingNetworkClient;
    private final UpstreamCallTemplate trackingNetworkCalls;
    private final VolumeResolver volumeResolver;
    private final IdentifierCodec identifierCodec;
    private final CpmAttributor cpmAttributor;
    private final Clock clock;
    private final ZoneId zoneId;
    private final int lookbackDays;

    public DataPartnerAnalyticsService(
            TrackingDataStore trackingDataStore,
            ReportCaches reportCaches,
            TrackingNetworkClient trackingNetworkClient,
            @Qualifier("trackingNetworkCalls") UpstreamCallTemplate trackingNetworkCalls,
            VolumeResolver volumeResolver,
            IdentifierCodec identifierCodec,
            CpmAttributor cpmAttributor,
            AppProperties appProperties,
            Clock clock) {
        this.trackingDataStore = trackingDataStore;
        this.reportCaches = reportCaches;
        this.trackingNetworkClient = trackingNetworkClient;
        this.trackingNetworkCalls = trackingNetworkCalls;
        this.volumeResolver = volumeResolver;
        this.identifierCodec = identifierCodec;
        this.cpmAttributor = cpmAttributor;
        this.clock = clock;
        this.zoneId = ZoneId.of(appProperties.getTracking().getZoneId());
        this.lookbackDays = appProperties.getTracking().getLookbackDays();
    }

    /** Rebuilds the analytics for the lookback window and publishes them as the cached copy. */
    public DataPartnerAnalytics refreshCache() {
        DateRange window = DateRange.lastDays(LocalDate.now(clock.withZone(zoneId)), lookbackDays);
        log.info("Refreshing data partner analytics for {}", window);
        DataPartnerAnalytics analytics = build(window);
        trackingDataStore.publishPartnerAnalytics(analytics);
        log.info(
                "Data partner analytics refreshed: {} partners, {} revenue",
                analytics.getPartners().size(),
                analytics.getTotals() == null ? BigDecimal.ZERO : analytics.getTotals().getRevenue());
        return analytics;
    }

    public Optional<DataPartnerAnalytics> getCached() {
        return trackingDataStore.getPartnerAnalytics();
    }

    public DataPartnerAnalytics build(DateRange range) {
        TrackingData data = trackingDataStore.getData();
        if (!data.isFetched()) {
            log.debug("No tracking data yet, returning empty partner analytics for {}", range);
            return DataPartnerAnalytics.empty(range.getFrom(), range.getTo(), clock.instant());
        }
        AttributionSnapshot snapshot = trackingDataStore.getSnapshot();
        PartnerCatalog partnerCatalog = identifierCodec.getPartnerCatalog();
        Map<String, PartnerTally> partners = new TreeMap<>();

        // Clicks per partner and data set
        EntityReport sub2Report =
                rangeReport(
                        reportCaches.partnerClicks(),
                        range,
                        List.of(ReportDimension.SUB2),
                        data.getSub2Report(),
                        "sub2");
        if (sub2Report != null) {
            for (EntityReportRow row : sub2Report.getTable()) {
                String sub2 = row.label(ReportDimension.SUB2);
                if (sub2.isEmpty()) {
                    continue;
                }
                Optional<ParsedSub2> parsed = identifierCodec.parseSub2(sub2);
                if (parsed.isEmpty() || !parsed.get().isAttributable()) {
                    continue;
                }
                long clicks = row.getReporting() == null ? 0 : row.getReporting().getTotalClick();
                PartnerTally partner =
                        partnerFor(
                                partners,
                                parsed.get().getPartnerPrefix(),
                                parsed.get().getPartnerName(),
                                parsed.get().getDataSetCode());
                partner.clicks += clicks;
                partner.dataSet(parsed.get().getDataSetCode()).clicks += clicks;
            }
        }

        // CPM revenue by click share
        EntityReport offerPartnerReport =
                rangeReport(
                        reportCaches.offerPartnerClicks(),
                        range,
                        List.of(ReportDimension.OFFER, ReportDimension.SUB2),
                        data.getOfferPartnerReport(),
                        "offer x sub2");
        CpmAttribution cpm = null;
        if (offerPartnerReport != null && !offerPartnerReport.isEmpty()) {
            cpm = cpmAttributor.attribute(offerPartnerReport, cpmOfferRevenue(range, snapshot));
            for (CpmAttribution.PartnerOfferShare share : cpm.getShares()) {
                PartnerTally partner = partnerFor(partners, share.getPartnerKey(), share.getPartnerName(), "");
                partner.revenue = partner.revenue.add(share.getRevenue());
                partner.cpmRevenue = partner.cpmRevenue.add(share.getRevenue());
                OfferTally offer = partner.offer(share.getOfferId(), share.getOfferName());
                offer.cpm = true;
                offer.clicks += share.getClicks();
                offer.revenue = offer.revenue.add(share.getRevenue());
            }
        } else {
            log.info("No offer x sub2 report available for {}, skipping CPM attribution", range);
        }

        // CPA revenue from conversions
        for (Conversion conversion : conversionsFor(range, data)) {
            String groupKey;
            String groupName;
            String dataSetCode;
            Optional<ParsedSub2> parsed = identifierCodec.parseSub2(conversion.getSub2());
            if (parsed.isPresent() && parsed.get().isAttributable()) {
                groupKey = parsed.get().getPartnerPrefix();
                groupName = parsed.get().getPartnerName();
                dataSetCode = parsed.get().getDataSetCode();
            } else if (notEmpty(conversion.getDataSetCode())) {
                PartnerGroup group = partnerCatalog.resolve(conversion.getDataSetCode());
                groupKey = group.getKey();
                groupName = group.getName();
                dataSetCode = conversion.getDataSetCode();
            } else if (notEmpty(conversion.getDataPartner())) {
                PartnerGroup group = partnerCatalog.resolve(conversion.getDataPartner());
                groupKey = group.getKey();
                groupName = group.getName();
                dataSetCode = conversion.getDataPartner();
            } else {
                continue;
            }

            BigDecimal revenue = MoneyUtils.nullToZero(conversion.getRevenue());
            PartnerTally partner = partnerFor(partners, groupKey, groupName, dataSetCode);
            partner.conversions++;
            partner.payout = partner.payout.add(MoneyUtils.nullToZero(conversion.getPayout()));
            partner.revenue = partner.revenue.add(revenue);
            partner.cpaRevenue = partner.cpaRevenue.add(revenue);

            DataSetTally dataSet = partner.dataSet(dataSetCode);
            dataSet.conversions++;
            dataSet.revenue = dataSet.revenue.add(revenue);

            if (notEmpty(conversion.getOfferId())) {
                OfferTally offer = partner.offer(conversion.getOfferId(), conversion.getOfferName());
                offer.conversions++;
                offer.revenue = offer.revenue.add(revenue);
            }

            if (conversion.getConversionDate() != null) {
                DailyTally day =
                        partner.daily.computeIfAbsent(conversion.getConversionDate(), d -> new DailyTally());
                day.conversions++;
                day.revenue = day.revenue.add(revenue);
            }
        }

        // Volume
        long grandClicks = 0;
        long grandConversions = 0;
        for (PartnerTally partner : partners.values()) {
            grandClicks += partner.clicks;
            grandConversions += partner.conversions;
        }
        long espSent = 0;
        for (EspRevenuePerformance esp : snapshot.getEspRevenue()) {
            espSent += esp.getTotalSent();
        }
        PartnerVolumeView volume =
                volumeResolver.viewFor(range, partners.keySet(), grandClicks, grandConversions, espSent);

        List<DataPartnerPerformance> rows = new ArrayList<>(partners.size());
        PeriodSummaryTally totals = new PeriodSummaryTally();
        for (PartnerTally partner : partners.values()) {
            DataPartnerPerformance row = buildPartner(partner, volume);
            rows.add(row);
            totals.add(row);
        }
        rows.sort(
                Comparator.comparing(DataPartnerPerformance::getRevenue)
                        .reversed()
                        .thenComparing(DataPartnerPerformance::getPartnerPrefix));

        List<OfferPartnerBreakdown> cpmOffers = new ArrayList<>();
        List<OfferPartnerBreakdown> cpaOffers = new ArrayList<>();
        buildOfferCentricView(rows, cpmOffers, cpaOffers);

        return DataPartnerAnalytics.builder()
                .from(range.getFrom())
                .to(range.getTo())
                .partners(rows)
                .totals(
                        PeriodSummary.builder()
                                .label(RANGE_START.format(range.getFrom()) + " – " + RANGE_END.format(range.getTo()))
                                .clicks(totals.clicks)
                                .conversions(totals.conversions)
                                .revenue(totals.revenue)
                                .cpaRevenue(totals.cpaRevenue)
                                .cpmRevenue(totals.cpmRevenue)
                                .volume(Math.max(totals.volume, volume.getTotalSends()))
                                .build())
                .monthOverMonth(buildMonthOverMonth(data.getConversions(), totals.clicks))
                .cpmOffers(cpmOffers)
                .cpaOffers(cpaOffers)
                .cpmAttribution(cpm == null ? null : cpm.getSummary())
                .totalSends(volume.getTotalSends())
                .computedAt(clock.instant())
                .build();
    }

    private EntityReport rangeReport(
            CacheStore<String, EntityReport> cache,
            DateRange range,
            List<ReportDimension> dimensions,
            EntityReport periodic,
            String name) {
        EntityReport report = null;
        try {
            report =
                    cache.getOrFetch(
                            range.key(),
                            () ->
                                    trackingNetworkCalls.call(
                                            "getEntityReport",
                                            () ->
                                                    trackingNetworkClient.getEntityReport(
                                                            range.getFrom(), range.getTo(), dimensions)));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Range {} report for {} failed: {}", name, range, e.getMessage());
        }
        if (report != null && !report.isEmpty()) {
            log.debug("Using range {} report for {} ({} rows)", name, range, report.getTable().size());
            return report;
        }
        log.info("Range {} report unavailable for {}, using periodic report", name, range);
        return periodic;
    }

    /** CPM offer revenue for the range, falling back to the offer totals of the snapshot. */
    private Map<String, BigDecimal> cpmOfferRevenue(DateRange range, AttributionSnapshot snapshot) {
        Map<String, BigDecimal> revenue = new TreeMap<>();
        try {
            EntityReport offerReport =
                    trackingNetworkCalls.call(
                            "getEntityReport",
                            () ->
                                    trackingNetworkClient.getEntityReport(
                                            range.getFrom(), range.getTo(), List.of(ReportDimension.OFFER)));
            if (offerReport != null && !offerReport.isEmpty()) {
                for (EntityReportRow row : offerReport.getTable()) {
                    String offerId = row.id(ReportDimension.OFFER);
                    if (!offerId.isEmpty() && OfferType.isCpm(row.label(ReportDimension.OFFER))) {
                        revenue.put(
                                offerId,
                                row.getReporting() == null
                                        ? BigDecimal.ZERO
                                        : MoneyUtils.nullToZero(row.getReporting().getRevenue()));
                    }
                }
                return revenue;
            }
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Range offer report for {} failed: {}", range, e.getMessage());
        }
        log.info("Using cached offer totals for CPM revenue in {}", range);
        for (OfferPerformance offer : snapshot.getOffers()) {
            if (OfferType.isCpm(offer.getOfferName())) {
                revenue.put(offer.getOfferId(), MoneyUtils.nullToZero(offer.getRevenue()));
            }
        }
        return revenue;
    }

    /** Lookback conversions whose conversion date falls in the range. */
    private List<Conversion> conversionsFor(DateRange range, TrackingData data) {
        return reportCaches
                .conversions()
                .getOrFetch(
                        range.key(),
                        () ->
                                data.getConversions().stream()
                                        .filter(c -> c.getConversionDate() != null)
                                        .filter(c -> range.contains(c.getConversionDate()))
                                        .collect(Collectors.toList()));
    }

    private DataPartnerPerformance buildPartner(PartnerTally partner, PartnerVolumeView volume) {
        List<DataSetMetrics> dataSets = new ArrayList<>(partner.dataSets.size());
        for (DataSetTally dataSet : partner.dataSets.values()) {
            dataSets.add(
                    DataSetMetrics.builder()
                            .dataSetCode(dataSet.code)
                            .clicks(dataSet.clicks)
                            .conversions(dataSet.conversions)
                            .revenue(dataSet.revenue)
                            .volume(volume.forDataSet(dataSet.code, dataSet.clicks, dataSet.conversions))
                            .cvr(MoneyUtils.percentOf(dataSet.conversions, dataSet.clicks))
                            .epc(MoneyUtils.per(dataSet.revenue, dataSet.clicks))
                            .build());
        }
        dataSets.sort(
                Comparator.comparing(DataSetMetrics::getRevenue)
                        .reversed()
                        .thenComparing(DataSetMetrics::getDataSetCode));

        List<OfferPartnerMetrics> offers = new ArrayList<>(partner.offers.size());
        for (OfferTally offer : partner.offers.values()) {
            offers.add(
                    OfferPartnerMetrics.builder()
                            .offerId(offer.offerId)
                            .offerName(offer.offerName)
                            .cpm(offer.cpm)
                            .clicks(offer.clicks)
                            .conversions(offer.conversions)
                            .revenue(offer.revenue)
                            .build());
        }
        offers.sort(
                Comparator.comparing(OfferPartnerMetrics::getRevenue)
                        .reversed()
                        .thenComparing(OfferPartnerMetrics::getOfferId));

        List<PartnerDailyMetrics> daily = new ArrayList<>(partner.daily.size());
        partner.daily.forEach(
                (date, day) ->
                        daily.add(
                                PartnerDailyMetrics.builder()
                                        .date(date)
                                        .conversions(day.conversions)
                                        .revenue(day.revenue)
                                        .build()));

        return DataPartnerPerformance.builder()
                .partnerPrefix(partner.prefix)
                .partnerName(partner.name)
                .dataSetCode(partner.dataSetCode)
                .clicks(partner.clicks)
                .conversions(partner.conversions)
                .revenue(partner.revenue)
                .cpaRevenue(partner.cpaRevenue)
                .cpmRevenue(partner.cpmRevenue)
                .payout(partner.payout)
                .volume(volume.forPartner(partner.prefix, partner.clicks, partner.conversions))
                .conversionRate(MoneyUtils.percentOf(partner.conversions, partner.clicks))
                .epc(MoneyUtils.per(partner.revenue, partner.clicks))
                .dataSetBreakdown(dataSets)
                .offerBreakdown(offers)
                .dailySeries(daily)
                .build();
    }

    /** Inverts partner to offer breakdowns into offers with per-partner shares. */
    static void buildOfferCentricView(
            List<DataPartnerPerformance> partners,
            List<OfferPartnerBreakdown> cpmOffers,
            List<OfferPartnerBreakdown> cpaOffers) {
        Map<String, OfferPartnerBreakdown.OfferPartnerBreakdownBuilder> offers = new TreeMap<>();
        Map<String, Map<String, ShareTally>> sharesByOffer = new TreeMap<>();
        for (DataPartnerPerformance partner : partners) {
            for (OfferPartnerMetrics offer : partner.getOfferBreakdown()) {
                offers.computeIfAbsent(
                        offer.getOfferId(),
                        id ->
                                OfferPartnerBreakdown.builder()
                                        .offerId(id)
                                        .offerName(offer.getOfferName())
                                        .cpm(offer.isCpm()));
                ShareTally share =
                        sharesByOffer
                                .computeIfAbsent(offer.getOfferId(), id -> new TreeMap<>())
                                .computeIfAbsent(
                                        partner.getPartnerPrefix(),
                                        p -> new ShareTally(p, partner.getPartnerName()));
                share.clicks += offer.getClicks();
                share.conversions += offer.getConversions();
                share.revenue = share.revenue.add(offer.getRevenue());
            }
        }

        offers.forEach(
                (offerId, builder) -> {
                    long totalClicks = 0;
                    long totalConversions = 0;
                    BigDecimal totalRevenue = BigDecimal.ZERO;
                    for (ShareTally share : sharesByOffer.get(offerId).values()) {
                        totalClicks += share.clicks;
                        totalConversions += share.conversions;
                        totalRevenue = totalRevenue.add(share.revenue);
                    }
                    List<PartnerShare> shares = new ArrayList<>();
                    for (ShareTally share : sharesByOffer.get(offerId).values()) {
                        shares.add(
                                PartnerShare.builder()
                                        .partnerPrefix(share.prefix)
                                        .partnerName(share.name)
                                        .clicks(share.clicks)
                                        .conversions(share.conversions)
                                        .revenue(share.revenue)
                                        .clickShare(MoneyUtils.percentOf(share.clicks, totalClicks))
                                        .build());
                    }
                    shares.sort(
                            Comparator.comparing(PartnerShare::getRevenue)
                                    .reversed()
                                    .thenComparing(PartnerShare::getPartnerPrefix));
                    OfferPartnerBreakdown breakdown =
                            builder.totalClicks(totalClicks)
                                    .totalConversions(totalConversions)
                                    .totalRevenue(totalRevenue)
                                    .partners(shares)
                                    .build();
                    (breakdown.isCpm() ? cpmOffers : cpaOffers).add(breakdown);
                });

        Comparator<OfferPartnerBreakdown> byRevenue =
                Comparator.comparing(OfferPartnerBreakdown::getTotalRevenue)
                        .reversed()
                        .thenComparing(OfferPartnerBreakdown::getOfferId);
        cpmOffers.sort(byRevenue);
        cpaOffers.sort(byRevenue);
    }

    /**
     * Partner conversions this calendar month against last month. Clicks are not split by month,
     * so all window clicks count toward the current month.
     */
    MonthOverMonthComparison buildMonthOverMonth(List<Conversion> conversions, long windowClicks) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        ZonedDateTime currentStart = now.toLocalDate().withDayOfMonth(1).atStartOfDay(zoneId);
        ZonedDateTime previousStart = currentStart.minusMonths(1);

        long currentConversions = 0;
        long previousConversions = 0;
        BigDecimal currentRevenue = BigDecimal.ZERO;
        BigDecimal previousRevenue = BigDecimal.ZERO;
        for (Conversion conversion : conversions) {
            if (!notEmpty(conversion.getDataPartner()) || conversion.getConversionTime() == null) {
                continue;
            }
            ZonedDateTime time = conversion.getConversionTime();
            BigDecimal revenue = MoneyUtils.nullToZero(conversion.getRevenue());
            if (!time.isBefore(currentStart) && !time.isAfter(now)) {
                currentConversions++;
                currentRevenue = currentRevenue.add(revenue);
            } else if (!time.isBefore(previousStart) && time.isBefore(currentStart)) {
                previousConversions++;
                previousRevenue = previousRevenue.add(revenue);
            }
        }

        return MonthOverMonthComparison.builder()
                .currentMonth(monthSummary(currentStart, windowClicks, currentConversions, currentRevenue))
                .previousMonth(monthSummary(previousStart, 0, previousConversions, previousRevenue))
                .revenueChangePct(MoneyUtils.changePercent(currentRevenue, previousRevenue))
                .conversionsChangePct(
                        MoneyUtils.changePercent(
                                BigDecimal.valueOf(currentConversions),
                                BigDecimal.valueOf(previousConversions)))
                .clicksChangePct(BigDecimal.ZERO)
                .build();
    }

    private static PeriodSummary monthSummary(
            ZonedDateTime monthStart, long clicks, long conversions, BigDecimal revenue) {
        return PeriodSummary.builder()
                .label(MONTH_LABEL.format(monthStart))
                .clicks(clicks)
                .conversions(conversions)
                .revenue(revenue)
                .cpaRevenue(revenue)
                .cpmRevenue(BigDecimal.ZERO)
                .build();
    }

    private static PartnerTally partnerFor(
            Map<String, PartnerTally> partners, String key, String name, String dataSetCode) {
        return partners.computeIfAbsent(key, k -> new PartnerTally(k, name, dataSetCode));
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    private static class PartnerTally {
        final String prefix;
        final String name;
        final String dataSetCode;
        long clicks;
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal cpaRevenue = BigDecimal.ZERO;
        BigDecimal cpmRevenue = BigDecimal.ZERO;
        BigDecimal payout = BigDecimal.ZERO;
        final Map<LocalDate, DailyTally> daily = new TreeMap<>();
        final Map<String, DataSetTally> dataSets = new TreeMap<>();
        final Map<String, OfferTally> offers = new TreeMap<>();

        PartnerTally(String prefix, String name, String dataSetCode) {
            this.prefix = prefix;
            this.name = name;
            this.dataSetCode = dataSetCode;
        }

        /** Data set by code; an empty code falls back to the partner prefix. */
        DataSetTally dataSet(String code) {
            String key = notEmpty(code) ? code : prefix;
            return dataSets.computeIfAbsent(key, DataSetTally::new);
        }

        OfferTally offer(String offerId, String offerName) {
            return offers.computeIfAbsent(offerId, id -> new OfferTally(id, offerName));
        }
    }

    private static class DataSetTally {
        final String code;
        long clicks;
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;

        DataSetTally(String code) {
            this.code = code;
        }
    }

    private static class OfferTally {
        final String offerId;
        final String offerName;
        boolean cpm;
        long clicks;
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;

        OfferTally(String offerId, String offerName) {
            this.offerId = offerId;
            this.offerName = offerName;
        }
    }

    private static class DailyTally {
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;
    }

    private static class ShareTally {
        final String prefix;
        final String name;
        long clicks;
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;

        ShareTally(String prefix, String name) {
            this.prefix = prefix;
            this.name = name;
        }
    }

    private static class PeriodSummaryTally {
        long clicks;
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal cpaRevenue = BigDecimal.ZERO;
        BigDecimal cpmRevenue = BigDecimal.ZERO;
        long volume;

        void add(DataPartnerPerformance partner) {
            clicks += partner.getClicks();
            conversions += partner.getConversions();
            revenue = revenue.add(partner.getRevenue());
            cpaRevenue = cpaRevenue.add(partner.getCpaRevenue());
            cpmRevenue = cpmRevenue.add(partner.getCpmRevenue());
            VolumeFigure figure = partner.getVolume();
            volume += figure == null ? 0 : figure.getValue();
        }
    }
}
