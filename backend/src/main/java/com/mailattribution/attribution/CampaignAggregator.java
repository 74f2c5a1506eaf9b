package com.mailattribution.attribution;

import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.client.tracking.EntityReportRow;
import com.mailattribution.client.tracking.ReportDimension;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.codec.OfferType;
import com.mailattribution.codec.ParsedSub1;
import com.mailattribution.codec.PropertyCatalog;
import com.mailattribution.codec.Sub1Classification;
import com.mailattribution.codec.Sub1Reason;
import com.mailattribution.model.CampaignRevenue;
import com.mailattribution.model.Click;
import com.mailattribution.model.Conversion;
import com.mailattribution.model.DailyPerformance;
import com.mailattribution.model.OfferPerformance;
import com.mailattribution.model.PropertyPerformance;
import com.mailattribution.model.TodaySummary;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds campaign, property, offer and daily totals.
 *
 * <p>Entity reports are preferred: the sub1 report drives campaigns and properties, the offer
 * report drives offers and the date report drives daily totals. Whatever report is missing or
 * empty is rebuilt from raw clicks and conversions. Rows that cannot be tied to a known property
 * are bucketed by {@link Sub1Reason}; nothing is dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignAggregator {

    public static final String UNATTRIBUTED_CODE = "UNATTRIBUTED";
    public static final String UNATTRIBUTED_NAME = "Unattributed";
    public static final String UNKNOWN_PROPERTY_CODE = "UNKNOWN_PROPERTY";
    public static final String UNKNOWN_PROPERTY_NAME = "Unknown Property";

    private final IdentifierCodec identifierCodec;
    private final UnknownPropertyResolver unknownPropertyResolver;

    public AggregationResult aggregate(AggregationInput input) {
        Map<String, String> offerNames = offerNamesFromConversions(input.getConversions());

        Map<LocalDate, Tally> daily =
                hasRows(input.getDateReport())
                        ? dailyFromReport(input.getDateReport(), input.getZoneId())
                        : dailyFromRecords(input.getClicks(), input.getConversions());

        List<OfferPerformance> offers =
                hasRows(input.getOfferReport())
                        ? offersFromReport(input.getOfferReport(), offerNames)
                        : offersFromRecords(input.getClicks(), input.getConversions());

        Map<Sub1Reason, Tally> buckets = new EnumMap<>(Sub1Reason.class);
        Map<String, CampaignTally> campaigns = campaignsFromReport(input.getSub1Report(), buckets);
        boolean fromSub1Report = !campaigns.isEmpty();
        if (!fromSub1Report) {
            if (input.getSub1Report() != null) {
                log.info("sub1 report has no mailing rows, aggregating campaigns from conversions");
            }
            buckets.clear();
            campaigns = campaignsFromRecords(input.getClicks(), input.getConversions(), buckets);
        }

        Map<String, Tally> properties = new TreeMap<>();
        for (CampaignTally campaign : campaigns.values()) {
            if (campaign.reason == Sub1Reason.KNOWN_PROPERTY) {
                properties.computeIfAbsent(campaign.propertyCode, k -> new Tally()).add(campaign.tally);
            }
        }

        int resolved = resolveUnknownProperties(campaigns, properties, buckets);

        return AggregationResult.builder()
                .campaigns(buildCampaigns(campaigns, offerNames))
                .properties(buildProperties(properties, buckets, input.getConversions()))
                .offers(offers)
                .daily(buildDaily(daily))
                .unattributedByReason(buildReasonRows(buckets))
                .today(buildToday(daily, input.getToday()))
                .fromSub1Report(fromSub1Report)
                .resolvedUnknownProperties(resolved)
                .build();
    }

    private static boolean hasRows(EntityReport report) {
        return report != null && !report.isEmpty();
    }

    private static Map<String, String> offerNamesFromConversions(List<Conversion> conversions) {
        Map<String, String> names = new HashMap<>();
        for (Conversion conversion : conversions) {
            if (conversion.getOfferName() != null && !conversion.getOfferName().isEmpty()) {
                names.put(conversion.getOfferId(), conversion.getOfferName());
            }
        }
        return names;
    }

    // Daily

    private Map<LocalDate, Tally> dailyFromReport(EntityReport report, ZoneId zoneId) {
        Map<LocalDate, Tally> daily = new HashMap<>();
        for (EntityReportRow row : report.getTable()) {
            String id = row.id(ReportDimension.DATE);
            if (id.isEmpty()) {
                continue;
            }
            long epochSeconds;
            try {
                epochSeconds = Long.parseLong(id);
            } catch (NumberFormatException e) {
                log.debug("Skipping date row with non-numeric id '{}'", id);
                continue;
            }
            if (epochSeconds == 0) {
                continue;
            }
            LocalDate date = Instant.ofEpochSecond(epochSeconds).atZone(zoneId).toLocalDate();
            daily.computeIfAbsent(date, d -> new Tally()).add(row.getReporting());
        }
        return daily;
    }

    private Map<LocalDate, Tally> dailyFromRecords(List<Click> clicks, List<Conversion> conversions) {
        Map<LocalDate, Tally> daily = new HashMap<>();
        for (Click click : clicks) {
            if (click.getTimestamp() != null) {
                daily.computeIfAbsent(click.getTimestamp().toLocalDate(), d -> new Tally()).addClick();
            }
        }
        for (Conversion conversion : conversions) {
            if (conversion.getConversionDate() != null) {
                daily.computeIfAbsent(conversion.getConversionDate(), d -> new Tally())
                        .addConversion(conversion);
            }
        }
        return daily;
    }

    private static List<DailyPerformance> buildDaily(Map<LocalDate, Tally> daily) {
        List<DailyPerformance> rows = new ArrayList<>(daily.size());
        daily.forEach(
                (date, tally) ->
                        rows.add(
                                DailyPerformance.builder()
                                        .date(date)
                                        .clicks(tally.getClicks())
                                        .conversions(tally.getConversions())
                                        .revenue(tally.getRevenue())
                                        .payout(tally.getPayout())
                                        .conversionRate(tally.conversionRate())
                                        .epc(tally.epc())
                                        .build()));
        rows.sort(Comparator.comparing(DailyPerformance::getDate).reversed());
        return rows;
    }

    private static TodaySummary buildToday(Map<LocalDate, Tally> daily, LocalDate today) {
        Tally tally = today == null ? null : daily.get(today);
        if (tally == null) {
            tally = new Tally();
        }
        return TodaySummary.builder()
                .date(today)
                .clicks(tally.getClicks())
                .conversions(tally.getConversions())
                .revenue(tally.getRevenue())
                .payout(tally.getPayout())
                .build();
    }

    // Offers

    private List<OfferPerformance> offersFromReport(
            EntityReport report, Map<String, String> offerNames) {
        Map<String, String> names = new HashMap<>();
        Map<String, Tally> offers = new HashMap<>();
        for (EntityReportRow row : report.getTable()) {
            String offerId = row.id(ReportDimension.OFFER);
            if (offerId.isEmpty()) {
                continue;
            }
            offers.computeIfAbsent(offerId, k -> new Tally()).add(row.getReporting());
            String label = row.label(ReportDimension.OFFER);
            if (!label.isEmpty()) {
                names.put(offerId, label);
            }
        }
        offerNames.forEach(names::putIfAbsent);
        return buildOffers(offers, names);
    }

    private List<OfferPerformance> offersFromRecords(List<Click> clicks, List<Conversion> conversions) {
        Map<String, String> names = new HashMap<>();
        Map<String, Tally> offers = new HashMap<>();
        for (Click click : clicks) {
            String offerId = nullToEmpty(click.getOfferId());
            offers.computeIfAbsent(offerId, k -> new Tally()).addClick();
            if (click.getOfferName() != null) {
                names.putIfAbsent(offerId, click.getOfferName());
            }
        }
        for (Conversion conversion : conversions) {
            String offerId = nullToEmpty(conversion.getOfferId());
            offers.computeIfAbsent(offerId, k -> new Tally()).addConversion(conversion);
            if (conversion.getOfferName() != null) {
                names.putIfAbsent(offerId, conversion.getOfferName());
            }
        }
        return buildOffers(offers, names);
    }

    private static List<OfferPerformance> buildOffers(
            Map<String, Tally> offers, Map<String, String> names) {
        List<OfferPerformance> rows = new ArrayList<>(offers.size());
        offers.forEach(
                (offerId, tally) -> {
                    String name = names.get(offerId);
                    rows.add(
                            OfferPerformance.builder()
                                    .offerId(offerId)
                                    .offerName(name)
                                    .offerType(OfferType.fromOfferName(name))
                                    .clicks(tally.getClicks())
                                    .conversions(tally.getConversions())
                                    .revenue(tally.getRevenue())
                                    .payout(tally.getPayout())
                                    .conversionRate(tally.conversionRate())
                                    .epc(tally.epc())
                                    .build());
                });
        rows.sort(
                Comparator.comparing(OfferPerformance::getRevenue)
                        .reversed()
                        .thenComparing(OfferPerformance::getOfferId));
        return rows;
    }

    // Campaigns and properties

    private Map<String, CampaignTally> campaignsFromReport(
            EntityReport report, Map<Sub1Reason, Tally> buckets) {
        Map<String, CampaignTally> campaigns = new LinkedHashMap<>();
        if (report == null) {
            return campaigns;
        }
        for (EntityReportRow row : report.getTable()) {
            String sub1 = row.label(ReportDimension.SUB1);
            Sub1Classification classification = identifierCodec.classifySub1(sub1);
            Tally tally = new Tally();
            tally.add(row.getReporting());
            if (classification.getReason().isUntagged()) {
                buckets.computeIfAbsent(classification.getReason(), r -> new Tally()).add(tally);
                continue;
            }
            campaignFor(campaigns, sub1, classification, null).add(tally, buckets);
        }
        return campaigns;
    }

    private Map<String, CampaignTally> campaignsFromRecords(
            List<Click> clicks, List<Conversion> conversions, Map<Sub1Reason, Tally> buckets) {
        Map<String, CampaignTally> campaigns = new LinkedHashMap<>();
        for (Click click : clicks) {
            Sub1Classification classification = identifierCodec.classifySub1(click.getSub1());
            Tally tally = new Tally();
            tally.addClick();
            if (classification.getReason().isUntagged()) {
                buckets.computeIfAbsent(classification.getReason(), r -> new Tally()).add(tally);
                continue;
            }
            campaignFor(campaigns, click.getSub1(), classification, click.getOfferId())
                    .add(tally, buckets);
        }
        for (Conversion conversion : conversions) {
            Sub1Classification classification = identifierCodec.classifySub1(conversion.getSub1());
            Tally tally = new Tally();
            tally.addConversion(conversion);
            if (classification.getReason().isUntagged()) {
                buckets.computeIfAbsent(classification.getReason(), r -> new Tally()).add(tally);
                continue;
            }
            campaignFor(campaigns, conversion.getSub1(), classification, conversion.getOfferId())
                    .add(tally, buckets);
        }
        return campaigns;
    }

    private CampaignTally campaignFor(
            Map<String, CampaignTally> campaigns,
            String sub1,
            Sub1Classification classification,
            String recordOfferId) {
        ParsedSub1 parsed = classification.getParsed();
        return campaigns.computeIfAbsent(
                parsed.getMailingId(),
                id -> {
                    CampaignTally campaign = new CampaignTally();
                    campaign.mailingId = id;
                    campaign.campaignName = sub1;
                    campaign.reason = classification.getReason();
                    campaign.propertyCode = parsed.getPropertyCode();
                    campaign.propertyName = parsed.getPropertyName();
                    campaign.offerId = parsed.getOfferId() != null ? parsed.getOfferId() : recordOfferId;
                    return campaign;
                });
    }

    /**
     * Moves campaigns with an uncatalogued property onto the property their sending-platform
     * campaign name points at. Unresolved campaigns stay in the Unknown Property bucket.
     */
    private int resolveUnknownProperties(
            Map<String, CampaignTally> campaigns,
            Map<String, Tally> properties,
            Map<Sub1Reason, Tally> buckets) {
        List<String> unknown = new ArrayList<>();
        for (CampaignTally campaign : campaigns.values()) {
            if (campaign.reason == Sub1Reason.UNKNOWN_PROPERTY) {
                unknown.add(campaign.mailingId);
            }
        }
        if (unknown.isEmpty()) {
            return 0;
        }

        Map<String, String> resolved;
        try {
            resolved = unknownPropertyResolver.resolvePropertyCodes(unknown);
        } catch (RuntimeException e) {
            log.warn("Unknown-property resolution failed for {} campaigns: {}", unknown.size(), e.getMessage());
            return 0;
        }

        PropertyCatalog catalog = identifierCodec.getPropertyCatalog();
        int count = 0;
        for (String mailingId : unknown) {
            String code = resolved.get(mailingId);
            if (code == null || !catalog.isKnown(code)) {
                continue;
            }
            CampaignTally campaign = campaigns.get(mailingId);
            campaign.propertyCode = code.toUpperCase(Locale.ROOT);
            campaign.propertyName = catalog.nameOf(code);
            campaign.reason = Sub1Reason.KNOWN_PROPERTY;
            properties.computeIfAbsent(campaign.propertyCode, k -> new Tally()).add(campaign.tally);
            buckets.get(Sub1Reason.UNKNOWN_PROPERTY).subtract(campaign.tally);
            count++;
        }
        log.info("Resolved {} of {} unknown-property campaigns", count, unknown.size());
        return count;
    }

    private static List<CampaignRevenue> buildCampaigns(
            Map<String, CampaignTally> campaigns, Map<String, String> offerNames) {
        List<CampaignRevenue> rows = new ArrayList<>(campaigns.size());
        for (CampaignTally campaign : campaigns.values()) {
            Tally tally = campaign.tally;
            rows.add(
                    CampaignRevenue.builder()
                            .mailingId(campaign.mailingId)
                            .campaignName(campaign.campaignName)
                            .propertyCode(campaign.propertyCode)
                            .propertyName(campaign.propertyName)
                            .offerId(campaign.offerId)
                            .offerName(campaign.offerId == null ? null : offerNames.get(campaign.offerId))
                            .clicks(tally.getClicks())
                            .conversions(tally.getConversions())
                            .revenue(tally.getRevenue())
                            .payout(tally.getPayout())
                            .conversionRate(tally.conversionRate())
                            .epc(tally.epc())
                            .build());
        }
        rows.sort(
                Comparator.comparing(CampaignRevenue::getRevenue)
                        .reversed()
                        .thenComparing(CampaignRevenue::getMailingId));
        return rows;
    }

    private List<PropertyPerformance> buildProperties(
            Map<String, Tally> properties,
            Map<Sub1Reason, Tally> buckets,
            List<Conversion> conversions) {
        PropertyCatalog catalog = identifierCodec.getPropertyCatalog();
        Map<String, Set<String>> offersByProperty = new HashMap<>();
        for (Conversion conversion : conversions) {
            if (conversion.getPropertyCode() != null) {
                offersByProperty
                        .computeIfAbsent(conversion.getPropertyCode(), k -> new HashSet<>())
                        .add(nullToEmpty(conversion.getOfferId()));
            }
        }

        List<PropertyPerformance> rows = new ArrayList<>();
        properties.forEach(
                (code, tally) ->
                        rows.add(
                                propertyRow(code, catalog.nameOf(code), tally, null)
                                        .uniqueOffers(
                                                offersByProperty
                                                        .getOrDefault(code, Collections.emptySet())
                                                        .size())
                                        .build()));

        Tally untagged = new Tally();
        Sub1Reason dominant = null;
        BigDecimal dominantRevenue = null;
        for (Sub1Reason reason : Sub1Reason.values()) {
            Tally bucket = buckets.get(reason);
            if (bucket == null || !reason.isUntagged()) {
                continue;
            }
            untagged.add(bucket);
            if (dominantRevenue == null || bucket.getRevenue().compareTo(dominantRevenue) > 0) {
                dominant = reason;
                dominantRevenue = bucket.getRevenue();
            }
        }
        if (untagged.getRevenue().signum() > 0) {
            rows.add(propertyRow(UNATTRIBUTED_CODE, UNATTRIBUTED_NAME, untagged, dominant).build());
        }

        Tally unknown = buckets.get(Sub1Reason.UNKNOWN_PROPERTY);
        if (unknown != null && unknown.getRevenue().signum() > 0) {
            rows.add(
                    propertyRow(
                                    UNKNOWN_PROPERTY_CODE,
                                    UNKNOWN_PROPERTY_NAME,
                                    unknown,
                                    Sub1Reason.UNKNOWN_PROPERTY)
                            .build());
        }

        rows.sort(
                Comparator.comparing(PropertyPerformance::getRevenue)
                        .reversed()
                        .thenComparing(PropertyPerformance::getPropertyCode));
        return rows;
    }

    private static Map<Sub1Reason, PropertyPerformance> buildReasonRows(Map<Sub1Reason, Tally> buckets) {
        Map<Sub1Reason, PropertyPerformance> rows = new EnumMap<>(Sub1Reason.class);
        buckets.forEach(
                (reason, tally) -> {
                    if (!tally.isEmpty()) {
                        rows.put(reason, propertyRow(reason.name(), reason.name(), tally, reason).build());
                    }
                });
        return Collections.unmodifiableMap(rows);
    }

    private static PropertyPerformance.PropertyPerformanceBuilder propertyRow(
            String code, String name, Tally tally, Sub1Reason reason) {
        return PropertyPerformance.builder()
                .propertyCode(code)
                .propertyName(name)
                .clicks(tally.getClicks())
                .conversions(tally.getConversions())
                .revenue(tally.getRevenue())
                .payout(tally.getPayout())
                .conversionRate(tally.conversionRate())
                .epc(tally.epc())
                .unattributed(reason != null)
                .unattributedReason(reason);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /** Per-mailing accumulator; unknown-property campaigns also feed the Unknown Property bucket. */
    private static class CampaignTally {
        String mailingId;
        String campaignName;
        String propertyCode;
        String propertyName;
        String offerId;
        Sub1Reason reason;
        final Tally tally = new Tally();

        void add(Tally delta, Map<Sub1Reason, Tally> buckets) {
            tally.add(delta);
            if (reason == Sub1Reason.UNKNOWN_PROPERTY) {
                buckets.computeIfAbsent(Sub1Reason.UNKNOWN_PROPERTY, r -> new Tally()).add(delta);
            }
        }
    }
}
