package com.mailattribution.attribution;

import com.mailattribution.client.sending.CampaignMetadata;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.codec.ParsedCampaignName;
import com.mailattribution.exception.IdentifierParseException;
import com.mailattribution.model.CampaignRevenue;
import com.mailattribution.model.EspRevenuePerformance;
import com.mailattribution.model.OfferPerformance;
import com.mailattribution.model.ReconciliationMethod;
import com.mailattribution.model.ReconciliationReport;
import com.mailattribution.util.MoneyUtils;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Attributes revenue to sending service providers and reconciles it with the offer-level total.
 *
 * <p>Conversion-based ESP revenue comes from campaigns linked to the sending platform. The gap to
 * the offer total is then closed, in order, by distributing it along each offer's send volume
 * per ESP, by scaling the existing entries, or by a single "Unattributed" entry. Entries that
 * overshoot the offer total are scaled down. A final residual step puts whatever rounding left
 * over on the largest entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EspRevenueReconciler {

    public static final String UNKNOWN_ESP = "Unknown";
    public static final String UNATTRIBUTED_ESP = "Unattributed";

    private final IdentifierCodec identifierCodec;

    /** Groups ESP name variants under one display name. */
    public static String normalizeEspName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN_ESP;
        }
        switch (name) {
            case "SparkPost":
            case "SparkPost Enterprise":
            case "SparkPost Momentum":
                return "SparkPost";
            default:
                return name;
        }
    }

    public EspReconciliation reconcile(
            List<CampaignRevenue> campaigns,
            List<OfferPerformance> offers,
            List<CampaignMetadata> platformCampaigns) {
        Map<String, EspTally> espMap = new TreeMap<>();
        BigDecimal conversionBased = BigDecimal.ZERO;
        for (CampaignRevenue campaign : campaigns) {
            if (!campaign.isPlatformLinked()) {
                continue;
            }
            String espName = normalizeEspName(campaign.getEspName());
            espMap.computeIfAbsent(espName, EspTally::new).addCampaign(campaign);
            conversionBased = conversionBased.add(MoneyUtils.nullToZero(campaign.getRevenue()));
        }

        if (offers.isEmpty()) {
            log.debug("No offer totals available, skipping ESP reconciliation");
            BigDecimal total = totalRevenue(espMap);
            return new EspReconciliation(
                    buildEntries(espMap),
                    ReconciliationReport.builder()
                            .authoritativeTotal(BigDecimal.ZERO)
                            .conversionBasedTotal(conversionBased)
                            .gap(BigDecimal.ZERO)
                            .method(ReconciliationMethod.NONE)
                            .residual(BigDecimal.ZERO)
                            .finalAttributed(total)
                            .build());
        }

        BigDecimal authoritative = MoneyUtils.sum(offers, OfferPerformance::getRevenue);
        BigDecimal gap = authoritative.subtract(conversionBased);
        ReconciliationMethod method = ReconciliationMethod.NONE;
        boolean attributedViaOffers = false;

        if (gap.compareTo(MoneyUtils.ONE_CENT) > 0 && !platformCampaigns.isEmpty()) {
            log.info(
                    "ESP revenue gap of {} (offer total {}, conversion-based {})",
                    gap,
                    authoritative,
                    conversionBased);
            attributedViaOffers = distributeByOfferVolume(espMap, offers, platformCampaigns, gap);
            if (attributedViaOffers) {
                method = ReconciliationMethod.OFFER_VOLUME_DISTRIBUTION;
            }
        }

        BigDecimal current = totalRevenue(espMap);
        BigDecimal remaining = authoritative.subtract(current);
        if (remaining.compareTo(MoneyUtils.ONE_CENT) > 0
                && !espMap.isEmpty()
                && !attributedViaOffers
                && current.signum() > 0) {
            BigDecimal factor = MoneyUtils.divide(authoritative, current);
            log.info("Scaling {} ESP entries by {} to cover {} unattributed", espMap.size(), factor, remaining);
            espMap.values().forEach(esp -> esp.scale(factor));
            method = ReconciliationMethod.PROPORTIONAL_SCALE;
        } else if ((espMap.isEmpty() || current.signum() == 0) && authoritative.signum() > 0) {
            // Zero-revenue ESPs give no basis to scale by; they are kept as they are.
            log.info("No ESP attribution possible, creating {} entry for {}", UNATTRIBUTED_ESP, remaining);
            EspTally unattributed = espMap.computeIfAbsent(UNATTRIBUTED_ESP, EspTally::new);
            unattributed.revenue = unattributed.revenue.add(remaining);
            unattributed.payout =
                    unattributed.payout.add(MoneyUtils.sum(offers, OfferPerformance::getPayout));
            method = ReconciliationMethod.UNATTRIBUTED_ENTRY;
        } else if (remaining.compareTo(MoneyUtils.ONE_CENT.negate()) < 0 && current.signum() > 0) {
            BigDecimal factor = MoneyUtils.divide(authoritative, current);
            log.warn(
                    "ESP revenue {} exceeds offer total {}, scaling down by {}",
                    current,
                    authoritative,
                    factor);
            espMap.values().forEach(esp -> esp.scale(factor));
            method = ReconciliationMethod.SCALED_DOWN;
        }

        BigDecimal residual = authoritative.subtract(totalRevenue(espMap));
        if (residual.signum() == 0 || espMap.isEmpty()) {
            residual = BigDecimal.ZERO;
        } else if (residual.abs().compareTo(roundingTolerance(espMap.size())) <= 0) {
            EspTally largest =
                    espMap.values().stream()
                            .max(Comparator.comparing((EspTally esp) -> esp.revenue))
                            .orElseThrow();
            largest.revenue = largest.revenue.add(residual);
            log.debug("Moved rounding residual {} onto {}", residual, largest.name);
        } else if (residual.signum() > 0) {
            EspTally unattributed = espMap.computeIfAbsent(UNATTRIBUTED_ESP, EspTally::new);
            unattributed.revenue = unattributed.revenue.add(residual);
            log.warn("Residual {} left after {}, booked as {}", residual, method, UNATTRIBUTED_ESP);
        } else {
            BigDecimal factor = MoneyUtils.divide(authoritative, totalRevenue(espMap));
            espMap.values().forEach(esp -> esp.scale(factor));
            log.warn("Attributed revenue overshoots by {} after {}, scaled by {}", residual.negate(), method, factor);
        }

        List<EspRevenuePerformance> entries = buildEntries(espMap);
        BigDecimal finalAttributed = MoneyUtils.sum(entries, EspRevenuePerformance::getRevenue);
        log.info(
                "ESP revenue: {} entries, {} attributed (conversion-based {}, method {})",
                entries.size(),
                finalAttributed,
                conversionBased,
                method);

        return new EspReconciliation(
                entries,
                ReconciliationReport.builder()
                        .authoritativeTotal(authoritative)
                        .conversionBasedTotal(conversionBased)
                        .gap(gap)
                        .method(method)
                        .residual(residual)
                        .finalAttributed(finalAttributed)
                        .build());
    }

    /**
     * Spreads {@code gap} over ESPs in proportion to the offer revenue each ESP carried, where an
     * offer's revenue is split by its send volume per ESP.
     *
     * @return false when no offer could be mapped to an ESP
     */
    private boolean distributeByOfferVolume(
            Map<String, EspTally> espMap,
            List<OfferPerformance> offers,
            List<CampaignMetadata> platformCampaigns,
            BigDecimal gap) {
        Map<String, OfferEspVolume> volumes = buildOfferEspVolumeMap(platformCampaigns);
        log.debug(
                "Built offer-ESP volume map for {} offers from {} campaigns",
                volumes.size(),
                platformCampaigns.size());

        Map<String, EspTally> offerBased = new TreeMap<>();
        for (OfferPerformance offer : offers) {
            OfferEspVolume volume = volumes.get(offer.getOfferId());
            if (volume == null || volume.totalSent == 0) {
                continue;
            }
            volume.sentByEsp.forEach(
                    (espName, sent) -> {
                        EspTally esp = offerBased.computeIfAbsent(espName, EspTally::new);
                        esp.revenue =
                                esp.revenue.add(
                                        MoneyUtils.share(offer.getRevenue(), sent, volume.totalSent));
                        esp.payout =
                                esp.payout.add(
                                        MoneyUtils.share(offer.getPayout(), sent, volume.totalSent));
                        esp.sent += sent;
                    });
        }

        BigDecimal offerBasedTotal = totalRevenue(offerBased);
        if (offerBasedTotal.signum() <= 0) {
            log.info("No offer could be mapped to an ESP by send volume");
            return false;
        }

        BigDecimal factor = MoneyUtils.divide(gap, offerBasedTotal);
        offerBased.forEach(
                (espName, share) -> {
                    BigDecimal additionalRevenue = MoneyUtils.scale(share.revenue, factor);
                    BigDecimal additionalPayout = MoneyUtils.scale(share.payout, factor);
                    EspTally existing = espMap.get(espName);
                    if (existing != null) {
                        existing.revenue = existing.revenue.add(additionalRevenue);
                        existing.payout = existing.payout.add(additionalPayout);
                    } else {
                        EspTally created = new EspTally(espName);
                        created.revenue = additionalRevenue;
                        created.payout = additionalPayout;
                        created.sent = share.sent;
                        espMap.put(espName, created);
                    }
                    log.debug("Distributed {} of the gap to {}", additionalRevenue, espName);
                });
        return true;
    }

    /** Send volume per ESP for each offer id found in a sending-platform campaign name. */
    Map<String, OfferEspVolume> buildOfferEspVolumeMap(List<CampaignMetadata> platformCampaigns) {
        Map<String, OfferEspVolume> volumes = new TreeMap<>();
        for (CampaignMetadata campaign : platformCampaigns) {
            if (campaign.getSent() == 0
                    || campaign.getEspName() == null
                    || campaign.getEspName().isEmpty()) {
                continue;
            }
            ParsedCampaignName parsed;
            try {
                parsed = identifierCodec.parseCampaignName(campaign.getName());
            } catch (IdentifierParseException e) {
                log.trace("Campaign {} name carries no offer: {}", campaign.getMailingId(), e.getMessage());
                continue;
            }
            if (parsed.getOfferId() == null || parsed.getOfferId().isEmpty()) {
                continue;
            }
            OfferEspVolume volume = volumes.computeIfAbsent(parsed.getOfferId(), k -> new OfferEspVolume());
            volume.totalSent += campaign.getSent();
            volume.sentByEsp.merge(normalizeEspName(campaign.getEspName()), campaign.getSent(), Long::sum);
        }
        return volumes;
    }

    /** Rounding can leave at most one cent per entry. */
    private static BigDecimal roundingTolerance(int entries) {
        return MoneyUtils.ONE_CENT.multiply(BigDecimal.valueOf(entries));
    }

        private static BigDecimal totalRevenue(Map<String, EspTally> espMap) {
        BigDecimal total = BigDecimal.ZERO;
        for (EspTally esp : espMap.values()) {
            total = total.add(esp.revenue);
        }
        return total;
    }

    private static List<EspRevenuePerformance> buildEntries(Map<String, EspTally> espMap) {
        BigDecimal total = totalRevenue(espMap);
        List<EspRevenuePerformance> entries = new ArrayList<>(espMap.size());
        for (EspTally esp : espMap.values()) {
            entries.add(
                    EspRevenuePerformance.builder()
                            .espName(esp.name)
                            .campaignCount(esp.campaignCount)
                            .totalSent(esp.sent)
                            .totalDelivered(esp.delivered)
                            .totalOpens(esp.opens)
                            .clicks(esp.clicks)
                            .conversions(esp.conversions)
                            .revenue(esp.revenue)
                            .payout(esp.payout)
                            .percentage(MoneyUtils.percentOf(esp.revenue, total))
                            .avgEcpm(MoneyUtils.perThousand(esp.revenue, esp.delivered))
                            .conversionRate(MoneyUtils.ratio(esp.conversions, esp.clicks))
                            .epc(MoneyUtils.per(esp.revenue, esp.clicks))
                            .build());
        }
        entries.sort(
                Comparator.comparing(EspRevenuePerformance::getRevenue)
                        .reversed()
                        .thenComparing(EspRevenuePerformance::getEspName));
        return entries;
    }

    static class OfferEspVolume {
        long totalSent;
        final Map<String, Long> sentByEsp = new TreeMap<>();
    }

    private static class EspTally {
        final String name;
        int campaignCount;
        long sent;
        long delivered;
        long opens;
        long clicks;
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal payout = BigDecimal.ZERO;

        EspTally(String name) {
            this.name = name;
        }

        void addCampaign(CampaignRevenue campaign) {
            campaignCount++;
            sent += campaign.getSent();
            delivered += campaign.getDelivered();
            opens += campaign.getUniqueOpens();
            clicks += campaign.getClicks();
            conversions += campaign.getConversions();
            revenue = revenue.add(MoneyUtils.nullToZero(campaign.getRevenue()));
            payout = payout.add(MoneyUtils.nullToZero(campaign.getPayout()));
        }

        void scale(BigDecimal factor) {
            revenue = MoneyUtils.scale(revenue, factor);
            payout = MoneyUtils.scale(payout, factor);
        }
    }
}
