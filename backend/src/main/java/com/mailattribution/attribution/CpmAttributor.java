package com.mailattribution.attribution;

import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.client.tracking.EntityReportRow;
import com.mailattribution.client.tracking.ReportDimension;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.codec.OfferType;
import com.mailattribution.codec.ParsedSub2;
import com.mailattribution.codec.PartnerCatalog;
import com.mailattribution.model.CpmAttributionSummary;
import com.mailattribution.util.MoneyUtils;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits CPM offer revenue across data partners by click share.
 *
 * <p>For every CPM offer in the offer x sub2 report, a partner receives {@code offer revenue x
 * partner clicks / offer clicks}. Offers with revenue but no attributable clicks are reported and
 * their revenue stays unattributed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CpmAttributor {

    private final IdentifierCodec identifierCodec;

    /**
     * @param offerPartnerReport offer x sub2 click report
     * @param cpmOfferRevenue revenue per CPM offer id for the same window
     */
    public CpmAttribution attribute(
            EntityReport offerPartnerReport, Map<String, BigDecimal> cpmOfferRevenue) {
        Map<String, OfferClicks> byOffer = new TreeMap<>();
        if (offerPartnerReport != null) {
            for (EntityReportRow row : offerPartnerReport.getTable()) {
                String offerId = row.id(ReportDimension.OFFER);
                String offerName = row.label(ReportDimension.OFFER);
                String sub2 = row.label(ReportDimension.SUB2);
                if (offerId.isEmpty() || sub2.isEmpty() || !OfferType.isCpm(offerName)) {
                    continue;
                }
                Optional<ParsedSub2> parsed = identifierCodec.parseSub2(sub2);
                if (parsed.isEmpty() || !parsed.get().isAttributable()) {
                    continue;
                }
                long clicks = row.getReporting() == null ? 0 : row.getReporting().getTotalClick();
                OfferClicks offer =
                        byOffer.computeIfAbsent(offerId, id -> new OfferClicks(id, offerName));
                offer.clicksByPartner.merge(
                        parsed.get().getPartnerPrefix().toUpperCase(Locale.ROOT), clicks, Long::sum);
                offer.totalClicks += clicks;
            }
        }

        PartnerCatalog partnerCatalog = identifierCodec.getPartnerCatalog();
        List<CpmAttribution.PartnerOfferShare> shares = new ArrayList<>();
        List<String> zeroClickOffers = new ArrayList<>();
        BigDecimal attributed = BigDecimal.ZERO;

        for (OfferClicks offer : byOffer.values()) {
            BigDecimal revenue = MoneyUtils.nullToZero(cpmOfferRevenue.get(offer.offerId));
            if (offer.totalClicks == 0 || revenue.signum() == 0) {
                if (revenue.signum() > 0) {
                    log.warn(
                            "CPM offer {} ({}) has {} revenue but 0 clicks",
                            offer.offerId,
                            offer.offerName,
                            revenue);
                    zeroClickOffers.add(offer.offerId);
                }
                continue;
            }
            for (Map.Entry<String, Long> entry : offer.clicksByPartner.entrySet()) {
                BigDecimal share = MoneyUtils.share(revenue, entry.getValue(), offer.totalClicks);
                shares.add(
                        CpmAttribution.PartnerOfferShare.builder()
                                .partnerKey(entry.getKey())
                                .partnerName(partnerCatalog.nameOf(entry.getKey()))
                                .offerId(offer.offerId)
                                .offerName(offer.offerName)
                                .clicks(entry.getValue())
                                .revenue(share)
                                .build());
                attributed = attributed.add(share);
            }
            log.debug(
                    "CPM offer {} ({}): {} revenue over {} clicks across {} partners",
                    offer.offerId,
                    offer.offerName,
                    revenue,
                    offer.totalClicks,
                    offer.clicksByPartner.size());
        }

        for (Map.Entry<String, BigDecimal> entry : new TreeMap<>(cpmOfferRevenue).entrySet()) {
            if (!byOffer.containsKey(entry.getKey()) && MoneyUtils.nullToZero(entry.getValue()).signum() > 0) {
                log.warn("CPM offer {} has {} revenue but no partner clicks", entry.getKey(), entry.getValue());
                zeroClickOffers.add(entry.getKey());
            }
        }

        BigDecimal total = MoneyUtils.sum(cpmOfferRevenue.values(), v -> v);
        BigDecimal unattributed = total.subtract(attributed);
        if (unattributed.compareTo(MoneyUtils.ONE_CENT) > 0) {
            log.info("{} CPM revenue left unattributed", unattributed);
        }
        log.info(
                "CPM attribution: {} offers, {} attributed of {}",
                byOffer.size(),
                attributed,
                total);

        return new CpmAttribution(
                shares,
                CpmAttributionSummary.builder()
                        .cpmOfferCount(cpmOfferRevenue.size())
                        .totalCpmRevenue(total)
                        .attributedRevenue(attributed)
                        .unattributedRevenue(unattributed)
                        .zeroClickOfferIds(List.copyOf(zeroClickOffers))
                        .build());
    }

    private static class OfferClicks {
        final String offerId;
        final String offerName;
        final Map<String, Long> clicksByPartner = new TreeMap<>();
        long totalClicks;

        OfferClicks(String offerId, String offerName) {
            this.offerId = offerId;
            this.offerName = offerName;
        }
    }
}
