package com.mailattribution.attribution;

import com.mailattribution.codec.OfferType;
import com.mailattribution.model.Conversion;
import com.mailattribution.model.OfferPerformance;
import com.mailattribution.model.RevenueBreakdown;
import com.mailattribution.util.MoneyUtils;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/** Splits revenue into CPM and conversion-based offers, with a daily trend from conversions. */
@Component
public class RevenueBreakdownCalculator {

    public RevenueBreakdown calculate(List<OfferPerformance> offers, List<Conversion> conversions) {
        TypeTally cpm = new TypeTally();
        TypeTally nonCpm = new TypeTally();
        for (OfferPerformance offer : offers) {
            (OfferType.isCpm(offer.getOfferName()) ? cpm : nonCpm).add(offer);
        }
        BigDecimal total = cpm.revenue.add(nonCpm.revenue);

        Map<LocalDate, BigDecimal[]> daily = new TreeMap<>();
        for (Conversion conversion : conversions) {
            if (conversion.getConversionDate() == null) {
                continue;
            }
            BigDecimal[] day =
                    daily.computeIfAbsent(
                            conversion.getConversionDate(),
                            d -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            int slot = OfferType.isCpm(conversion.getOfferName()) ? 0 : 1;
            day[slot] = day[slot].add(MoneyUtils.nullToZero(conversion.getRevenue()));
        }

        List<RevenueBreakdown.DailyBreakdown> trend = new ArrayList<>(daily.size());
        daily.forEach((date, day) -> trend.add(new RevenueBreakdown.DailyBreakdown(date, day[0], day[1])));
        trend.sort(Comparator.comparing(RevenueBreakdown.DailyBreakdown::getDate).reversed());

        return RevenueBreakdown.builder()
                .cpm(cpm.toTotals(total))
                .nonCpm(nonCpm.toTotals(total))
                .dailyTrend(trend)
                .build();
    }

    private static class TypeTally {
        int offerCount;
        long clicks;
        long conversions;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal payout = BigDecimal.ZERO;

        void add(OfferPerformance offer) {
            offerCount++;
            clicks += offer.getClicks();
            conversions += offer.getConversions();
            revenue = revenue.add(MoneyUtils.nullToZero(offer.getRevenue()));
            payout = payout.add(MoneyUtils.nullToZero(offer.getPayout()));
        }

        RevenueBreakdown.RevenueTypeTotals toTotals(BigDecimal total) {
            return RevenueBreakdown.RevenueTypeTotals.builder()
                    .offerCount(offerCount)
                    .clicks(clicks)
                    .conversions(conversions)
                    .revenue(revenue)
                    .payout(payout)
                    .percentage(MoneyUtils.percentOf(revenue, total))
                    .build();
        }
    }
}
