package com.mailattribution.attribution;

import com.mailattribution.model.DailyPerformance;
import com.mailattribution.model.PeriodPerformance;
import com.mailattribution.util.MoneyUtils;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import lombok.experimental.UtilityClass;

/** Weekly (ISO week) and monthly roll-ups of daily performance, newest period first. */
@UtilityClass
public class PeriodRollups {

    public static List<PeriodPerformance> weekly(List<DailyPerformance> daily) {
        return rollUp(daily, PeriodRollups::isoWeekKey, PeriodPerformance.PeriodType.WEEKLY);
    }

    public static List<PeriodPerformance> monthly(List<DailyPerformance> daily) {
        return rollUp(
                daily,
                date -> String.format("%04d-%02d", date.getYear(), date.getMonthValue()),
                PeriodPerformance.PeriodType.MONTHLY);
    }

    /** e.g. {@code 2026-W05}; the year is the ISO week-based year. */
    public static String isoWeekKey(LocalDate date) {
        return String.format(
                "%04d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    private static List<PeriodPerformance> rollUp(
            List<DailyPerformance> daily,
            Function<LocalDate, String> periodKey,
            PeriodPerformance.PeriodType type) {
        Map<String, long[]> counts = new TreeMap<>();
        Map<String, BigDecimal[]> money = new TreeMap<>();
        for (DailyPerformance day : daily) {
            String key = periodKey.apply(day.getDate());
            long[] c = counts.computeIfAbsent(key, k -> new long[2]);
            c[0] += day.getClicks();
            c[1] += day.getConversions();
            BigDecimal[] m =
                    money.computeIfAbsent(key, k -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            m[0] = m[0].add(MoneyUtils.nullToZero(day.getRevenue()));
            m[1] = m[1].add(MoneyUtils.nullToZero(day.getPayout()));
        }

        List<PeriodPerformance> periods = new ArrayList<>(counts.size());
        counts.forEach(
                (key, c) -> {
                    BigDecimal[] m = money.get(key);
                    periods.add(
                            PeriodPerformance.builder()
                                    .period(key)
                                    .periodType(type)
                                    .totalClicks(c[0])
                                    .totalConversions(c[1])
                                    .totalRevenue(m[0])
                                    .totalPayout(m[1])
                                    .conversionRate(MoneyUtils.ratio(c[1], c[0]))
                                    .epc(MoneyUtils.per(m[0], c[0]))
                                    .build());
                });
        periods.sort(Comparator.comparing(PeriodPerformance::getPeriod).reversed());
        return periods;
    }
}
