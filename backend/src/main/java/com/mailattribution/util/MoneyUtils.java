package com.mailattribution.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;
import lombok.experimental.UtilityClass;

/** BigDecimal arithmetic for revenue, rates and per-thousand metrics. */
@UtilityClass
public class MoneyUtils {

    // Default scale for decimal places in calculations
    public static final int CALCULATION_SCALE = 10;

    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public static final BigDecimal ONE_CENT = new BigDecimal("0.01");

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    /** numerator / denominator, or zero when the denominator is zero. */
    public static BigDecimal ratio(long numerator, long denominator) {
        if (denominator == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(numerator)
                .divide(BigDecimal.valueOf(denominator), CALCULATION_SCALE, ROUNDING);
    }

    /** amount / count, or zero when count is zero. */
    public static BigDecimal per(BigDecimal amount, long count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return nullToZero(amount).divide(BigDecimal.valueOf(count), CALCULATION_SCALE, ROUNDING);
    }

    /** amount / volume x 1000 (RPM, eCPM), or zero when volume is zero. */
    public static BigDecimal perThousand(BigDecimal amount, long volume) {
        if (volume == 0) {
            return BigDecimal.ZERO;
        }
        return nullToZero(amount)
                .multiply(THOUSAND)
                .divide(BigDecimal.valueOf(volume), CALCULATION_SCALE, ROUNDING);
    }

    /** part / total x 100, or zero when total is zero. */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal total) {
        if (total == null || total.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return nullToZero(part).multiply(HUNDRED).divide(total, CALCULATION_SCALE, ROUNDING);
    }

    /** part / total x 100 for counts, or zero when total is zero. */
    public static BigDecimal percentOf(long part, long total) {
        return ratio(part, total).multiply(HUNDRED);
    }

    /** (current - previous) / previous x 100, or zero when previous is zero. */
    public static BigDecimal changePercent(BigDecimal current, BigDecimal previous) {
        if (previous == null || previous.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return nullToZero(current)
                .subtract(previous)
                .multiply(HUNDRED)
                .divide(previous, CALCULATION_SCALE, ROUNDING);
    }

    /** amount x numerator / denominator, or zero when the denominator is zero. */
    public static BigDecimal share(BigDecimal amount, long numerator, long denominator) {
        if (denominator == 0) {
            return BigDecimal.ZERO;
        }
        return nullToZero(amount)
                .multiply(BigDecimal.valueOf(numerator))
                .divide(BigDecimal.valueOf(denominator), CALCULATION_SCALE, ROUNDING);
    }

    public static BigDecimal scale(BigDecimal amount, BigDecimal factor) {
        return nullToZero(amount).multiply(factor).setScale(CALCULATION_SCALE, ROUNDING);
    }

    public static BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return nullToZero(numerator).divide(denominator, CALCULATION_SCALE, ROUNDING);
    }

    public static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> amount) {
        BigDecimal total = BigDecimal.ZERO;
        for (T item : items) {
            total = total.add(nullToZero(amount.apply(item)));
        }
        return total;
    }

    public static boolean withinOneCent(BigDecimal a, BigDecimal b) {
        return nullToZero(a).subtract(nullToZero(b)).abs().compareTo(ONE_CENT) <= 0;
    }
}
