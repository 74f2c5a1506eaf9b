package com.mailattribution.volume;

import com.mailattribution.util.MoneyUtils;
import java.math.BigDecimal;

/**
 * Estimates a partner's share of total sends from its share of clicks, or of conversions when no
 * clicks were recorded. The result is always labelled {@link VolumeSource#PROPORTIONAL_ESTIMATE}.
 */
public class ProportionalVolumeEstimator {

    private final long totalVolume;
    private final long grandTotalClicks;
    private final long grandTotalConversions;

    public ProportionalVolumeEstimator(
            long totalVolume, long grandTotalClicks, long grandTotalConversions) {
        this.totalVolume = totalVolume;
        this.grandTotalClicks = grandTotalClicks;
        this.grandTotalConversions = grandTotalConversions;
    }

    public VolumeFigure estimate(long clicks, long conversions) {
        if (totalVolume <= 0) {
            return VolumeFigure.none();
        }
        BigDecimal total = BigDecimal.valueOf(totalVolume);
        if (grandTotalClicks > 0) {
            return VolumeFigure.estimate(
                    MoneyUtils.share(total, clicks, grandTotalClicks).longValue());
        }
        if (grandTotalConversions > 0) {
            return VolumeFigure.estimate(
                    MoneyUtils.share(total, conversions, grandTotalConversions).longValue());
        }
        return VolumeFigure.none();
    }

    public long getTotalVolume() {
        return totalVolume;
    }
}
