package com.mailattribution.volume;

import com.mailattribution.codec.DataSetCodes;
import com.mailattribution.codec.PartnerCatalog;
import java.util.Map;
import java.util.Set;

/**
 * Volume lookups for one partner-analytics build.
 *
 * <p>Resolved per-data-set volume is used only when it is usable per partner, has more than the
 * minimum number of codes and at least one code maps to a partner present in the analytics;
 * otherwise every figure is a proportional estimate.
 */
public class PartnerVolumeView {

    private final VolumeResult volume;
    private final PartnerCatalog partnerCatalog;
    private final ProportionalVolumeEstimator estimator;
    private final boolean matchingVolume;

    public PartnerVolumeView(
            VolumeResult volume,
            PartnerCatalog partnerCatalog,
            Set<String> knownPrefixes,
            int minDistinctIdentifiers,
            ProportionalVolumeEstimator estimator) {
        this.volume = volume;
        this.partnerCatalog = partnerCatalog;
        this.estimator = estimator;
        this.matchingVolume = matches(volume, partnerCatalog, knownPrefixes, minDistinctIdentifiers);
    }

    private static boolean matches(
            VolumeResult volume,
            PartnerCatalog partnerCatalog,
            Set<String> knownPrefixes,
            int minDistinctIdentifiers) {
        if (!volume.isPerPartnerUsable() || volume.size() <= minDistinctIdentifiers) {
            return false;
        }
        return volume.getSendsByDataSet().keySet().stream()
                .filter(DataSetCodes::isValidVolumeKey)
                .anyMatch(key -> knownPrefixes.contains(partnerCatalog.resolve(key).getKey()));
    }

    public VolumeFigure forDataSet(String dataSetCode, long clicks, long conversions) {
        if (matchingVolume) {
            long sends = volume.sendsFor(dataSetCode);
            if (sends > 0) {
                return new VolumeFigure(sends, volume.getSource(), volume.isExact());
            }
        }
        return estimator.estimate(clicks, conversions);
    }

    public VolumeFigure forPartner(String partnerPrefix, long clicks, long conversions) {
        if (matchingVolume) {
            long total = 0;
            for (Map.Entry<String, Long> entry : volume.getSendsByDataSet().entrySet()) {
                if (DataSetCodes.isValidVolumeKey(entry.getKey())
                        && partnerCatalog.resolve(entry.getKey()).getKey().equals(partnerPrefix)) {
                    total += entry.getValue();
                }
            }
            if (total > 0) {
                return new VolumeFigure(total, volume.getSource(), volume.isExact());
            }
        }
        return estimator.estimate(clicks, conversions);
    }

    public boolean hasMatchingVolume() {
        return matchingVolume;
    }

    public long getTotalSends() {
        return estimator.getTotalVolume();
    }
}
