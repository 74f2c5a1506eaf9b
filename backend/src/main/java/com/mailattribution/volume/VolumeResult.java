package com.mailattribution.volume;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mailattribution.codec.DataSetCodes;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Sends per upper-cased data-set code for one window, as produced by a single strategy. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class VolumeResult {
    @Builder.Default Map<String, Long> sendsByDataSet = Map.of();
    VolumeSource source;
    boolean exact;

    /** False when the codes cannot be trusted to split volume by partner */
    @Builder.Default boolean perPartnerUsable = true;

    Instant resolvedAt;

    public static VolumeResult empty() {
        return VolumeResult.builder()
                .source(VolumeSource.PROPORTIONAL_ESTIMATE)
                .perPartnerUsable(false)
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sendsByDataSet.isEmpty();
    }

    public int size() {
        return sendsByDataSet.size();
    }

    public long total() {
        return sendsByDataSet.values().stream().mapToLong(Long::longValue).sum();
    }

    public long sendsFor(String dataSetCode) {
        return sendsByDataSet.getOrDefault(dataSetCode.toUpperCase(Locale.ROOT), 0L);
    }

    public long validKeyCount() {
        return sendsByDataSet.keySet().stream().filter(DataSetCodes::isValidVolumeKey).count();
    }
}
