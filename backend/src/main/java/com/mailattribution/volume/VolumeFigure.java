package com.mailattribution.volume;

import lombok.Value;

/** A send count together with its provenance, so estimates are never mistaken for exact counts. */
@Value
public class VolumeFigure {
    long value;
    VolumeSource source;
    boolean exact;

    public static VolumeFigure of(long value, VolumeSource source) {
        return new VolumeFigure(value, source, source.isExact());
    }

    public static VolumeFigure estimate(long value) {
        return new VolumeFigure(value, VolumeSource.PROPORTIONAL_ESTIMATE, false);
    }

    public static VolumeFigure none() {
        return estimate(0);
    }
}
