package com.mailattribution.volume;

/** Where a send-volume figure came from. */
public enum VolumeSource {
    /** Per-contact export from the sending platform; the only exact source */
    CONTACT_EXPORT,
    /** Sends grouped by segment, reduced to data-set codes by name */
    SEGMENT,
    /** Sends grouped by list; trusted for totals only */
    LIST,
    /** Share of total sends by clicks (or conversions) */
    PROPORTIONAL_ESTIMATE;

    public boolean isExact() {
        return this == CONTACT_EXPORT;
    }
}
