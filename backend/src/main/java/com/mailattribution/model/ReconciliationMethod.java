package com.mailattribution.model;

/** How the gap between ESP-attributed and offer-level revenue was closed. */
public enum ReconciliationMethod {
    /** Conversion-based ESP revenue already matched the offer total */
    NONE,
    /** Gap spread over ESPs by each offer's send volume per ESP */
    OFFER_VOLUME_DISTRIBUTION,
    /** Existing ESP entries scaled up to the offer total */
    PROPORTIONAL_SCALE,
    /** ESP entries exceeded the offer total and were scaled down to it */
    SCALED_DOWN,
    /** No ESP data; the whole total placed in an Unattributed entry */
    UNATTRIBUTED_ENTRY
}
