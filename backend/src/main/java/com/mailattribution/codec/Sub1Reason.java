package com.mailattribution.codec;

/** Outcome of classifying a sub1 tag for campaign and property attribution. */
public enum Sub1Reason {
    KNOWN_PROPERTY,
    /** Has a mailing id but the property code is not catalogued */
    UNKNOWN_PROPERTY,
    /** Parsed but no mailing id could be located */
    NO_MAILING_ID,
    PARSE_ERROR,
    EMPTY_TAG;

    public boolean isUnattributed() {
        return this != KNOWN_PROPERTY;
    }

    /** Reasons folded into the single "Unattributed" property row. */
    public boolean isUntagged() {
        return this == EMPTY_TAG || this == PARSE_ERROR || this == NO_MAILING_ID;
    }
}
