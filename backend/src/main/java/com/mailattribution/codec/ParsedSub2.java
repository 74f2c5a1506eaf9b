package com.mailattribution.codec;

import lombok.Builder;
import lombok.Value;

/** A sub2 value resolved to a data-set code and data partner, or flagged as an email hash. */
@Value
@Builder
public class ParsedSub2 {
    String raw;
    String dataSetCode;
    String partnerPrefix;
    String partnerName;
    boolean emailHash;

    /** True when the value names a data set that can be attributed to a partner. */
    public boolean isAttributable() {
        return !emailHash && partnerName != null && !partnerName.isEmpty();
    }
}
