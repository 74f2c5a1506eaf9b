package com.mailattribution.codec;

import lombok.Value;

/** A data partner as resolved from a data-set code: group key (e.g. {@code M77}) and display name. */
@Value
public class PartnerGroup {
    String key;
    String name;
}
