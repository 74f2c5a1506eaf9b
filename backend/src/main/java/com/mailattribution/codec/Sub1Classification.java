package com.mailattribution.codec;

import lombok.Value;

/** A sub1 tag's classification; {@code parsed} is null for {@link Sub1Reason#EMPTY_TAG} and {@link Sub1Reason#PARSE_ERROR}. */
@Value
public class Sub1Classification {
    Sub1Reason reason;
    ParsedSub1 parsed;
}
