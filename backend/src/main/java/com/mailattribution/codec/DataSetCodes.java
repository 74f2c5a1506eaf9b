package com.mailattribution.codec;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.experimental.UtilityClass;

/** Helpers for data-set codes as they appear in volume maps and segment names. */
@UtilityClass
public class DataSetCodes {

    /** Segment-name prefixes that carry a data-set code */
    public static final Set<String> SEGMENT_PREFIXES =
            Set.of("ATT", "GLB", "SCO", "M77", "IGN", "HAR", "EVS", "MAS");

    // Stripped in this order, one pass
    private static final List<String> ENGAGEMENT_SUFFIXES =
            List.of(
                    "_OPENERS", "_CLICKERS", "_ALL", "_ACTIVE", "_INACTIVE", "_ABS", "_CAB",
                    "_OPENS", "_CLICKS", "_ENGAGED", "_UNENGAGED", "_30D", "_60D", "_90D",
                    "_7D", "_14D");

    private static final Set<String> INVALID_KEYS = Set.of("N/A", "NA", "WMRY", "NULL", "TESTDATASET");

    public static boolean isValidVolumeKey(String key) {
        if (key == null || key.contains("{{") || key.contains("}}")) {
            return false;
        }
        return !INVALID_KEYS.contains(key.toUpperCase(Locale.ROOT));
    }

    /** True when an upper-cased segment name starts with a known data-set prefix. */
    public static boolean hasKnownSegmentPrefix(String upperName) {
        for (String prefix : SEGMENT_PREFIXES) {
            if (upperName.equals(prefix) || upperName.startsWith(prefix + "_")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reduces a segment name to its data-set code, e.g. {@code M77_WIT_OPENERS -> M77_WIT}.
     *
     * @return the code, or an empty string when nothing remains
     */
    public static String fromSegmentName(String upperName) {
        String result = upperName;
        for (String suffix : ENGAGEMENT_SUFFIXES) {
            if (result.endsWith(suffix)) {
                result = result.substring(0, result.length() - suffix.length());
            }
        }
        return trimTrailingUnderscores(result);
    }

    public static String trimTrailingUnderscores(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(0, end);
    }
}
