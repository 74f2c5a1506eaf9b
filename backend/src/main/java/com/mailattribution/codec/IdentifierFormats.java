package com.mailattribution.codec;

import com.mailattribution.exception.IdentifierParseException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/** Date, timestamp and numeric-token formats used by tracking identifiers. */
@UtilityClass
public class IdentifierFormats {

    private static final DateTimeFormatter SUB1_DATE = DateTimeFormatter.ofPattern("MMddyyyy");

    private static final DateTimeFormatter US_WITH_ZONE =
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss z", Locale.US);

    private static final DateTimeFormatter US_LOCAL =
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss");

    private static final DateTimeFormatter ISO_LOCAL =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Pattern US_ZONED_SHAPE =
            Pattern.compile("^\\d{2}/\\d{2}/\\d{4} \\d{2}:\\d{2}:\\d{2} \\S+$");
    private static final Pattern US_LOCAL_SHAPE =
            Pattern.compile("^\\d{2}/\\d{2}/\\d{4} \\d{2}:\\d{2}:\\d{2}$");
    private static final Pattern ISO_LOCAL_SHAPE =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}$");
    private static final Pattern DATE_SHAPE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    public static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /** Parses the mmddyyyy token of a sub1 tag. */
    public static LocalDate parseSub1Date(String token) {
        if (token == null || token.length() != 8 || !isNumeric(token)) {
            throw new IdentifierParseException("Invalid sub1 date token: " + token, token);
        }
        try {
            return LocalDate.parse(token, SUB1_DATE);
        } catch (DateTimeParseException e) {
            throw new IdentifierParseException("Invalid sub1 date token: " + token, token);
        }
    }

    /**
     * Parses a tracking-network timestamp such as {@code 01/27/2026 00:06:13 PST} or {@code
     * 2026-01-27 00:00:00}. Values without a zone are read in {@code defaultZone}.
     *
     * @return empty for a blank value
     */
    public static Optional<ZonedDateTime> parseTimestamp(String value, ZoneId defaultZone) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String ts = value.trim();
        try {
            if (US_ZONED_SHAPE.matcher(ts).matches()) {
                return Optional.of(ZonedDateTime.parse(ts, US_WITH_ZONE));
            }
            if (US_LOCAL_SHAPE.matcher(ts).matches()) {
                return Optional.of(LocalDateTime.parse(ts, US_LOCAL).atZone(defaultZone));
            }
            if (ISO_LOCAL_SHAPE.matcher(ts).matches()) {
                return Optional.of(LocalDateTime.parse(ts, ISO_LOCAL).atZone(defaultZone));
            }
            if (DATE_SHAPE.matcher(ts).matches()) {
                return Optional.of(LocalDate.parse(ts).atStartOfDay(defaultZone));
            }
            return Optional.of(OffsetDateTime.parse(ts).toZonedDateTime());
        } catch (DateTimeParseException e) {
            throw new IdentifierParseException("Unable to parse timestamp: " + value, value);
        }
    }

    /** Extracts {@code 123} from an offer name of the form {@code "Offer Name (123)"}. */
    public static Optional<String> extractOfferIdFromName(String offerName) {
        if (offerName == null) {
            return Optional.empty();
        }
        int open = offerName.lastIndexOf('(');
        if (open < 0) {
            return Optional.empty();
        }
        int close = offerName.indexOf(')', open);
        if (close < 0) {
            return Optional.empty();
        }
        String candidate = offerName.substring(open + 1, close).trim();
        return isNumeric(candidate) ? Optional.of(candidate) : Optional.empty();
    }
}
