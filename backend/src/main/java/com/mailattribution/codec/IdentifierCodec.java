package com.mailattribution.codec;

import com.mailattribution.exception.IdentifierParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses the tracking identifiers that tie a click or conversion back to a mailing.
 *
 * <ul>
 *   <li>sub1: {@code [PROPERTY]_[OFFERID]_[...]_[MMDDYYYY]_[MAILINGID]}
 *   <li>sub2: data-set code with optional trailing underscore, e.g. {@code M77_WIT_}
 *   <li>campaign name: {@code [DATE]_[PROPERTY]_[OFFERID]_[NAME...]_[SEGMENT]}
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentifierCodec {

    private static final Pattern DATE_TOKEN = Pattern.compile("^\\d{8}$");
    private static final Pattern EMAIL_HASH = Pattern.compile("^[a-f0-9]{10}$");
    private static final Set<String> SUB2_SENTINELS =
            Set.of("N/A", "NA", "NULL", "UNDEFINED", "TEST", "TESTDATASET", "WMRY");
    private static final int MIN_FALLBACK_MAILING_ID_LENGTH = 5;

    private final PropertyCatalog propertyCatalog;
    private final PartnerCatalog partnerCatalog;

    /**
     * Parses a sub1 tag.
     *
     * @throws IdentifierParseException when the tag is blank or has fewer than two segments
     */
    public ParsedSub1 parseSub1(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IdentifierParseException("Empty sub1", raw);
        }

        List<String> parts = Arrays.asList(raw.split("_", -1));
        if (parts.size() < 2) {
            throw new IdentifierParseException("Invalid sub1 format, not enough parts: " + raw, raw);
        }

        ParsedSub1.ParsedSub1Builder builder = ParsedSub1.builder().raw(raw);

        String first = parts.get(0).toUpperCase(Locale.ROOT);
        if (propertyCatalog.isKnown(first)) {
            builder.propertyCode(first).propertyName(propertyCatalog.nameOf(first));
            parts = parts.subList(1, parts.size());
        } else if (!IdentifierFormats.isNumeric(parts.get(0))) {
            // Uncatalogued property; the code doubles as its name
            builder.propertyCode(first).propertyName(first);
            parts = parts.subList(1, parts.size());
        }

        if (!parts.isEmpty() && IdentifierFormats.isNumeric(parts.get(0))) {
            builder.offerId(parts.get(0));
        }

        String mailingId = null;
        for (int i = 0; i < parts.size(); i++) {
            if (DATE_TOKEN.matcher(parts.get(i)).matches()) {
                builder.date(parts.get(i));
                if (i + 1 < parts.size()) {
                    mailingId = parts.get(i + 1);
                }
                break;
            }
        }

        if ((mailingId == null || mailingId.isEmpty()) && !parts.isEmpty()) {
            String last = parts.get(parts.size() - 1);
            if (IdentifierFormats.isNumeric(last) && last.length() >= MIN_FALLBACK_MAILING_ID_LENGTH) {
                mailingId = last;
            }
        }

        return builder.mailingId(mailingId == null || mailingId.isEmpty() ? null : mailingId).build();
    }

    /** Classifies a sub1 tag without throwing; used by aggregation to bucket unattributed revenue. */
    public Sub1Classification classifySub1(String raw) {
        if (raw == null || raw.isEmpty()) {
            return new Sub1Classification(Sub1Reason.EMPTY_TAG, null);
        }
        ParsedSub1 parsed;
        try {
            parsed = parseSub1(raw);
        } catch (IdentifierParseException e) {
            log.trace("Unparseable sub1 '{}': {}", raw, e.getMessage());
            return new Sub1Classification(Sub1Reason.PARSE_ERROR, null);
        }
        if (!parsed.hasMailingId()) {
            return new Sub1Classification(Sub1Reason.NO_MAILING_ID, parsed);
        }
        if (!propertyCatalog.isKnown(parsed.getPropertyCode())) {
            return new Sub1Classification(Sub1Reason.UNKNOWN_PROPERTY, parsed);
        }
        return new Sub1Classification(Sub1Reason.KNOWN_PROPERTY, parsed);
    }

    /**
     * Parses a sub2 value into a data-set code and data partner.
     *
     * @return empty for blank values, unsubstituted template variables and placeholder sentinels
     */
    public Optional<ParsedSub2> parseSub2(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        if (EMAIL_HASH.matcher(value).matches()) {
            return Optional.of(ParsedSub2.builder().raw(value).emailHash(true).build());
        }

        if (value.contains("{{") || value.contains("}}")) {
            return Optional.empty();
        }

        String code = DataSetCodes.trimTrailingUnderscores(value);
        if (code.isEmpty() || SUB2_SENTINELS.contains(code.toUpperCase(Locale.ROOT))) {
            return Optional.empty();
        }

        PartnerGroup group = partnerCatalog.resolve(code);
        return Optional.of(
                ParsedSub2.builder()
                        .raw(value)
                        .dataSetCode(code)
                        .partnerPrefix(group.getKey())
                        .partnerName(group.getName())
                        .build());
    }

    /**
     * Parses a campaign name such as {@code 02052025_HRO_1944_FidelityLife_OPENERS}. The leading
     * date is optional.
     *
     * @throws IdentifierParseException when the name is blank or has fewer than three segments
     */
    public ParsedCampaignName parseCampaignName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IdentifierParseException("Empty campaign name", name);
        }

        List<String> parts = Arrays.asList(name.split("_", -1));
        if (parts.size() < 3) {
            throw new IdentifierParseException("Invalid campaign name format: " + name, name);
        }

        ParsedCampaignName.ParsedCampaignNameBuilder builder = ParsedCampaignName.builder();

        if (DATE_TOKEN.matcher(parts.get(0)).matches()) {
            builder.date(parts.get(0));
            parts = parts.subList(1, parts.size());
        }

        if (!parts.isEmpty()) {
            builder.property(parts.get(0).toUpperCase(Locale.ROOT));
            parts = parts.subList(1, parts.size());
        }

        if (!parts.isEmpty() && IdentifierFormats.isNumeric(parts.get(0))) {
            builder.offerId(parts.get(0));
            parts = parts.subList(1, parts.size());
        }

        if (parts.size() >= 2) {
            builder.offerName(String.join("_", parts.subList(0, parts.size() - 1)));
            builder.segment(parts.get(parts.size() - 1));
        } else if (parts.size() == 1) {
            builder.offerName(parts.get(0));
        }

        return builder.build();
    }

    /**
     * Resolves a property code from a campaign name, provided the parsed property is catalogued.
     */
    public Optional<String> propertyFromCampaignName(String campaignName) {
        if (campaignName == null || campaignName.isEmpty()) {
            return Optional.empty();
        }
        try {
            String property = parseCampaignName(campaignName).getProperty();
            return propertyCatalog.isKnown(property) ? Optional.of(property) : Optional.empty();
        } catch (IdentifierParseException e) {
            log.debug("Campaign name '{}' carries no property: {}", campaignName, e.getMessage());
            return Optional.empty();
        }
    }

    public PropertyCatalog getPropertyCatalog() {
        return propertyCatalog;
    }

    public PartnerCatalog getPartnerCatalog() {
        return partnerCatalog;
    }
}
