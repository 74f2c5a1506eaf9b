package com.mailattribution.attribution;

import com.mailattribution.client.tracking.ClickRecord;
import com.mailattribution.client.tracking.ConversionRecord;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.codec.IdentifierFormats;
import com.mailattribution.codec.ParsedSub1;
import com.mailattribution.codec.ParsedSub2;
import com.mailattribution.config.AppProperties;
import com.mailattribution.exception.IdentifierParseException;
import com.mailattribution.model.Click;
import com.mailattribution.model.Conversion;
import com.mailattribution.util.MoneyUtils;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Turns raw tracking-network records into clicks and conversions with parsed identifiers. */
@Slf4j
@Component
public class TrackingRecordProcessor {

    private final IdentifierCodec identifierCodec;
    private final ZoneId zoneId;

    public TrackingRecordProcessor(IdentifierCodec identifierCodec, AppProperties appProperties) {
        this.identifierCodec = identifierCodec;
        this.zoneId = ZoneId.of(appProperties.getTracking().getZoneId());
    }

    public List<Click> processClicks(List<ClickRecord> records) {
        List<Click> clicks = new ArrayList<>(records.size());
        for (ClickRecord record : records) {
            clicks.add(processClick(record));
        }
        return clicks;
    }

    public List<Conversion> processConversions(List<ConversionRecord> records) {
        List<Conversion> conversions = new ArrayList<>(records.size());
        for (ConversionRecord record : records) {
            conversions.add(processConversion(record));
        }
        return conversions;
    }

    public Click processClick(ClickRecord record) {
        Click.ClickBuilder builder =
                Click.builder()
                        .clickId(record.getClickId())
                        .offerId(record.getOfferId())
                        .offerName(record.getOfferName())
                        .sub1(record.getSub1())
                        .sub2(record.getSub2())
                        .timestamp(parseClickTimestamp(record));

        ParsedSub1 sub1 = parseSub1(record.getSub1());
        if (sub1 != null) {
            builder.propertyCode(sub1.getPropertyCode())
                    .propertyName(sub1.getPropertyName())
                    .mailingId(sub1.getMailingId())
                    .parsedOfferId(sub1.getOfferId());
        }

        Optional<ParsedSub2> sub2 = identifierCodec.parseSub2(record.getSub2());
        if (sub2.isPresent() && !sub2.get().isEmailHash()) {
            builder.dataSetCode(sub2.get().getDataSetCode()).dataPartner(sub2.get().getPartnerName());
        }
        return builder.build();
    }

    public Conversion processConversion(ConversionRecord record) {
        Conversion.ConversionBuilder builder =
                Conversion.builder()
                        .conversionId(record.getConversionId())
                        .transactionId(record.getTransactionId())
                        .clickId(record.getClickId())
                        .offerId(record.getOfferId())
                        .offerName(record.getOfferName())
                        .status(record.getStatus())
                        .revenue(MoneyUtils.nullToZero(record.getRevenue()))
                        .payout(MoneyUtils.nullToZero(record.getPayout()))
                        .sub1(record.getSub1())
                        .sub2(record.getSub2())
                        .sub3(record.getSub3())
                        .conversionTime(fromUnixSeconds(record.getConversionUnixTimestamp()))
                        .clickTime(fromUnixSeconds(record.getClickUnixTimestamp()));

        ParsedSub1 sub1 = parseSub1(record.getSub1());
        if (sub1 != null) {
            builder.propertyCode(sub1.getPropertyCode())
                    .propertyName(sub1.getPropertyName())
                    .mailingId(sub1.getMailingId())
                    .parsedOfferId(sub1.getOfferId());
        }

        Optional<ParsedSub2> sub2 = identifierCodec.parseSub2(record.getSub2());
        if (sub2.isPresent() && !sub2.get().isEmailHash()) {
            builder.dataSetCode(sub2.get().getDataSetCode()).dataPartner(sub2.get().getPartnerName());
        }
        return builder.build();
    }

    private ParsedSub1 parseSub1(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return identifierCodec.parseSub1(raw);
        } catch (IdentifierParseException e) {
            log.trace("Leaving sub1 '{}' unparsed: {}", raw, e.getMessage());
            return null;
        }
    }

    private ZonedDateTime parseClickTimestamp(ClickRecord record) {
        try {
            return IdentifierFormats.parseTimestamp(record.getTimestamp(), zoneId).orElse(null);
        } catch (IdentifierParseException e) {
            log.debug("Click {} has unparseable timestamp: {}", record.getClickId(), e.getMessage());
            return null;
        }
    }

    private ZonedDateTime fromUnixSeconds(long seconds) {
        return seconds > 0 ? Instant.ofEpochSecond(seconds).atZone(zoneId) : null;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }
}
