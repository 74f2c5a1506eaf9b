package com.mailattribution.volume;

import com.mailattribution.cache.DateRange;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.sending.SendReportRow;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.codec.DataSetCodes;
import com.mailattribution.config.AppProperties;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Volume from sends grouped by segment, where segment names carry the data-set code. */
@Slf4j
@Component
@Order(2)
public class SegmentVolumeStrategy implements VolumeStrategy {

    private final SendingPlatformClient sendingPlatformClient;
    private final UpstreamCallTemplate sendingPlatformCalls;
    private final int minDistinctIdentifiers;
    private final Clock clock;

    public SegmentVolumeStrategy(
            SendingPlatformClient sendingPlatformClient,
            @Qualifier("sendingPlatformCalls") UpstreamCallTemplate sendingPlatformCalls,
            AppProperties appProperties,
            Clock clock) {
        this.sendingPlatformClient = sendingPlatformClient;
        this.sendingPlatformCalls = sendingPlatformCalls;
        this.minDistinctIdentifiers = appProperties.getVolume().getMinDistinctIdentifiers();
        this.clock = clock;
    }

    @Override
    public String name() {
        return "segment";
    }

    @Override
    public Optional<VolumeResult> resolve(DateRange range) {
        List<SendReportRow> rows =
                sendingPlatformCalls.call(
                        "getSendsBySegment",
                        () -> sendingPlatformClient.getSendsBySegment(range.getFrom(), range.getTo()));

        Map<String, Long> sends = sendsByDataSet(rows);
        if (sends.size() <= minDistinctIdentifiers) {
            log.info(
                    "Segment volume for {} has only {} data sets out of {} rows, skipping",
                    range,
                    sends.size(),
                    rows.size());
            return Optional.empty();
        }

        return Optional.of(
                VolumeResult.builder()
                        .sendsByDataSet(sends)
                        .source(VolumeSource.SEGMENT)
                        .perPartnerUsable(true)
                        .resolvedAt(clock.instant())
                        .build());
    }

    /** Reduces segment rows whose name starts with a data-set prefix to sends per code. */
    static Map<String, Long> sendsByDataSet(List<SendReportRow> rows) {
        Map<String, Long> result = new LinkedHashMap<>();
        int unmatched = 0;
        for (SendReportRow row : rows) {
            String name = row.getName() == null ? "" : row.getName().trim();
            if (name.isEmpty() || row.getSent() == 0) {
                continue;
            }
            String upper = name.toUpperCase(Locale.ROOT);
            if (!DataSetCodes.hasKnownSegmentPrefix(upper)) {
                unmatched++;
                continue;
            }
            String code = DataSetCodes.fromSegmentName(upper);
            if (code.isEmpty()) {
                unmatched++;
                continue;
            }
            result.merge(code, row.getSent(), Long::sum);
        }
        log.debug(
                "Segment parsing: {} data sets, {} unmatched of {} rows",
                result.size(),
                unmatched,
                rows.size());
        return Collections.unmodifiableMap(result);
    }
}
