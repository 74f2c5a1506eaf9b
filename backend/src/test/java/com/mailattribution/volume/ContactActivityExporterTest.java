package com.mailattribution.volume;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.mailattribution.TestFixtures;
import com.mailattribution.cache.DateRange;
import com.mailattribution.client.sending.ContactActivityRequest;
import com.mailattribution.client.sending.ContactActivityStatus;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.config.AppProperties;
import com.mailattribution.exception.RateLimitException;
import com.mailattribution.exception.UpstreamApiException;
import com.mailattribution.exception.VolumeExportException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ContactActivityExporterTest {

    private static final DateRange RANGE =
            DateRange.of(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31));
    private static final String REPORT_ID = "report-1";
    private static final String CSV =
            "\uFEFFdata_set,sent\n"
                    + "M77_WIT_,100\n"
                    + "m77_wit,50\n"
                    + "GLB_HOME,30.0\n"
                    + "ATT,25\n"
                    + "N/A,10\n"
                    + "{{data_set}},5\n"
                    + "SCO_X,abc\n";

    @Mock private SendingPlatformClient sendingPlatformClient;

    private AppProperties appProperties;
    private ContactActivityExporter exporter;

    @BeforeEach
    void setUp() {
        appProperties = TestFixtures.appProperties();
        exporter = newExporter();
    }

    private ContactActivityExporter newExporter() {
        return new ContactActivityExporter(
                sendingPlatformClient,
                TestFixtures.directCalls("sending-platform"),
                Runnable::run,
                appProperties,
                Clock.fixed(Instant.parse("2026-02-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("export polls until completed, sums sends per data set and deletes the report")
    void export_Success() {
        // Arrange
        when(sendingPlatformClient.createContactActivityReport(any())).thenReturn(REPORT_ID);
        when(sendingPlatformClient.getContactActivityStatus(REPORT_ID))
                .thenReturn(ContactActivityStatus.PENDING, ContactActivityStatus.COMPLETED);
        when(sendingPlatformClient.exportContactActivityCsv(REPORT_ID))
                .thenReturn(CSV.getBytes(StandardCharsets.UTF_8));

        // Act
        VolumeResult result = exporter.export(RANGE);

        // Assert
        assertEquals(Map.of("M77_WIT", 150L, "GLB_HOME", 30L, "ATT", 25L), result.getSendsByDataSet());
        assertEquals(VolumeSource.CONTACT_EXPORT, result.getSource());
        assertTrue(result.isExact());
        verify(sendingPlatformClient, times(2)).getContactActivityStatus(REPORT_ID);
        verify(sendingPlatformClient).deleteContactActivityReport(REPORT_ID);
    }

    @Test
    @DisplayName("export requests data_set and sent for the whole window in the tracking zone")
    void export_RequestShape() {
        when(sendingPlatformClient.createContactActivityReport(any())).thenReturn(REPORT_ID);
        when(sendingPlatformClient.getContactActivityStatus(REPORT_ID))
                .thenReturn(ContactActivityStatus.COMPLETED);
        when(sendingPlatformClient.exportContactActivityCsv(REPORT_ID))
                .thenReturn("data_set,sent\n".getBytes(StandardCharsets.UTF_8));

        exporter.export(RANGE);

        ArgumentCaptor<ContactActivityRequest> captor =
                ArgumentCaptor.forClass(ContactActivityRequest.class);
        verify(sendingPlatformClient).createContactActivityReport(captor.capture());
        ContactActivityRequest request = captor.getValue();
        assertTrue(request.getSelectedFields().contains("data_set"));
        assertTrue(request.getSelectedFields().contains("sent"));
        assertEquals(Instant.parse("2026-01-01T08:00:00Z"), request.getFromDate());
        assertEquals(Instant.parse("2026-02-01T08:00:00Z"), request.getToDate());
    }

    @Test
    @DisplayName("The remote report is deleted even when polling fails")
    void export_PollingFails_StillDeletes() {
        // Arrange
        when(sendingPlatformClient.createContactActivityReport(any())).thenReturn(REPORT_ID);
        when(sendingPlatformClient.getContactActivityStatus(REPORT_ID))
                .thenThrow(
                        new UpstreamApiException(
                                "Report not found", HttpStatus.NOT_FOUND, "sending-platform", "/reports"));

        // Act & Assert
        assertThrows(VolumeExportException.class, () -> exporter.export(RANGE));
        verify(sendingPlatformClient, never()).exportContactActivityCsv(any());
        verify(sendingPlatformClient).deleteContactActivityReport(REPORT_ID);
    }

    @Test
    @DisplayName("The remote report is deleted when the export exceeds its max wait")
    void export_Timeout_StillDeletes() {
        appProperties.getVolume().getExport().setMaxWait(Duration.ZERO);
        exporter = newExporter();
        when(sendingPlatformClient.createContactActivityReport(any())).thenReturn(REPORT_ID);

        assertThrows(VolumeExportException.class, () -> exporter.export(RANGE));
        verify(sendingPlatformClient).deleteContactActivityReport(REPORT_ID);
    }

    @Test
    @DisplayName("Rate-limited status checks back off and keep polling")
    void export_RateLimited_KeepsPolling() {
        when(sendingPlatformClient.createContactActivityReport(any())).thenReturn(REPORT_ID);
        when(sendingPlatformClient.getContactActivityStatus(REPORT_ID))
                .thenThrow(new RateLimitException("sending-platform", "/reports/status"))
                .thenReturn(ContactActivityStatus.COMPLETED);
        when(sendingPlatformClient.exportContactActivityCsv(REPORT_ID))
                .thenReturn(CSV.getBytes(StandardCharsets.UTF_8));

        VolumeResult result = exporter.export(RANGE);

        assertEquals(3, result.size());
        verify(sendingPlatformClient).deleteContactActivityReport(REPORT_ID);
    }

    @Test
    @DisplayName("A server Retry-After longer than the backoff wins, capped at the maximum")
    void rateLimitWait_RetryAfter() {
        Duration wait = exporter.rateLimitWait(1, Duration.ofMinutes(2));
        assertEquals(Duration.ofMinutes(2), wait);

        Duration capped = exporter.rateLimitWait(1, Duration.ofHours(1));
        assertEquals(appProperties.getVolume().getExport().getMaxRateLimitBackoff(), capped);
    }

    @Test
    @DisplayName("A CSV without the expected columns is rejected")
    void aggregateSends_MissingColumns() {
        byte[] csv = "email,opens\na@b.c,1\n".getBytes(StandardCharsets.UTF_8);

        assertThrows(VolumeExportException.class, () -> exporter.aggregateSends(csv));
    }
}
