package com.mailattribution.attribution;

import static org.junit.jupiter.api.Assertions.*;

import com.mailattribution.model.DailyPerformance;
import com.mailattribution.model.PeriodPerformance;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PeriodRollupsTest {

    private static DailyPerformance day(LocalDate date, long clicks, long conversions, String revenue) {
        return DailyPerformance.builder()
                .date(date)
                .clicks(clicks)
                .conversions(conversions)
                .revenue(new BigDecimal(revenue))
                .payout(BigDecimal.ZERO)
                .build();
    }

    @Test
    @DisplayName("ISO week keys use the week-based year")
    void isoWeekKey() {
        assertEquals("2026-W01", PeriodRollups.isoWeekKey(LocalDate.of(2026, 1, 1)));
        assertEquals("2026-W53", PeriodRollups.isoWeekKey(LocalDate.of(2027, 1, 3)));
        assertEquals("2026-W05", PeriodRollups.isoWeekKey(LocalDate.of(2026, 1, 27)));
    }

    @Test
    @DisplayName("Monthly roll-ups sum days and list the newest month first")
    void monthly() {
        // Arrange
        List<DailyPerformance> daily =
                List.of(
                        day(LocalDate.of(2026, 2, 1), 10, 1, "40.00"),
                        day(LocalDate.of(2026, 1, 31), 20, 2, "60.00"),
                        day(LocalDate.of(2026, 1, 30), 20, 0, "0.00"));

        // Act
        List<PeriodPerformance> months = PeriodRollups.monthly(daily);

        // Assert
        assertEquals(2, months.size());
        assertEquals("2026-02", months.get(0).getPeriod());
        PeriodPerformance january = months.get(1);
        assertEquals(PeriodPerformance.PeriodType.MONTHLY, january.getPeriodType());
        assertEquals(40, january.getTotalClicks());
        assertEquals(2, january.getTotalConversions());
        assertEquals(0, new BigDecimal("60.00").compareTo(january.getTotalRevenue()));
        assertEquals(0, new BigDecimal("1.5").compareTo(january.getEpc()));
        assertEquals(0, new BigDecimal("0.05").compareTo(january.getConversionRate()));
    }

    @Test
    @DisplayName("Weekly roll-ups group days by ISO week")
    void weekly() {
        List<PeriodPerformance> weeks =
                PeriodRollups.weekly(
                        List.of(
                                day(LocalDate.of(2026, 1, 26), 5, 0, "0.00"),
                                day(LocalDate.of(2026, 2, 1), 5, 1, "10.00"),
                                day(LocalDate.of(2026, 2, 2), 1, 0, "0.00")));

        assertEquals(2, weeks.size());
        assertEquals("2026-W06", weeks.get(0).getPeriod());
        assertEquals("2026-W05", weeks.get(1).getPeriod());
        assertEquals(10, weeks.get(1).getTotalClicks());
    }
}
