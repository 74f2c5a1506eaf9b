package com.mailattribution.attribution;

import static org.junit.jupiter.api.Assertions.*;

import com.mailattribution.model.Conversion;
import com.mailattribution.model.OfferPerformance;
import com.mailattribution.model.RevenueBreakdown;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RevenueBreakdownCalculatorTest {

    private static final ZoneId ZONE = ZoneId.of("America/Los_Angeles");

    private final RevenueBreakdownCalculator calculator = new RevenueBreakdownCalculator();

    private static OfferPerformance offer(String name, String revenue) {
        return OfferPerformance.builder()
                .offerId(name)
                .offerName(name)
                .clicks(10)
                .conversions(1)
                .revenue(new BigDecimal(revenue))
                .payout(BigDecimal.ZERO)
                .build();
    }

    private static Conversion conversion(String offerName, LocalDate day, String revenue) {
        return Conversion.builder()
                .offerName(offerName)
                .revenue(new BigDecimal(revenue))
                .conversionTime(day.atTime(9, 0).atZone(ZONE))
                .build();
    }

    @Test
    @DisplayName("Offers are split by CPM in the name with percentages of the total")
    void calculate_SplitsCpm() {
        // Act
        RevenueBreakdown breakdown =
                calculator.calculate(
                        List.of(
                                offer("Brand CPM", "250.00"),
                                offer("Fidelity Life CPA", "600.00"),
                                offer("Quotes CPL", "150.00")),
                        List.of());

        // Assert
        assertEquals(1, breakdown.getCpm().getOfferCount());
        assertEquals(2, breakdown.getNonCpm().getOfferCount());
        assertEquals(0, new BigDecimal("25").compareTo(breakdown.getCpm().getPercentage()));
        assertEquals(0, new BigDecimal("75").compareTo(breakdown.getNonCpm().getPercentage()));
        assertEquals(20, breakdown.getNonCpm().getClicks());
        assertTrue(breakdown.getDailyTrend().isEmpty());
    }

    @Test
    @DisplayName("The daily trend comes from conversions, newest day first")
    void calculate_DailyTrend() {
        LocalDate first = LocalDate.of(2026, 1, 26);
        LocalDate second = first.plusDays(1);

        RevenueBreakdown breakdown =
                calculator.calculate(
                        List.of(),
                        List.of(
                                conversion("Brand CPM", first, "5.00"),
                                conversion("Fidelity Life CPA", first, "20.00"),
                                conversion("Fidelity Life CPA", second, "30.00"),
                                Conversion.builder().offerName("Undated CPA").revenue(BigDecimal.TEN).build()));

        assertEquals(2, breakdown.getDailyTrend().size());
        RevenueBreakdown.DailyBreakdown newest = breakdown.getDailyTrend().get(0);
        assertEquals(second, newest.getDate());
        assertEquals(0, BigDecimal.ZERO.compareTo(newest.getCpmRevenue()));
        RevenueBreakdown.DailyBreakdown oldest = breakdown.getDailyTrend().get(1);
        assertEquals(0, new BigDecimal("5.00").compareTo(oldest.getCpmRevenue()));
        assertEquals(0, new BigDecimal("20.00").compareTo(oldest.getNonCpmRevenue()));
        assertEquals(0, BigDecimal.ZERO.compareTo(breakdown.getCpm().getPercentage()));
    }
}
