package com.mailattribution.cache;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/** Inclusive date window; also the key of every range-scoped cache. */
@Value
public class DateRange {
    LocalDate from;
    LocalDate to;

    public DateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Date range bounds are required");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Date range end " + to + " is before start " + from);
        }
        this.from = from;
        this.to = to;
    }

    public static DateRange of(LocalDate from, LocalDate to) {
        return new DateRange(from, to);
    }

    public static DateRange lastDays(LocalDate today, int days) {
        return new DateRange(today.minusDays(days), today);
    }

    /** Cache key, {@code "2026-01-01|2026-01-31"}. */
    public String key() {
        return from + "|" + to;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(from, to) + 1;
    }

    public List<LocalDate> days() {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            days.add(d);
        }
        return days;
    }

    @Override
    public String toString() {
        return key();
    }
}
