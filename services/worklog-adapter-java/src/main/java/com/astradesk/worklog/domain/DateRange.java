package com.astradesk.worklog.domain;

import java.util.Optional;

/**
 * Inclusive {@code YYYY-MM-DD} bounds, each optional. {@code from > to} is allowed and
 * simply matches nothing.
 */
public record DateRange(Optional<String> from, Optional<String> to) {

    public DateRange {
        from = from == null ? Optional.empty() : from;
        to = to == null ? Optional.empty() : to;
    }

    public static DateRange unbounded() {
        return new DateRange(Optional.empty(), Optional.empty());
    }

    public static DateRange of(String from, String to) {
        return new DateRange(Optional.ofNullable(from), Optional.ofNullable(to));
    }

    public static DateRange singleDay(String day) {
        return of(day, day);
    }

    public boolean isBounded() {
        return from.isPresent() || to.isPresent();
    }

    public boolean isClosed() {
        return from.isPresent() && to.isPresent();
    }

    /**
     * String comparison is valid because both sides are fixed-width ISO dates.
     */
    public boolean contains(String isoDate) {
        if (from.isPresent() && isoDate.compareTo(from.get()) < 0) {
            return false;
        }
        return to.isEmpty() || isoDate.compareTo(to.get()) <= 0;
    }
}
