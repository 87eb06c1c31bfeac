package com.investbyyourself.etl.model;

import java.time.LocalDate;

/**
 * Inclusive date window of a collection request. Either bound may be null (open).
 */
public record TimeWindow(LocalDate from, LocalDate to) {

    public TimeWindow {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Time window start " + from + " is after end " + to);
        }
    }

    public static TimeWindow open() {
        return new TimeWindow(null, null);
    }

    public boolean contains(LocalDate date) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }
}
