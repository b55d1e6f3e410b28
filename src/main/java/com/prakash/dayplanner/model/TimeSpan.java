package com.prakash.dayplanner.model;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Anything that occupies a range of calendar time.
 * Committed blocks, planned blocks and free windows all share this view, so the
 * free-window computation can take any mix of them as its busy set.
 */
public interface TimeSpan {

    LocalDateTime getStart();

    LocalDateTime getEnd();

    /**
     * Whole minutes between {@code start} and {@code end}; 0 for inverted ranges.
     */
    static long minutesBetween(LocalDateTime start, LocalDateTime end) {
        return Math.max(0L, Duration.between(start, end).getSeconds() / 60);
    }
}
