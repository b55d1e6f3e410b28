package com.prakash.dayplanner.model;

import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;

// A free sub-interval of the planning day
@Value
public class TimeWindow implements TimeSpan {

    @With
    LocalDateTime start;
    LocalDateTime end;

    public static TimeWindow of(LocalDateTime start, LocalDateTime end) {
        return new TimeWindow(start, end);
    }

    public long getMinutes() {
        return TimeSpan.minutesBetween(start, end);
    }
}
