package com.prakash.dayplanner.planner;

import com.prakash.dayplanner.model.TimeSpan;
import com.prakash.dayplanner.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the free windows of a planning day from a set of busy intervals.
 * <p>
 * The day is the fixed window [06:00, 22:00]. Busy intervals are clamped to it,
 * merged (overlapping or touching intervals collapse into one) and inverted;
 * only gaps of at least {@code minBlockMinutes} are returned, in start order.
 * </p>
 */
@Component
public class FreeWindowFinder {

    private static final Logger log = LoggerFactory.getLogger(FreeWindowFinder.class);

    public static final LocalTime DAY_START = LocalTime.of(6, 0);
    public static final LocalTime DAY_END = LocalTime.of(22, 0);
    public static final int DEFAULT_MIN_BLOCK_MINUTES = 15;

    public List<TimeWindow> freeWindows(LocalDate day, Collection<? extends TimeSpan> busy) {
        return freeWindows(day, busy, DEFAULT_MIN_BLOCK_MINUTES);
    }

    /**
     * @param day             the planning day
     * @param busy            committed intervals; never modified
     * @param minBlockMinutes shortest gap worth returning
     * @return ordered, non-overlapping free windows inside the day window
     */
    public List<TimeWindow> freeWindows(LocalDate day, Collection<? extends TimeSpan> busy, int minBlockMinutes) {
        LocalDateTime dayStart = day.atTime(DAY_START);
        LocalDateTime dayEnd = day.atTime(DAY_END);

        List<TimeWindow> merged = mergeIntervals(clampToDay(day, busy, dayStart, dayEnd));

        List<TimeWindow> free = new ArrayList<>();
        LocalDateTime cursor = dayStart;
        for (TimeWindow occupied : merged) {
            if (cursor.isBefore(occupied.getStart())
                    && TimeSpan.minutesBetween(cursor, occupied.getStart()) >= minBlockMinutes) {
                free.add(TimeWindow.of(cursor, occupied.getStart()));
            }
            cursor = later(cursor, occupied.getEnd());
        }
        if (cursor.isBefore(dayEnd) && TimeSpan.minutesBetween(cursor, dayEnd) >= minBlockMinutes) {
            free.add(TimeWindow.of(cursor, dayEnd));
        }

        log.debug("Day {}: {} busy interval(s) merged into {}, {} free window(s) of >= {} min",
                day, busy == null ? 0 : busy.size(), merged.size(), free.size(), minBlockMinutes);
        return free;
    }

    /**
     * Sorts by start and collapses intervals whose start is not after the previous end.
     */
    public List<TimeWindow> mergeIntervals(List<TimeWindow> intervals) {
        List<TimeWindow> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparing(TimeWindow::getStart));

        List<TimeWindow> merged = new ArrayList<>();
        for (TimeWindow current : sorted) {
            int lastIdx = merged.size() - 1;
            if (lastIdx < 0 || current.getStart().isAfter(merged.get(lastIdx).getEnd())) {
                merged.add(current);
            } else {
                TimeWindow last = merged.get(lastIdx);
                merged.set(lastIdx, TimeWindow.of(last.getStart(), later(last.getEnd(), current.getEnd())));
            }
        }
        return merged;
    }

    private List<TimeWindow> clampToDay(LocalDate day,
                                        Collection<? extends TimeSpan> busy,
                                        LocalDateTime dayStart,
                                        LocalDateTime dayEnd) {
        List<TimeWindow> clamped = new ArrayList<>();
        if (busy == null) {
            return clamped;
        }
        for (TimeSpan span : busy) {
            if (span == null) {
                log.debug("Ignoring null busy interval");
                continue;
            }
            LocalDateTime start = span.getStart();
            LocalDateTime end = span.getEnd();
            if (start == null || end == null) {
                log.debug("Ignoring busy interval without bounds: {}", span);
                continue;
            }
            if (start.toLocalDate().isAfter(day) || end.toLocalDate().isBefore(day)) {
                continue;
            }
            LocalDateTime clampedStart = later(dayStart, start);
            LocalDateTime clampedEnd = earlier(dayEnd, end);
            if (clampedStart.isBefore(clampedEnd)) {
                clamped.add(TimeWindow.of(clampedStart, clampedEnd));
            }
        }
        return clamped;
    }

    private static LocalDateTime later(LocalDateTime a, LocalDateTime b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDateTime earlier(LocalDateTime a, LocalDateTime b) {
        return a.isBefore(b) ? a : b;
    }
}
