package com.prakash.dayplanner.service;

import com.prakash.dayplanner.exception.InvalidPlanRequestException;
import com.prakash.dayplanner.model.BusyBlock;
import com.prakash.dayplanner.model.DayPlan;
import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.Task;
import com.prakash.dayplanner.model.TimeWindow;
import com.prakash.dayplanner.planner.DayPlanner;
import com.prakash.dayplanner.planner.FreeWindowFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
public class DayPlanningService {

    private static final Logger log = LoggerFactory.getLogger(DayPlanningService.class);

    private final DayPlanner dayPlanner;
    private final FreeWindowFinder freeWindowFinder;
    private final DefaultPoolRegistry poolRegistry;

    public DayPlanningService(DayPlanner dayPlanner,
                              FreeWindowFinder freeWindowFinder,
                              DefaultPoolRegistry poolRegistry) {
        this.dayPlanner = dayPlanner;
        this.freeWindowFinder = freeWindowFinder;
        this.poolRegistry = poolRegistry;
    }

    /**
     * Plans a day around the given committed blocks. Empty task or habit lists fall back
     * to the current default pools.
     *
     * @throws InvalidPlanRequestException if {@code day} is missing
     */
    public DayPlan planDay(LocalDate day, List<BusyBlock> existing, List<Task> tasks, List<Habit> habits) {
        requireDay(day);
        log.info("Planning {} around {} committed block(s) with {} task(s) and {} habit(s) supplied",
                day, sizeOf(existing), sizeOf(tasks), sizeOf(habits));
        return dayPlanner.planDay(day, existing, tasks, habits, poolRegistry.snapshot());
    }

    /**
     * Plans an otherwise empty day from the default pools only.
     */
    public DayPlan suggestForDate(LocalDate day) {
        requireDay(day);
        log.info("Generating suggestions for {} from default pools", day);
        return dayPlanner.planDay(day, List.of(), List.of(), List.of(), poolRegistry.snapshot());
    }

    public List<TimeWindow> freeWindows(LocalDate day, List<BusyBlock> busy, Integer minBlockMinutes) {
        requireDay(day);
        int minBlock = minBlockMinutes != null ? minBlockMinutes : FreeWindowFinder.DEFAULT_MIN_BLOCK_MINUTES;
        if (minBlock < 1) {
            throw new InvalidPlanRequestException("minBlockMinutes must be at least 1.");
        }
        return freeWindowFinder.freeWindows(day, busy != null ? busy : List.of(), minBlock);
    }

    private static void requireDay(LocalDate day) {
        if (day == null) {
            throw new InvalidPlanRequestException("A valid day is required for planning.");
        }
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
