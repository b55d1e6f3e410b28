package com.prakash.dayplanner.planner;

import com.prakash.dayplanner.model.BusyBlock;
import com.prakash.dayplanner.model.DayPlan;
import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.PlannedBlock;
import com.prakash.dayplanner.model.PlanningPool;
import com.prakash.dayplanner.model.Task;
import com.prakash.dayplanner.model.TimeSpan;
import com.prakash.dayplanner.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plans one day in two passes.
 * <ol>
 *   <li>Free windows from the committed blocks.</li>
 *   <li>Tasks carved into those windows, with buffers.</li>
 *   <li>Free windows recomputed over committed blocks plus everything just carved.</li>
 *   <li>Habits placed into what is left.</li>
 * </ol>
 * The current time is read once per call from the injected {@link Clock}.
 */
@Component
public class DayPlanner {

    private static final Logger log = LoggerFactory.getLogger(DayPlanner.class);

    private final FreeWindowFinder freeWindowFinder;
    private final TaskCarver taskCarver;
    private final HabitPlacer habitPlacer;
    private final Clock clock;

    public DayPlanner(FreeWindowFinder freeWindowFinder,
                      TaskCarver taskCarver,
                      HabitPlacer habitPlacer,
                      Clock clock) {
        this.freeWindowFinder = freeWindowFinder;
        this.taskCarver = taskCarver;
        this.habitPlacer = habitPlacer;
        this.clock = clock;
    }

    /**
     * @param day          the day to plan; must be a valid date
     * @param existing     committed blocks; never modified
     * @param tasks        tasks to place; the fallback pool's tasks are used when empty
     * @param habits       habits to place; the fallback pool's habits are used when empty
     * @param fallbackPool pool consulted for empty task/habit lists; may be null
     */
    public DayPlan planDay(LocalDate day,
                           List<BusyBlock> existing,
                           List<Task> tasks,
                           List<Habit> habits,
                           PlanningPool fallbackPool) {
        Objects.requireNonNull(day, "day");
        LocalDateTime now = LocalDateTime.now(clock);
        PlanningPool pool = fallbackPool != null ? fallbackPool : PlanningPool.empty();
        List<BusyBlock> committed = existing != null ? existing : List.of();

        List<TimeWindow> freeSlots = freeWindowFinder.freeWindows(day, committed);

        List<Task> effectiveTasks = CollectionUtils.isEmpty(tasks) ? pool.getTasks() : tasks;
        List<PlannedBlock> plannedTasks = taskCarver.carve(freeSlots, effectiveTasks, now);

        List<TimeSpan> busy = new ArrayList<>(committed);
        busy.addAll(plannedTasks);
        List<TimeWindow> freeAfterTasks = freeWindowFinder.freeWindows(day, busy);

        List<Habit> effectiveHabits = CollectionUtils.isEmpty(habits) ? pool.getHabits() : habits;
        List<PlannedBlock> plannedHabits = habitPlacer.place(freeAfterTasks, effectiveHabits);

        List<PlannedBlock> all = new ArrayList<>(plannedTasks);
        all.addAll(plannedHabits);

        long taskMinutes = plannedTasks.stream()
                .filter(b -> !b.isBuffer())
                .mapToLong(PlannedBlock::getMinutes)
                .sum();
        String summary = String.format("Planned %d task min and %d habit block(s) for %s.",
                taskMinutes, plannedHabits.size(), day.format(DateTimeFormatter.ISO_LOCAL_DATE));
        log.info(summary);

        return DayPlan.builder()
                .day(day)
                .blocks(List.copyOf(all))
                .summary(summary)
                .taskMinutes(taskMinutes)
                .habitBlocks(plannedHabits.size())
                .build();
    }
}
