package com.prakash.dayplanner.service;

import com.prakash.dayplanner.config.PlannerProperties;
import com.prakash.dayplanner.exception.InvalidPlanRequestException;
import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.PlanningPool;
import com.prakash.dayplanner.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the default task and habit pools shared across planning requests.
 * <p>
 * Seeded from {@link PlannerProperties}; replacements swap an immutable
 * {@link PlanningPool} snapshot atomically, so concurrent planning calls always
 * see a consistent pair of lists.
 * </p>
 */
@Service
public class DefaultPoolRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultPoolRegistry.class);

    private final AtomicReference<PlanningPool> pool;

    public DefaultPoolRegistry(PlannerProperties properties) {
        PlannerProperties.Defaults defaults = properties.getDefaults();
        this.pool = new AtomicReference<>(PlanningPool.of(defaults.getTasks(), defaults.getHabits()));
        log.info("Default pools initialised with {} task(s) and {} habit(s)",
                pool.get().getTasks().size(), pool.get().getHabits().size());
    }

    public PlanningPool snapshot() {
        return pool.get();
    }

    public List<Task> getTasks() {
        return pool.get().getTasks();
    }

    public List<Habit> getHabits() {
        return pool.get().getHabits();
    }

    public List<Task> replaceTasks(List<Task> tasks) {
        if (tasks == null) {
            throw new InvalidPlanRequestException("Task pool cannot be null.");
        }
        PlanningPool updated = pool.updateAndGet(current -> current.withTasks(tasks));
        log.info("Default task pool replaced: {} task(s)", updated.getTasks().size());
        return updated.getTasks();
    }

    public List<Habit> replaceHabits(List<Habit> habits) {
        if (habits == null) {
            throw new InvalidPlanRequestException("Habit pool cannot be null.");
        }
        PlanningPool updated = pool.updateAndGet(current -> current.withHabits(habits));
        log.info("Default habit pool replaced: {} habit(s)", updated.getHabits().size());
        return updated.getHabits();
    }
}
