package com.prakash.dayplanner.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fallback tasks and habits used when a planning request supplies none.
 * Copies on the way in and on the way out, so a snapshot never changes after
 * creation even though {@link Task} and {@link Habit} are mutable.
 */
@Value
public class PlanningPool {

    List<Task> tasks;
    List<Habit> habits;

    public static PlanningPool empty() {
        return new PlanningPool(List.of(), List.of());
    }

    public static PlanningPool of(List<Task> tasks, List<Habit> habits) {
        return new PlanningPool(copyTasks(tasks), copyHabits(habits));
    }

    public List<Task> getTasks() {
        return copyTasks(tasks);
    }

    public List<Habit> getHabits() {
        return copyHabits(habits);
    }

    public PlanningPool withTasks(List<Task> newTasks) {
        return new PlanningPool(copyTasks(newTasks), habits);
    }

    public PlanningPool withHabits(List<Habit> newHabits) {
        return new PlanningPool(tasks, copyHabits(newHabits));
    }

    private static List<Task> copyTasks(List<Task> source) {
        if (source == null) {
            return List.of();
        }
        return source.stream().map(t -> t.toBuilder().build()).collect(Collectors.toUnmodifiableList());
    }

    private static List<Habit> copyHabits(List<Habit> source) {
        if (source == null) {
            return List.of();
        }
        return source.stream().map(h -> h.toBuilder().build()).collect(Collectors.toUnmodifiableList());
    }
}
