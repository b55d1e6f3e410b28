package com.prakash.dayplanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A block produced by the planner: a task chunk, a buffer, or a habit.
 */
@Value
@Builder
public class PlannedBlock implements TimeSpan {

    public static final String TASK_MARKER = "🔵";
    public static final String HABIT_MARKER = "🟢";
    public static final String BUFFER_TITLE = "Buffer";

    String title;
    String description;
    LocalDateTime start;
    LocalDateTime end;
    String color;
    BlockCategory category;

    public static PlannedBlock taskChunk(String taskTitle, LocalDateTime start, LocalDateTime end) {
        return of(TASK_MARKER + " " + taskTitle, start, end, BlockCategory.TASK);
    }

    public static PlannedBlock buffer(LocalDateTime start, LocalDateTime end) {
        return of(BUFFER_TITLE, start, end, BlockCategory.BUFFER);
    }

    public static PlannedBlock habit(String habitTitle, LocalDateTime start, LocalDateTime end) {
        return of(HABIT_MARKER + " " + habitTitle, start, end, BlockCategory.HABIT);
    }

    // Title doubles as description
    private static PlannedBlock of(String title, LocalDateTime start, LocalDateTime end, BlockCategory category) {
        return PlannedBlock.builder()
                .title(title)
                .description(title)
                .start(start)
                .end(end)
                .color(category.getColor())
                .category(category)
                .build();
    }

    public boolean isBuffer() {
        return category == BlockCategory.BUFFER;
    }

    public long getMinutes() {
        return TimeSpan.minutesBetween(start, end);
    }
}
