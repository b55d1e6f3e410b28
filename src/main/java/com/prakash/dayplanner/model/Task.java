package com.prakash.dayplanner.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A unit of work to be placed into today's free time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    public static final int MIN_EFFORT_MINUTES = 15;

    private String id; // optional external id

    @NotBlank(message = "Task title cannot be blank.")
    private String title;

    // Total effort in minutes, may be split across several windows
    @Builder.Default
    @Min(value = 1, message = "Task estimate must be at least 1 minute.")
    private int estimateMinutes = 30;

    @Builder.Default
    @Min(value = 1, message = "Task priority must be between 1 and 5.")
    @Max(value = 5, message = "Task priority must be between 1 and 5.")
    private int priority = 3;

    private LocalDateTime deadline;

    private boolean preferMorning;
    private boolean preferAfternoon;

    @Builder.Default
    private boolean splitAllowed = true;

    @Builder.Default
    @Min(value = 1, message = "Maximum chunk length must be at least 1 minute.")
    private int maxChunkMinutes = 120;

    private String notes; // not used in scoring

    public boolean hasDeadline() {
        return deadline != null;
    }

    /**
     * Effort actually scheduled: never less than {@value #MIN_EFFORT_MINUTES} minutes.
     */
    public int effectiveEstimateMinutes() {
        return Math.max(MIN_EFFORT_MINUTES, estimateMinutes);
    }
}
