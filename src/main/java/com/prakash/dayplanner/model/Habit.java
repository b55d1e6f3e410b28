package com.prakash.dayplanner.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Small recurring block, placed at most once per planning run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Habit {

    @NotBlank(message = "Habit title cannot be blank.")
    private String title;

    @Builder.Default
    @Min(value = 1, message = "Habit duration must be at least 1 minute.")
    private int targetMinutes = 20;

    @Builder.Default
    private HabitAnchor anchor = HabitAnchor.NONE;

    @Builder.Default
    @Min(value = 1, message = "Habit priority must be between 1 and 5.")
    @Max(value = 5, message = "Habit priority must be between 1 and 5.")
    private int priority = 3;

    public HabitAnchor effectiveAnchor() {
        return anchor != null ? anchor : HabitAnchor.NONE;
    }
}
