package com.prakash.dayplanner.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A committed calendar entry the planner must work around.
 * Blocks whose end is not after their start are ignored by the planner rather than rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusyBlock implements TimeSpan {

    private String title;
    private String category; // free-form category or notes
    @NotNull(message = "Block start is required.")
    private LocalDateTime start;
    @NotNull(message = "Block end is required.")
    private LocalDateTime end;
    private String color;
    private String seriesId; // empty for one-off entries, shared across a recurring series
}
