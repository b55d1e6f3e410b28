package com.prakash.dayplanner.dto;

import com.prakash.dayplanner.model.BusyBlock;
import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.Task;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanDayRequest {

    @NotNull(message = "day is required")
    private LocalDate day;

    private List<@Valid BusyBlock> existing;

    // Empty or missing lists fall back to the default pools
    private List<@Valid Task> tasks;
    private List<@Valid Habit> habits;
}
