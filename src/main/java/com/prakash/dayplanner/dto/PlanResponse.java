package com.prakash.dayplanner.dto;

import com.prakash.dayplanner.model.DayPlan;
import com.prakash.dayplanner.model.PlannedBlock;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlanResponse {

    private LocalDate day;
    private String summary;
    private long taskMinutes;
    private int habitBlocks;
    private List<PlannedBlock> blocks;

    // Factory method to convert a DayPlan into the API response
    public static PlanResponse fromPlan(DayPlan plan) {
        if (plan == null) {
            return null;
        }
        return PlanResponse.builder()
                .day(plan.getDay())
                .summary(plan.getSummary())
                .taskMinutes(plan.getTaskMinutes())
                .habitBlocks(plan.getHabitBlocks())
                .blocks(plan.getBlocks())
                .build();
    }
}
