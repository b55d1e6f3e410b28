package com.prakash.dayplanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

// Result of one planning run
@Value
@Builder
public class DayPlan {
    LocalDate day;
    List<PlannedBlock> blocks; // task chunks with their buffers, then habit blocks
    String summary;
    long taskMinutes; // buffers excluded
    int habitBlocks;
}
