package com.prakash.dayplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleAnalysis {
    private int blockCount;
    private long totalMinutes;
    private String firstStart; // HH:mm, or "--" when there are no blocks
    private String lastEnd;
    private int meetings;
    private String summary;
}
