package com.prakash.dayplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InsightsReport {
    private int deepWorkBlocks;
    private long bufferMinutes;
    private long longestBlockMinutes;
    private String text;
}
