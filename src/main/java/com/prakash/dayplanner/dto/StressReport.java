package com.prakash.dayplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// All scores are on a 0..100 scale
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StressReport {
    private int load;
    private int recovery;
    private int risk;
    private String text;
}
