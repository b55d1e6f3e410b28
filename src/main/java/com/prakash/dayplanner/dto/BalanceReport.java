package com.prakash.dayplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BalanceReport {
    private int score; // 0..100
    private long focusMinutes;
    private long recoveryMinutes;
    private String text;
}
