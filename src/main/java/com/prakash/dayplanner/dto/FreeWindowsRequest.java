package com.prakash.dayplanner.dto;

import com.prakash.dayplanner.model.BusyBlock;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
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
public class FreeWindowsRequest {

    @NotNull(message = "day is required")
    private LocalDate day;

    private List<@Valid BusyBlock> busy;

    @Min(value = 1, message = "minBlockMinutes must be at least 1")
    private Integer minBlockMinutes; // defaults to 15
}
