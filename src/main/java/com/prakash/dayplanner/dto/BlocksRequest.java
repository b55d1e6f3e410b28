package com.prakash.dayplanner.dto;

import com.prakash.dayplanner.model.BusyBlock;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// Calendar blocks submitted for analysis
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlocksRequest {

    @NotNull(message = "blocks is required")
    private List<@Valid BusyBlock> blocks;
}
