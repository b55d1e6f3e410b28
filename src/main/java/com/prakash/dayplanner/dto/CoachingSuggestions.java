package com.prakash.dayplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoachingSuggestions {

    public static final String SOURCE_MODEL = "model";
    public static final String SOURCE_FALLBACK = "fallback";

    private String source; // "model" or "fallback"
    private List<String> suggestions;
}
