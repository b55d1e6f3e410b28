package com.prakash.dayplanner.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor // Required for BeanOutputConverter
public class AiCoachingAdvice {

    // Ensure this field name matches the format instruction in the prompt
    private List<String> suggestions;
}
