package com.prakash.dayplanner.service.agent;

import com.prakash.dayplanner.dto.AiCoachingAdvice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Asks the chat model for short goal and habit suggestions based on a schedule summary.
 */
@Service
public class PlanCoachAgent {

    private static final Logger log = LoggerFactory.getLogger(PlanCoachAgent.class);

    private final ChatModel chatModel;

    private final String goalsPromptTemplate = """
            You are a pragmatic productivity coach. Here is a summary of someone's calendar for the day:

            {summary}

            Suggest exactly three concrete, short goals for this day (each under 80 characters).
            Favour deep-work blocks of 60 to 90 minutes before noon, movement breaks and batching admin work.
            Return the goals as a JSON object matching the requested format.

            {format}
            """;

    private final String habitsPromptTemplate = """
            You are a pragmatic wellbeing coach. Here is a summary of someone's calendar for the day:

            {summary}

            Recommend exactly three small daily habits that fit around this schedule (each under 80 characters),
            each with a duration and a time of day, for example "Walk 20m after lunch".
            Return the habits as a JSON object matching the requested format.

            {format}
            """;

    public PlanCoachAgent(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    /**
     * @param scheduleSummary one-line summary of the day's blocks
     * @return the suggested goals, possibly empty
     * @throws RuntimeException if the model call or response parsing fails
     */
    public List<String> suggestGoals(String scheduleSummary) {
        log.info("Requesting goal suggestions from the model");
        return ask(goalsPromptTemplate, scheduleSummary, "goal suggestions");
    }

    /**
     * @param scheduleSummary one-line summary of the day's blocks
     * @return the recommended habits, possibly empty
     * @throws RuntimeException if the model call or response parsing fails
     */
    public List<String> recommendHabits(String scheduleSummary) {
        log.info("Requesting habit recommendations from the model");
        return ask(habitsPromptTemplate, scheduleSummary, "habit recommendations");
    }

    private List<String> ask(String template, String scheduleSummary, String what) {
        BeanOutputConverter<AiCoachingAdvice> outputConverter = new BeanOutputConverter<>(AiCoachingAdvice.class);

        PromptTemplate promptTemplate = new PromptTemplate(template);
        Prompt prompt = promptTemplate.create(Map.of(
                "summary", scheduleSummary,
                "format", outputConverter.getFormat()
        ));
        log.debug("Sending coaching prompt to AI: \n{}", prompt.getContents());

        try {
            var chatResponse = chatModel.call(prompt);
            String rawResponse = chatResponse.getResult().getOutput().getText();
            log.debug("Received raw AI response for {}: \n{}", what, rawResponse);
            AiCoachingAdvice advice = outputConverter.convert(rawResponse);
            if (advice == null || advice.getSuggestions() == null) {
                log.warn("AI response parsed, but 'suggestions' list is null. Returning no {}.", what);
                return List.of();
            }
            log.info("Successfully parsed {} {}.", advice.getSuggestions().size(), what);
            return advice.getSuggestions();
        } catch (Exception e) {
            log.error("Failed to generate or parse {}: {}", what, e.getMessage(), e);
            throw new RuntimeException("AI " + what + " failed", e);
        }
    }
}
