package com.prakash.dayplanner.service;

import com.prakash.dayplanner.config.PlannerProperties;
import com.prakash.dayplanner.dto.CoachingSuggestions;
import com.prakash.dayplanner.model.BusyBlock;
import com.prakash.dayplanner.service.agent.PlanCoachAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

/**
 * Goal and habit suggestions for a schedule. Uses {@link PlanCoachAgent} when coaching is
 * enabled and falls back to fixed suggestions when it is disabled, fails or returns nothing.
 */
@Service
public class CoachingService {

    private static final Logger log = LoggerFactory.getLogger(CoachingService.class);

    static final List<String> DEFAULT_GOALS = List.of(
            "Ship two 60-90m deep-work blocks before noon",
            "Book 30-45m movement break",
            "Protect 1h for admin/email batching");

    static final List<String> DEFAULT_HABITS = List.of(
            "⚑ Walk 20m after lunch",
            "📚 Read 25m in the evening",
            "🧘 5m breathing before first meeting");

    private final PlanCoachAgent coachAgent;
    private final ScheduleInsightsService insightsService;
    private final PlannerProperties properties;

    public CoachingService(PlanCoachAgent coachAgent,
                           ScheduleInsightsService insightsService,
                           PlannerProperties properties) {
        this.coachAgent = coachAgent;
        this.insightsService = insightsService;
        this.properties = properties;
    }

    public CoachingSuggestions suggestGoals(List<BusyBlock> blocks) {
        return coach(blocks, coachAgent::suggestGoals, DEFAULT_GOALS, "goals");
    }

    public CoachingSuggestions recommendHabits(List<BusyBlock> blocks) {
        return coach(blocks, coachAgent::recommendHabits, DEFAULT_HABITS, "habits");
    }

    private CoachingSuggestions coach(List<BusyBlock> blocks,
                                      Function<String, List<String>> ask,
                                      List<String> fallback,
                                      String what) {
        if (!properties.getCoach().isEnabled()) {
            log.debug("Coaching disabled; returning default {}", what);
            return new CoachingSuggestions(CoachingSuggestions.SOURCE_FALLBACK, fallback);
        }
        String summary = insightsService.analyze(blocks).getSummary();
        try {
            List<String> suggestions = ask.apply(summary);
            if (suggestions.isEmpty()) {
                log.warn("Model returned no {}; using defaults", what);
                return new CoachingSuggestions(CoachingSuggestions.SOURCE_FALLBACK, fallback);
            }
            return new CoachingSuggestions(CoachingSuggestions.SOURCE_MODEL, suggestions);
        } catch (RuntimeException e) {
            log.warn("Coaching model unavailable for {}, using defaults: {}", what, e.getMessage());
            return new CoachingSuggestions(CoachingSuggestions.SOURCE_FALLBACK, fallback);
        }
    }
}
