package com.prakash.dayplanner.orchestrator;

import com.prakash.dayplanner.model.DayPlan;
import com.prakash.dayplanner.service.DayPlanningService;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class SuggestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SuggestionOrchestrator.class);

    private final DayPlanningService planningService;
    private final Clock clock;

    private final AtomicReference<CachedPlan> latest = new AtomicReference<>();
    // Bumped on every invalidation; a cached plan is only served while its generation is current
    private final AtomicLong generation = new AtomicLong();

    public SuggestionOrchestrator(DayPlanningService planningService, Clock clock) {
        this.planningService = planningService;
        this.clock = clock;
    }

    /**
     * Periodically pre-computes today's suggested plan from the default pools so the
     * suggestions endpoint can answer from cache.
     */
    @Scheduled(cron = "${dayplanner.suggestions.cron:0 0 5 * * *}") // Default: daily at 5 AM
    public void refreshSuggestions() {
        log.info("==== Orchestrator: Starting suggestion refresh ====");
        try {
            long startedAt = generation.get();
            DayPlan plan = planningService.suggestForDate(LocalDate.now(clock));
            if (store(plan, startedAt)) {
                log.info("Orchestrator: Cached suggestions - {}", plan.getSummary());
            }
        } catch (Exception e) {
            log.error("Orchestrator: Error occurred during suggestion refresh: {}", e.getMessage(), e);
        } finally {
            log.info("==== Orchestrator: Finished suggestion refresh ====");
        }
    }

    /**
     * Suggested plan for {@code date}: the cached one if it was computed for that date
     * from the current default pools, otherwise a freshly computed plan, which then
     * replaces the cache.
     */
    public DayPlan suggestionsFor(LocalDate date) {
        CachedPlan cached = latest.get();
        if (cached != null
                && cached.getGeneration() == generation.get()
                && cached.getPlan().getDay().equals(date)) {
            log.debug("Serving cached suggestions for {}", date);
            return cached.getPlan();
        }
        long startedAt = generation.get();
        DayPlan plan = planningService.suggestForDate(date);
        store(plan, startedAt);
        return plan;
    }

    /**
     * Drops the cached plan, e.g. after the default pools changed. Plans still being
     * computed from the old pools will not be cached.
     */
    public void invalidate() {
        generation.incrementAndGet();
        latest.set(null);
    }

    private boolean store(DayPlan plan, long startedAt) {
        if (startedAt != generation.get()) {
            log.debug("Default pools changed while planning {}; not caching", plan.getDay());
            return false;
        }
        latest.set(new CachedPlan(plan, startedAt));
        return true;
    }

    @Value
    private static class CachedPlan {
        DayPlan plan;
        long generation;
    }
}
