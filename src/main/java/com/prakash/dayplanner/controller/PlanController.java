package com.prakash.dayplanner.controller;

import com.prakash.dayplanner.dto.FreeWindowsRequest;
import com.prakash.dayplanner.dto.PlanDayRequest;
import com.prakash.dayplanner.dto.PlanResponse;
import com.prakash.dayplanner.model.DayPlan;
import com.prakash.dayplanner.model.TimeWindow;
import com.prakash.dayplanner.orchestrator.SuggestionOrchestrator;
import com.prakash.dayplanner.service.DayPlanningService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final DayPlanningService planningService;
    private final SuggestionOrchestrator suggestionOrchestrator;

    public PlanController(DayPlanningService planningService, SuggestionOrchestrator suggestionOrchestrator) {
        this.planningService = planningService;
        this.suggestionOrchestrator = suggestionOrchestrator;
    }

    /**
     * Plans a day around the committed blocks in the request.
     *
     * @param request the day, committed blocks, and optional tasks and habits
     * @return planned task chunks, buffers and habit blocks with a summary
     */
    @PostMapping
    public ResponseEntity<PlanResponse> planDay(@Valid @RequestBody PlanDayRequest request) {
        log.info("Received request to plan {}", request.getDay());
        DayPlan plan = planningService.planDay(request.getDay(), request.getExisting(),
                request.getTasks(), request.getHabits());
        return ResponseEntity.ok(PlanResponse.fromPlan(plan));
    }

    /**
     * Free windows of a day given its busy blocks.
     */
    @PostMapping("/free-windows")
    public ResponseEntity<List<TimeWindow>> freeWindows(@Valid @RequestBody FreeWindowsRequest request) {
        log.debug("Received request for free windows on {}", request.getDay());
        return ResponseEntity.ok(planningService.freeWindows(request.getDay(), request.getBusy(),
                request.getMinBlockMinutes()));
    }

    /**
     * Suggested plan built only from the default pools.
     *
     * @param date the day to plan
     */
    @GetMapping("/suggestions")
    public ResponseEntity<PlanResponse> suggestions(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("Received request for suggestions on {}", date);
        return ResponseEntity.ok(PlanResponse.fromPlan(suggestionOrchestrator.suggestionsFor(date)));
    }
}
