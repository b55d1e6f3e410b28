package com.prakash.dayplanner.controller;

import com.prakash.dayplanner.dto.BalanceReport;
import com.prakash.dayplanner.dto.BlocksRequest;
import com.prakash.dayplanner.dto.CoachingSuggestions;
import com.prakash.dayplanner.dto.InsightsReport;
import com.prakash.dayplanner.dto.ScheduleAnalysis;
import com.prakash.dayplanner.dto.StressReport;
import com.prakash.dayplanner.service.CoachingService;
import com.prakash.dayplanner.service.ScheduleInsightsService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/insights")
public class InsightsController {

    private static final Logger log = LoggerFactory.getLogger(InsightsController.class);

    private final ScheduleInsightsService insightsService;
    private final CoachingService coachingService;

    public InsightsController(ScheduleInsightsService insightsService, CoachingService coachingService) {
        this.insightsService = insightsService;
        this.coachingService = coachingService;
    }

    @PostMapping("/analysis")
    public ResponseEntity<ScheduleAnalysis> analyze(@Valid @RequestBody BlocksRequest request) {
        log.debug("Received analysis request for {} block(s)", request.getBlocks().size());
        return ResponseEntity.ok(insightsService.analyze(request.getBlocks()));
    }

    @PostMapping("/overview")
    public ResponseEntity<InsightsReport> overview(@Valid @RequestBody BlocksRequest request) {
        return ResponseEntity.ok(insightsService.insights(request.getBlocks()));
    }

    @PostMapping("/stress")
    public ResponseEntity<StressReport> stress(@Valid @RequestBody BlocksRequest request) {
        return ResponseEntity.ok(insightsService.stress(request.getBlocks()));
    }

    @PostMapping("/balance")
    public ResponseEntity<BalanceReport> balance(@Valid @RequestBody BlocksRequest request) {
        return ResponseEntity.ok(insightsService.balance(request.getBlocks()));
    }

    @PostMapping("/goals")
    public ResponseEntity<CoachingSuggestions> goals(@Valid @RequestBody BlocksRequest request) {
        log.info("Received goal suggestion request for {} block(s)", request.getBlocks().size());
        return ResponseEntity.ok(coachingService.suggestGoals(request.getBlocks()));
    }

    @PostMapping("/habits")
    public ResponseEntity<CoachingSuggestions> habits(@Valid @RequestBody BlocksRequest request) {
        log.info("Received habit recommendation request for {} block(s)", request.getBlocks().size());
        return ResponseEntity.ok(coachingService.recommendHabits(request.getBlocks()));
    }
}
