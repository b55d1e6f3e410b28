package com.prakash.dayplanner.controller;

import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.Task;
import com.prakash.dayplanner.orchestrator.SuggestionOrchestrator;
import com.prakash.dayplanner.service.DefaultPoolRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Reads and replaces the default task and habit pools.
 */
@RestController
@Validated
@RequestMapping("/api/v1/pools")
public class PoolController {

    private static final Logger log = LoggerFactory.getLogger(PoolController.class);

    private final DefaultPoolRegistry poolRegistry;
    private final SuggestionOrchestrator suggestionOrchestrator;

    public PoolController(DefaultPoolRegistry poolRegistry, SuggestionOrchestrator suggestionOrchestrator) {
        this.poolRegistry = poolRegistry;
        this.suggestionOrchestrator = suggestionOrchestrator;
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<Task>> getTasks() {
        return ResponseEntity.ok(poolRegistry.getTasks());
    }

    @PutMapping("/tasks")
    public ResponseEntity<List<Task>> replaceTasks(@RequestBody List<@Valid Task> tasks) {
        log.info("Received request to replace default task pool ({} task(s))", tasks.size());
        List<Task> updated = poolRegistry.replaceTasks(tasks);
        suggestionOrchestrator.invalidate();
        return ResponseEntity.ok(updated);
    }

    @GetMapping("/habits")
    public ResponseEntity<List<Habit>> getHabits() {
        return ResponseEntity.ok(poolRegistry.getHabits());
    }

    @PutMapping("/habits")
    public ResponseEntity<List<Habit>> replaceHabits(@RequestBody List<@Valid Habit> habits) {
        log.info("Received request to replace default habit pool ({} habit(s))", habits.size());
        List<Habit> updated = poolRegistry.replaceHabits(habits);
        suggestionOrchestrator.invalidate();
        return ResponseEntity.ok(updated);
    }
}
