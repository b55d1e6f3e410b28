package com.prakash.dayplanner.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prakash.dayplanner.model.DayPlan;
import com.prakash.dayplanner.model.PlannedBlock;
import com.prakash.dayplanner.orchestrator.SuggestionOrchestrator;
import com.prakash.dayplanner.planner.DayPlanner;
import com.prakash.dayplanner.planner.FreeWindowFinder;
import com.prakash.dayplanner.planner.HabitPlacer;
import com.prakash.dayplanner.planner.SlotScorer;
import com.prakash.dayplanner.planner.TaskCarver;
import com.prakash.dayplanner.service.DayPlanningService;
import com.prakash.dayplanner.service.DefaultPoolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PlanController.class)
@AutoConfigureMockMvc(addFilters = false)
class PlanControllerTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);

    @SpringBootConfiguration
    @Import({PlanController.class, GlobalExceptionHandler.class, DayPlanningService.class,
            DayPlanner.class, FreeWindowFinder.class, TaskCarver.class, SlotScorer.class, HabitPlacer.class})
    static class TestApplication {

        @Bean
        Clock clock() {
            return Clock.fixed(DAY.atTime(5, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        }
    }

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    DefaultPoolRegistry poolRegistry;

    @MockBean
    SuggestionOrchestrator suggestionOrchestrator;

    @BeforeEach
    void setup() {
        Mockito.reset(poolRegistry, suggestionOrchestrator);
    }

    @Test
    void planDay_placesTaskAroundExistingBlock() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("day", "2025-03-10");
        req.put("existing", List.of(block("Standup", "2025-03-10T09:00:00", "2025-03-10T10:00:00")));
        req.put("tasks", List.of(Map.of("title", "Draft", "estimateMinutes", 60, "priority", 5, "splitAllowed", false)));

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.day").value("2025-03-10"))
                .andExpect(jsonPath("$.taskMinutes").value(60))
                .andExpect(jsonPath("$.habitBlocks").value(0))
                .andExpect(jsonPath("$.summary").value("Planned 60 task min and 0 habit block(s) for 2025-03-10."))
                .andExpect(jsonPath("$.blocks", hasSize(3)))
                .andExpect(jsonPath("$.blocks[0].category").value("task"))
                .andExpect(jsonPath("$.blocks[0].color").value("#2f6feb"))
                .andExpect(jsonPath("$.blocks[0].start", startsWith("2025-03-10T06:00")))
                .andExpect(jsonPath("$.blocks[0].end", startsWith("2025-03-10T07:00")))
                .andExpect(jsonPath("$.blocks[1].title").value(PlannedBlock.BUFFER_TITLE))
                .andExpect(jsonPath("$.blocks[1].start", startsWith("2025-03-10T05:55")))
                .andExpect(jsonPath("$.blocks[2].category").value("buffer"));
    }

    @Test
    void planDay_returns400_whenDayMissing() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("tasks", List.of(Map.of("title", "Draft")));

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.error").value("day is required"));
    }

    @Test
    void planDay_returns400_whenTaskPriorityOutOfRange() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("day", "2025-03-10");
        req.put("tasks", List.of(Map.of("title", "Draft", "priority", 9)));

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Task priority must be between 1 and 5."));
    }

    @Test
    void planDay_returns400_whenBlockHasNoStart() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("day", "2025-03-10");
        req.put("existing", List.of(Map.of("title", "Lunch", "end", "2025-03-10T13:00:00")));

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Block start is required."));
    }

    @Test
    void planDay_skipsNullExistingBlocks() throws Exception {
        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"day\":\"2025-03-10\",\"existing\":[null],"
                                + "\"tasks\":[{\"title\":\"Draft\",\"estimateMinutes\":60,\"splitAllowed\":false}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskMinutes").value(60))
                .andExpect(jsonPath("$.blocks[0].start", startsWith("2025-03-10T06:00")));
    }

    @Test
    void planDay_returns400_whenDateUnparseable() throws Exception {
        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"day\": \"2025-02-30\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request"));
    }

    @Test
    void freeWindows_honoursMinimumLength() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("day", "2025-03-10");
        req.put("busy", List.of(
                block("Gym", "2025-03-10T06:10:00", "2025-03-10T09:00:00"),
                block("Work", "2025-03-10T09:30:00", "2025-03-10T21:00:00")));
        req.put("minBlockMinutes", 30);

        mockMvc.perform(post("/api/v1/plans/free-windows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].start", startsWith("2025-03-10T09:00")))
                .andExpect(jsonPath("$[0].minutes").value(30))
                .andExpect(jsonPath("$[1].start", startsWith("2025-03-10T21:00")))
                .andExpect(jsonPath("$[1].minutes").value(60));
    }

    @Test
    void freeWindows_returns400_whenMinimumBelowOne() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("day", "2025-03-10");
        req.put("minBlockMinutes", 0);

        mockMvc.perform(post("/api/v1/plans/free-windows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("minBlockMinutes must be at least 1"));
    }

    @Test
    void suggestions_servedByOrchestrator() throws Exception {
        DayPlan plan = DayPlan.builder()
                .day(DAY)
                .blocks(List.of())
                .summary("Planned 0 task min and 0 habit block(s) for 2025-03-10.")
                .build();
        when(suggestionOrchestrator.suggestionsFor(DAY)).thenReturn(plan);

        mockMvc.perform(get("/api/v1/plans/suggestions").param("date", "2025-03-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("Planned 0 task min and 0 habit block(s) for 2025-03-10."))
                .andExpect(jsonPath("$.blocks", hasSize(0)));
    }

    @Test
    void suggestions_returns400_forBadOrMissingDate() throws Exception {
        mockMvc.perform(get("/api/v1/plans/suggestions").param("date", "tomorrow"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request"));
        mockMvc.perform(get("/api/v1/plans/suggestions"))
                .andExpect(status().isBadRequest());

        verify(suggestionOrchestrator, never()).suggestionsFor(any());
    }

    private static Map<String, Object> block(String title, String start, String end) {
        var block = new LinkedHashMap<String, Object>();
        block.put("title", title);
        block.put("start", start);
        block.put("end", end);
        return block;
    }
}
