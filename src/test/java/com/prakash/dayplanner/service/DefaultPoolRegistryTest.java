package com.prakash.dayplanner.service;

import com.prakash.dayplanner.config.PlannerProperties;
import com.prakash.dayplanner.exception.InvalidPlanRequestException;
import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.HabitAnchor;
import com.prakash.dayplanner.model.PlanningPool;
import com.prakash.dayplanner.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultPoolRegistryTest {

    private DefaultPoolRegistry registry;

    @BeforeEach
    void setUp() {
        PlannerProperties properties = new PlannerProperties();
        properties.getDefaults().setTasks(List.of(Task.builder().title("Report").estimateMinutes(90).build()));
        properties.getDefaults().setHabits(List.of(Habit.builder().title("Walk").anchor(HabitAnchor.AFTER_LUNCH).build()));
        registry = new DefaultPoolRegistry(properties);
    }

    @Test
    void seededFromProperties() {
        assertThat(registry.getTasks()).extracting(Task::getTitle).containsExactly("Report");
        assertThat(registry.getHabits()).extracting(Habit::getTitle).containsExactly("Walk");
    }

    @Test
    void replaceTasks_keepsHabits() {
        registry.replaceTasks(List.of(Task.builder().title("Email").build(), Task.builder().title("Review").build()));

        assertThat(registry.getTasks()).extracting(Task::getTitle).containsExactly("Email", "Review");
        assertThat(registry.getHabits()).extracting(Habit::getTitle).containsExactly("Walk");
    }

    @Test
    void replaceHabits_withEmptyListClearsPool() {
        registry.replaceHabits(List.of());

        assertThat(registry.getHabits()).isEmpty();
        assertThat(registry.getTasks()).hasSize(1);
    }

    @Test
    void snapshot_isUnaffectedByLaterChanges() {
        PlanningPool before = registry.snapshot();
        List<Task> source = new ArrayList<>(List.of(Task.builder().title("Email").build()));

        registry.replaceTasks(source);
        source.get(0).setTitle("Changed");
        source.add(Task.builder().title("Extra").build());

        assertThat(before.getTasks()).extracting(Task::getTitle).containsExactly("Report");
        assertThat(registry.getTasks()).extracting(Task::getTitle).containsExactly("Email");
    }

    @Test
    void returnedItems_cannotChangeThePool() {
        registry.getTasks().get(0).setTitle("Changed");
        registry.getHabits().get(0).setTitle("Changed");
        registry.snapshot().getTasks().get(0).setEstimateMinutes(5);
        registry.replaceTasks(List.of(Task.builder().title("Email").build()))
                .get(0).setTitle("Changed");

        assertThat(registry.getTasks()).extracting(Task::getTitle).containsExactly("Email");
        assertThat(registry.getHabits()).extracting(Habit::getTitle).containsExactly("Walk");
        assertThat(registry.snapshot().getTasks().get(0).getTitle()).isEqualTo("Email");
    }

    @Test
    void snapshotItems_areCopiedOnEveryRead() {
        PlanningPool pool = registry.snapshot();

        pool.getTasks().get(0).setEstimateMinutes(5);

        assertThat(pool.getTasks().get(0).getEstimateMinutes()).isEqualTo(90);
    }

    @Test
    void nullReplacement_isRejected() {
        assertThatThrownBy(() -> registry.replaceTasks(null)).isInstanceOf(InvalidPlanRequestException.class);
        assertThatThrownBy(() -> registry.replaceHabits(null)).isInstanceOf(InvalidPlanRequestException.class);
    }
}
