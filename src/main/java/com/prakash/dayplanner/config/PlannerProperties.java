package com.prakash.dayplanner.config;

import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.Task;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration class for the planner, bound to the property prefix <strong>dayplanner</strong>.
 *
 * Example configuration in <code>application.properties</code>:
 * <pre>
 * dayplanner.defaults.tasks[0].title=Write report
 * dayplanner.defaults.tasks[0].estimate-minutes=90
 * dayplanner.defaults.habits[0].title=Walk
 * dayplanner.defaults.habits[0].anchor=after-lunch
 * dayplanner.coach.enabled=true
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "dayplanner")
public class PlannerProperties {

    /**
     * Initial default pools, used when a planning request brings no tasks or habits.
     */
    private Defaults defaults = new Defaults();

    /**
     * LLM coaching settings.
     */
    private Coach coach = new Coach();

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Coach getCoach() {
        return coach;
    }

    public void setCoach(Coach coach) {
        this.coach = coach;
    }

    public static class Defaults {

        private List<Task> tasks = new ArrayList<>();
        private List<Habit> habits = new ArrayList<>();

        public List<Task> getTasks() {
            return tasks;
        }

        public void setTasks(List<Task> tasks) {
            this.tasks = tasks;
        }

        public List<Habit> getHabits() {
            return habits;
        }

        public void setHabits(List<Habit> habits) {
            this.habits = habits;
        }
    }

    public static class Coach {

        /**
         * When false, goal and habit suggestions come from the static fallback lists
         * and the model is never called.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
