package com.prakash.dayplanner.planner;

import com.prakash.dayplanner.model.Task;
import com.prakash.dayplanner.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Scores how suitable a free window is for a task.
 * <p>
 * The score is a weighted sum of priority, deadline urgency, circadian bias,
 * window length (capped at two hours) and earliness relative to {@code now}.
 * Windows shorter than {@value #MIN_USABLE_MINUTES} minutes get {@link #UNUSABLE}.
 * </p>
 */
@Component
public class SlotScorer {

    public static final double UNUSABLE = -1e9;
    public static final int MIN_USABLE_MINUTES = 15;

    private static final double PRIORITY_WEIGHT = 1.8;
    private static final double URGENCY_WEIGHT = 1.4;
    private static final double CIRCADIAN_WEIGHT = 0.8;
    private static final double LENGTH_WEIGHT = 0.5;
    private static final double EARLINESS_WEIGHT = 0.2;

    private static final double URGENCY_HORIZON_MINUTES = 60.0 * 24 * 7;
    private static final double LENGTH_CAP_MINUTES = 120.0;
    private static final double IN_BAND_BONUS = 1.0;
    private static final double OUT_OF_BAND_PENALTY = -0.3;

    public double score(TimeWindow window, Task task, LocalDateTime now) {
        long minutes = window.getMinutes();
        if (minutes < MIN_USABLE_MINUTES) {
            return UNUSABLE;
        }
        int startHour = window.getStart().getHour();

        return PRIORITY_WEIGHT * normalizedPriority(task.getPriority())
                + URGENCY_WEIGHT * urgency(task, now)
                + CIRCADIAN_WEIGHT * circadianBias(task, startHour)
                + LENGTH_WEIGHT * Math.min(1.0, minutes / LENGTH_CAP_MINUTES)
                + EARLINESS_WEIGHT * earliness(window, now);
    }

    // 1..5 -> 0..1
    static double normalizedPriority(int priority) {
        return (priority - 1) / 4.0;
    }

    /**
     * Linear ramp: 0 for no deadline or one at least a week away, 1 once it is due or past.
     */
    double urgency(Task task, LocalDateTime now) {
        if (!task.hasDeadline()) {
            return 0.0;
        }
        long minutesLeft = Duration.between(now, task.getDeadline()).getSeconds() / 60;
        return clamp(1.0 - (minutesLeft / URGENCY_HORIZON_MINUTES), 0.0, 1.0);
    }

    // Morning = start hour 7..12, afternoon = 13..17; the two flags add up independently
    double circadianBias(Task task, int startHour) {
        double bias = 0.0;
        if (task.isPreferMorning()) {
            bias += (startHour >= 7 && startHour <= 12) ? IN_BAND_BONUS : OUT_OF_BAND_PENALTY;
        }
        if (task.isPreferAfternoon()) {
            bias += (startHour >= 13 && startHour <= 17) ? IN_BAND_BONUS : OUT_OF_BAND_PENALTY;
        }
        return bias;
    }

    double earliness(TimeWindow window, LocalDateTime now) {
        double hoursAway = Duration.between(now, window.getStart()).getSeconds() / 3600.0;
        return 1.0 / Math.max(1.0, hoursAway);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
