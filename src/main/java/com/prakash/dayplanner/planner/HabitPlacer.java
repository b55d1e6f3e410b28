package com.prakash.dayplanner.planner;

import com.prakash.dayplanner.model.Habit;
import com.prakash.dayplanner.model.HabitAnchor;
import com.prakash.dayplanner.model.PlannedBlock;
import com.prakash.dayplanner.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Places at most one block per habit into the windows left after task carving.
 * <p>
 * Every habit is scored against the same windows: length (uncapped), anchor match
 * and habit priority. The block starts at the chosen window's start and lasts the
 * habit's target duration, even if that runs past the window's end. When an earlier
 * habit already sits in the chosen window, the block starts where that habit ended
 * instead; a window filled up to its end takes no further habits.
 * </p>
 */
@Component
public class HabitPlacer {

    private static final Logger log = LoggerFactory.getLogger(HabitPlacer.class);

    private static final double LENGTH_WEIGHT_PER_HOUR = 0.2;
    private static final double ANCHOR_MATCH_BONUS = 1.0;
    private static final double ANCHOR_MISS_PENALTY = -0.2;
    private static final double PRIORITY_WEIGHT = 0.5;

    public List<PlannedBlock> place(List<TimeWindow> windows, List<Habit> habits) {
        List<PlannedBlock> out = new ArrayList<>();
        if (CollectionUtils.isEmpty(habits) || CollectionUtils.isEmpty(windows)) {
            return out;
        }

        // Next free start per window; scoring always sees the windows as given
        Map<Integer, LocalDateTime> cursors = new HashMap<>();
        for (Habit habit : habits) {
            if (habit.getTargetMinutes() <= 0) {
                log.warn("Skipping habit '{}' with non-positive duration {}", habit.getTitle(), habit.getTargetMinutes());
                continue;
            }
            int bestIdx = -1;
            double best = SlotScorer.UNUSABLE;
            for (int i = 0; i < windows.size(); i++) {
                double score = score(windows.get(i), habit);
                if (score > best) {
                    best = score;
                    bestIdx = i;
                }
            }
            if (bestIdx < 0) {
                log.debug("No window left for habit '{}'", habit.getTitle());
                continue;
            }

            TimeWindow chosen = windows.get(bestIdx);
            LocalDateTime start = cursors.getOrDefault(bestIdx, chosen.getStart());
            if (!start.isBefore(chosen.getEnd())) {
                log.debug("Window {} already filled by earlier habits; '{}' left unplaced",
                        chosen.getStart(), habit.getTitle());
                continue;
            }
            LocalDateTime end = start.plusMinutes(habit.getTargetMinutes());
            out.add(PlannedBlock.habit(habit.getTitle(), start, end));
            cursors.put(bestIdx, end);
            log.debug("Placed habit '{}' at {} ({} min)", habit.getTitle(), start, habit.getTargetMinutes());
        }
        return out;
    }

    double score(TimeWindow window, Habit habit) {
        double score = LENGTH_WEIGHT_PER_HOUR * (window.getMinutes() / 60.0);
        HabitAnchor anchor = habit.effectiveAnchor();
        if (anchor != HabitAnchor.NONE) {
            score += anchor.covers(window.getStart().getHour()) ? ANCHOR_MATCH_BONUS : ANCHOR_MISS_PENALTY;
        }
        score += PRIORITY_WEIGHT * SlotScorer.normalizedPriority(habit.getPriority());
        return score;
    }
}
