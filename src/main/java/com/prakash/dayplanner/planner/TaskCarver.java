package com.prakash.dayplanner.planner;

import com.prakash.dayplanner.model.PlannedBlock;
import com.prakash.dayplanner.model.Task;
import com.prakash.dayplanner.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy carving of tasks into free windows.
 * <p>
 * Tasks are handled in {@link #PLACEMENT_ORDER}. For each task the best-scoring
 * window fragment is chosen repeatedly; a chunk is cut from its start and wrapped
 * in a {@value #PRE_BUFFER_MINUTES}-minute buffer before and a
 * {@value #POST_BUFFER_MINUTES}-minute buffer after. There is no backtracking:
 * whatever a task cannot get is left unplaced.
 * </p>
 */
@Component
public class TaskCarver {

    private static final Logger log = LoggerFactory.getLogger(TaskCarver.class);

    public static final int PRE_BUFFER_MINUTES = 5;
    public static final int POST_BUFFER_MINUTES = 10;

    /**
     * Priority descending, then earliest deadline (undated tasks last), then largest estimate.
     */
    public static final Comparator<Task> PLACEMENT_ORDER =
            Comparator.comparingInt(Task::getPriority).reversed()
                    .thenComparing(Task::getDeadline, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(Comparator.comparingInt(Task::getEstimateMinutes).reversed());

    private final SlotScorer slotScorer;

    public TaskCarver(SlotScorer slotScorer) {
        this.slotScorer = slotScorer;
    }

    /**
     * @param windows free windows to carve from; the list itself is not modified
     * @param tasks   tasks to place
     * @param now     reference time for urgency and earliness scoring
     * @return task chunks, each followed by its leading and trailing buffer
     */
    public List<PlannedBlock> carve(List<TimeWindow> windows, List<Task> tasks, LocalDateTime now) {
        List<PlannedBlock> out = new ArrayList<>();
        if (CollectionUtils.isEmpty(tasks) || CollectionUtils.isEmpty(windows)) {
            return out;
        }

        List<Task> ordered = new ArrayList<>(tasks);
        ordered.sort(PLACEMENT_ORDER);

        List<TimeWindow> fragments = new ArrayList<>(windows);
        for (Task task : ordered) {
            int unplaced = carveTask(task, fragments, now, out);
            if (unplaced > 0) {
                log.debug("Task '{}' left with {} unplaced minute(s)", task.getTitle(), unplaced);
            }
        }
        return out;
    }

    private int carveTask(Task task, List<TimeWindow> fragments, LocalDateTime now, List<PlannedBlock> acc) {
        int remaining = task.effectiveEstimateMinutes();
        int maxChunk = Math.max(1, task.getMaxChunkMinutes());

        while (remaining > 0) {
            int bestIdx = bestFragment(task, fragments, now);
            if (bestIdx < 0) {
                break;
            }

            TimeWindow chosen = fragments.get(bestIdx);
            int chunk = (int) Math.min(Math.min(maxChunk, remaining), chosen.getMinutes());

            LocalDateTime start = chosen.getStart();
            LocalDateTime end = start.plusMinutes(chunk);
            LocalDateTime bufferEnd = end.plusMinutes(POST_BUFFER_MINUTES);

            acc.add(PlannedBlock.taskChunk(task.getTitle(), start, end));
            acc.add(PlannedBlock.buffer(start.minusMinutes(PRE_BUFFER_MINUTES), start));
            acc.add(PlannedBlock.buffer(end, bufferEnd));
            log.debug("Placed {} min of '{}' at {}", chunk, task.getTitle(), start);

            if (bufferEnd.isBefore(chosen.getEnd())) {
                fragments.set(bestIdx, chosen.withStart(bufferEnd));
            } else {
                fragments.remove(bestIdx);
            }

            remaining -= chunk;
            if (!task.isSplitAllowed()) {
                break;
            }
        }
        return Math.max(0, remaining);
    }

    // First fragment with the strictly highest score wins ties
    private int bestFragment(Task task, List<TimeWindow> fragments, LocalDateTime now) {
        int bestIdx = -1;
        double bestScore = SlotScorer.UNUSABLE;
        for (int i = 0; i < fragments.size(); i++) {
            TimeWindow fragment = fragments.get(i);
            if (fragment.getMinutes() < SlotScorer.MIN_USABLE_MINUTES) {
                continue;
            }
            double score = slotScorer.score(fragment, task, now);
            if (score > bestScore) {
                bestScore = score;
                bestIdx = i;
            }
        }
        return bestIdx;
    }
}
