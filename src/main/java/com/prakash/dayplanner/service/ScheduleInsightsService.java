package com.prakash.dayplanner.service;

import com.prakash.dayplanner.dto.BalanceReport;
import com.prakash.dayplanner.dto.InsightsReport;
import com.prakash.dayplanner.dto.ScheduleAnalysis;
import com.prakash.dayplanner.dto.StressReport;
import com.prakash.dayplanner.model.BusyBlock;
import com.prakash.dayplanner.model.PlannedBlock;
import com.prakash.dayplanner.model.TimeSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Quick heuristic read-outs over a list of calendar blocks.
 * Planned blocks sent back by clients are recognised by their title markers
 * ({@value PlannedBlock#TASK_MARKER} for task chunks, {@value PlannedBlock#BUFFER_TITLE} for buffers).
 */
@Service
public class ScheduleInsightsService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleInsightsService.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");
    private static final List<String> RECOVERY_KEYWORDS = List.of("buffer", "walk", "break", "exercise");

    /**
     * Counts, total time, the time-of-day window covered and the number of meetings.
     */
    public ScheduleAnalysis analyze(List<BusyBlock> blocks) {
        List<BusyBlock> valid = withBounds(blocks);
        long totalMinutes = 0;
        int meetings = 0;
        LocalTime first = null;
        LocalTime last = null;

        for (BusyBlock block : valid) {
            totalMinutes += minutes(block);
            if (block.getTitle() != null && block.getTitle().toLowerCase(Locale.ROOT).contains("meeting")) {
                meetings++;
            }
            LocalTime start = block.getStart().toLocalTime();
            LocalTime end = block.getEnd().toLocalTime();
            if (first == null || start.isBefore(first)) first = start;
            if (last == null || end.isAfter(last)) last = end;
        }

        String firstText = first != null ? first.format(TIME_FORMATTER) : "--";
        String lastText = last != null ? last.format(TIME_FORMATTER) : "--";
        String summary = String.format("Blocks: %d  |  Total: %dh%dm  |  Window: %s-%s  |  Meetings: %d",
                valid.size(), totalMinutes / 60, totalMinutes % 60, firstText, lastText, meetings);
        log.debug("Schedule analysis: {}", summary);

        return ScheduleAnalysis.builder()
                .blockCount(valid.size())
                .totalMinutes(totalMinutes)
                .firstStart(firstText)
                .lastEnd(lastText)
                .meetings(meetings)
                .summary(summary)
                .build();
    }

    public InsightsReport insights(List<BusyBlock> blocks) {
        int deepWork = 0;
        long bufferMinutes = 0;
        long longest = 0;

        for (BusyBlock block : withBounds(blocks)) {
            String title = block.getTitle() != null ? block.getTitle() : "";
            long minutes = minutes(block);
            if (title.startsWith(PlannedBlock.TASK_MARKER)) deepWork++;
            if (title.equals(PlannedBlock.BUFFER_TITLE)) bufferMinutes += minutes;
            longest = Math.max(longest, minutes);
        }

        String text = String.format("Deep-work blocks: %d%nBuffers: %d min%nLongest block: %d min%n"
                        + "Tip: keep deep-work blocks >= 60m and surround with 5-10m buffers.",
                deepWork, bufferMinutes, longest);
        return InsightsReport.builder()
                .deepWorkBlocks(deepWork)
                .bufferMinutes(bufferMinutes)
                .longestBlockMinutes(longest)
                .text(text)
                .build();
    }

    /**
     * Density versus recovery: load grows with booked time, recovery with the gaps between
     * consecutive blocks, and risk is load minus half the recovery. All clamped to 0..100.
     */
    public StressReport stress(List<BusyBlock> blocks) {
        List<BusyBlock> sorted = withBounds(blocks).stream()
                .sorted(Comparator.comparing(BusyBlock::getStart))
                .collect(Collectors.toList());

        long totalMinutes = 0;
        long gapMinutes = 0;
        LocalDateTime lastEnd = null;
        for (BusyBlock block : sorted) {
            totalMinutes += minutes(block);
            if (lastEnd != null && lastEnd.isBefore(block.getStart())) {
                gapMinutes += TimeSpan.minutesBetween(lastEnd, block.getStart());
            }
            lastEnd = block.getEnd();
        }

        int load = (int) Math.min(100, totalMinutes / 6);
        int recovery = (int) clamp(gapMinutes / 3, 0, 100);
        int risk = (int) clamp(load - (recovery / 2), 0, 100);

        String text = String.format("Load: %d/100%nRecovery: %d/100%nStress risk: %d/100%n"
                + "Tip: add micro-buffers (5-10m) after meetings and one 30m walk.", load, recovery, risk);
        return StressReport.builder().load(load).recovery(recovery).risk(risk).text(text).build();
    }

    /**
     * Splits booked time into focus and recovery (titles mentioning buffers, walks, breaks
     * or exercise) and scores the mix.
     */
    public BalanceReport balance(List<BusyBlock> blocks) {
        long focus = 0;
        long recovery = 0;
        for (BusyBlock block : withBounds(blocks)) {
            String title = block.getTitle() != null ? block.getTitle().toLowerCase(Locale.ROOT) : "";
            long minutes = minutes(block);
            if (RECOVERY_KEYWORDS.stream().anyMatch(title::contains)) {
                recovery += minutes;
            } else {
                focus += minutes;
            }
        }

        int score = (int) clamp(70 + (recovery / 15) - Math.abs(focus - recovery) / 10, 0, 100);
        String text = String.format("Balance score: %d/100%nFocus: %dm | Recovery: %dm%n"
                + "Suggestion: schedule recovery up to ~35%% of total focus time.", score, focus, recovery);
        return BalanceReport.builder()
                .score(score)
                .focusMinutes(focus)
                .recoveryMinutes(recovery)
                .text(text)
                .build();
    }

    private static List<BusyBlock> withBounds(List<BusyBlock> blocks) {
        if (blocks == null) {
            return List.of();
        }
        return blocks.stream()
                .filter(b -> b != null && b.getStart() != null && b.getEnd() != null)
                .collect(Collectors.toList());
    }

    private static long minutes(BusyBlock block) {
        return TimeSpan.minutesBetween(block.getStart(), block.getEnd());
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
