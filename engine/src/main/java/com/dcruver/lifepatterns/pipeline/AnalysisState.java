package com.dcruver.lifepatterns.pipeline;

import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.CyclicPattern;
import com.dcruver.lifepatterns.domain.DayOfWeekProfile;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import com.dcruver.lifepatterns.domain.InsightBundle;
import com.dcruver.lifepatterns.domain.WeekAggregate;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Results of the stages completed so far in one run.
 * Immutable via Lombok @With; each stage returns a new state.
 */
@Data
@Builder
@With
public class AnalysisState {
    private final List<DayRecord> days;
    private final EntryTextSource texts;

    private final ClusteringResult clustering;
    private final List<WeekAggregate> weeks;
    private final List<Anomaly> anomalies;
    private final CyclicPattern cycle;  // null when no cycle was found
    private final DayOfWeekProfile dayOfWeekProfile;
    private final InsightBundle insights;

    private final List<PipelineStage> completedStages;

    public static AnalysisState start(List<DayRecord> days, EntryTextSource texts) {
        return AnalysisState.builder()
            .days(days)
            .texts(texts)
            .completedStages(List.of())
            .build();
    }

    public Optional<CyclicPattern> findCycle() {
        return Optional.ofNullable(cycle);
    }

    public boolean hasCompleted(PipelineStage stage) {
        return completedStages.contains(stage);
    }

    AnalysisState complete(PipelineStage stage) {
        List<PipelineStage> stages = new ArrayList<>(completedStages);
        stages.add(stage);
        return withCompletedStages(List.copyOf(stages));
    }
}
