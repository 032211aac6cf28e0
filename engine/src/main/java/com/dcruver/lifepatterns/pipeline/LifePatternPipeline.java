package com.dcruver.lifepatterns.pipeline;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.CyclicPattern;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import com.dcruver.lifepatterns.domain.InsightBundle;
import com.dcruver.lifepatterns.domain.InsufficientDataException;
import com.dcruver.lifepatterns.domain.JournalEntry;
import com.dcruver.lifepatterns.domain.LifePatternException;
import com.dcruver.lifepatterns.domain.WeekAggregate;
import com.dcruver.lifepatterns.domain.anomaly.AnomalyDetector;
import com.dcruver.lifepatterns.domain.clustering.ThemeClusterer;
import com.dcruver.lifepatterns.domain.cycle.CycleDetector;
import com.dcruver.lifepatterns.domain.insight.InsightSynthesizer;
import com.dcruver.lifepatterns.domain.temporal.LexiconMoodSignal;
import com.dcruver.lifepatterns.domain.temporal.MoodSignal;
import com.dcruver.lifepatterns.domain.temporal.TemporalAggregator;
import com.dcruver.lifepatterns.nlp.EmbeddingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs the analysis stages in order:
 *
 * 1. embed entries -> DayRecords
 * 2. cluster days -> themes
 * 3. aggregate windows -> weekly trends
 * 4. detect anomalies
 * 5. detect cycles (plus day-of-week profile)
 * 6. synthesize insights
 *
 * Configuration and input size are checked once before the first stage.
 * A failing stage stops the run; nothing is retried because every stage is
 * deterministic for a given seed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LifePatternPipeline {

    private static final int MIN_DAYS = 2;

    private final AnalysisSettings settings;
    private final EmbeddingProvider embeddingProvider;
    private final ThemeClusterer themeClusterer;
    private final TemporalAggregator temporalAggregator;
    private final AnomalyDetector anomalyDetector;
    private final CycleDetector cycleDetector;
    private final InsightSynthesizer insightSynthesizer;

    /**
     * Embed the entries and analyse them with the lexicon mood signal.
     */
    public AnalysisReport run(List<JournalEntry> entries) {
        settings.validate();
        List<JournalEntry> ordered = validateEntries(entries);
        EntryTextSource texts = EntryTextSource.fromEntries(ordered);

        log.info("Step 1: Embedding {} entries with {}", ordered.size(), embeddingProvider.name());
        AnalysisState empty = AnalysisState.start(List.of(), texts);
        List<DayRecord> days = runStage(PipelineStage.EMBEDDING, empty,
            s -> embeddingProvider.embedAll(ordered));

        AnalysisState state = AnalysisState.start(days, texts).complete(PipelineStage.EMBEDDING);
        return AnalysisReport.from(analyze(state, new LexiconMoodSignal(texts)), embeddingProvider.name());
    }

    /**
     * Analyse days that were embedded elsewhere.
     *
     * @param days chronological day records
     * @param texts text behind each day, used for keywords, categories and safety notes
     * @param mood per-day mood signal
     */
    public AnalysisReport analyze(List<DayRecord> days, EntryTextSource texts, MoodSignal mood) {
        settings.validate();
        if (days == null || days.size() < MIN_DAYS) {
            throw new InsufficientDataException("Analysis pipeline", MIN_DAYS, days == null ? 0 : days.size());
        }
        requireUniqueIds(days.stream().map(DayRecord::getId).toList());
        List<DayRecord> ordered = days.stream()
            .sorted(Comparator.comparing(DayRecord::getDate))
            .toList();
        return AnalysisReport.from(analyze(AnalysisState.start(ordered, texts), mood), "external");
    }

    private AnalysisState analyze(AnalysisState initial, MoodSignal mood) {
        AnalysisState state = initial;
        List<DayRecord> days = state.getDays();
        EntryTextSource texts = state.getTexts();

        log.info("Step 2: Clustering {} days into {} themes", days.size(), settings.getK());
        ClusteringResult clustering = runStage(PipelineStage.CLUSTERING, state,
            s -> themeClusterer.cluster(days, texts, settings.getK(), settings.getSeed()));
        state = state.withClustering(clustering).complete(PipelineStage.CLUSTERING);

        log.info("Step 3: Aggregating into {}-day windows", settings.getWeekWindow());
        List<WeekAggregate> weeks = runStage(PipelineStage.AGGREGATION, state,
            s -> temporalAggregator.aggregate(days, clustering, mood, settings.getWeekWindow()));
        state = state.withWeeks(weeks).complete(PipelineStage.AGGREGATION);

        log.info("Step 4: Detecting anomalies (contamination {}, top {})",
            settings.getContamination(), settings.getAnomalyTopN());
        List<Anomaly> anomalies = runStage(PipelineStage.ANOMALY_DETECTION, state,
            s -> anomalyDetector.detect(days, clustering, texts, settings.getContamination(),
                settings.getSeed(), settings.getAnomalyTopN()));
        state = state.withAnomalies(anomalies).complete(PipelineStage.ANOMALY_DETECTION);

        log.info("Step 5: Detecting cycles at periods {}", settings.getPeriodCandidates());
        Optional<CyclicPattern> cycle = runStage(PipelineStage.CYCLE_DETECTION, state,
            s -> cycleDetector.detectCycles(days, mood, settings.getPeriodCandidates()));
        state = state.withCycle(cycle.orElse(null))
            .withDayOfWeekProfile(runStage(PipelineStage.CYCLE_DETECTION, state,
                s -> cycleDetector.profileDaysOfWeek(days, mood)))
            .complete(PipelineStage.CYCLE_DETECTION);

        log.info("Step 6: Synthesizing insights");
        InsightBundle insights = runStage(PipelineStage.SYNTHESIS, state,
            s -> insightSynthesizer.synthesize(weeks, clustering, anomalies, cycle, texts));
        state = state.withInsights(insights).complete(PipelineStage.SYNTHESIS);

        log.info("Analysis complete: {} themes, {} weeks, {} anomalies, cycle {}",
            clustering.getClusters().size(), weeks.size(), anomalies.size(),
            cycle.map(c -> c.getPeriodDays() + " days").orElse("none"));
        return state;
    }

    private <T> T runStage(PipelineStage stage, AnalysisState state, Function<AnalysisState, T> body) {
        try {
            return body.apply(state);
        } catch (RuntimeException e) {
            log.error("Stage {} failed after {}", stage, state.getCompletedStages(), e);
            throw new PipelineStageException(stage, state, e);
        }
    }

    private List<JournalEntry> validateEntries(List<JournalEntry> entries) {
        if (entries == null || entries.size() < MIN_DAYS) {
            throw new InsufficientDataException("Analysis pipeline", MIN_DAYS, entries == null ? 0 : entries.size());
        }
        for (JournalEntry entry : entries) {
            if (entry.getEntryId() == null || entry.getDate() == null) {
                throw new LifePatternException("Every entry needs an entry_id and a date: " + entry);
            }
        }
        requireUniqueIds(entries.stream().map(JournalEntry::getEntryId).toList());
        return entries.stream()
            .sorted(Comparator.comparing(JournalEntry::getDate))
            .toList();
    }

    private void requireUniqueIds(List<String> ids) {
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            if (!seen.add(id)) {
                throw new LifePatternException("Duplicate day id: " + id);
            }
        }
    }
}
