package com.dcruver.lifepatterns.domain.insight;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.CyclicPattern;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import com.dcruver.lifepatterns.domain.InsightBundle;
import com.dcruver.lifepatterns.domain.Trend;
import com.dcruver.lifepatterns.domain.WeekAggregate;
import com.dcruver.lifepatterns.domain.cycle.CycleDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the analytic results into micro (weekly), macro (whole period) and
 * predictive statements, then runs the safety filter over them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InsightSynthesizer {

    public static final String FORECAST_PREFIX = "Forecast (heuristic, not a certainty): ";

    private final AnalysisSettings settings;
    private final SafetyFilter safetyFilter;

    public InsightBundle synthesize(List<WeekAggregate> weeks, ClusteringResult clustering, List<Anomaly> anomalies,
                                    Optional<CyclicPattern> cycle, EntryTextSource texts) {
        List<String> micro = weeks.stream()
            .map(week -> microInsight(week, clustering))
            .toList();
        String macro = macroInsight(weeks, clustering, anomalies, cycle);
        String predictive = predictiveInsight(weeks, clustering, cycle);

        List<String> generated = new ArrayList<>(micro);
        generated.add(macro);
        generated.add(predictive);
        List<String> dayIds = weeks.stream().flatMap(week -> week.getDayIds().stream()).toList();

        List<String> safetyNotes = safetyFilter.review(generated, dayIds, texts);
        log.info("Synthesized {} weekly insights and {} safety notes", micro.size(), safetyNotes.size());

        return InsightBundle.builder()
            .micro(micro)
            .macro(macro)
            .predictive(predictive)
            .safetyNotes(safetyNotes)
            .disclaimer(SafetyFilter.DISCLAIMER)
            .build();
    }

    private String microInsight(WeekAggregate week, ClusteringResult clustering) {
        String theme = clustering.cluster(week.getDominantClusterId()).getLabel();
        String body = switch (week.getTrend()) {
            case IMPROVING -> theme + " shows positive progression. Consider maintaining current strategies.";
            case DECLINING -> theme + " indicates increasing challenges. Consider seeking support or adjusting approach.";
            case STABLE -> theme + " remains consistent. Current balance appears sustainable.";
        };
        return String.format("Week %d (%s to %s): %s", week.getWeekIndex(), week.getStartDate(), week.getEndDate(), body);
    }

    private String macroInsight(List<WeekAggregate> weeks, ClusteringResult clustering, List<Anomaly> anomalies,
                                Optional<CyclicPattern> cycle) {
        List<String> parts = new ArrayList<>();
        String theme = clustering.dominantCluster().getLabel();

        if (weeks.isEmpty()) {
            parts.add(String.format("Across the period, life patterns were primarily characterized by %s.",
                theme.toLowerCase()));
        } else {
            WeekAggregate first = weeks.get(0);
            WeekAggregate last = weeks.get(weeks.size() - 1);
            int dayCount = weeks.stream().mapToInt(WeekAggregate::dayCount).sum();
            parts.add(String.format("Over the %d-day period (%s to %s), life patterns were primarily characterized by %s.",
                dayCount, first.getStartDate(), last.getEndDate(), theme.toLowerCase()));

            Trend net = Trend.between(first.getMoodScore(), last.getMoodScore(), settings.getTrendEpsilon());
            parts.add(switch (net) {
                case IMPROVING -> "Overall emotional trajectory shows positive growth.";
                case DECLINING -> "Some challenging periods were observed, suggesting need for additional support strategies.";
                case STABLE -> "Emotional patterns remained relatively balanced throughout the period.";
            });
        }

        cycle.ifPresent(pattern -> parts.add(pattern.getDescription()));

        if (!anomalies.isEmpty()) {
            parts.add(String.format("%d significant emotional %s identified.",
                anomalies.size(), anomalies.size() == 1 ? "event was" : "events were"));
        }
        return String.join(" ", parts);
    }

    private String predictiveInsight(List<WeekAggregate> weeks, ClusteringResult clustering,
                                     Optional<CyclicPattern> cycle) {
        if (weeks.size() < 2) {
            return FORECAST_PREFIX + "Insufficient data for a reliable forecast.";
        }

        WeekAggregate previous = weeks.get(weeks.size() - 2);
        WeekAggregate last = weeks.get(weeks.size() - 1);
        int nextWeek = last.getWeekIndex() + 1;

        // Straight-line extrapolation of the last week-over-week change
        double delta = last.getMoodScore() - previous.getMoodScore();
        double projected = last.getMoodScore() + delta;
        Trend direction = Trend.between(last.getMoodScore(), projected, settings.getTrendEpsilon());

        List<String> parts = new ArrayList<>();
        parts.add(switch (direction) {
            case IMPROVING -> String.format("If the current momentum continues, week %d is likely to show a "
                + "sustained positive trajectory (projected mood %.2f).", nextWeek, projected);
            case DECLINING -> String.format("If the current pattern continues, week %d may bring continued "
                + "challenges (projected mood %.2f); consider stress-reduction strategies proactively.", nextWeek, projected);
            case STABLE -> String.format("Week %d may look similar to recent weeks, with typical fluctuations "
                + "(projected mood %.2f).", nextWeek, projected);
        });

        cycle.ifPresent(pattern -> {
            if (pattern.getTroughDay().isPresent() && pattern.getPeakDay().isPresent()) {
                parts.add(String.format("Expect lower mood around %s, easing by %s.",
                    CycleDetector.dayName(pattern.getTroughDay().get()),
                    CycleDetector.dayName(pattern.getPeakDay().get())));
            } else {
                parts.add(String.format("Expect the low point around day %d of the next %d-day cycle.",
                    pattern.getTroughPhase() + 1, pattern.getPeriodDays()));
            }
        });

        if (previous.getDominantClusterId() == last.getDominantClusterId()) {
            parts.add(String.format("%s is likely to remain a central focus.",
                clustering.cluster(last.getDominantClusterId()).getLabel()));
        }

        return FORECAST_PREFIX + String.join(" ", parts);
    }
}
