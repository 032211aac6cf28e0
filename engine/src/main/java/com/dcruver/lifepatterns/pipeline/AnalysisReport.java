package com.dcruver.lifepatterns.pipeline;

import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.CyclicPattern;
import com.dcruver.lifepatterns.domain.DayOfWeekProfile;
import com.dcruver.lifepatterns.domain.InsightBundle;
import com.dcruver.lifepatterns.domain.ThemeCluster;
import com.dcruver.lifepatterns.domain.WeekAggregate;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The complete output of one analysis run, handed to the writers.
 */
@Value
@Builder
public class AnalysisReport {
    int dayCount;
    LocalDate startDate;
    LocalDate endDate;
    String embeddingProvider;

    List<ThemeCluster> themes;
    List<WeekReport> weeks;
    List<Anomaly> anomalies;
    boolean cycleDetected;
    CyclicPattern cycle;  // null when cycleDetected is false
    DayOfWeekProfile dayOfWeekProfile;

    String macroInsight;
    String predictiveInsight;
    List<String> safetyNotes;
    String disclaimer;
    List<String> warnings;

    @Value
    public static class WeekReport {
        WeekAggregate week;
        String microInsight;
    }

    static AnalysisReport from(AnalysisState state, String embeddingProvider) {
        InsightBundle insights = state.getInsights();
        List<WeekAggregate> weeks = state.getWeeks();
        List<WeekReport> weekReports = new ArrayList<>();
        for (int i = 0; i < weeks.size(); i++) {
            weekReports.add(new WeekReport(weeks.get(i), insights.getMicro().get(i)));
        }

        List<String> warnings = state.getClustering().getWarning()
            .map(warning -> List.of(warning.message()))
            .orElse(List.of());

        return AnalysisReport.builder()
            .dayCount(state.getDays().size())
            .startDate(state.getDays().get(0).getDate())
            .endDate(state.getDays().get(state.getDays().size() - 1).getDate())
            .embeddingProvider(embeddingProvider)
            .themes(state.getClustering().getClusters())
            .weeks(List.copyOf(weekReports))
            .anomalies(state.getAnomalies())
            .cycleDetected(state.getCycle() != null)
            .cycle(state.getCycle())
            .dayOfWeekProfile(state.getDayOfWeekProfile())
            .macroInsight(insights.getMacro())
            .predictiveInsight(insights.getPredictive())
            .safetyNotes(insights.getSafetyNotes())
            .disclaimer(insights.getDisclaimer())
            .warnings(warnings)
            .build();
    }
}
