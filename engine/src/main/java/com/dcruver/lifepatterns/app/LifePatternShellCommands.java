package com.dcruver.lifepatterns.app;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.JournalEntry;
import com.dcruver.lifepatterns.domain.ThemeCluster;
import com.dcruver.lifepatterns.io.AnalysisReportWriter;
import com.dcruver.lifepatterns.io.JournalEntryReader;
import com.dcruver.lifepatterns.pipeline.AnalysisReport;
import com.dcruver.lifepatterns.pipeline.LifePatternPipeline;
import com.dcruver.lifepatterns.pipeline.PipelineStageException;
import com.dcruver.lifepatterns.reporting.OrgReportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for the life-pattern engine.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class LifePatternShellCommands {

    private final JournalEntryReader journalEntryReader;
    private final LifePatternPipeline pipeline;
    private final AnalysisReportWriter reportWriter;
    private final OrgReportGenerator orgReportGenerator;
    private final AnalysisSettings settings;

    // Cached report from the last run
    private AnalysisReport lastReport;

    @ShellMethod(key = {"analyze", "analyse"}, value = "Analyse a JSON journal and write results.json plus an Org report")
    public String analyze(
            @ShellOption(value = "--input", help = "JSON array of journal entries") String input,
            @ShellOption(value = "--output", defaultValue = "output", help = "Directory for the results") String output) {
        log.info("Analysing journal {}", input);

        try {
            List<JournalEntry> entries = journalEntryReader.read(Path.of(input));
            lastReport = pipeline.run(entries);

            Path outputDir = Path.of(output);
            Path json = reportWriter.write(lastReport, outputDir);
            Path org = orgReportGenerator.generateReport(lastReport, outputDir);

            StringBuilder result = new StringBuilder(summarize(lastReport));
            result.append("\nResults saved to: ").append(json).append("\n");
            result.append("Org report saved to: ").append(org).append("\n");
            return result.toString();

        } catch (PipelineStageException e) {
            log.error("Analysis failed at {}", e.getStage(), e);
            return String.format("Analysis failed at %s after %s: %s",
                e.getStage(), e.getPartialState().getCompletedStages(), e.getCause().getMessage());
        } catch (IOException | RuntimeException e) {
            log.error("Analysis failed", e);
            return "Analysis failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"summary", "last"}, value = "Show the summary of the last analysis")
    public String summary() {
        if (lastReport == null) {
            return "No analysis has been run yet. Run 'analyze --input <file>' first.";
        }
        return summarize(lastReport);
    }

    @ShellMethod(key = "settings", value = "Show the active analysis settings")
    public String settings() {
        StringBuilder result = new StringBuilder();
        result.append("Analysis Settings\n\n");
        result.append(String.format("- Themes (k): %d\n", settings.getK()));
        result.append(String.format("- Contamination: %.2f\n", settings.getContamination()));
        result.append(String.format("- Top anomalies: %d\n", settings.getAnomalyTopN()));
        result.append(String.format("- Week window: %d days\n", settings.getWeekWindow()));
        result.append(String.format("- Seed: %d\n", settings.getSeed()));
        result.append(String.format("- Restarts: %d\n", settings.getRestarts()));
        result.append(String.format("- Distance: %s\n", settings.getDistanceMetric()));
        result.append(String.format("- Trees: %d (subsample %d)\n", settings.getTreeCount(), settings.getSubsampleSize()));
        result.append(String.format("- Cycle periods: %s (threshold %.2f, p < %.3f)\n",
            settings.getPeriodCandidates(), settings.getCycleThreshold(), settings.getCycleSignificance()));
        return result.toString();
    }

    static String summarize(AnalysisReport report) {
        StringBuilder result = new StringBuilder();
        result.append(String.format("Analysed %d days (%s to %s) with %s embeddings.\n\n",
            report.getDayCount(), report.getStartDate(), report.getEndDate(), report.getEmbeddingProvider()));

        result.append("Themes:\n");
        for (ThemeCluster theme : report.getThemes()) {
            result.append(String.format("- %s: %d days (confidence %.2f)\n",
                theme.getLabel(), theme.size(), theme.getConfidence()));
        }

        result.append("\nAnomalies:\n");
        if (report.getAnomalies().isEmpty()) {
            result.append("- none\n");
        }
        for (Anomaly anomaly : report.getAnomalies()) {
            result.append(String.format("%d. %s (%s)\n", anomaly.getRank(), anomaly.getDescription(), anomaly.getCategory()));
        }

        result.append("\n").append(report.getMacroInsight()).append("\n");
        result.append(report.getPredictiveInsight()).append("\n");
        report.getSafetyNotes().forEach(note -> result.append("! ").append(note).append("\n"));
        report.getWarnings().forEach(warning -> result.append("Warning: ").append(warning).append("\n"));
        result.append(report.getDisclaimer()).append("\n");
        return result.toString();
    }
}
