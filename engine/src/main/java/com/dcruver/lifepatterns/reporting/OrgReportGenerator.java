package com.dcruver.lifepatterns.reporting;

import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.ThemeCluster;
import com.dcruver.lifepatterns.domain.WeekAggregate;
import com.dcruver.lifepatterns.pipeline.AnalysisReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Generates an Org-format summary of an analysis run.
 */
@Component
@Slf4j
public class OrgReportGenerator {

    /**
     * Generate and save the report next to the JSON results
     */
    public Path generateReport(AnalysisReport report, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        String reportFilename = String.format("life-patterns-report-%s.org", report.getEndDate());
        Path reportPath = outputDir.resolve(reportFilename);

        Files.writeString(reportPath, buildReport(report, LocalDate.now()));
        log.info("Generated Org report: {}", reportPath);

        return reportPath;
    }

    /**
     * Build Org-format report content
     */
    public String buildReport(AnalysisReport report, LocalDate created) {
        StringBuilder sb = new StringBuilder();

        // Same period always gets the same note id
        String id = UUID.nameUUIDFromBytes((report.getStartDate() + "/" + report.getEndDate())
            .getBytes(StandardCharsets.UTF_8)).toString();

        // Header
        sb.append(":PROPERTIES:\n");
        sb.append(":ID:       ").append(id).append("\n");
        sb.append(":CREATED:  [").append(created).append("]\n");
        sb.append(":TAGS:     life-patterns report\n");
        sb.append(":END:\n");

        sb.append("* Life Pattern Report ").append(report.getStartDate())
            .append(" to ").append(report.getEndDate()).append("\n\n");

        // Summary
        sb.append("** Summary\n\n");
        sb.append(String.format("- Days analysed: %d\n", report.getDayCount()));
        sb.append(String.format("- Themes: %d\n", report.getThemes().size()));
        sb.append(String.format("- Anomalies: %d\n", report.getAnomalies().size()));
        sb.append(String.format("- Cycle: %s\n\n",
            report.isCycleDetected() ? report.getCycle().getPeriodDays() + " days" : "none detected"));
        sb.append(report.getMacroInsight()).append("\n\n");

        // Themes
        sb.append("** Themes\n\n");
        for (ThemeCluster theme : report.getThemes()) {
            sb.append(String.format("- %s (%d days, confidence %.2f): %s\n",
                theme.getLabel(), theme.size(), theme.getConfidence(), String.join(", ", theme.getKeywords())));
        }
        sb.append("\n");

        // Weeks
        sb.append("** Weekly Evolution\n\n");
        for (AnalysisReport.WeekReport weekReport : report.getWeeks()) {
            WeekAggregate week = weekReport.getWeek();
            sb.append(String.format("*** Week %d: %s to %s (%s, mood %+.2f)\n\n", week.getWeekIndex(),
                week.getStartDate(), week.getEndDate(), week.getTrend().label(), week.getMoodScore()));
            for (Map.Entry<Integer, Integer> entry : week.getThemeDistribution().entrySet()) {
                sb.append(String.format("- Theme %d: %d days\n", entry.getKey(), entry.getValue()));
            }
            sb.append("\n").append(weekReport.getMicroInsight()).append("\n\n");
        }

        // Anomalies
        sb.append("** Anomalies\n\n");
        if (report.getAnomalies().isEmpty()) {
            sb.append("No anomalies detected.\n\n");
        } else {
            for (Anomaly anomaly : report.getAnomalies()) {
                sb.append(String.format("%d. %s: %s (score %.3f)\n",
                    anomaly.getRank(), anomaly.getCategory(), anomaly.getDescription(), anomaly.getScore()));
            }
            sb.append("\n");
        }

        // Forecast
        sb.append("** Forecast\n\n");
        sb.append(report.getPredictiveInsight()).append("\n\n");

        // Safety
        sb.append("** Safety Notes\n\n");
        for (String note : report.getSafetyNotes()) {
            sb.append("- ").append(note).append("\n");
        }
        for (String warning : report.getWarnings()) {
            sb.append("- Warning: ").append(warning).append("\n");
        }
        sb.append("- ").append(report.getDisclaimer()).append("\n");

        return sb.toString();
    }
}
