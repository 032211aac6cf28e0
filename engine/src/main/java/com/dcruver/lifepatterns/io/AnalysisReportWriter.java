package com.dcruver.lifepatterns.io;

import com.dcruver.lifepatterns.pipeline.AnalysisReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the analysis report as pretty-printed JSON with ISO dates.
 */
@Component
@Slf4j
public class AnalysisReportWriter {

    public static final String RESULTS_FILE = "results.json";

    private final ObjectWriter writer;

    public AnalysisReportWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer()
            .with(SerializationFeature.INDENT_OUTPUT)
            .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(AnalysisReport report) throws IOException {
        return writer.writeValueAsString(report);
    }

    public Path write(AnalysisReport report, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(RESULTS_FILE);
        Files.writeString(target, toJson(report));
        log.info("Wrote analysis results: {}", target);
        return target;
    }
}
