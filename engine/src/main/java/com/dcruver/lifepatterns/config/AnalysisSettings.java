package com.dcruver.lifepatterns.config;

import com.dcruver.lifepatterns.domain.InvalidConfigurationException;
import com.dcruver.lifepatterns.domain.clustering.DistanceMetric;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Every tunable of the analytics engine, read once per run.
 *
 * The confidence scale, category rules and thresholds were tuned on a single
 * month of journal data; they are exposed here instead of hard-coded.
 */
@ConfigurationProperties(prefix = "lifepatterns.analysis")
@Data
public class AnalysisSettings {
    public static final int MIN_THEMES = 3;
    public static final int MAX_THEMES = 6;

    // Core surface
    private int k = 5;
    private double contamination = 0.1;
    private int anomalyTopN = 3;
    private int weekWindow = 7;
    private long seed = 42L;

    // Theme clustering
    private int restarts = 10;
    private int maxIterations = 100;
    private DistanceMetric distanceMetric = DistanceMetric.EUCLIDEAN;
    private double confidenceScale = 1.0;
    private int exemplarCount = 3;
    private int keywordCount = 10;

    // Anomaly detection
    private int treeCount = 100;
    private int subsampleSize = 256;
    private double varianceFloor = 1e-9;

    // Trends and cycles
    private double trendEpsilon = 0.1;
    private double cycleThreshold = 0.6;
    private double cycleSignificance = 0.01;  // one-way ANOVA p-value over phase groups
    private List<Integer> periodCandidates = new ArrayList<>(List.of(7));

    // Safety filter
    private List<String> riskKeywords = new ArrayList<>(List.of(
        "hopeless", "worthless", "give up", "can't go on", "suicide", "self-harm"));
    private List<String> ambiguityKeywords = new ArrayList<>(List.of(
        "uncertain", "doubt", "worried", "unprepared"));

    /**
     * Reject out-of-range values, naming the first offending field.
     */
    public void validate() {
        if (k < MIN_THEMES || k > MAX_THEMES) {
            throw new InvalidConfigurationException("k", k,
                String.format("must be between %d and %d", MIN_THEMES, MAX_THEMES));
        }
        if (!(contamination > 0.0 && contamination < 0.5)) {
            throw new InvalidConfigurationException("contamination", contamination, "must be in (0, 0.5)");
        }
        if (anomalyTopN < 0) {
            throw new InvalidConfigurationException("anomaly-top-n", anomalyTopN, "must be >= 0");
        }
        if (weekWindow < 1) {
            throw new InvalidConfigurationException("week-window", weekWindow, "must be >= 1");
        }
        if (restarts < 1) {
            throw new InvalidConfigurationException("restarts", restarts, "must be >= 1");
        }
        if (maxIterations < 1) {
            throw new InvalidConfigurationException("max-iterations", maxIterations, "must be >= 1");
        }
        if (distanceMetric == null) {
            throw new InvalidConfigurationException("distance-metric", null, "is required");
        }
        if (!(confidenceScale > 0.0) || Double.isInfinite(confidenceScale)) {
            throw new InvalidConfigurationException("confidence-scale", confidenceScale, "must be a positive number");
        }
        if (exemplarCount < 1) {
            throw new InvalidConfigurationException("exemplar-count", exemplarCount, "must be >= 1");
        }
        if (keywordCount < 0) {
            throw new InvalidConfigurationException("keyword-count", keywordCount, "must be >= 0");
        }
        if (treeCount < 1) {
            throw new InvalidConfigurationException("tree-count", treeCount, "must be >= 1");
        }
        if (subsampleSize < 2) {
            throw new InvalidConfigurationException("subsample-size", subsampleSize, "must be >= 2");
        }
        if (varianceFloor < 0.0) {
            throw new InvalidConfigurationException("variance-floor", varianceFloor, "must be >= 0");
        }
        if (trendEpsilon < 0.0) {
            throw new InvalidConfigurationException("trend-epsilon", trendEpsilon, "must be >= 0");
        }
        if (!(cycleThreshold > 0.0 && cycleThreshold <= 1.0)) {
            throw new InvalidConfigurationException("cycle-threshold", cycleThreshold, "must be in (0, 1]");
        }
        if (!(cycleSignificance > 0.0 && cycleSignificance <= 1.0)) {
            throw new InvalidConfigurationException("cycle-significance", cycleSignificance, "must be in (0, 1]");
        }
        if (periodCandidates == null || periodCandidates.isEmpty()) {
            throw new InvalidConfigurationException("period-candidates", periodCandidates, "must not be empty");
        }
        for (Integer period : periodCandidates) {
            if (period == null || period < 2) {
                throw new InvalidConfigurationException("period-candidates", periodCandidates,
                    "every period must be >= 2");
            }
        }
        if (riskKeywords == null) {
            throw new InvalidConfigurationException("risk-keywords", null, "is required");
        }
        if (ambiguityKeywords == null) {
            throw new InvalidConfigurationException("ambiguity-keywords", null, "is required");
        }
    }
}
