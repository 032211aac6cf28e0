package com.dcruver.lifepatterns.domain.anomaly;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import com.dcruver.lifepatterns.domain.InsufficientDataException;
import com.dcruver.lifepatterns.domain.InvalidConfigurationException;
import com.dcruver.lifepatterns.domain.ThemeCluster;
import com.dcruver.lifepatterns.domain.clustering.DistanceMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores every day with an isolation forest and returns the most isolated
 * ones, ranked. An empty list is a normal outcome.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetector {

    private static final int MIN_DAYS = 2;

    private final AnalysisSettings settings;
    private final CategoryRuleTable categoryRules;

    public List<Anomaly> detect(List<DayRecord> days, ClusteringResult clustering, EntryTextSource texts,
                                double contamination, long seed, int topN) {
        if (!(contamination > 0.0 && contamination < 0.5)) {
            throw new InvalidConfigurationException("contamination", contamination, "must be in (0, 0.5)");
        }
        if (topN < 0) {
            throw new InvalidConfigurationException("anomaly-top-n", topN, "must be >= 0");
        }
        if (days.size() < MIN_DAYS) {
            throw new InsufficientDataException("Anomaly detection", MIN_DAYS, days.size());
        }

        double[][] points = days.stream().map(DayRecord::getEmbedding).toArray(double[][]::new);

        double variance = totalVariance(points);
        if (variance < settings.getVarianceFloor()) {
            log.info("Day vectors are near-identical (total variance {}), no anomalies reported", variance);
            return List.of();
        }

        IsolationForest forest = new IsolationForest(settings.getTreeCount(), settings.getSubsampleSize());
        double[] scores = forest.scores(points, seed);

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < days.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed()
            .thenComparing(i -> days.get(i).getDate())
            .thenComparing(i -> days.get(i).getId()));

        // Guard against 0.1 * 30 = 3.0000000000000004
        int operative = (int) Math.ceil(contamination * days.size() - 1e-9);
        int limit = Math.min(topN, operative);

        List<Anomaly> anomalies = new ArrayList<>();
        for (int rank = 1; rank <= limit; rank++) {
            int index = order.get(rank - 1);
            DayRecord day = days.get(index);

            ThemeCluster nearest = nearestCluster(points[index], clustering);
            List<String> clusterTerms = new ArrayList<>(nearest.getKeywords());
            clusterTerms.addAll(List.of(nearest.getLabel().toLowerCase().split("\\W+")));
            CategoryRuleTable.CategoryRule rule = categoryRules.categorize(clusterTerms, texts.textOf(day.getId()));

            anomalies.add(Anomaly.builder()
                .dayId(day.getId())
                .date(day.getDate())
                .score(scores[index])
                .rank(rank)
                .category(rule.getCategory())
                .description(rule.describe(day.getDate()))
                .build());
        }

        log.info("Detected {} anomalies out of {} days (operative set {}, cap {})",
            anomalies.size(), days.size(), operative, topN);
        return List.copyOf(anomalies);
    }

    private ThemeCluster nearestCluster(double[] point, ClusteringResult clustering) {
        DistanceMetric metric = settings.getDistanceMetric();
        ThemeCluster nearest = null;
        double nearestDistance = Double.POSITIVE_INFINITY;
        for (ThemeCluster cluster : clustering.getClusters()) {
            double distance = metric.distance(point, cluster.centroidArray());
            if (distance < nearestDistance) {
                nearestDistance = distance;
                nearest = cluster;
            }
        }
        if (nearest == null) {
            throw new IllegalStateException("Clustering produced no themes");
        }
        return nearest;
    }

    /**
     * Sum of per-dimension population variances.
     */
    private double totalVariance(double[][] points) {
        Variance population = new Variance(false);
        double[] column = new double[points.length];
        double total = 0.0;
        for (int d = 0; d < points[0].length; d++) {
            for (int i = 0; i < points.length; i++) {
                column[i] = points[i][d];
            }
            total += population.evaluate(column);
        }
        return total;
    }
}
