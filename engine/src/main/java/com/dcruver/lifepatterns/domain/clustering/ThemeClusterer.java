package com.dcruver.lifepatterns.domain.clustering;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.DegenerateClusteringWarning;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import com.dcruver.lifepatterns.domain.InsufficientDataException;
import com.dcruver.lifepatterns.domain.InvalidConfigurationException;
import com.dcruver.lifepatterns.domain.ThemeCluster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Groups day vectors into k latent themes.
 *
 * Runs K-Means several times from seeds derived from the caller's seed and
 * keeps the lowest-inertia partition. Cluster ids are then renumbered by the
 * position of each cluster's first day so the same input always yields the
 * same ids.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ThemeClusterer {

    private static final int MIN_DAYS = 2;

    private final AnalysisSettings settings;
    private final KeywordExtractor keywordExtractor;
    private final ThemeLabeler themeLabeler;

    public ClusteringResult cluster(List<DayRecord> days, EntryTextSource texts, int k, long seed) {
        if (days == null || days.size() < MIN_DAYS) {
            throw new InsufficientDataException("Theme clustering", MIN_DAYS, days == null ? 0 : days.size());
        }
        if (k < 1) {
            throw new InvalidConfigurationException("k", k, "must be >= 1");
        }

        double[][] points = toMatrix(days);
        int distinct = countDistinct(points);
        int effectiveK = Math.min(k, distinct);

        DegenerateClusteringWarning warning = null;
        if (effectiveK < k) {
            warning = new DegenerateClusteringWarning(k, effectiveK, distinct);
            log.warn(warning.message());
        }

        log.info("Clustering {} days into {} themes ({} restarts, {} distance)",
            days.size(), effectiveK, settings.getRestarts(), settings.getDistanceMetric());

        KMeans.Partition best = bestOfRestarts(points, effectiveK, seed);
        int[] labels = canonicalLabels(best.labels(), effectiveK);
        double[][] centroids = reorder(best.centroids(), best.labels(), labels, effectiveK);

        double[] confidences = entryConfidences(points, labels, centroids);

        Map<String, Integer> assignments = new LinkedHashMap<>();
        Map<String, Double> entryConfidences = new LinkedHashMap<>();
        for (int i = 0; i < days.size(); i++) {
            assignments.put(days.get(i).getId(), labels[i]);
            entryConfidences.put(days.get(i).getId(), confidences[i]);
        }

        List<ThemeCluster> clusters = new ArrayList<>();
        for (int c = 0; c < effectiveK; c++) {
            clusters.add(buildCluster(c, days, labels, centroids[c], confidences, texts));
        }

        clusters.forEach(cluster -> log.info("Theme {} '{}': {} days, confidence {}",
            cluster.getClusterId(), cluster.getLabel(), cluster.size(),
            String.format("%.2f", cluster.getConfidence())));

        return ClusteringResult.builder()
            .clusters(List.copyOf(clusters))
            .assignments(Collections.unmodifiableMap(assignments))
            .entryConfidences(Collections.unmodifiableMap(entryConfidences))
            .inertia(best.inertia())
            .warning(warning)
            .build();
    }

    private KMeans.Partition bestOfRestarts(double[][] points, int k, long seed) {
        KMeans kMeans = new KMeans(settings.getDistanceMetric(), settings.getMaxIterations());
        Random seeds = new Random(seed);

        KMeans.Partition best = null;
        for (int restart = 0; restart < settings.getRestarts(); restart++) {
            KMeans.Partition candidate = kMeans.fit(points, k, seeds.nextLong());
            if (candidate == null) {
                continue;
            }
            log.debug("Restart {}: inertia {}", restart, candidate.inertia());
            if (best == null || candidate.inertia() < best.inertia()) {
                best = candidate;
            }
        }
        if (best == null) {
            throw new IllegalStateException("Every restart ended with an empty cluster (k=" + k + ")");
        }
        return best;
    }

    /**
     * Renumber clusters in order of first appearance in the input.
     */
    private int[] canonicalLabels(int[] labels, int k) {
        int[] mapping = new int[k];
        Arrays.fill(mapping, -1);
        int next = 0;
        int[] result = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            if (mapping[labels[i]] < 0) {
                mapping[labels[i]] = next++;
            }
            result[i] = mapping[labels[i]];
        }
        return result;
    }

    private double[][] reorder(double[][] centroids, int[] original, int[] canonical, int k) {
        double[][] reordered = new double[k][];
        for (int i = 0; i < original.length; i++) {
            reordered[canonical[i]] = centroids[original[i]];
        }
        return reordered;
    }

    /**
     * exp(-d / (scale * dispersion)) where dispersion is the mean distance of
     * every day to the global centroid.
     */
    private double[] entryConfidences(double[][] points, int[] labels, double[][] centroids) {
        DistanceMetric metric = settings.getDistanceMetric();
        int dimension = points[0].length;

        double[] global = new double[dimension];
        double[] column = new double[points.length];
        for (int d = 0; d < dimension; d++) {
            for (int i = 0; i < points.length; i++) {
                column[i] = points[i][d];
            }
            global[d] = StatUtils.mean(column);
        }

        double[] toGlobal = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            toGlobal[i] = metric.distance(points[i], global);
        }
        double dispersion = StatUtils.mean(toGlobal);

        double[] confidences = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            if (dispersion <= 0.0) {
                confidences[i] = 1.0;
                continue;
            }
            double distance = metric.distance(points[i], centroids[labels[i]]);
            double confidence = Math.exp(-distance / (settings.getConfidenceScale() * dispersion));
            confidences[i] = Math.max(0.0, Math.min(1.0, confidence));
        }
        return confidences;
    }

    private ThemeCluster buildCluster(int clusterId, List<DayRecord> days, int[] labels, double[] centroid,
                                      double[] confidences, EntryTextSource texts) {
        List<Integer> members = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == clusterId) {
                members.add(i);
            }
        }

        Set<String> memberIds = new LinkedHashSet<>();
        double confidenceSum = 0.0;
        for (int index : members) {
            memberIds.add(days.get(index).getId());
            confidenceSum += confidences[index];
        }

        List<Integer> byConfidence = new ArrayList<>(members);
        byConfidence.sort(Comparator.comparingDouble((Integer i) -> confidences[i]).reversed()
            .thenComparingInt(i -> i));
        List<String> exemplarIds = byConfidence.stream()
            .limit(settings.getExemplarCount())
            .map(i -> days.get(i).getId())
            .toList();

        List<String> keywords = keywordExtractor.extract(
            exemplarIds.stream().map(texts::textOf).toList(),
            settings.getKeywordCount());

        List<Double> centroidValues = new ArrayList<>(centroid.length);
        for (double value : centroid) {
            centroidValues.add(value);
        }

        return ThemeCluster.builder()
            .clusterId(clusterId)
            .label(themeLabeler.label(clusterId, keywords))
            .centroid(Collections.unmodifiableList(centroidValues))
            .memberIds(Collections.unmodifiableSet(memberIds))
            .confidence(confidenceSum / members.size())
            .keywords(keywords)
            .exemplarIds(exemplarIds)
            .build();
    }

    private double[][] toMatrix(List<DayRecord> days) {
        int dimension = days.get(0).dimension();
        double[][] points = new double[days.size()][];
        for (int i = 0; i < days.size(); i++) {
            DayRecord day = days.get(i);
            if (day.dimension() != dimension) {
                throw new IllegalArgumentException(String.format(
                    "Day %s has dimension %d, expected %d", day.getId(), day.dimension(), dimension));
            }
            points[i] = day.getEmbedding();
        }
        return points;
    }

    /**
     * Points the metric cannot tell apart count once: same-direction vectors
     * under cosine, 0.0 and -0.0 under Euclidean.
     */
    private int countDistinct(double[][] points) {
        DistanceMetric metric = settings.getDistanceMetric();
        List<double[]> seen = new ArrayList<>();
        for (double[] point : points) {
            boolean duplicate = seen.stream().anyMatch(other -> !(metric.distance(other, point) > 0.0));
            if (!duplicate) {
                seen.add(point);
            }
        }
        return seen.size();
    }
}
