package com.dcruver.lifepatterns.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one clustering pass: the themes plus the per-day bookkeeping
 * downstream stages need.
 */
@Value
@Builder
public class ClusteringResult {
    List<ThemeCluster> clusters;
    Map<String, Integer> assignments;  // dayId -> clusterId
    Map<String, Double> entryConfidences;  // dayId -> 0.0-1.0
    double inertia;
    DegenerateClusteringWarning warning;

    public Optional<DegenerateClusteringWarning> getWarning() {
        return Optional.ofNullable(warning);
    }

    public ThemeCluster cluster(int clusterId) {
        return clusters.stream()
            .filter(c -> c.getClusterId() == clusterId)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown cluster " + clusterId));
    }

    public int clusterOf(String dayId) {
        Integer clusterId = assignments.get(dayId);
        if (clusterId == null) {
            throw new IllegalArgumentException("Day " + dayId + " was not clustered");
        }
        return clusterId;
    }

    /**
     * Largest theme; ties go to the lowest cluster id.
     */
    public ThemeCluster dominantCluster() {
        return clusters.stream()
            .max(Comparator.comparingInt(ThemeCluster::size)
                .thenComparing(ThemeCluster::getClusterId, Comparator.reverseOrder()))
            .orElseThrow(() -> new IllegalStateException("No clusters"));
    }
}
