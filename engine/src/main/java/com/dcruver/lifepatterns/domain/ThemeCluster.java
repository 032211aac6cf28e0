package com.dcruver.lifepatterns.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * A latent theme: days whose embeddings sit close together.
 * Built once per clustering pass and never changed afterwards.
 */
@Value
@Builder
public class ThemeCluster {
    int clusterId;
    String label;
    List<Double> centroid;
    Set<String> memberIds;  // input order
    double confidence;  // 0.0-1.0, mean of member confidences
    List<String> keywords;
    List<String> exemplarIds;  // highest member confidence first

    public int size() {
        return memberIds.size();
    }

    public boolean contains(String dayId) {
        return memberIds.contains(dayId);
    }

    public double[] centroidArray() {
        double[] values = new double[centroid.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = centroid.get(i);
        }
        return values;
    }
}
