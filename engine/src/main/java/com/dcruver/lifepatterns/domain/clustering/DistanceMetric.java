package com.dcruver.lifepatterns.domain.clustering;

import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.util.MathArrays;

/**
 * Distance used for centroid assignment, duplicate detection and confidence.
 */
public enum DistanceMetric implements DistanceMeasure {
    EUCLIDEAN {
        @Override
        public double distance(double[] a, double[] b) {
            return MathArrays.distance(a, b);
        }
    },
    COSINE {
        @Override
        public double distance(double[] a, double[] b) {
            double dot = 0.0;
            double normA = 0.0;
            double normB = 0.0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                normA += a[i] * a[i];
                normB += b[i] * b[i];
            }
            if (normA == 0.0 || normB == 0.0) {
                // zero vectors only match each other
                return normA == normB ? 0.0 : 1.0;
            }
            double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
            return Math.max(0.0, 1.0 - Math.min(1.0, similarity));
        }
    };

    public abstract double distance(double[] a, double[] b);

    @Override
    public double compute(double[] a, double[] b) {
        return distance(a, b);
    }
}
