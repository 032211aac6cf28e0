package com.dcruver.lifepatterns.domain.clustering;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.random.JDKRandomGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * One k-means++ run on commons-math, reduced to per-point labels.
 *
 * Clusters that empty out are reseeded at the point farthest from its
 * centroid. Callers must pass at least k points that are distinct under the
 * metric.
 */
@Slf4j
final class KMeans {

    private final DistanceMetric metric;
    private final int maxIterations;

    KMeans(DistanceMetric metric, int maxIterations) {
        this.metric = metric;
        this.maxIterations = maxIterations;
    }

    /**
     * @param labels cluster index per point
     * @param inertia sum of squared point-to-centroid distances
     */
    record Partition(int[] labels, double[][] centroids, double inertia) {}

    /**
     * Keeps the input position so duplicate vectors can be told apart.
     */
    private record IndexedPoint(int index, double[] point) implements Clusterable {
        @Override
        public double[] getPoint() {
            return point;
        }
    }

    /**
     * @return the partition, or null when the run ended with an empty cluster
     */
    Partition fit(double[][] points, int k, long seed) {
        JDKRandomGenerator random = new JDKRandomGenerator();
        random.setSeed(seed);

        KMeansPlusPlusClusterer<IndexedPoint> clusterer = new KMeansPlusPlusClusterer<>(
            k, maxIterations, metric, random, KMeansPlusPlusClusterer.EmptyClusterStrategy.FARTHEST_POINT);

        List<IndexedPoint> input = new ArrayList<>(points.length);
        for (int i = 0; i < points.length; i++) {
            input.add(new IndexedPoint(i, points[i]));
        }
        List<CentroidCluster<IndexedPoint>> clusters = clusterer.cluster(input);

        int[] labels = new int[points.length];
        double[][] centroids = new double[k][];
        double inertia = 0.0;
        for (int c = 0; c < clusters.size(); c++) {
            CentroidCluster<IndexedPoint> cluster = clusters.get(c);
            if (cluster.getPoints().isEmpty()) {
                log.debug("Seed {} left cluster {} empty", seed, c);
                return null;
            }
            centroids[c] = cluster.getCenter().getPoint().clone();
            for (IndexedPoint member : cluster.getPoints()) {
                labels[member.index()] = c;
                double d = metric.distance(member.point(), centroids[c]);
                inertia += d * d;
            }
        }
        return new Partition(labels, centroids, inertia);
    }
}
