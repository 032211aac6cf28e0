package com.dcruver.lifepatterns.domain.anomaly;

import java.util.Random;

/**
 * Ensemble of random isolation trees.
 *
 * Each tree is grown on a subsample drawn without replacement. Nodes split on
 * a random dimension that still has spread within the node, at a uniform
 * value between that dimension's min and max, until a node holds one point or
 * the depth cap ceil(log2(subsample)) is reached.
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int treeCount;
    private final int subsampleSize;

    public IsolationForest(int treeCount, int subsampleSize) {
        this.treeCount = treeCount;
        this.subsampleSize = subsampleSize;
    }

    private record Node(int dimension, double split, Node left, Node right, int size) {
        boolean isLeaf() {
            return left == null;
        }
    }

    /**
     * @return one score per point in [0, 1]; higher isolates faster
     */
    public double[] scores(double[][] points, long seed) {
        int n = points.length;
        int sampleSize = Math.min(subsampleSize, n);
        int depthLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        Random random = new Random(seed);

        double[] pathSums = new double[n];
        int[] indices = new int[n];
        for (int t = 0; t < treeCount; t++) {
            for (int i = 0; i < n; i++) {
                indices[i] = i;
            }
            // Partial Fisher-Yates: first sampleSize slots become the subsample
            for (int i = 0; i < sampleSize; i++) {
                int j = i + random.nextInt(n - i);
                int swap = indices[i];
                indices[i] = indices[j];
                indices[j] = swap;
            }
            int[] sample = new int[sampleSize];
            System.arraycopy(indices, 0, sample, 0, sampleSize);

            Node root = grow(points, sample, 0, depthLimit, random);
            for (int i = 0; i < n; i++) {
                pathSums[i] += pathLength(root, points[i], 0);
            }
        }

        double normaliser = averagePathLength(sampleSize);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double expected = pathSums[i] / treeCount;
            scores[i] = normaliser > 0.0 ? Math.pow(2.0, -expected / normaliser) : 0.5;
        }
        return scores;
    }

    private Node grow(double[][] points, int[] members, int depth, int depthLimit, Random random) {
        if (members.length <= 1 || depth >= depthLimit) {
            return new Node(-1, 0.0, null, null, members.length);
        }

        int dimensions = points[members[0]].length;
        double[] min = new double[dimensions];
        double[] max = new double[dimensions];
        for (int d = 0; d < dimensions; d++) {
            min[d] = Double.POSITIVE_INFINITY;
            max[d] = Double.NEGATIVE_INFINITY;
        }
        for (int member : members) {
            for (int d = 0; d < dimensions; d++) {
                min[d] = Math.min(min[d], points[member][d]);
                max[d] = Math.max(max[d], points[member][d]);
            }
        }

        int[] splittable = new int[dimensions];
        int splittableCount = 0;
        for (int d = 0; d < dimensions; d++) {
            if (max[d] > min[d]) {
                splittable[splittableCount++] = d;
            }
        }
        if (splittableCount == 0) {
            // identical points cannot be separated
            return new Node(-1, 0.0, null, null, members.length);
        }

        int dimension = splittable[random.nextInt(splittableCount)];
        double split = min[dimension] + random.nextDouble() * (max[dimension] - min[dimension]);

        int leftCount = 0;
        for (int member : members) {
            if (points[member][dimension] <= split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[members.length - leftCount];
        int l = 0;
        int r = 0;
        for (int member : members) {
            if (points[member][dimension] <= split) {
                left[l++] = member;
            } else {
                right[r++] = member;
            }
        }

        return new Node(dimension, split,
            grow(points, left, depth + 1, depthLimit, random),
            grow(points, right, depth + 1, depthLimit, random),
            members.length);
    }

    private double pathLength(Node node, double[] point, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size());
        }
        Node next = point[node.dimension()] <= node.split() ? node.left() : node.right();
        return pathLength(next, point, depth + 1);
    }

    /**
     * Expected path length of an unsuccessful BST search over n points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }
}
