package com.finance.audit.engine.isolationforest;

import java.util.Random;

/**
 * A single random isolation tree grown on a sub-sample of row indices.
 */
final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] data, int[] rows, int maxDepth, Random random) {
        return new IsolationTree(grow(data, rows, 0, rows.length, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point);
    }

    // Partitions rows[from, to) in place around a random split.
    private static IsolationNode grow(double[][] data, int[] rows, int from, int to,
                                      int depth, int maxDepth, Random random) {
        int n = to - from;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int feature = random.nextInt(data[rows[from]].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = data[rows[i]][feature];
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min >= max) {
            return IsolationNode.leaf(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);

        int boundary = from;
        for (int i = from; i < to; i++) {
            if (data[rows[i]][feature] < splitValue) {
                int tmp = rows[boundary];
                rows[boundary] = rows[i];
                rows[i] = tmp;
                boundary++;
            }
        }

        IsolationNode left = grow(data, rows, from, boundary, depth + 1, maxDepth, random);
        IsolationNode right = grow(data, rows, boundary, to, depth + 1, maxDepth, random);
        return IsolationNode.split(feature, splitValue, left, right);
    }
}
