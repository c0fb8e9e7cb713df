package com.finance.audit.engine.isolationforest;

/**
 * Node of an isolation tree. Internal nodes split on one feature; external
 * nodes remember how many training samples reached them.
 */
final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode split(int feature, double value, IsolationNode left, IsolationNode right) {
        return new IsolationNode(feature, value, left, right, left.size + right.size);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    boolean isLeaf() {
        return left == null;
    }

    int size() {
        return size;
    }

    double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Expected path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n with H(i) ~ ln(i) + Euler's constant.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }
}
