package com.finance.audit.engine.isolationforest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou). Points that are isolated after few random
 * splits score close to 1; typical points score around or below 0.5.
 */
public class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Grow a forest on the given data.
     *
     * @param data       samples, one feature vector per row
     * @param numTrees   number of trees
     * @param sampleSize sub-sample size per tree, capped at the number of rows
     * @param seed       random seed
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            return new IsolationForest(List.of(), 0);
        }
        int psi = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            trees.add(IsolationTree.grow(data, subsample(data.length, psi, random), maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), psi);
    }

    /**
     * Anomaly score s(x, n) = 2^(-E(h(x)) / c(n)), in [0, 1].
     */
    public double score(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (trees.isEmpty() || c <= 0) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public int treeCount() {
        return trees.size();
    }

    // Partial Fisher-Yates: the first `size` slots become a sample without replacement.
    private static int[] subsample(int n, int size, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(indices, 0, sample, 0, size);
        return sample;
    }
}
