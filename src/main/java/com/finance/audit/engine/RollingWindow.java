package com.finance.audit.engine;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Bounded sliding window over the most recent values of one series. Keeps the
 * values in arrival order and in sorted order so that quartiles are available
 * without re-sorting; each update costs O(capacity).
 */
public class RollingWindow {

    private final int capacity;
    private final ArrayDeque<Double> arrival;
    private final double[] sorted;
    private int size;

    public RollingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.arrival = new ArrayDeque<>(capacity);
        this.sorted = new double[capacity];
    }

    public void add(double value) {
        if (size == capacity) {
            removeSorted(arrival.removeFirst());
        }
        arrival.addLast(value);
        insertSorted(value);
    }

    public int size() {
        return size;
    }

    /**
     * Baseline of the current window contents, or {@link Baseline#NONE} when the
     * window holds fewer than {@code minPeriods} values.
     */
    public Baseline baseline(int minPeriods) {
        if (size == 0 || size < minPeriods) {
            return Baseline.NONE;
        }
        double sum = 0.0;
        for (double v : arrival) {
            sum += v;
        }
        return new Baseline(size, sum / size,
                DescriptiveStats.percentileSorted(sorted, size, 0.25),
                DescriptiveStats.percentileSorted(sorted, size, 0.75));
    }

    private void insertSorted(double value) {
        int idx = Arrays.binarySearch(sorted, 0, size, value);
        if (idx < 0) idx = -idx - 1;
        System.arraycopy(sorted, idx, sorted, idx + 1, size - idx);
        sorted[idx] = value;
        size++;
    }

    private void removeSorted(double value) {
        int idx = Arrays.binarySearch(sorted, 0, size, value);
        if (idx < 0) {
            throw new IllegalStateException("Window out of sync: " + value + " not found");
        }
        System.arraycopy(sorted, idx + 1, sorted, idx, size - idx - 1);
        size--;
    }
}
