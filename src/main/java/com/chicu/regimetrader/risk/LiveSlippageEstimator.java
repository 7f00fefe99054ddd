package com.chicu.regimetrader.risk;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Скользящая оценка проскальзывания live-исполнений:
 * |fill - expected| / expected в bps, среднее и p95 по последним N.
 */
public class LiveSlippageEstimator {

    private final int window;
    private final Deque<Double> samples = new ArrayDeque<>();

    public LiveSlippageEstimator(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be > 0");
        }
        this.window = window;
    }

    public synchronized void record(double expectedPrice, double fillPrice) {
        if (!(expectedPrice > 0.0) || !(fillPrice > 0.0)) {
            return;
        }
        samples.addLast(Math.abs(fillPrice - expectedPrice) / expectedPrice * 10_000.0);
        while (samples.size() > window) {
            samples.removeFirst();
        }
    }

    public synchronized int count() {
        return samples.size();
    }

    public synchronized double meanBps() {
        return samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public synchronized double p95Bps() {
        if (samples.isEmpty()) {
            return 0.0;
        }
        double[] sorted = samples.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int idx = (int) Math.ceil(0.95 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(idx, sorted.length - 1))];
    }
}
