package com.chicu.regimetrader.validation;

import java.util.Arrays;

/**
 * Распределения метрик по бутстреп-симуляциям.
 */
public record MonteCarloResult(
        double[] sharpeRatios,
        double[] totalReturns,
        double[] maxDrawdowns,
        int simulations
) {

    public double sharpeMean() {
        return Arrays.stream(sharpeRatios).average().orElse(0.0);
    }

    public double sharpeP5() {
        return Percentiles.of(sharpeRatios, 5.0);
    }

    public double sharpeP95() {
        return Percentiles.of(sharpeRatios, 95.0);
    }

    public double returnMean() {
        return Arrays.stream(totalReturns).average().orElse(0.0);
    }

    public double returnP5() {
        return Percentiles.of(totalReturns, 5.0);
    }

    public double returnP95() {
        return Percentiles.of(totalReturns, 95.0);
    }

    public double maxDrawdownMedian() {
        return Percentiles.of(maxDrawdowns, 50.0);
    }

    public double maxDrawdownP95() {
        return Percentiles.of(maxDrawdowns, 95.0);
    }
}
