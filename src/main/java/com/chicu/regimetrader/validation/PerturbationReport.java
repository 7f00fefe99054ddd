package com.chicu.regimetrader.validation;

import java.util.List;
import java.util.Map;

/**
 * Чувствительность к параметрам: базовый прогон против прогонов с шумом ±pct.
 *
 * @param collapseRatio 5-й перцентиль Sharpe возмущённых прогонов / базовый Sharpe;
 *                      NaN, если базовый Sharpe ≤ 0. Порог выбирает вызывающий.
 */
public record PerturbationReport(
        Map<String, Double> baseParams,
        double baseSharpe,
        double baseReturn,
        List<Map<String, Double>> perturbedParams,
        double[] perturbedSharpes,
        double[] perturbedReturns,
        double collapseRatio
) {

    public double perturbedSharpeMean() {
        double sum = 0.0;
        for (double s : perturbedSharpes) {
            sum += s;
        }
        return perturbedSharpes.length == 0 ? 0.0 : sum / perturbedSharpes.length;
    }

    public double perturbedSharpeP5() {
        return Percentiles.of(perturbedSharpes, 5.0);
    }

    public double perturbedReturnP5() {
        return Percentiles.of(perturbedReturns, 5.0);
    }
}
