package com.chicu.regimetrader.validation;

import lombok.experimental.UtilityClass;

import java.util.Arrays;

/**
 * Перцентиль с линейной интерполяцией между соседними порядковыми статистиками.
 */
@UtilityClass
public class Percentiles {

    public double of(double[] values, double percentile) {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (percentile < 0.0 || percentile > 100.0) {
            throw new IllegalArgumentException("percentile must be in [0,100], got " + percentile);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        double frac = rank - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }
}
