package com.chicu.regimetrader.risk;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Просадки по кривой капитала: drawdown = (peak - equity) / peak,
 * peak: бегущий максимум начиная с засеянного значения.
 */
@UtilityClass
public class DrawdownMonitor {

    public double drawdown(double peak, double equity) {
        if (!(peak > 0.0)) {
            return 0.0;
        }
        return Math.max(0.0, (peak - equity) / peak);
    }

    public double maxDrawdown(List<Double> equity) {
        return maxDrawdown(equity, Double.NEGATIVE_INFINITY);
    }

    /** Максимальная просадка, пик засеивается значением seedPeak. */
    public double maxDrawdown(List<Double> equity, double seedPeak) {
        double peak = seedPeak;
        double max = 0.0;
        for (double e : equity) {
            if (e > peak) {
                peak = e;
            }
            max = Math.max(max, drawdown(peak, e));
        }
        return max;
    }

    /** Самый длинный период (в барах) ниже предыдущего пика. */
    public int maxDrawdownDuration(List<Double> equity) {
        double peak = Double.NEGATIVE_INFINITY;
        int current = 0;
        int longest = 0;
        for (double e : equity) {
            if (e >= peak) {
                peak = e;
                current = 0;
            } else {
                current++;
                longest = Math.max(longest, current);
            }
        }
        return longest;
    }
}
