package com.chicu.regimetrader.provider;

/**
 * Признаки бара от внешнего FeatureProvider.
 * Отсутствующее значение = NaN.
 */
public record MarketFeatures(
        double logReturn,
        double realizedVol,
        double rsi,
        double atr,
        double bbPctB,
        double vwapDeviation
) {

    public static MarketFeatures regimeOnly(double logReturn, double realizedVol) {
        return new MarketFeatures(logReturn, realizedVol, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    /** Есть ли оба входа HMM (log-return и realized vol). */
    public boolean hasRegimeInputs() {
        return Double.isFinite(logReturn) && Double.isFinite(realizedVol);
    }
}
