package com.chicu.regimetrader.regime;

import com.chicu.regimetrader.provider.MarketFeatures;

/**
 * Наблюдение HMM: log-return и realized volatility одного бара.
 */
public record FeatureVector(double logReturn, double realizedVol) {

    public static FeatureVector of(MarketFeatures f) {
        return new FeatureVector(f.logReturn(), f.realizedVol());
    }

    public boolean isFinite() {
        return Double.isFinite(logReturn) && Double.isFinite(realizedVol);
    }
}
