package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.provider.MarketFeatures;
import lombok.experimental.UtilityClass;

import java.util.OptionalDouble;

/**
 * Композитный технический score в [-1, 1]:
 * 0.4·RSI + 0.3·Bollinger %B + 0.3·VWAP deviation (контртрендовая трактовка).
 * Отсутствующие (NaN) индикаторы исключаются, веса оставшихся нормируются.
 */
@UtilityClass
public class TechnicalScorer {

    private static final double W_RSI = 0.4;
    private static final double W_BB = 0.3;
    private static final double W_VWAP = 0.3;

    public OptionalDouble score(MarketFeatures f) {
        if (f == null) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        double w = 0.0;
        if (Double.isFinite(f.rsi())) {
            sum += W_RSI * clip((50.0 - f.rsi()) / 50.0);
            w += W_RSI;
        }
        if (Double.isFinite(f.bbPctB())) {
            sum += W_BB * clip((0.5 - f.bbPctB()) * 2.0);
            w += W_BB;
        }
        if (Double.isFinite(f.vwapDeviation())) {
            sum += W_VWAP * clip(-f.vwapDeviation() * 20.0);
            w += W_VWAP;
        }
        if (w == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(clip(sum / w));
    }

    private double clip(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }
}
