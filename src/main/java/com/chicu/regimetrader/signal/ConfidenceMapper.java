package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.provider.Prediction;

/**
 * Уверенность модели из ширины квантильного интервала:
 * {@code 1 - (iqr - minIqr) / (maxIqr - minIqr)}, обрезано в [0, 1].
 */
public final class ConfidenceMapper {

    private final double minIqr;
    private final double maxIqr;
    private final double fallback;

    public ConfidenceMapper(double minIqr, double maxIqr, double fallback) {
        this.minIqr = minIqr;
        this.maxIqr = maxIqr;
        this.fallback = fallback;
    }

    public double fromIqr(double iqr) {
        if (maxIqr <= minIqr || !Double.isFinite(iqr)) {
            return fallback;
        }
        double c = 1.0 - (iqr - minIqr) / (maxIqr - minIqr);
        return clip(c);
    }

    /**
     * null (предиктор недоступен) → fallback;
     * вырожденные квантили → labelConfidence;
     * иначе по IQR.
     */
    public double confidenceFor(Prediction prediction) {
        if (prediction == null) {
            return fallback;
        }
        if (prediction.isDegenerate()) {
            double lc = prediction.labelConfidence();
            return Double.isFinite(lc) ? clip(lc) : fallback;
        }
        return fromIqr(prediction.iqr());
    }

    public double fallback() {
        return fallback;
    }

    private static double clip(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
