package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.common.enums.SignalSource;

import java.time.Instant;
import java.util.Objects;

/**
 * Сигнал одного источника, score ∈ [-1, 1]. Только для чтения.
 */
public record ComponentSignal(SignalSource source, double score, Instant timestamp) {

    public ComponentSignal {
        Objects.requireNonNull(source, "source");
        if (!Double.isFinite(score) || score < -1.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [-1,1], got " + score + " for " + source);
        }
    }

    /** Обрезает внешний score в [-1, 1]. NaN недопустим. */
    public static ComponentSignal clamped(SignalSource source, double score, Instant ts) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score is NaN for " + source);
        }
        return new ComponentSignal(source, Math.max(-1.0, Math.min(1.0, score)), ts);
    }
}
