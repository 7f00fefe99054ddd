package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.common.enums.Regime;
import com.chicu.regimetrader.common.enums.SignalSource;
import com.chicu.regimetrader.common.exception.ConfigurationException;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Regime-gated mixture of experts.
 *
 * <pre>
 * raw      = Σ w[regime][src] * score[src]     (веса отсутствующих источников перераспределяются)
 * raw     *= choppyScale                        (только CHOPPY, до confidence)
 * strength = clamp(raw * confidence, -1, 1)
 * </pre>
 *
 * Чистая функция: одинаковые входы → одинаковый выход, без состояния.
 */
public final class SignalFusion {

    private final RegimeWeights weights;
    private final double choppyScale;
    private final double directionThreshold;

    public SignalFusion(RegimeWeights weights, double choppyScale, double directionThreshold) {
        this.weights = Objects.requireNonNull(weights, "weights");
        if (!(choppyScale >= 0.0 && choppyScale < 1.0)) {
            throw new ConfigurationException("fusion.choppyScale must be in [0,1), got " + choppyScale);
        }
        if (!(directionThreshold > 0.0 && directionThreshold < 1.0)) {
            throw new ConfigurationException("fusion.directionThreshold must be in (0,1), got " + directionThreshold);
        }
        this.choppyScale = choppyScale;
        this.directionThreshold = directionThreshold;
    }

    public double directionThreshold() {
        return directionThreshold;
    }

    public FusedSignal fuse(String symbol,
                            Regime regime,
                            Collection<ComponentSignal> signals,
                            double confidence,
                            Instant timestamp) {

        Objects.requireNonNull(regime, "regime");
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence is NaN");
        }
        double conf = Math.max(0.0, Math.min(1.0, confidence));

        Map<SignalSource, Double> present = new EnumMap<>(SignalSource.class);
        if (signals != null) {
            for (ComponentSignal s : signals) {
                if (present.put(s.source(), s.score()) != null) {
                    throw new IllegalArgumentException("duplicate signal source " + s.source() + " for " + symbol);
                }
            }
        }

        double weighted = 0.0;
        double presentWeight = 0.0;
        for (Map.Entry<SignalSource, Double> e : present.entrySet()) {
            double w = weights.weight(regime, e.getKey());
            weighted += w * e.getValue();
            presentWeight += w;
        }
        double raw = presentWeight > 0.0 ? weighted / presentWeight : 0.0;

        if (regime == Regime.CHOPPY) {
            raw *= choppyScale;
        }

        double strength = Math.max(-1.0, Math.min(1.0, raw * conf));

        Map<SignalSource, Double> components = new EnumMap<>(SignalSource.class);
        for (SignalSource src : SignalSource.values()) {
            components.put(src, present.getOrDefault(src, 0.0));
        }

        return FusedSignal.builder()
                .symbol(symbol)
                .direction(directionOf(strength))
                .strength(strength)
                .confidence(conf)
                .regime(regime)
                .components(components)
                .timestamp(timestamp)
                .build();
    }

    Direction directionOf(double strength) {
        if (strength > directionThreshold) return Direction.LONG;
        if (strength < -directionThreshold) return Direction.SHORT;
        return Direction.FLAT;
    }
}
