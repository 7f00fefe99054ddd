package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.common.enums.Regime;
import com.chicu.regimetrader.common.enums.SignalSource;
import com.chicu.regimetrader.common.exception.ConfigurationException;
import com.chicu.regimetrader.config.RegimeTraderProperties;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Таблица весов источников по режимам.
 * Проверяется один раз при создании: веса неотрицательны и в сумме дают 1.0.
 */
public final class RegimeWeights {

    private static final double SUM_TOLERANCE = 1e-9;

    private final Map<Regime, Map<SignalSource, Double>> table;

    private RegimeWeights(Map<Regime, Map<SignalSource, Double>> table) {
        this.table = table;
    }

    public static RegimeWeights from(RegimeTraderProperties.Fusion fusion) {
        Map<Regime, RegimeTraderProperties.Weights> raw = new EnumMap<>(Regime.class);
        raw.put(Regime.TRENDING, fusion.getTrending());
        raw.put(Regime.MEAN_REVERTING, fusion.getMeanReverting());
        raw.put(Regime.CHOPPY, fusion.getChoppy());
        return of(raw);
    }

    public static RegimeWeights of(Map<Regime, RegimeTraderProperties.Weights> raw) {
        Map<Regime, Map<SignalSource, Double>> table = new EnumMap<>(Regime.class);
        for (Regime regime : Regime.values()) {
            RegimeTraderProperties.Weights w = raw.get(regime);
            if (w == null) {
                throw new ConfigurationException("fusion weights missing for regime " + regime);
            }
            Map<SignalSource, Double> row = new EnumMap<>(SignalSource.class);
            row.put(SignalSource.TECHNICAL, w.getTechnical());
            row.put(SignalSource.ML, w.getMl());
            row.put(SignalSource.SENTIMENT, w.getSentiment());

            double sum = 0.0;
            for (Map.Entry<SignalSource, Double> e : row.entrySet()) {
                double v = e.getValue();
                if (!Double.isFinite(v) || v < 0.0) {
                    throw new ConfigurationException(
                            "fusion weight " + regime + "." + e.getKey() + " must be finite and >= 0, got " + v);
                }
                sum += v;
            }
            if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
                throw new ConfigurationException(
                        String.format("fusion weights for %s must sum to 1.0, got %.6f", regime, sum));
            }
            table.put(regime, Collections.unmodifiableMap(row));
        }
        return new RegimeWeights(table);
    }

    public double weight(Regime regime, SignalSource source) {
        return table.get(regime).get(source);
    }

    public Map<SignalSource, Double> row(Regime regime) {
        return table.get(regime);
    }
}
