package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.provider.FeatureProvider;
import com.chicu.regimetrader.provider.MarketFeatures;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Признаки по истории, выровненные по индексу бара.
 * Признак бара i построен только по барам 0..i.
 */
public class HistoricalFeatureProvider implements FeatureProvider {

    private final String symbol;
    private final List<MarketFeatures> features;
    private final Map<Instant, MarketFeatures> byTimestamp;

    public HistoricalFeatureProvider(String symbol, List<Bar> bars, List<MarketFeatures> features) {
        Objects.requireNonNull(bars, "bars");
        Objects.requireNonNull(features, "features");
        if (bars.size() != features.size()) {
            throw new IllegalArgumentException(
                    "features must be aligned with bars: " + features.size() + " != " + bars.size());
        }
        this.symbol = symbol;
        this.features = List.copyOf(features);
        this.byTimestamp = new HashMap<>();
        for (int i = 0; i < bars.size(); i++) {
            byTimestamp.put(bars.get(i).timestamp(), features.get(i));
        }
    }

    /**
     * Только входы режима: log-return к предыдущему close и
     * realized vol (выборочное σ log-return за volWindow баров, годовое через √barsPerYear).
     * Индикаторы остаются NaN.
     */
    public static HistoricalFeatureProvider fromBars(String symbol, List<Bar> bars, int volWindow, int barsPerYear) {
        List<MarketFeatures> out = new ArrayList<>(bars.size());
        double[] logReturns = new double[bars.size()];
        double annualize = Math.sqrt(barsPerYear);

        for (int i = 0; i < bars.size(); i++) {
            logReturns[i] = i == 0 ? Double.NaN : Math.log(bars.get(i).close() / bars.get(i - 1).close());

            double vol = Double.NaN;
            if (i >= volWindow) {
                vol = sampleStd(logReturns, i - volWindow + 1, i + 1) * annualize;
            }
            out.add(MarketFeatures.regimeOnly(logReturns[i], vol));
        }
        return new HistoricalFeatureProvider(symbol, bars, out);
    }

    public MarketFeatures at(int barIndex) {
        return features.get(barIndex);
    }

    public int size() {
        return features.size();
    }

    public List<MarketFeatures> upTo(int barIndex) {
        return Collections.unmodifiableList(features.subList(0, barIndex + 1));
    }

    @Override
    public Optional<MarketFeatures> getFeatures(String symbol, Instant timestamp) {
        if (!Objects.equals(this.symbol, symbol)) {
            return Optional.empty();
        }
        return Optional.ofNullable(byTimestamp.get(timestamp));
    }

    private static double sampleStd(double[] values, int from, int to) {
        int n = to - from;
        double mean = 0.0;
        for (int i = from; i < to; i++) {
            mean += values[i];
        }
        mean /= n;
        double ss = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            ss += d * d;
        }
        return Math.sqrt(ss / (n - 1));
    }
}
