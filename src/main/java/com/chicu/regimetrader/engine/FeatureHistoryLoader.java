package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.market.MarketDataProvider;
import com.chicu.regimetrader.provider.FeatureProvider;
import com.chicu.regimetrader.regime.FeatureVector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Ряд наблюдений HMM по последним барам символа (бары без признаков пропускаются).
 */
@Component
@RequiredArgsConstructor
public class FeatureHistoryLoader {

    private final MarketDataProvider marketData;
    private final FeatureProvider featureProvider;

    public List<FeatureVector> load(String symbol, int bars) {
        List<FeatureVector> out = new ArrayList<>();
        for (Bar bar : marketData.recentBars(symbol, bars)) {
            featureProvider.getFeatures(symbol, bar.timestamp())
                    .filter(f -> f.hasRegimeInputs())
                    .map(FeatureVector::of)
                    .ifPresent(out::add);
        }
        return out;
    }
}
