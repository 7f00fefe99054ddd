package com.chicu.regimetrader.provider;

import java.time.Instant;
import java.util.Optional;

/**
 * Внешний расчёт индикаторов. Ядро их не пересчитывает.
 */
public interface FeatureProvider {

    Optional<MarketFeatures> getFeatures(String symbol, Instant timestamp);
}
