package com.chicu.regimetrader.regime;

import com.chicu.regimetrader.common.enums.Regime;

import java.time.Instant;
import java.util.Map;

/**
 * Режим рынка на (symbol, timestamp). Не изменяется: только замещается следующим.
 *
 * @param confidence    апостериорная вероятность выбранного режима [0..1]
 * @param probabilities апостериор по всем трём режимам
 */
public record RegimeState(
        String symbol,
        Regime regime,
        double confidence,
        Map<Regime, Double> probabilities,
        Instant timestamp
) {

    public RegimeState {
        probabilities = probabilities == null ? Map.of() : Map.copyOf(probabilities);
    }
}
