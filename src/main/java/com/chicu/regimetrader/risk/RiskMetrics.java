package com.chicu.regimetrader.risk;

import lombok.Builder;

import java.time.Instant;

/**
 * Риск-панель. Производная от истории снимков, пересчитывается каждым health-тиком.
 *
 * @param sharpeRatio null, если точек истории меньше 5
 */
@Builder
public record RiskMetrics(
        Instant timestamp,
        double currentDrawdownPct,
        double maxDrawdownPct,
        double portfolioVol,
        Double sharpeRatio,
        double concentrationPct,
        boolean killSwitchActive,
        double slippageMeanBps,
        double slippageP95Bps
) {
}
