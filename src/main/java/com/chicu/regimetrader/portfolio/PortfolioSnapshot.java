package com.chicu.regimetrader.portfolio;

import java.time.Instant;

/**
 * Точка кривой капитала. Пишется каждый цикл, а не только при сделках.
 * equity = cash + positionsValue.
 */
public record PortfolioSnapshot(
        Instant timestamp,
        double equity,
        double cash,
        double positionsValue,
        double unrealizedPnl,
        double realizedPnl,
        double drawdownPct
) {
}
