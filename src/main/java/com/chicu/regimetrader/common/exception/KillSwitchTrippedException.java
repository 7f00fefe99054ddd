package com.chicu.regimetrader.common.exception;

import java.time.Instant;

/**
 * Kill switch сработал: блокируются ВСЕ символы, а не только текущий.
 * Снимается только ручным reset.
 */
public class KillSwitchTrippedException extends TradingCoreException {

    private final Instant trippedAt;
    private final double drawdownPct;

    public KillSwitchTrippedException(Instant trippedAt, double drawdownPct) {
        super(String.format("Kill switch TRIPPED at %s (drawdown=%.4f), all trading halted", trippedAt, drawdownPct));
        this.trippedAt = trippedAt;
        this.drawdownPct = drawdownPct;
    }

    public Instant getTrippedAt() {
        return trippedAt;
    }

    public double getDrawdownPct() {
        return drawdownPct;
    }
}
