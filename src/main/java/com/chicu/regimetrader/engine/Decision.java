package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.regime.RegimeState;
import com.chicu.regimetrader.risk.RiskDecision;
import com.chicu.regimetrader.risk.SizedOrderIntent;
import com.chicu.regimetrader.signal.FusedSignal;

import java.time.Instant;

/**
 * Результат одного прохода пайплайна по символу.
 *
 * @param target целевая позиция от сайзера
 * @param order  ордер-дельта к цели; null, если торговать нечего
 * @param risk   решение риска по order; null, если order == null
 */
public record Decision(
        String symbol,
        Instant timestamp,
        RegimeState regime,
        FusedSignal signal,
        SizedOrderIntent target,
        SizedOrderIntent order,
        RiskDecision risk
) {

    public Decision withRisk(RiskDecision decision) {
        return new Decision(symbol, timestamp, regime, signal, target, order, decision);
    }

    public boolean hasOrder() {
        return order != null;
    }

    public boolean approved() {
        return order != null && risk != null && risk.approved();
    }
}
