package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.risk.SizedOrderIntent;

import java.util.Optional;

/**
 * Источник сигналов для бэктеста. Вызывается на событии SIGNAL каждого бара.
 * Экземпляр с состоянием (например, HMM) создаётся на каждый прогон.
 */
public interface BacktestStrategy {

    String name();

    /**
     * @return ордер-дельта к целевой позиции; пусто = ничего не делать
     */
    Optional<SizedOrderIntent> onBar(BarContext ctx);
}
