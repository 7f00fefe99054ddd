package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.order.Order;
import com.chicu.regimetrader.portfolio.Fill;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.RoundTripTrade;
import com.chicu.regimetrader.risk.KillSwitchStatus;

import java.util.List;

/**
 * Итог прогона.
 *
 * @param equityCurve снимок на конец каждого бара
 * @param events      обработанные события в порядке диспетчеризации
 */
public record BacktestResult(
        BacktestMetrics metrics,
        List<PortfolioSnapshot> equityCurve,
        List<RoundTripTrade> trades,
        List<Fill> fills,
        List<Order> orders,
        List<BacktestEvent> events,
        KillSwitchStatus killSwitch
) {

    public double[] equity() {
        return equityCurve.stream().mapToDouble(PortfolioSnapshot::equity).toArray();
    }

    public double[] returns() {
        return PerformanceMetrics.returns(equity());
    }
}
