package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import lombok.Builder;

/**
 * Параметры одного прогона. Снимок значений из properties: прогоны не делят изменяемое состояние.
 */
@Builder(toBuilder = true)
public record BacktestConfig(
        double initialCapital,
        int fillLatencyBars,
        double spreadBps,
        double linearImpactBps,
        double makerFeeBps,
        double takerFeeBps,
        double maxParticipation,
        double partialFillFraction,
        int cancelAfterBars,
        int advWindow,
        int volWindow,
        int barsPerYear,
        OrderType orderType,

        // риск
        double maxPositionPct,
        double maxConcentrationPct,
        double maxDrawdownPct,
        double minTradeUsd
) {

    public BacktestConfig {
        if (!(initialCapital > 0.0)) {
            throw new IllegalArgumentException("initialCapital must be > 0, got " + initialCapital);
        }
        if (fillLatencyBars < 0) {
            throw new IllegalArgumentException("fillLatencyBars must be >= 0, got " + fillLatencyBars);
        }
        if (spreadBps < 0 || linearImpactBps < 0 || makerFeeBps < 0 || takerFeeBps < 0) {
            throw new IllegalArgumentException("cost parameters must be >= 0");
        }
        if (!(maxParticipation > 0.0)) {
            throw new IllegalArgumentException("maxParticipation must be > 0, got " + maxParticipation);
        }
        if (!(partialFillFraction > 0.0 && partialFillFraction <= 1.0)) {
            throw new IllegalArgumentException("partialFillFraction must be in (0,1], got " + partialFillFraction);
        }
        if (cancelAfterBars < 1 || advWindow < 1 || volWindow < 2 || barsPerYear < 1) {
            throw new IllegalArgumentException("cancelAfterBars/advWindow/barsPerYear must be >= 1, volWindow >= 2");
        }
        if (orderType == null) {
            orderType = OrderType.MARKET;
        }
    }

    public static BacktestConfig from(RegimeTraderProperties props) {
        RegimeTraderProperties.Backtest bt = props.getBacktest();
        RegimeTraderProperties.Risk risk = props.getRisk();
        return BacktestConfig.builder()
                .initialCapital(bt.getInitialCapital())
                .fillLatencyBars(bt.getFillLatencyBars())
                .spreadBps(bt.getSpreadBps())
                .linearImpactBps(bt.getLinearImpactBps())
                .makerFeeBps(bt.getMakerFeeBps())
                .takerFeeBps(bt.getTakerFeeBps())
                .maxParticipation(bt.getMaxParticipation())
                .partialFillFraction(bt.getPartialFillFraction())
                .cancelAfterBars(bt.getCancelAfterBars())
                .advWindow(bt.getAdvWindow())
                .volWindow(20)
                .barsPerYear(props.getUniverse().getBarsPerYear())
                .orderType(props.getExecution().getOrderType())
                .maxPositionPct(risk.getMaxPositionPct())
                .maxConcentrationPct(risk.getMaxConcentrationPct())
                .maxDrawdownPct(risk.getMaxDrawdownPct())
                .minTradeUsd(risk.getMinTradeUsd())
                .build();
    }

    /** Нулевая задержка и нулевые издержки: регрессия против buy-and-hold. */
    public BacktestConfig neutralCosts() {
        return toBuilder()
                .fillLatencyBars(0)
                .spreadBps(0.0)
                .linearImpactBps(0.0)
                .makerFeeBps(0.0)
                .takerFeeBps(0.0)
                .build();
    }
}
