package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderType;

/**
 * Издержки исполнения: половина спреда на сторону, линейный импакт от доли ADV, комиссия maker/taker.
 */
public final class CostModel {

    private static final double BPS = 10_000.0;

    private final double spreadBps;
    private final double linearImpactBps;
    private final double makerFeeBps;
    private final double takerFeeBps;

    public CostModel(double spreadBps, double linearImpactBps, double makerFeeBps, double takerFeeBps) {
        this.spreadBps = spreadBps;
        this.linearImpactBps = linearImpactBps;
        this.makerFeeBps = makerFeeBps;
        this.takerFeeBps = takerFeeBps;
    }

    public static CostModel from(BacktestConfig config) {
        return new CostModel(config.spreadBps(), config.linearImpactBps(),
                config.makerFeeBps(), config.takerFeeBps());
    }

    /** Импакт в bps: linearImpactBps * notional / adv. ADV снизу ограничен 1.0. */
    public double impactBps(double notional, double adv) {
        return linearImpactBps * Math.abs(notional) / Math.max(adv, 1.0);
    }

    /**
     * Цена рыночного исполнения: покупка по ask-эквиваленту, продажа по bid-эквиваленту,
     * плюс импакт в сторону, невыгодную для ордера.
     */
    public double marketFillPrice(OrderSide side, double close, double notional, double adv) {
        double slipBps = spreadBps / 2.0 + impactBps(notional, adv);
        return close * (1.0 + side.sign() * slipBps / BPS);
    }

    public double feeBps(OrderType type) {
        return type == OrderType.LIMIT ? makerFeeBps : takerFeeBps;
    }

    public double fee(OrderType type, double notional) {
        return Math.abs(notional) * feeBps(type) / BPS;
    }
}
