package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.risk.SizedOrderIntent;

import java.util.Optional;

/**
 * Бенчмарк: на первом баре покупаем allocation от капитала и держим до конца.
 */
public class BuyAndHoldStrategy implements BacktestStrategy {

    private final double allocation;

    public BuyAndHoldStrategy() {
        this(1.0);
    }

    public BuyAndHoldStrategy(double allocation) {
        if (!(allocation > 0.0 && allocation <= 1.0)) {
            throw new IllegalArgumentException("allocation must be in (0,1], got " + allocation);
        }
        this.allocation = allocation;
    }

    @Override
    public String name() {
        return "buy_and_hold";
    }

    @Override
    public Optional<SizedOrderIntent> onBar(BarContext ctx) {
        if (ctx.portfolio().quantity(ctx.symbol()) != 0.0 || !ctx.portfolio().appliedFills().isEmpty()) {
            return Optional.empty();
        }
        double price = ctx.bar().close();
        double equity = ctx.portfolio().equity();
        if (!(price > 0.0) || !(equity > 0.0)) {
            return Optional.empty();
        }
        return Optional.of(SizedOrderIntent.builder()
                .symbol(ctx.symbol())
                .side(OrderSide.BUY)
                .quantity(equity * allocation / price)
                .notionalPctOfEquity(allocation)
                .signalStrength(1.0)
                .referencePrice(price)
                .build());
    }
}
