package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.risk.SizedOrderIntent;

import java.util.List;
import java.util.Optional;

/**
 * Бенчмарк: long, пока быстрая SMA выше медленной, иначе вне рынка.
 * Средние считаются по барам до текущего (без заглядывания), исполнение от close текущего.
 */
public class MovingAverageCrossoverStrategy implements BacktestStrategy {

    private final int fastPeriod;
    private final int slowPeriod;
    private final double allocation;

    public MovingAverageCrossoverStrategy(int fastPeriod, int slowPeriod, double allocation) {
        if (fastPeriod < 1 || slowPeriod <= fastPeriod) {
            throw new IllegalArgumentException("need 1 <= fast < slow, got " + fastPeriod + "/" + slowPeriod);
        }
        if (!(allocation > 0.0 && allocation <= 1.0)) {
            throw new IllegalArgumentException("allocation must be in (0,1], got " + allocation);
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.allocation = allocation;
    }

    @Override
    public String name() {
        return "ma_crossover_" + fastPeriod + "_" + slowPeriod;
    }

    @Override
    public Optional<SizedOrderIntent> onBar(BarContext ctx) {
        List<Bar> history = ctx.history();
        int prev = ctx.index() - 1;
        if (prev + 1 < slowPeriod) {
            return Optional.empty();
        }
        boolean wantLong = sma(history, prev, fastPeriod) > sma(history, prev, slowPeriod);

        double qty = ctx.portfolio().quantity(ctx.symbol());
        double price = ctx.bar().close();

        if (wantLong && qty == 0.0) {
            double equity = ctx.portfolio().equity();
            return Optional.of(intent(ctx.symbol(), OrderSide.BUY, equity * allocation / price, allocation, 1.0, price));
        }
        if (!wantLong && qty > 0.0) {
            return Optional.of(intent(ctx.symbol(), OrderSide.SELL, qty, 0.0, -1.0, price));
        }
        return Optional.empty();
    }

    private static double sma(List<Bar> bars, int lastIndex, int period) {
        double sum = 0.0;
        for (int i = lastIndex - period + 1; i <= lastIndex; i++) {
            sum += bars.get(i).close();
        }
        return sum / period;
    }

    private static SizedOrderIntent intent(String symbol, OrderSide side, double qty, double pct,
                                           double strength, double price) {
        return SizedOrderIntent.builder()
                .symbol(symbol)
                .side(side)
                .quantity(qty)
                .notionalPctOfEquity(pct)
                .signalStrength(strength)
                .referencePrice(price)
                .build();
    }
}
