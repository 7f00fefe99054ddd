package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.order.Order;

import java.util.Optional;

/**
 * Симуляция исполнения открытого ордера на закрытии бара.
 *
 * <ul>
 *     <li>MARKET: всегда пересекает спред, цена от close.</li>
 *     <li>LIMIT: исполняется, только если бар дошёл до лимита (buy: low ≤ limit, sell: high ≥ limit),
 *     по цене лимита, с maker-комиссией и без импакта.</li>
 *     <li>Остаток больше maxParticipation * volume исполняется частично: partialFillFraction от остатка.</li>
 * </ul>
 */
public final class FillSimulator {

    private final CostModel costs;
    private final double maxParticipation;
    private final double partialFillFraction;

    public FillSimulator(CostModel costs, double maxParticipation, double partialFillFraction) {
        this.costs = costs;
        this.maxParticipation = maxParticipation;
        this.partialFillFraction = partialFillFraction;
    }

    public static FillSimulator from(BacktestConfig config) {
        return new FillSimulator(CostModel.from(config), config.maxParticipation(), config.partialFillFraction());
    }

    /**
     * @param adv средний долларовый объём за окно (для импакта)
     * @return пусто, если на этом баре исполнения нет
     */
    public Optional<SimulatedFill> simulate(Order order, Bar bar, double adv) {
        double remaining = order.remainingQty();
        if (!(remaining > 0.0) || !(bar.close() > 0.0) || !(bar.volume() > 0.0)) {
            return Optional.empty();
        }

        double qty = fillQuantity(remaining, bar.volume());

        if (order.getType() == OrderType.LIMIT) {
            double limit = order.getLimitPrice();
            boolean crossed = order.getSide() == OrderSide.BUY ? bar.low() <= limit : bar.high() >= limit;
            if (!crossed) {
                return Optional.empty();
            }
            double notional = qty * limit;
            return Optional.of(new SimulatedFill(qty, limit, costs.fee(OrderType.LIMIT, notional)));
        }

        double price = costs.marketFillPrice(order.getSide(), bar.close(), qty * bar.close(), adv);
        return Optional.of(new SimulatedFill(qty, price, costs.fee(OrderType.MARKET, qty * price)));
    }

    double fillQuantity(double remaining, double barVolume) {
        if (remaining > maxParticipation * barVolume) {
            return remaining * partialFillFraction;
        }
        return remaining;
    }
}
