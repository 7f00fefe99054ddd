package com.chicu.regimetrader.portfolio;

import com.chicu.regimetrader.common.enums.Direction;

/**
 * Позиция по символу (снимок). side = FLAT при quantity = 0.
 *
 * @param quantity     абсолютное количество; направление: в side
 * @param realizedPnl  реализованный PnL за всё время, за вычетом комиссий
 */
public record Position(
        String symbol,
        Direction side,
        double quantity,
        double avgEntryPrice,
        double markPrice,
        double unrealizedPnl,
        double realizedPnl
) {

    public static Position flat(String symbol) {
        return new Position(symbol, Direction.FLAT, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public double signedQuantity() {
        return side == Direction.SHORT ? -quantity : quantity;
    }

    public double marketValue() {
        return signedQuantity() * markPrice;
    }

    public boolean isFlat() {
        return side == Direction.FLAT;
    }
}
