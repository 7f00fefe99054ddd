package com.chicu.regimetrader.portfolio;

import com.chicu.regimetrader.common.enums.Direction;

import java.time.Instant;

/**
 * Закрытая сделка: от открытия позиции до возврата в ноль (или переворота).
 *
 * @param entryPrice средняя цена входа (фактические цены исполнения)
 * @param exitPrice  средневзвешенная цена выходов
 * @param pnl        реализованный PnL сделки, за вычетом всех её комиссий
 */
public record RoundTripTrade(
        String symbol,
        Direction side,
        Instant entryTime,
        Instant exitTime,
        double quantity,
        double entryPrice,
        double exitPrice,
        double fees,
        double pnl
) {

    public boolean isWin() {
        return pnl > 0.0;
    }
}
