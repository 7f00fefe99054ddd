package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostModelTest {

    private final CostModel costs = new CostModel(6, 10, 2, 7);

    @Test
    void impact_shouldGrowLinearlyWithShareOfAdv() {
        assertEquals(1.0, costs.impactBps(10_000, 100_000), 1e-12);
        assertEquals(2.0, costs.impactBps(-20_000, 100_000), 1e-12);
    }

    @Test
    void impact_shouldFloorAdvAtOne() {
        assertEquals(10.0 * 5, costs.impactBps(5, 0.0), 1e-12);
    }

    @Test
    void marketFillPrice_shouldMoveAgainstOrder() {
        double buy = costs.marketFillPrice(OrderSide.BUY, 200, 0, 1e9);
        double sell = costs.marketFillPrice(OrderSide.SELL, 200, 0, 1e9);

        assertEquals(200 * (1 + 3.0 / 10_000), buy, 1e-9);
        assertEquals(200 * (1 - 3.0 / 10_000), sell, 1e-9);
    }

    @Test
    void fee_shouldUseMakerForLimitAndTakerForMarket() {
        assertEquals(2.0, costs.feeBps(OrderType.LIMIT));
        assertEquals(7.0, costs.feeBps(OrderType.MARKET));
        assertEquals(7.0, costs.fee(OrderType.MARKET, -10_000), 1e-12);
    }
}
