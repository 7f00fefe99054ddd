package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.Regime;
import com.chicu.regimetrader.signal.FusedSignal;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PositionSizerTest {

    private final PositionSizer sizer = new PositionSizer(0.15, 1e-4, 0.25, false);

    private static FusedSignal signal(Direction dir, double strength, double confidence) {
        return FusedSignal.builder()
                .symbol("BTCUSDT")
                .direction(dir)
                .strength(strength)
                .confidence(confidence)
                .regime(Regime.TRENDING)
                .timestamp(Instant.EPOCH)
                .build();
    }

    @Test
    void targetPct_shouldBeMonotonicallyDecreasingInVol_andBounded() {
        double prev = Double.POSITIVE_INFINITY;
        for (double vol = 0.05; vol <= 3.0; vol += 0.05) {
            double pct = sizer.targetPct(0.6, 0.9, vol);
            assertTrue(pct <= prev + 1e-15, "размер не должен расти с волатильностью");
            assertTrue(pct >= 0.0 && pct <= 0.25, "размер в [0, maxPositionPct]");
            prev = pct;
        }
    }

    @Test
    void targetPct_shouldFloorVolatility() {
        assertEquals(0.25, sizer.targetPct(1.0, 1.0, 0.0));
        assertEquals(0.25, sizer.targetPct(1.0, 1.0, -5.0));
    }

    @Test
    void size_shouldComputeQuantityFromEquityAndPrice() {
        // 0.15 / 0.6 * 0.5 * 0.8 = 0.1
        SizedOrderIntent target = sizer.size(signal(Direction.LONG, 0.5, 0.8), 0.6, 100_000, 50_000);

        assertEquals(0.1, target.notionalPctOfEquity(), 1e-12);
        assertEquals(0.2, target.quantity(), 1e-12);
        assertEquals(OrderSide.BUY, target.side());
    }

    @Test
    void size_shouldBeZero_forFlatOrBadInputs() {
        assertEquals(0.0, sizer.size(signal(Direction.FLAT, 0.01, 1.0), 0.5, 100_000, 100).quantity());
        assertEquals(0.0, sizer.size(signal(Direction.LONG, 0.5, 1.0), Double.NaN, 100_000, 100).quantity());
        assertEquals(0.0, sizer.size(signal(Direction.LONG, 0.5, 1.0), 0.5, 100_000, 0.0).quantity());
        assertEquals(0.0, sizer.size(signal(Direction.LONG, 0.5, 1.0), 0.5, -1.0, 100).quantity());
    }

    @Test
    void rebalance_long_shouldBuyOnlyTheDifference() {
        SizedOrderIntent target = sizer.size(signal(Direction.LONG, 0.5, 0.8), 0.6, 100_000, 50_000);

        Optional<SizedOrderIntent> order = sizer.rebalance(target, Direction.LONG, 0.05);

        assertTrue(order.isPresent());
        assertEquals(OrderSide.BUY, order.get().side());
        assertEquals(0.15, order.get().quantity(), 1e-12);
    }

    @Test
    void rebalance_long_shouldNotSellExcess() {
        SizedOrderIntent target = sizer.size(signal(Direction.LONG, 0.5, 0.8), 0.6, 100_000, 50_000);

        assertTrue(sizer.rebalance(target, Direction.LONG, 0.5).isEmpty());
    }

    @Test
    void rebalance_shortOnSpot_shouldSellExistingLongToZero() {
        SizedOrderIntent target = sizer.size(signal(Direction.SHORT, -0.5, 0.8), 0.6, 100_000, 50_000);

        Optional<SizedOrderIntent> order = sizer.rebalance(target, Direction.SHORT, 0.3);

        assertTrue(order.isPresent());
        assertEquals(OrderSide.SELL, order.get().side());
        assertEquals(0.3, order.get().quantity(), 1e-12);
        assertEquals(0.0, order.get().notionalPctOfEquity());
        assertTrue(sizer.rebalance(target, Direction.SHORT, 0.0).isEmpty(), "без позиции шорт на споте не открывается");
    }

    @Test
    void rebalance_shortAllowed_shouldOpenShort() {
        PositionSizer shortable = new PositionSizer(0.15, 1e-4, 0.25, true);
        SizedOrderIntent target = shortable.size(signal(Direction.SHORT, -0.5, 0.8), 0.6, 100_000, 50_000);

        Optional<SizedOrderIntent> order = shortable.rebalance(target, Direction.SHORT, 0.0);

        assertTrue(order.isPresent());
        assertEquals(OrderSide.SELL, order.get().side());
        assertEquals(0.2, order.get().quantity(), 1e-12);
    }

    @Test
    void rebalance_flat_shouldHold() {
        SizedOrderIntent target = sizer.size(signal(Direction.FLAT, 0.0, 0.5), 0.6, 100_000, 50_000);

        assertTrue(sizer.rebalance(target, Direction.FLAT, 0.3).isEmpty());
    }
}
