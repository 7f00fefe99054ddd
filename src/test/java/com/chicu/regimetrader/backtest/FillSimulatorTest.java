package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.order.Order;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FillSimulatorTest {

    private static final Instant TS = Instant.parse("2024-01-01T04:00:00Z");

    private final FillSimulator simulator = new FillSimulator(new CostModel(10, 4, 2, 8), 0.1, 0.5);

    private static Order order(OrderSide side, OrderType type, double qty, Double limit) {
        Order o = Order.builder()
                .id("RT-sim")
                .symbol("BTCUSDT")
                .side(side)
                .type(type)
                .quantity(qty)
                .limitPrice(limit)
                .expectedPrice(100)
                .createdAt(TS)
                .build();
        o.submit("RT-sim", TS);
        return o;
    }

    private static Bar bar(double low, double high, double close, double volume) {
        return new Bar(TS, "BTCUSDT", close, high, low, close, volume);
    }

    @Test
    void marketBuy_shouldPayHalfSpreadPlusImpactAndTakerFee() {
        Optional<SimulatedFill> fill = simulator.simulate(order(OrderSide.BUY, OrderType.MARKET, 10, null),
                bar(99, 101, 100, 1_000), 100_000);

        assertTrue(fill.isPresent());
        // импакт 4 * 1000 / 100000 = 0.04 bps, половина спреда 5 bps
        assertEquals(100.0 * (1 + 5.04 / 10_000), fill.get().price(), 1e-9);
        assertEquals(fill.get().notional() * 8 / 10_000, fill.get().fees(), 1e-9);
        assertEquals(10.0, fill.get().quantity());
    }

    @Test
    void marketSell_shouldFillBelowClose() {
        SimulatedFill fill = simulator.simulate(order(OrderSide.SELL, OrderType.MARKET, 10, null),
                bar(99, 101, 100, 1_000), 100_000).orElseThrow();

        assertTrue(fill.price() < 100.0);
    }

    @Test
    void limitBuy_shouldWaitUntilLowReachesLimit() {
        Order o = order(OrderSide.BUY, OrderType.LIMIT, 10, 98.0);

        assertTrue(simulator.simulate(o, bar(98.5, 101, 100, 1_000), 100_000).isEmpty());

        SimulatedFill fill = simulator.simulate(o, bar(97.5, 100, 99, 1_000), 100_000).orElseThrow();
        assertEquals(98.0, fill.price(), 1e-12, "по цене лимита, без импакта");
        assertEquals(10 * 98.0 * 2 / 10_000, fill.fees(), 1e-12, "maker-комиссия");
    }

    @Test
    void limitSell_shouldFillWhenHighReachesLimit() {
        Order o = order(OrderSide.SELL, OrderType.LIMIT, 10, 102.0);

        assertTrue(simulator.simulate(o, bar(99, 101.9, 100, 1_000), 100_000).isEmpty());
        assertTrue(simulator.simulate(o, bar(99, 102.0, 100, 1_000), 100_000).isPresent());
    }

    @Test
    void orderAboveParticipation_shouldFillPartially() {
        SimulatedFill fill = simulator.simulate(order(OrderSide.BUY, OrderType.MARKET, 500, null),
                bar(99, 101, 100, 1_000), 100_000).orElseThrow();

        assertEquals(250.0, fill.quantity(), 1e-12);
        assertEquals(100.0, simulator.fillQuantity(100.0, 1_000), 1e-12, "ровно на пороге: целиком");
    }

    @Test
    void zeroVolumeBar_shouldNotFill() {
        assertTrue(simulator.simulate(order(OrderSide.BUY, OrderType.MARKET, 1, null),
                bar(99, 101, 100, 0), 100_000).isEmpty());
    }
}
