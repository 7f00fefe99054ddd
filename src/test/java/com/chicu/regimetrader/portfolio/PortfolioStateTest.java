package com.chicu.regimetrader.portfolio;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.exception.IdempotencyViolationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioStateTest {

    private static final Instant T0 = Instant.parse("2024-02-01T00:00:00Z");

    private static Fill fill(String orderId, int seq, OrderSide side, double qty, double price, double fees, int hour) {
        return new Fill(Fill.fillId(orderId, seq), orderId, "BTCUSDT", side, qty, price, fees, T0.plusSeconds(hour * 3600L));
    }

    @Test
    void buy_shouldDebitNotionalAndFees() {
        PortfolioState p = new PortfolioState(10_000);

        assertTrue(p.applyFill(fill("RT-a", 1, OrderSide.BUY, 2, 1_000, 2, 0)));

        assertEquals(7_998.0, p.cash(), 1e-9);
        assertEquals(2.0, p.quantity("BTCUSDT"));
        assertEquals(9_998.0, p.equity(), 1e-9);
    }

    @Test
    void sameFillTwice_shouldBeNoop() {
        PortfolioState once = new PortfolioState(10_000);
        PortfolioState twice = new PortfolioState(10_000);
        Fill f = fill("RT-a", 1, OrderSide.BUY, 2, 1_000, 2, 0);

        once.applyFill(f);
        twice.applyFill(f);
        assertFalse(twice.applyFill(f), "повтор должен вернуть false");

        assertEquals(once.cash(), twice.cash());
        assertEquals(once.quantity("BTCUSDT"), twice.quantity("BTCUSDT"));
        assertEquals(once.totalFees(), twice.totalFees());
        assertEquals(once.position("BTCUSDT"), twice.position("BTCUSDT"));
        assertEquals(1, twice.appliedFills().size());
    }

    @Test
    void sameFillIdWithDifferentContent_shouldBeInvariantFailure() {
        PortfolioState p = new PortfolioState(10_000);
        p.applyFill(fill("RT-a", 1, OrderSide.BUY, 2, 1_000, 2, 0));

        assertThrows(IdempotencyViolationException.class,
                () -> p.applyFill(fill("RT-a", 1, OrderSide.BUY, 3, 1_000, 2, 0)));
        assertEquals(2.0, p.quantity("BTCUSDT"));
    }

    @Test
    void partialClose_shouldRealizeAtAverageCost() {
        PortfolioState p = new PortfolioState(100_000);
        p.applyFill(fill("RT-a", 1, OrderSide.BUY, 1, 100, 0, 0));
        p.applyFill(fill("RT-b", 1, OrderSide.BUY, 1, 200, 0, 1));   // avg = 150

        p.applyFill(fill("RT-c", 1, OrderSide.SELL, 1, 180, 0, 2));

        Position pos = p.position("BTCUSDT");
        assertEquals(30.0, pos.realizedPnl(), 1e-9, "(180 - 150) * 1");
        assertEquals(150.0, pos.avgEntryPrice(), 1e-9);
        assertEquals(1.0, pos.quantity(), 1e-12);
        assertTrue(p.roundTrips().isEmpty(), "позиция ещё открыта");
    }

    @Test
    void fullClose_shouldRecordRoundTripNetOfFees() {
        PortfolioState p = new PortfolioState(100_000);
        p.applyFill(fill("RT-a", 1, OrderSide.BUY, 2, 100, 1, 0));
        p.applyFill(fill("RT-b", 1, OrderSide.SELL, 2, 110, 1, 5));

        assertEquals(1, p.roundTrips().size());
        RoundTripTrade t = p.roundTrips().get(0);
        assertEquals(Direction.LONG, t.side());
        assertEquals(100.0, t.entryPrice(), 1e-12, "вход по фактической цене исполнения");
        assertEquals(110.0, t.exitPrice(), 1e-12);
        assertEquals(2.0, t.fees(), 1e-12);
        assertEquals(18.0, t.pnl(), 1e-9);
        assertTrue(t.isWin());
        assertEquals(100_018.0, p.equity(), 1e-9);
        assertTrue(p.position("BTCUSDT").isFlat());
    }

    @Test
    void flip_shouldCloseTripAndOpenOppositeAtFillPrice() {
        PortfolioState p = new PortfolioState(100_000);
        p.applyFill(fill("RT-a", 1, OrderSide.BUY, 1, 100, 0, 0));
        p.applyFill(fill("RT-b", 1, OrderSide.SELL, 3, 90, 0, 1));

        assertEquals(-2.0, p.quantity("BTCUSDT"), 1e-12);
        assertEquals(1, p.roundTrips().size());
        assertEquals(-10.0, p.roundTrips().get(0).pnl(), 1e-9);
        assertEquals(90.0, p.position("BTCUSDT").avgEntryPrice(), 1e-12);
        assertEquals(Direction.SHORT, p.position("BTCUSDT").side());
    }

    @Test
    void snapshot_shouldReflectPriceMovesOnUnchangedPosition() {
        PortfolioState p = new PortfolioState(10_000);
        p.applyFill(fill("RT-a", 1, OrderSide.BUY, 10, 500, 0, 0));

        p.markPrice("BTCUSDT", 500);
        PortfolioSnapshot s1 = p.snapshot(T0);
        p.markPrice("BTCUSDT", 450);
        PortfolioSnapshot s2 = p.snapshot(T0.plusSeconds(3600));

        assertEquals(10_000.0, s1.equity(), 1e-9);
        assertEquals(9_500.0, s2.equity(), 1e-9);
        assertEquals(0.05, s2.drawdownPct(), 1e-12);
        assertEquals(-500.0, s2.unrealizedPnl(), 1e-9);
        assertEquals(s2, p.latestSnapshot());
        assertEquals(2, p.history().size());
    }

    @Test
    void restore_shouldKeepHistoricalPeak() {
        PortfolioState p = new PortfolioState(100_000);
        Position btc = new Position("BTCUSDT", Direction.LONG, 1.0, 40_000, 45_000, 5_000, 0.0);

        p.restore(50_000, java.util.List.of(btc), 120_000);

        assertEquals(95_000.0, p.equity(), 1e-9);
        assertEquals(120_000.0, p.peakEquity(), 1e-9);
        assertEquals(0.2083, p.snapshot(T0).drawdownPct(), 1e-4);
    }

    @Test
    void retainLimit_shouldKeepOnlyLatestHistory() {
        PortfolioState p = new PortfolioState(10_000, 3);
        for (int i = 0; i < 5; i++) {
            // купить и закрыть: один round trip
            p.applyFill(fill("RT-" + i, 1, OrderSide.BUY, 1, 100, 0, i));
            p.applyFill(fill("RT-" + i, 2, OrderSide.SELL, 1, 100, 0, i));
            p.snapshot(T0.plusSeconds(i * 3600L));
        }

        assertEquals(3, p.history().size());
        assertEquals(T0.plusSeconds(4 * 3600L), p.history().get(2).timestamp());
        assertEquals(3, p.appliedFills().size());
        assertEquals(3, p.roundTrips().size());
        assertEquals(10_000.0, p.equity(), 1e-9, "обрезка истории не трогает капитал");
    }

    @Test
    void defaultConstructor_shouldKeepFullHistory() {
        PortfolioState p = new PortfolioState(10_000);
        for (int i = 0; i < 50; i++) {
            p.snapshot(T0.plusSeconds(i * 3600L));
        }

        assertEquals(50, p.history().size());
    }
}
