package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.Regime;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.order.OrderBook;
import com.chicu.regimetrader.order.OrderManager;
import com.chicu.regimetrader.persistence.InMemoryPersistenceStore;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.portfolio.Position;
import com.chicu.regimetrader.provider.UnavailableExecutionAdapter;
import com.chicu.regimetrader.risk.KillSwitch;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import com.chicu.regimetrader.risk.LiveSlippageEstimator;
import com.chicu.regimetrader.risk.RiskChecker;
import com.chicu.regimetrader.risk.SizedOrderIntent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioBootstrapTest {

    private static final Instant T0 = Instant.parse("2024-04-01T00:00:00Z");

    private static PortfolioSnapshot snapshot(int hour, double equity, double cash) {
        return new PortfolioSnapshot(T0.plusSeconds(hour * 3600L), equity, cash, equity - cash, 0, 0, 0);
    }

    @Test
    void restore_shouldStartFresh_whenStoreIsEmpty() {
        PortfolioState p = PortfolioBootstrap.restore(50_000, new InMemoryPersistenceStore());

        assertEquals(50_000.0, p.equity(), 1e-9);
        assertEquals(50_000.0, p.peakEquity(), 1e-9);
    }

    @Test
    void restore_shouldUseHistoricalPeakAndLastCash() {
        InMemoryPersistenceStore store = new InMemoryPersistenceStore();
        store.appendSnapshot(snapshot(0, 100_000, 100_000));
        store.appendSnapshot(snapshot(4, 120_000, 60_000));
        store.appendSnapshot(snapshot(8, 95_000, 50_000));
        store.upsertPosition(new Position("BTCUSDT", Direction.LONG, 1.0, 40_000, 45_000, 5_000, 0.0));

        PortfolioState p = PortfolioBootstrap.restore(100_000, store);

        assertEquals(50_000.0, p.cash(), 1e-9);
        assertEquals(95_000.0, p.equity(), 1e-9);
        assertEquals(120_000.0, p.peakEquity(), 1e-9, "пик не сбрасывается при рестарте");
    }

    @Test
    void historicalPeak_shouldStartFromResetEquity_afterManualReset() {
        InMemoryPersistenceStore store = new InMemoryPersistenceStore();
        store.appendSnapshot(snapshot(0, 120_000, 120_000));
        store.appendSnapshot(snapshot(8, 90_000, 90_000));
        store.saveKillSwitch(KillSwitchStatus.armed().toBuilder()
                .resetAt(T0.plusSeconds(10 * 3600L))
                .resetBy("ops")
                .resetEquity(90_000.0)
                .build());
        store.appendSnapshot(snapshot(12, 93_000, 93_000));

        assertEquals(93_000.0, PortfolioBootstrap.historicalPeak(store, 100_000), 1e-9);
    }

    @Test
    void restore_shouldMatchLiveEquity_afterPaperFillWithinTick() {
        InMemoryPersistenceStore store = new InMemoryPersistenceStore();
        PortfolioState live = new PortfolioState(100_000);
        live.markPrice("BTCUSDT", 50_000);
        store.appendSnapshot(live.snapshot(T0));

        RegimeTraderProperties.Execution execution = new RegimeTraderProperties.Execution();
        execution.setMode("PAPER");
        OrderManager manager = new OrderManager(execution, "test", new OrderBook(), live,
                new RiskChecker(new KillSwitch(0.15, store), 10, 0.5, 0.5, Duration.ofHours(5)),
                store, new UnavailableExecutionAdapter(), new LiveSlippageEstimator(50),
                Clock.fixed(T0, ZoneOffset.UTC));
        manager.place(SizedOrderIntent.builder()
                .symbol("BTCUSDT")
                .side(OrderSide.BUY)
                .quantity(1.0)
                .notionalPctOfEquity(0.5)
                .signalStrength(0.5)
                .signalRegime(Regime.TRENDING)
                .referencePrice(50_000)
                .build()).orElseThrow();

        PortfolioState restored = PortfolioBootstrap.restore(100_000, store);

        assertTrue(live.cash() < 50_000.0, "покупка списала кэш");
        assertEquals(live.cash(), restored.cash(), 1e-6);
        assertEquals(live.equity(), restored.equity(), 1e-6, "рестарт не создаёт капитал");
        assertEquals(1.0, restored.position("BTCUSDT").quantity(), 1e-12);
    }
}
