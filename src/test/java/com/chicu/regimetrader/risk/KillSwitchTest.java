package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.common.exception.KillSwitchTrippedException;
import com.chicu.regimetrader.persistence.InMemoryPersistenceStore;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KillSwitchTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private static PortfolioSnapshot snapshot(int bar, double equity, double peak) {
        double dd = (peak - equity) / peak;
        return new PortfolioSnapshot(T0.plusSeconds(bar * 14_400L), equity, equity, 0.0, 0.0, 0.0, Math.max(0.0, dd));
    }

    @Test
    void drawdownAtLimit_shouldTrip_andStayTrippedOnRecovery() {
        KillSwitch ks = new KillSwitch(0.15, new InMemoryPersistenceStore());

        assertFalse(ks.evaluate(snapshot(0, 100_000, 100_000)));
        assertTrue(ks.evaluate(snapshot(1, 84_000, 100_000)), "просадка 0.16 ≥ 0.15 должна сработать");
        assertTrue(ks.isTripped());

        assertFalse(ks.evaluate(snapshot(2, 90_000, 100_000)));
        for (int i = 3; i < 50; i++) {
            ks.evaluate(snapshot(i, 100_000 + i * 1_000, 100_000 + i * 1_000));
        }
        assertTrue(ks.isTripped(), "снимки с прибылью не должны снимать kill switch");
        assertEquals(0.16, ks.status().drawdownAtTrip(), 1e-12);
        assertEquals(100_000.0, ks.status().peakEquityAtTrip(), 1e-6);
    }

    @Test
    void trippedState_shouldSurviveRestart() {
        InMemoryPersistenceStore store = new InMemoryPersistenceStore();
        new KillSwitch(0.15, store).evaluate(snapshot(1, 80_000, 100_000));

        KillSwitch restarted = new KillSwitch(0.15, store);

        assertTrue(restarted.isTripped());
        assertThrows(KillSwitchTrippedException.class, restarted::requireArmed);
    }

    @Test
    void reset_shouldRequireOperator_andPersistArmedState() {
        InMemoryPersistenceStore store = new InMemoryPersistenceStore();
        KillSwitch ks = new KillSwitch(0.15, store);
        ks.evaluate(snapshot(1, 80_000, 100_000));

        assertThrows(IllegalArgumentException.class, () -> ks.reset(" ", "note", 80_000, T0));
        assertTrue(ks.reset("alice", "checked positions", 80_000, T0.plusSeconds(60)));

        assertFalse(ks.isTripped());
        KillSwitchStatus persisted = store.loadKillSwitch().orElseThrow();
        assertEquals(KillSwitchState.ARMED, persisted.state());
        assertEquals("alice", persisted.resetBy());
        assertEquals(80_000.0, persisted.resetEquity());
        assertFalse(ks.reset("alice", "again", 80_000, T0), "повторный reset ничего не делает");
    }

    @Test
    void trip_shouldBeWrittenBeforeStateChange_andStayTrippedIfWriteFails() {
        PersistenceStore store = mock(PersistenceStore.class);
        when(store.loadKillSwitch()).thenReturn(java.util.Optional.empty());
        doThrow(new IllegalStateException("db down")).when(store).saveKillSwitch(any());
        KillSwitch ks = new KillSwitch(0.15, store);

        assertThrows(IllegalStateException.class, () -> ks.evaluate(snapshot(1, 80_000, 100_000)));

        assertTrue(ks.isTripped(), "при ошибке записи торговля всё равно остановлена");
        verify(store).saveKillSwitch(argThat(KillSwitchStatus::isTripped));
    }
}
