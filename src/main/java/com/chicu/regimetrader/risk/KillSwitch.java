package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.common.exception.KillSwitchTrippedException;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;

/**
 * Kill switch: ARMED → TRIPPED при drawdown ≥ maxDrawdownPct,
 * TRIPPED → ARMED только ручным {@link #reset}.
 *
 * <p>Срабатывание сначала пишется в хранилище, потом меняется состояние.
 * Если запись упала, в памяти всё равно TRIPPED, а ошибка пробрасывается.</p>
 */
@Slf4j
public class KillSwitch {

    private final double maxDrawdownPct;
    private final PersistenceStore store;

    private volatile KillSwitchStatus status;

    public KillSwitch(double maxDrawdownPct, PersistenceStore store) {
        if (!(maxDrawdownPct > 0.0 && maxDrawdownPct < 1.0)) {
            throw new IllegalArgumentException("maxDrawdownPct must be in (0,1), got " + maxDrawdownPct);
        }
        this.maxDrawdownPct = maxDrawdownPct;
        this.store = Objects.requireNonNull(store, "store");
        this.status = store.loadKillSwitch().orElseGet(KillSwitchStatus::armed);
        if (status.isTripped()) {
            log.error("🛑 Kill switch восстановлен в состоянии TRIPPED (since {}, dd={})",
                    status.trippedAt(), status.drawdownAtTrip());
        }
    }

    public double maxDrawdownPct() {
        return maxDrawdownPct;
    }

    public KillSwitchStatus status() {
        return status;
    }

    public boolean isTripped() {
        return status.isTripped();
    }

    /**
     * Проверка на каждом снимке портфеля.
     *
     * @return true, если переключился в TRIPPED именно сейчас
     */
    public synchronized boolean evaluate(PortfolioSnapshot snapshot) {
        if (status.isTripped()) {
            return false;
        }
        if (snapshot.drawdownPct() < maxDrawdownPct) {
            return false;
        }

        double peak = snapshot.drawdownPct() < 1.0
                ? snapshot.equity() / (1.0 - snapshot.drawdownPct())
                : Double.NaN;
        KillSwitchStatus tripped = status.toBuilder()
                .state(KillSwitchState.TRIPPED)
                .trippedAt(snapshot.timestamp())
                .drawdownAtTrip(snapshot.drawdownPct())
                .peakEquityAtTrip(peak)
                .equityAtTrip(snapshot.equity())
                .updatedAt(snapshot.timestamp())
                .build();

        try {
            store.saveKillSwitch(tripped);
        } finally {
            this.status = tripped;
            log.error("🛑 KILL SWITCH TRIPPED: drawdown={} ≥ {} equity={} at {}",
                    String.format("%.4f", snapshot.drawdownPct()), maxDrawdownPct,
                    String.format("%.2f", snapshot.equity()), snapshot.timestamp());
        }
        return true;
    }

    /** @throws KillSwitchTrippedException если сработал */
    public void requireArmed() {
        KillSwitchStatus s = status;
        if (s.isTripped()) {
            throw new KillSwitchTrippedException(s.trippedAt(), s.drawdownAtTrip() == null ? Double.NaN : s.drawdownAtTrip());
        }
    }

    /**
     * Ручной сброс оператором.
     *
     * @param currentEquity капитал на момент сброса, становится новым базовым пиком
     * @return false, если сбрасывать нечего (уже ARMED)
     */
    public synchronized boolean reset(String operator, String note, double currentEquity, Instant now) {
        if (!status.isTripped()) {
            return false;
        }
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator is required for kill switch reset");
        }
        KillSwitchStatus armed = status.toBuilder()
                .state(KillSwitchState.ARMED)
                .resetAt(now)
                .resetBy(operator.trim())
                .resetNote(note)
                .resetEquity(currentEquity)
                .updatedAt(now)
                .build();
        store.saveKillSwitch(armed);
        this.status = armed;
        log.warn("🔓 Kill switch RESET by '{}' (equity={}, note={})", operator, currentEquity, note);
        return true;
    }
}
