package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Подъём live-портфеля из хранилища.
 * Пик = исторический максимум капитала, либо (после ручного reset) максимум из
 * капитала на момент reset и всех снимков после него.
 */
@Slf4j
@UtilityClass
public class PortfolioBootstrap {

    /** Сколько снимков, fill'ов и round trip'ов держит live-портфель в памяти; полная история в хранилище */
    static final int LIVE_RETAIN_LIMIT = 10_000;

    public PortfolioState restore(double initialEquity, PersistenceStore store) {
        PortfolioState portfolio = new PortfolioState(initialEquity, LIVE_RETAIN_LIMIT);
        double peak = historicalPeak(store, initialEquity);

        Optional<PortfolioSnapshot> last = store.latestSnapshot();
        if (last.isPresent()) {
            portfolio.restore(last.get().cash(), store.positions(), peak);
        } else {
            portfolio.seedPeak(peak);
            log.info("🆕 Portfolio: пустое хранилище, старт с капиталом {}", initialEquity);
        }
        return portfolio;
    }

    double historicalPeak(PersistenceStore store, double fallback) {
        Optional<KillSwitchStatus> ks = store.loadKillSwitch();
        if (ks.isPresent() && ks.get().resetAt() != null && ks.get().resetEquity() != null) {
            double since = store.maxEquitySince(ks.get().resetAt()).orElse(Double.NEGATIVE_INFINITY);
            return Math.max(ks.get().resetEquity(), since);
        }
        return store.maxEquity().orElse(fallback);
    }
}
