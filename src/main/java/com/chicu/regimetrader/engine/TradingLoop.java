package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.common.exception.IdempotencyViolationException;
import com.chicu.regimetrader.common.exception.InsufficientDataException;
import com.chicu.regimetrader.common.exception.KillSwitchTrippedException;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.market.MarketDataProvider;
import com.chicu.regimetrader.order.OrderBook;
import com.chicu.regimetrader.order.OrderManager;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.portfolio.Position;
import com.chicu.regimetrader.provider.FeatureProvider;
import com.chicu.regimetrader.provider.MarketFeatures;
import com.chicu.regimetrader.regime.FeatureVector;
import com.chicu.regimetrader.regime.RegimeService;
import com.chicu.regimetrader.regime.RegimeState;
import com.chicu.regimetrader.risk.KillSwitch;
import com.chicu.regimetrader.risk.RiskChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live/paper цикл решений: один вызов {@link #tick()} на тик планировщика.
 *
 * <ol>
 *     <li>обновить цены, снять снимок портфеля, проверить kill switch;</li>
 *     <li>если TRIPPED, весь тик подавлен (все символы);</li>
 *     <li>по каждому символу: режим → пайплайн → ордер.</li>
 * </ol>
 * Тик не реентерабелен; символ с ордером в полёте пропускается.
 * Пробелы в данных пропускают символ, а не роняют цикл.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingLoop {

    private final RegimeTraderProperties properties;
    private final MarketDataProvider marketData;
    private final FeatureProvider featureProvider;
    private final FeatureHistoryLoader historyLoader;
    private final RegimeService regimeService;
    private final DecisionPipeline pipeline;
    private final OrderManager orderManager;
    private final OrderBook orderBook;
    private final PortfolioState portfolio;
    private final KillSwitch killSwitch;
    private final RiskChecker riskChecker;
    private final PersistenceStore store;
    private final CoreStatusService status;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public void tick() {
        if (!running.compareAndSet(false, true)) {
            log.warn("⏭ Decision tick skipped: previous tick still running");
            return;
        }
        try {
            runTick();
        } finally {
            running.set(false);
        }
    }

    private void runTick() {
        Instant now = Instant.now(clock);

        // ===== MARK + SNAPSHOT =====
        Map<String, Bar> lastBars = new LinkedHashMap<>();
        for (String symbol : properties.getUniverse().getSymbols()) {
            List<Bar> bars = marketData.recentBars(symbol, 1);
            if (bars.isEmpty()) {
                log.warn("⚠️ {}: нет баров, символ пропущен", symbol);
                continue;
            }
            Bar bar = bars.get(bars.size() - 1);
            portfolio.markPrice(symbol, bar.close());
            lastBars.put(symbol, bar);
        }

        PortfolioSnapshot snapshot = portfolio.snapshot(now);
        store.appendSnapshot(snapshot);
        for (Position p : portfolio.positions()) {
            store.upsertPosition(p);
        }
        killSwitch.evaluate(snapshot);
        status.recordTick(now);

        try {
            killSwitch.requireArmed();
        } catch (KillSwitchTrippedException e) {
            log.error("🛑 Tick suppressed for ALL symbols: {}", e.getMessage());
            status.recordSuppressedTick(now);
            return;
        }

        // ===== DECISIONS =====
        lastBars.forEach((symbol, bar) -> {
            try {
                processSymbol(symbol, bar, now);
            } catch (InsufficientDataException e) {
                log.warn("⚠️ {}: цикл пропущен, режим/сигнал прежние: {}", symbol, e.getMessage());
            } catch (IdempotencyViolationException e) {
                log.error("💥 {}: нарушение идемпотентности: {}", symbol, e.getMessage(), e);
                status.recordInvariantFailure(e.getMessage());
            } catch (RuntimeException e) {
                log.error("❌ {}: ошибка тика: {}", symbol, e.getMessage(), e);
            }
        });
    }

    private void processSymbol(String symbol, Bar bar, Instant now) {
        if (orderBook.isInFlight(symbol)) {
            log.info("⏸ {}: ордер ещё в полёте, решение не принимаем", symbol);
            return;
        }

        Optional<MarketFeatures> features = featureProvider.getFeatures(symbol, bar.timestamp());
        if (features.isEmpty() || !features.get().hasRegimeInputs()) {
            log.warn("⚠️ {}: нет признаков на {}, символ пропущен", symbol, bar.timestamp());
            return;
        }

        if (!regimeService.detector(symbol).isFitted()) {
            regimeService.refit(symbol, historyLoader.load(symbol, properties.getRegime().getTrainingBars()));
        }
        List<FeatureVector> window = historyLoader.load(symbol, properties.getRegime().getClassifyWindow());
        RegimeState regime = regimeService.classify(symbol, bar.timestamp(), window);

        Decision decision = pipeline.propose(
                symbol, bar.timestamp(), bar.close(), features.get(), regime, portfolio);
        if (decision.hasOrder()) {
            // бар помечен временем открытия, возраст данных считаем от его закрытия
            Instant closedAt = bar.timestamp().plus(properties.getUniverse().timeframeDuration());
            decision = decision.withRisk(riskChecker.preTrade(decision.order(), portfolio, closedAt, now));
        }
        status.recordDecision(decision);

        log.info("📊 {} regime={}({}) strength={} dir={}", symbol,
                regime.regime(), String.format("%.2f", regime.confidence()),
                String.format("%.4f", decision.signal().strength()), decision.signal().direction());

        if (!decision.hasOrder()) {
            return;
        }
        if (decision.risk().rejected()) {
            log.info("🚫 {} order rejected: {} ({})", symbol, decision.risk().reason(), decision.risk().detail());
            return;
        }
        orderManager.place(decision.order());
    }
}
