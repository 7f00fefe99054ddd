package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.order.Order;
import com.chicu.regimetrader.order.OrderIds;
import com.chicu.regimetrader.persistence.InMemoryPersistenceStore;
import com.chicu.regimetrader.portfolio.Fill;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.portfolio.RoundTripTrade;
import com.chicu.regimetrader.risk.KillSwitch;
import com.chicu.regimetrader.risk.RiskChecker;
import com.chicu.regimetrader.risk.RiskDecision;
import com.chicu.regimetrader.risk.SizedOrderIntent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Событийный бэктест по одному символу.
 *
 * <p>Все события идут через одну очередь с приоритетом (бар, тип, порядок постановки),
 * поэтому внутри бара всегда BAR_CLOSE → SIGNAL → ORDER → FILL.
 * Ордер, принятый на баре N, впервые исполняется на баре N + fillLatencyBars.
 * На конец каждого бара пишется снимок портфеля и проверяется kill switch.</p>
 *
 * <p>Движок без состояния: портфель, хранилище, kill switch и риск создаются на каждый прогон,
 * поэтому прогоны можно запускать параллельно.</p>
 */
@Slf4j
public class BacktestEngine {

    private static final String EXCHANGE = "BACKTEST";

    private final BacktestConfig config;

    public BacktestEngine(BacktestConfig config) {
        this.config = config;
    }

    public BacktestConfig config() {
        return config;
    }

    public BacktestResult run(String symbol, List<Bar> bars, BacktestStrategy strategy) {
        return run(symbol, bars, HistoricalFeatureProvider.fromBars(symbol, bars, config.volWindow(), config.barsPerYear()), strategy);
    }

    public BacktestResult run(String symbol, List<Bar> bars, HistoricalFeatureProvider features, BacktestStrategy strategy) {
        if (bars == null || bars.size() < 2) {
            log.warn("⚠️ Backtest {} {}: недостаточно баров", strategy.name(), symbol);
            return new BacktestResult(BacktestMetrics.fail("Not enough bars for backtest"),
                    List.of(), List.of(), List.of(), List.of(), List.of(), null);
        }
        if (features.size() != bars.size()) {
            throw new IllegalArgumentException("features must be aligned with bars");
        }

        Run run = new Run(symbol, bars, features, strategy);
        run.execute();
        BacktestResult result = run.result();

        BacktestMetrics m = result.metrics();
        log.info("📊 Backtest {} {}: bars={} return={} sharpe={} maxDD={} trades={}",
                strategy.name(), symbol, m.bars(),
                String.format("%.4f", m.totalReturn()),
                String.format("%.3f", m.sharpe()),
                String.format("%.4f", m.maxDrawdown()),
                m.totalTrades());
        return result;
    }

    /** Состояние одного прогона. */
    private final class Run {

        private final String symbol;
        private final List<Bar> bars;
        private final HistoricalFeatureProvider features;
        private final BacktestStrategy strategy;

        private final InMemoryPersistenceStore store = new InMemoryPersistenceStore();
        private final PortfolioState portfolio = new PortfolioState(config.initialCapital());
        private final KillSwitch killSwitch = new KillSwitch(config.maxDrawdownPct(), store);
        // данные в бэктесте всегда на время бара
        private final RiskChecker risk = new RiskChecker(
                killSwitch, config.minTradeUsd(), config.maxPositionPct(), config.maxConcentrationPct(), Duration.ZERO);
        private final FillSimulator simulator = FillSimulator.from(config);

        private final PriorityQueue<BacktestEvent> queue = new PriorityQueue<>();
        private final List<BacktestEvent> processed = new ArrayList<>();
        private final Map<String, Order> orders = new LinkedHashMap<>();
        private final Map<String, Integer> submittedAt = new LinkedHashMap<>();
        private final Map<String, Integer> rejections = new LinkedHashMap<>();
        private final double[] adv;

        private Order open;
        private long seq;

        Run(String symbol, List<Bar> bars, HistoricalFeatureProvider features, BacktestStrategy strategy) {
            this.symbol = symbol;
            this.bars = bars;
            this.features = features;
            this.strategy = strategy;
            this.adv = rollingDollarVolume(bars, config.advWindow());
        }

        void execute() {
            for (int i = 0; i < bars.size(); i++) {
                queue.add(BacktestEvent.barClose(i, seq++));
                while (!queue.isEmpty() && queue.peek().barIndex() == i) {
                    BacktestEvent event = queue.poll();
                    processed.add(event);
                    dispatch(event);
                }
                endOfBar(i);
            }
            // хвост: всё, что осталось открытым после последнего бара, отменяется
            if (open != null) {
                open.cancel(bars.get(bars.size() - 1).timestamp());
                store.saveOrder(open);
                open = null;
            }
        }

        private void dispatch(BacktestEvent event) {
            switch (event.type()) {
                case BAR_CLOSE -> onBarClose(event.barIndex());
                case SIGNAL -> onSignal(event.barIndex());
                case ORDER -> onOrder(event.barIndex(), event.intent());
                case FILL -> onFill(event.barIndex(), event.orderId());
            }
        }

        // ===== BAR_CLOSE =====

        private void onBarClose(int i) {
            portfolio.markPrice(symbol, bars.get(i).close());
            queue.add(BacktestEvent.signal(i, seq++));
        }

        // ===== SIGNAL =====

        private void onSignal(int i) {
            BarContext ctx = new BarContext(
                    symbol, i, bars.get(i), features.at(i),
                    bars.subList(0, i + 1), features.upTo(i), portfolio);

            strategy.onBar(ctx)
                    .filter(intent -> !intent.isEmpty())
                    .ifPresent(intent -> {
                        if (open != null) {
                            log.debug("[Backtest] {} bar={} ордер {} ещё открыт, сигнал пропущен", symbol, i, open.getId());
                            return;
                        }
                        queue.add(BacktestEvent.order(i, seq++, intent));
                    });
        }

        // ===== ORDER =====

        private void onOrder(int i, SizedOrderIntent intent) {
            Bar bar = bars.get(i);
            RiskDecision decision = risk.preTrade(intent, portfolio, bar.timestamp(), bar.timestamp());
            if (!decision.approved()) {
                rejections.merge(decision.reason().name(), 1, Integer::sum);
                log.debug("[Backtest] {} bar={} отказ риска: {} {}", symbol, i, decision.reason(), decision.detail());
                return;
            }

            OrderType type = config.orderType();
            Order order = Order.builder()
                    .id(OrderIds.newOrderId())
                    .symbol(symbol)
                    .exchange(EXCHANGE)
                    .side(intent.side())
                    .type(type)
                    .quantity(intent.quantity())
                    .limitPrice(type == OrderType.LIMIT ? intent.referencePrice() : null)
                    .expectedPrice(intent.referencePrice())
                    .createdAt(bar.timestamp())
                    .build();
            order.submit(order.getId(), bar.timestamp());

            orders.put(order.getId(), order);
            submittedAt.put(order.getId(), i);
            store.saveOrder(order);
            open = order;

            int fillBar = i + config.fillLatencyBars();
            if (fillBar < bars.size()) {
                queue.add(BacktestEvent.fill(fillBar, seq++, order.getId()));
            }
        }

        // ===== FILL =====

        private void onFill(int i, String orderId) {
            Order order = orders.get(orderId);
            if (order == null || !order.isOpen()) {
                return;
            }
            Bar bar = bars.get(i);

            simulator.simulate(order, bar, adv[i]).ifPresent(sim -> {
                Fill fill = order.recordFill(sim.quantity(), sim.price(), sim.fees(), bar.timestamp());
                portfolio.applyFill(fill);
                store.appendFill(fill);
                store.upsertPosition(portfolio.position(symbol));
                risk.postTrade(symbol, portfolio);
            });

            if (order.isOpen()) {
                if (i - submittedAt.get(orderId) >= config.cancelAfterBars()) {
                    order.cancel(bar.timestamp());
                    log.debug("[Backtest] {} bar={} ордер {} отменён, остаток {}", symbol, i, orderId, order.remainingQty());
                } else if (i + 1 < bars.size()) {
                    queue.add(BacktestEvent.fill(i + 1, seq++, orderId));
                }
            }
            store.saveOrder(order);
            if (!order.isOpen()) {
                open = null;
            }
        }

        // ===== конец бара =====

        private void endOfBar(int i) {
            PortfolioSnapshot snapshot = portfolio.snapshot(bars.get(i).timestamp());
            store.appendSnapshot(snapshot);
            if (killSwitch.evaluate(snapshot)) {
                log.warn("🛑 Backtest {} {}: kill switch на баре {} (dd={})",
                        strategy.name(), symbol, i, String.format("%.4f", snapshot.drawdownPct()));
            }
        }

        BacktestResult result() {
            List<PortfolioSnapshot> curve = store.snapshots();
            double[] equity = curve.stream().mapToDouble(PortfolioSnapshot::equity).toArray();
            double[] returns = PerformanceMetrics.returns(equity);
            List<RoundTripTrade> trades = portfolio.roundTrips();

            double totalReturn = PerformanceMetrics.totalReturn(equity);
            double annualized = PerformanceMetrics.annualizedReturn(totalReturn, equity.length, config.barsPerYear());
            double maxDd = PerformanceMetrics.maxDrawdown(equity);
            int wins = (int) trades.stream().filter(RoundTripTrade::isWin).count();

            BacktestMetrics metrics = BacktestMetrics.builder()
                    .ok(true)
                    .reason("OK")
                    .strategy(strategy.name())
                    .symbol(symbol)
                    .startAt(bars.get(0).timestamp())
                    .endAt(bars.get(bars.size() - 1).timestamp())
                    .bars(bars.size())
                    .totalReturn(totalReturn)
                    .annualizedReturn(annualized)
                    .sharpe(PerformanceMetrics.sharpe(returns, config.barsPerYear()))
                    .sortino(PerformanceMetrics.sortino(returns, config.barsPerYear()))
                    .calmar(PerformanceMetrics.calmar(annualized, maxDd))
                    .maxDrawdown(maxDd)
                    .maxDrawdownDurationBars(PerformanceMetrics.maxDrawdownDuration(equity))
                    .totalTrades(trades.size())
                    .wins(wins)
                    .losses(trades.size() - wins)
                    .hitRate(PerformanceMetrics.hitRate(trades))
                    .profitFactor(PerformanceMetrics.profitFactor(trades))
                    .annualTurnover(PerformanceMetrics.annualTurnover(portfolio.tradedNotional(), equity, config.barsPerYear()))
                    .totalFees(portfolio.totalFees())
                    .rejections(Map.copyOf(rejections))
                    .build();

            return new BacktestResult(metrics, curve, trades, store.fills(),
                    List.copyOf(orders.values()), List.copyOf(processed), killSwitch.status());
        }
    }

    static double[] rollingDollarVolume(List<Bar> bars, int window) {
        double[] out = new double[bars.size()];
        double sum = 0.0;
        for (int i = 0; i < bars.size(); i++) {
            sum += bars.get(i).dollarVolume();
            if (i >= window) {
                sum -= bars.get(i - window).dollarVolume();
            }
            out[i] = sum / Math.min(i + 1, window);
        }
        return out;
    }
}
