package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.market.MarketDataProvider;
import com.chicu.regimetrader.provider.ModelPredictor;
import com.chicu.regimetrader.provider.SentimentProvider;
import com.chicu.regimetrader.validation.MonteCarloResult;
import com.chicu.regimetrader.validation.MonteCarloRobustness;
import com.chicu.regimetrader.validation.PerturbationReport;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Запуск бэктестов на истории из {@link MarketDataProvider}.
 * Стратегия и бенчмарк идут параллельно, у каждого прогона своё состояние.
 */
@Slf4j
@Service
public class BacktestService {

    private final RegimeTraderProperties properties;
    private final MarketDataProvider marketData;
    private final ModelPredictor predictor;
    private final SentimentProvider sentiment;

    private final ExecutorService executor = Executors.newFixedThreadPool(2, r -> {
        Thread t = new Thread(r, "backtest-run");
        t.setDaemon(true);
        return t;
    });

    public BacktestService(RegimeTraderProperties properties,
                           MarketDataProvider marketData,
                           ModelPredictor predictor,
                           SentimentProvider sentiment) {
        this.properties = properties;
        this.marketData = marketData;
        this.predictor = predictor;
        this.sentiment = sentiment;
    }

    public BacktestComparison runLatest(String symbol) {
        List<Bar> bars = marketData.recentBars(symbol, properties.getBacktest().getHistoryWindow());
        return run(symbol, bars);
    }

    public BacktestComparison run(String symbol, List<Bar> bars) {
        BacktestEngine engine = new BacktestEngine(BacktestConfig.from(properties));
        log.info("🚀 Backtest {}: bars={}", symbol, bars.size());

        CompletableFuture<BacktestResult> strategy = CompletableFuture.supplyAsync(
                () -> engine.run(symbol, bars, PipelineBacktestStrategy.create(properties, predictor, sentiment)), executor);
        CompletableFuture<BacktestResult> benchmark = CompletableFuture.supplyAsync(
                () -> engine.run(symbol, bars, new BuyAndHoldStrategy(properties.getRisk().getMaxPositionPct())), executor);

        BacktestResult main = strategy.join();
        MonteCarloResult mc = monteCarlo(main);
        return new BacktestComparison(main, benchmark.join(), mc);
    }

    /** Бутстреп доходностей прогона; null, если доходностей нет. */
    public MonteCarloResult monteCarlo(BacktestResult result) {
        double[] returns = result.returns();
        if (returns.length == 0) {
            return null;
        }
        RegimeTraderProperties.MonteCarlo mc = properties.getMonteCarlo();
        return new MonteCarloRobustness(properties.getUniverse().getBarsPerYear())
                .bootstrap(returns, mc.getSimulations(), mc.getBlockSize(), mc.getSeed());
    }

    /** Чувствительность стратегии к ±perturbationPct по настраиваемым параметрам. */
    public PerturbationReport perturbation(String symbol, List<Bar> bars) {
        BacktestConfig base = BacktestConfig.from(properties);
        RegimeTraderProperties.MonteCarlo mc = properties.getMonteCarlo();
        return new MonteCarloRobustness(properties.getUniverse().getBarsPerYear()).perturbationTest(
                PipelineBacktestStrategy.baseParameters(properties),
                mc.getPerturbationPct(),
                mc.getPerturbationRuns(),
                mc.getSeed(),
                params -> new BacktestEngine(PipelineBacktestStrategy.configFor(base, params)).run(symbol, bars,
                        PipelineBacktestStrategy.create(properties, predictor, sentiment, params)).metrics());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
