package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.common.exception.InsufficientDataException;
import com.chicu.regimetrader.common.exception.InvalidWindowException;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.provider.ModelTrainer;
import com.chicu.regimetrader.regime.FeatureVector;
import com.chicu.regimetrader.regime.RegimeService;
import com.chicu.regimetrader.validation.WalkForwardSplit;
import com.chicu.regimetrader.validation.WalkForwardSplitter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Переобучение: refit HMM по символам + walk-forward фолды во внешний тренер.
 * Одновременно не больше одного прогона; запрос во время прогона получает ALREADY_RUNNING,
 * в очередь не ставится.
 */
@Slf4j
@Service
public class RetrainService {

    private final RegimeTraderProperties properties;
    private final FeatureHistoryLoader historyLoader;
    private final RegimeService regimeService;
    private final ModelTrainer trainer;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "retrain-worker");
        t.setDaemon(true);
        return t;
    });

    public RetrainService(RegimeTraderProperties properties,
                          FeatureHistoryLoader historyLoader,
                          RegimeService regimeService,
                          ModelTrainer trainer,
                          Clock clock) {
        this.properties = properties;
        this.historyLoader = historyLoader;
        this.regimeService = regimeService;
        this.trainer = trainer;
        this.clock = clock;
    }

    public boolean isRunning() {
        return inFlight.get();
    }

    /** Асинхронный запуск (REST). */
    public RetrainResult requestRetrain(String reason) {
        if (!inFlight.compareAndSet(false, true)) {
            log.info("🧠 Retrain request ignored (already running), reason={}", reason);
            return RetrainResult.alreadyRunning(Instant.now(clock));
        }
        try {
            worker.submit(() -> {
                try {
                    runRetrain(reason);
                } catch (RuntimeException e) {
                    log.error("❌ Retrain failed: {}", e.getMessage(), e);
                } finally {
                    inFlight.set(false);
                }
            });
        } catch (RuntimeException e) {
            inFlight.set(false);
            throw e;
        }
        return RetrainResult.started(Instant.now(clock));
    }

    /** Синхронный запуск (плановая задача). */
    public RetrainResult retrainNow(String reason) {
        if (!inFlight.compareAndSet(false, true)) {
            return RetrainResult.alreadyRunning(Instant.now(clock));
        }
        try {
            return runRetrain(reason);
        } finally {
            inFlight.set(false);
        }
    }

    private RetrainResult runRetrain(String reason) {
        long started = System.currentTimeMillis();
        log.info("🧠 RETRAIN START reason={}", reason);

        RegimeTraderProperties.WalkForward wf = properties.getWalkForward();
        int refit = 0;
        int folds = 0;

        int bars = Math.max(properties.getRegime().getTrainingBars(),
                wf.getTrainBars() + wf.getPurgeBars() + wf.getTestBars());

        for (String symbol : properties.getUniverse().getSymbols()) {
            List<FeatureVector> history = historyLoader.load(symbol, bars);
            try {
                regimeService.refit(symbol, history);
                refit++;
            } catch (InsufficientDataException e) {
                log.warn("⚠️ Retrain {}: {}", symbol, e.getMessage());
                continue;
            }

            List<WalkForwardSplit> splits;
            try {
                splits = WalkForwardSplitter.generate(
                        history.size(), wf.getTrainBars(), wf.getTestBars(), wf.getPurgeBars(), wf.getEmbargoBars());
            } catch (InvalidWindowException e) {
                log.warn("⚠️ Retrain {}: walk-forward skipped: {}", symbol, e.getMessage());
                continue;
            }
            for (WalkForwardSplit split : splits) {
                double score = trainer.train(symbol, split);
                folds++;
                log.info("🧠 {} fold#{} train={} test={} score={}",
                        symbol, split.index(), split.trainRange(), split.testRange(), score);
            }
        }

        log.info("🧠 RETRAIN DONE refit={} folds={} took={}ms", refit, folds, System.currentTimeMillis() - started);
        return RetrainResult.completed(refit, folds, Instant.now(clock));
    }

    @PreDestroy
    public void shutdown() {
        worker.shutdownNow();
    }
}
