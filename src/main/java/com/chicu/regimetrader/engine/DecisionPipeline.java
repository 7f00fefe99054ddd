package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.common.enums.SignalSource;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.provider.CollaboratorCalls;
import com.chicu.regimetrader.provider.MarketFeatures;
import com.chicu.regimetrader.provider.ModelPredictor;
import com.chicu.regimetrader.provider.Prediction;
import com.chicu.regimetrader.provider.SentimentProvider;
import com.chicu.regimetrader.regime.RegimeState;
import com.chicu.regimetrader.risk.PositionSizer;
import com.chicu.regimetrader.risk.SizedOrderIntent;
import com.chicu.regimetrader.signal.ComponentSignal;
import com.chicu.regimetrader.signal.ConfidenceMapper;
import com.chicu.regimetrader.signal.FusedSignal;
import com.chicu.regimetrader.signal.SignalFusion;
import com.chicu.regimetrader.signal.TechnicalScorer;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Один и тот же путь решения для live/paper и бэктеста:
 * компоненты → fusion → сайзинг → дельта к позиции.
 *
 * <p>Классификация режима делается вызывающим (у live и бэктеста разная политика refit),
 * pre-trade риск тоже: в бэктесте это отдельное событие ORDER, в live следующий шаг тика.</p>
 */
@Slf4j
public class DecisionPipeline {

    private final SignalFusion fusion;
    private final ConfidenceMapper confidenceMapper;
    private final PositionSizer sizer;
    private final ModelPredictor predictor;
    private final SentimentProvider sentiment;
    /** null = звать коллабораторов напрямую (бэктест, детерминированно). */
    private final CollaboratorCalls calls;

    public DecisionPipeline(SignalFusion fusion,
                            ConfidenceMapper confidenceMapper,
                            PositionSizer sizer,
                            ModelPredictor predictor,
                            SentimentProvider sentiment,
                            CollaboratorCalls calls) {
        this.fusion = fusion;
        this.confidenceMapper = confidenceMapper;
        this.sizer = sizer;
        this.predictor = predictor;
        this.sentiment = sentiment;
        this.calls = calls;
    }

    /**
     * Сигнал и предлагаемый ордер, без риск-проверки ({@link Decision#risk()} == null).
     *
     * @param dataTimestamp время бара, на котором построены признаки
     */
    public Decision propose(String symbol,
                            Instant dataTimestamp,
                            double price,
                            MarketFeatures features,
                            RegimeState regime,
                            PortfolioState portfolio) {

        List<ComponentSignal> components = new ArrayList<>(3);

        OptionalDouble technical = TechnicalScorer.score(features);
        technical.ifPresent(s -> components.add(ComponentSignal.clamped(SignalSource.TECHNICAL, s, dataTimestamp)));

        Optional<Prediction> prediction = call("ModelPredictor", () -> predictor.predict(symbol, features));
        prediction.ifPresent(p -> components.add(
                ComponentSignal.clamped(SignalSource.ML, p.directionalScore(), dataTimestamp)));
        double confidence = confidenceMapper.confidenceFor(prediction.orElse(null));

        Optional<OptionalDouble> sent = call("SentimentProvider", () -> sentiment.getScore(symbol));
        sent.filter(OptionalDouble::isPresent)
                .map(OptionalDouble::getAsDouble)
                .filter(Double::isFinite)
                .ifPresent(s -> components.add(ComponentSignal.clamped(SignalSource.SENTIMENT, s, dataTimestamp)));

        FusedSignal signal = fusion.fuse(symbol, regime.regime(), components, confidence, dataTimestamp);

        double equity = portfolio.equity();
        SizedOrderIntent target = sizer.size(signal, features.realizedVol(), equity, price);
        Optional<SizedOrderIntent> order = sizer.rebalance(target, signal.direction(), portfolio.quantity(symbol));

        if (log.isDebugEnabled()) {
            log.debug("[Pipeline] {} regime={} strength={} dir={} conf={} order={}",
                    symbol, regime.regime(), signal.strength(), signal.direction(), confidence, order.orElse(null));
        }

        return new Decision(symbol, dataTimestamp, regime, signal, target, order.orElse(null), null);
    }

    private <T> Optional<T> call(String name, Supplier<T> supplier) {
        if (calls != null) {
            return calls.withTimeout(name, supplier);
        }
        try {
            return Optional.ofNullable(supplier.get());
        } catch (RuntimeException e) {
            log.warn("⚠️ {}: ошибка, источник пропущен: {}", name, e.toString());
            return Optional.empty();
        }
    }
}
