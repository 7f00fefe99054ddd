package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.common.exception.InsufficientDataException;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.engine.Decision;
import com.chicu.regimetrader.engine.DecisionPipeline;
import com.chicu.regimetrader.provider.MarketFeatures;
import com.chicu.regimetrader.provider.ModelPredictor;
import com.chicu.regimetrader.provider.SentimentProvider;
import com.chicu.regimetrader.regime.FeatureVector;
import com.chicu.regimetrader.regime.RegimeDetector;
import com.chicu.regimetrader.regime.RegimeState;
import com.chicu.regimetrader.risk.PositionSizer;
import com.chicu.regimetrader.risk.SizedOrderIntent;
import com.chicu.regimetrader.signal.ConfidenceMapper;
import com.chicu.regimetrader.signal.RegimeWeights;
import com.chicu.regimetrader.signal.SignalFusion;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Тот же {@link DecisionPipeline}, что и в live, поверх своего {@link RegimeDetector}.
 * HMM переобучается только на прошлом: первый раз при minTrainingBars валидных баров,
 * затем каждые refitEveryBars на последних trainingBars.
 */
@Slf4j
public class PipelineBacktestStrategy implements BacktestStrategy {

    public static final Set<String> TUNABLE = Set.of(
            "volTarget", "maxPositionPct", "choppyScale", "directionThreshold", "minIqr", "maxIqr");

    private final DecisionPipeline pipeline;
    private final RegimeDetector detector;
    private final RegimeTraderProperties.RegimeProps regimeProps;

    private final List<FeatureVector> vectors = new ArrayList<>();
    private final List<Decision> decisions = new ArrayList<>();
    private int lastFitAt = -1;

    public PipelineBacktestStrategy(DecisionPipeline pipeline,
                                    RegimeDetector detector,
                                    RegimeTraderProperties.RegimeProps regimeProps) {
        this.pipeline = pipeline;
        this.detector = detector;
        this.regimeProps = regimeProps;
    }

    /**
     * Сборка из properties. Коллабораторы зовутся напрямую, без таймаутов.
     */
    public static PipelineBacktestStrategy create(RegimeTraderProperties props,
                                                  ModelPredictor predictor,
                                                  SentimentProvider sentiment) {
        return create(props, predictor, sentiment, Map.of());
    }

    /**
     * То же, с подменой числовых параметров (ключи {@link #TUNABLE}).
     * Неизвестный ключ: {@link IllegalArgumentException}.
     */
    public static PipelineBacktestStrategy create(RegimeTraderProperties props,
                                                  ModelPredictor predictor,
                                                  SentimentProvider sentiment,
                                                  Map<String, Double> overrides) {
        for (String key : overrides.keySet()) {
            if (!TUNABLE.contains(key)) {
                throw new IllegalArgumentException("unknown pipeline parameter: " + key);
            }
        }
        RegimeTraderProperties.Fusion fusion = props.getFusion();
        RegimeTraderProperties.Confidence conf = props.getConfidence();
        RegimeTraderProperties.Risk risk = props.getRisk();

        DecisionPipeline pipeline = new DecisionPipeline(
                new SignalFusion(RegimeWeights.from(fusion),
                        overrides.getOrDefault("choppyScale", fusion.getChoppyScale()),
                        overrides.getOrDefault("directionThreshold", fusion.getDirectionThreshold())),
                new ConfidenceMapper(
                        overrides.getOrDefault("minIqr", conf.getMinIqr()),
                        overrides.getOrDefault("maxIqr", conf.getMaxIqr()),
                        conf.getFallback()),
                new PositionSizer(
                        overrides.getOrDefault("volTarget", risk.getVolTarget()),
                        risk.getVolFloor(),
                        Math.min(1.0, overrides.getOrDefault("maxPositionPct", risk.getMaxPositionPct())),
                        risk.isAllowShort()),
                predictor,
                sentiment,
                null
        );
        return new PipelineBacktestStrategy(pipeline, new RegimeDetector(props.getRegime()), props.getRegime());
    }

    /**
     * Конфиг прогона с лимитом позиции, который получил сайзер.
     * Для одного символа концентрация равна доле позиции, поэтому её лимит не ниже нового maxPositionPct.
     */
    public static BacktestConfig configFor(BacktestConfig base, Map<String, Double> overrides) {
        Double maxPosition = overrides.get("maxPositionPct");
        if (maxPosition == null) {
            return base;
        }
        double capped = Math.min(1.0, maxPosition);
        return base.toBuilder()
                .maxPositionPct(capped)
                .maxConcentrationPct(Math.max(base.maxConcentrationPct(), capped))
                .build();
    }

    /** Базовые значения настраиваемых параметров, для возмущения. */
    public static Map<String, Double> baseParameters(RegimeTraderProperties props) {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("volTarget", props.getRisk().getVolTarget());
        out.put("maxPositionPct", props.getRisk().getMaxPositionPct());
        out.put("choppyScale", props.getFusion().getChoppyScale());
        out.put("directionThreshold", props.getFusion().getDirectionThreshold());
        out.put("minIqr", props.getConfidence().getMinIqr());
        out.put("maxIqr", props.getConfidence().getMaxIqr());
        return out;
    }

    @Override
    public String name() {
        return "regime_pipeline";
    }

    @Override
    public Optional<SizedOrderIntent> onBar(BarContext ctx) {
        MarketFeatures features = ctx.features();
        if (features == null || !features.hasRegimeInputs()) {
            return Optional.empty();
        }
        vectors.add(FeatureVector.of(features));

        try {
            refitIfDue(ctx.index());
            if (!detector.isFitted()) {
                return Optional.empty();
            }
            RegimeState regime = detector.classify(ctx.symbol(), ctx.bar().timestamp(), tail(regimeProps.getClassifyWindow()));
            Decision decision = pipeline.propose(
                    ctx.symbol(), ctx.bar().timestamp(), ctx.bar().close(), features, regime, ctx.portfolio());
            decisions.add(decision);
            return Optional.ofNullable(decision.order());
        } catch (InsufficientDataException e) {
            log.debug("[Backtest] {} bar={} пропуск: {}", ctx.symbol(), ctx.index(), e.getMessage());
            return Optional.empty();
        }
    }

    public List<Decision> decisions() {
        return Collections.unmodifiableList(decisions);
    }

    private void refitIfDue(int barIndex) {
        boolean first = !detector.isFitted() && vectors.size() >= regimeProps.getMinTrainingBars();
        boolean periodic = detector.isFitted() && barIndex - lastFitAt >= regimeProps.getRefitEveryBars();
        if (first || periodic) {
            detector.fit(tail(regimeProps.getTrainingBars()));
            lastFitAt = barIndex;
        }
    }

    private List<FeatureVector> tail(int n) {
        return vectors.subList(Math.max(0, vectors.size() - n), vectors.size());
    }
}
