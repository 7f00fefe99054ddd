package com.chicu.regimetrader.config;

import com.chicu.regimetrader.common.exception.ConfigurationException;
import com.chicu.regimetrader.engine.DecisionPipeline;
import com.chicu.regimetrader.engine.PortfolioBootstrap;
import com.chicu.regimetrader.order.OrderBook;
import com.chicu.regimetrader.order.OrderManager;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.provider.CollaboratorCalls;
import com.chicu.regimetrader.provider.ExecutionAdapter;
import com.chicu.regimetrader.provider.ModelPredictor;
import com.chicu.regimetrader.provider.SentimentProvider;
import com.chicu.regimetrader.regime.RegimeDetector;
import com.chicu.regimetrader.risk.KillSwitch;
import com.chicu.regimetrader.risk.LiveSlippageEstimator;
import com.chicu.regimetrader.risk.PositionSizer;
import com.chicu.regimetrader.risk.RiskChecker;
import com.chicu.regimetrader.signal.ConfidenceMapper;
import com.chicu.regimetrader.signal.RegimeWeights;
import com.chicu.regimetrader.signal.SignalFusion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

/**
 * Сборка ядра live/paper режима.
 * Вся валидация конфигурации здесь, на старте: ошибка = контекст не поднимается.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RegimeTraderProperties.class)
public class TradingCoreConfig {

    public TradingCoreConfig(RegimeTraderProperties props) {
        validate(props);
        log.info("✅ regimetrader config validated: symbols={} mode={} states={}",
                props.getUniverse().getSymbols(), props.getExecution().getMode(), props.getRegime().getStates());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegimeWeights regimeWeights(RegimeTraderProperties props) {
        RegimeWeights weights = RegimeWeights.from(props.getFusion());
        log.info("⚖️ Fusion weights validated: trending={} meanReverting={} choppy={}",
                props.getFusion().getTrending(), props.getFusion().getMeanReverting(), props.getFusion().getChoppy());
        return weights;
    }

    @Bean
    public SignalFusion signalFusion(RegimeWeights weights, RegimeTraderProperties props) {
        return new SignalFusion(weights, props.getFusion().getChoppyScale(), props.getFusion().getDirectionThreshold());
    }

    @Bean
    public ConfidenceMapper confidenceMapper(RegimeTraderProperties props) {
        RegimeTraderProperties.Confidence c = props.getConfidence();
        return new ConfidenceMapper(c.getMinIqr(), c.getMaxIqr(), c.getFallback());
    }

    @Bean
    public PositionSizer positionSizer(RegimeTraderProperties props) {
        return new PositionSizer(props.getRisk());
    }

    @Bean
    public KillSwitch killSwitch(RegimeTraderProperties props, PersistenceStore store) {
        return new KillSwitch(props.getRisk().getMaxDrawdownPct(), store);
    }

    @Bean
    public RiskChecker riskChecker(RegimeTraderProperties props, KillSwitch killSwitch) {
        return new RiskChecker(props.getRisk(), killSwitch);
    }

    @Bean
    public PortfolioState portfolioState(RegimeTraderProperties props, PersistenceStore store) {
        return PortfolioBootstrap.restore(props.getRisk().getInitialEquity(), store);
    }

    @Bean
    public OrderBook orderBook() {
        return new OrderBook();
    }

    @Bean
    public LiveSlippageEstimator liveSlippageEstimator() {
        return new LiveSlippageEstimator(100);
    }

    @Bean
    public CollaboratorCalls collaboratorCalls(RegimeTraderProperties props) {
        return new CollaboratorCalls(props.getExecution().getCollaboratorTimeoutMs());
    }

    @Bean
    public DecisionPipeline decisionPipeline(SignalFusion fusion,
                                             ConfidenceMapper confidenceMapper,
                                             PositionSizer sizer,
                                             ModelPredictor predictor,
                                             SentimentProvider sentiment,
                                             CollaboratorCalls calls) {
        return new DecisionPipeline(fusion, confidenceMapper, sizer, predictor, sentiment, calls);
    }

    @Bean
    public OrderManager orderManager(RegimeTraderProperties props,
                                     OrderBook book,
                                     PortfolioState portfolio,
                                     RiskChecker riskChecker,
                                     PersistenceStore store,
                                     ExecutionAdapter adapter,
                                     LiveSlippageEstimator slippage,
                                     Clock clock) {
        String exchange = "LIVE".equalsIgnoreCase(props.getExecution().getMode())
                ? adapter.exchangeName()
                : props.getUniverse().getExchange();
        return new OrderManager(props.getExecution(), exchange, book, portfolio, riskChecker, store, adapter, slippage, clock);
    }

    // ===== validation =====

    /**
     * Проверки, которые не покрываются конструкторами компонентов.
     *
     * @throws ConfigurationException при любой ошибке
     */
    public static void validate(RegimeTraderProperties props) {
        // число состояний и прочие параметры HMM проверяет конструктор детектора
        new RegimeDetector(props.getRegime());
        // суммы весов, choppyScale, порог направления
        new SignalFusion(RegimeWeights.from(props.getFusion()),
                props.getFusion().getChoppyScale(), props.getFusion().getDirectionThreshold());

        RegimeTraderProperties.Confidence c = props.getConfidence();
        if (!(c.getMaxIqr() > c.getMinIqr())) {
            throw new ConfigurationException("confidence.maxIqr must be > minIqr");
        }
        if (c.getFallback() < 0.0 || c.getFallback() > 1.0) {
            throw new ConfigurationException("confidence.fallback must be in [0,1]");
        }

        RegimeTraderProperties.Risk r = props.getRisk();
        requireRange("risk.maxPositionPct", r.getMaxPositionPct(), 0.0, 1.0);
        requireRange("risk.maxConcentrationPct", r.getMaxConcentrationPct(), 0.0, 1.0);
        requireRange("risk.maxDrawdownPct", r.getMaxDrawdownPct(), 0.0, 1.0);
        requirePositive("risk.volTarget", r.getVolTarget());
        requirePositive("risk.volFloor", r.getVolFloor());
        requirePositive("risk.initialEquity", r.getInitialEquity());
        requirePositive("risk.stalenessMinutes", r.getStalenessMinutes());
        if (r.getMinTradeUsd() < 0.0) {
            throw new ConfigurationException("risk.minTradeUsd must be >= 0");
        }

        String mode = props.getExecution().getMode();
        try {
            OrderManager.Mode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new ConfigurationException("execution.mode must be PAPER or LIVE, got " + mode);
        }
        if (props.getUniverse().getSymbols() == null || props.getUniverse().getSymbols().isEmpty()) {
            throw new ConfigurationException("universe.symbols must not be empty");
        }
        requirePositive("universe.barsPerYear", props.getUniverse().getBarsPerYear());
        props.getUniverse().timeframeDuration();
    }

    private static void requireRange(String name, double v, double lowExclusive, double highInclusive) {
        if (!(v > lowExclusive && v <= highInclusive)) {
            throw new ConfigurationException(name + " must be in (" + lowExclusive + "," + highInclusive + "], got " + v);
        }
    }

    private static void requirePositive(String name, double v) {
        if (!(v > 0.0)) {
            throw new ConfigurationException(name + " must be > 0, got " + v);
        }
    }
}
