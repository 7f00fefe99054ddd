package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.engine.Decision;
import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.provider.ModelPredictor;
import com.chicu.regimetrader.provider.SentimentProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class PipelineBacktestStrategyTest {

    private static final ModelPredictor NO_MODEL = (symbol, features) -> null;
    private static final SentimentProvider BULLISH = symbol -> OptionalDouble.of(0.4);

    private RegimeTraderProperties props;

    @BeforeEach
    void setUp() {
        props = new RegimeTraderProperties();
        props.getRegime().setMinTrainingBars(100);
        props.getRegime().setTrainingBars(300);
        props.getRegime().setRefitEveryBars(100);
        props.getRegime().setClassifyWindow(20);
    }

    @Test
    void create_shouldRejectUnknownParameter() {
        assertThrows(IllegalArgumentException.class,
                () -> PipelineBacktestStrategy.create(props, NO_MODEL, BULLISH, Map.of("leverage", 3.0)));
    }

    @Test
    void baseParameters_shouldCoverEveryTunableKey() {
        assertEquals(PipelineBacktestStrategy.TUNABLE, PipelineBacktestStrategy.baseParameters(props).keySet());
    }

    @Test
    void decisions_shouldStartOnlyAfterDetectorHasEnoughHistory() {
        List<Bar> bars = SyntheticBars.regimeSwitching("BTCUSDT", 400, 5L);
        BacktestConfig cfg = BacktestConfig.from(props);
        PipelineBacktestStrategy strategy = PipelineBacktestStrategy.create(props, NO_MODEL, BULLISH);

        BacktestResult result = new BacktestEngine(cfg).run("BTCUSDT", bars, strategy);

        assertTrue(result.metrics().ok());
        List<Decision> decisions = strategy.decisions();
        assertFalse(decisions.isEmpty());
        // первые volWindow баров без realized vol, затем minTrainingBars на обучение
        Bar firstEligible = bars.get(cfg.volWindow() + 100 - 1);
        assertFalse(decisions.get(0).timestamp().isBefore(firstEligible.timestamp()), "без заглядывания вперёд");
        assertTrue(result.fills().size() > 0, "положительный сентимент должен дать входы");
    }

    @Test
    void run_shouldBeReproducible() {
        List<Bar> bars = SyntheticBars.regimeSwitching("BTCUSDT", 300, 9L);
        BacktestEngine engine = new BacktestEngine(BacktestConfig.from(props));

        BacktestMetrics a = engine.run("BTCUSDT", bars, PipelineBacktestStrategy.create(props, NO_MODEL, BULLISH)).metrics();
        BacktestMetrics b = engine.run("BTCUSDT", bars, PipelineBacktestStrategy.create(props, NO_MODEL, BULLISH)).metrics();

        assertEquals(a.totalReturn(), b.totalReturn());
        assertEquals(a.totalTrades(), b.totalTrades());
        assertEquals(a.totalFees(), b.totalFees());
    }

    @Test
    void overrides_shouldChangeSizing() {
        List<Bar> bars = SyntheticBars.regimeSwitching("BTCUSDT", 300, 9L);
        BacktestEngine engine = new BacktestEngine(BacktestConfig.from(props));

        BacktestResult base = engine.run("BTCUSDT", bars, PipelineBacktestStrategy.create(props, NO_MODEL, BULLISH));
        BacktestResult tiny = engine.run("BTCUSDT", bars,
                PipelineBacktestStrategy.create(props, NO_MODEL, BULLISH, Map.of("maxPositionPct", 0.01)));

        double baseNotional = base.fills().stream().mapToDouble(f -> f.quantity() * f.price()).max().orElse(0);
        double tinyNotional = tiny.fills().stream().mapToDouble(f -> f.quantity() * f.price()).max().orElse(0);
        assertTrue(tinyNotional <= 0.011 * 100_000 * 1.5, "лимит 1% капитала: " + tinyNotional);
        assertTrue(baseNotional > tinyNotional);
    }

    @Test
    void configFor_shouldCarryPositionLimitIntoRiskChecks() {
        BacktestConfig base = BacktestConfig.from(props);

        BacktestConfig raised = PipelineBacktestStrategy.configFor(base, Map.of("maxPositionPct", 0.4));

        assertEquals(0.4, raised.maxPositionPct(), 1e-12);
        assertEquals(0.4, raised.maxConcentrationPct(), 1e-12, "концентрация одного символа не ниже лимита позиции");
        assertSame(base, PipelineBacktestStrategy.configFor(base, Map.of("volTarget", 0.2)));
    }

    @Test
    void raisedPositionLimit_shouldNotBeRejectedByRisk_whenSizerHitsCap() {
        props.getRisk().setVolTarget(5.0);
        List<Bar> bars = SyntheticBars.regimeSwitching("BTCUSDT", 300, 9L);
        Map<String, Double> raised = Map.of("maxPositionPct", props.getRisk().getMaxPositionPct() * 1.05);

        BacktestResult result = new BacktestEngine(PipelineBacktestStrategy.configFor(BacktestConfig.from(props), raised))
                .run("BTCUSDT", bars, PipelineBacktestStrategy.create(props, NO_MODEL, BULLISH, raised));

        assertTrue(result.metrics().ok());
        assertFalse(result.fills().isEmpty());
        assertFalse(result.metrics().rejections().containsKey("POSITION_LIMIT"), "rej=" + result.metrics().rejections());
        assertFalse(result.metrics().rejections().containsKey("CONCENTRATION_LIMIT"));
    }
}
