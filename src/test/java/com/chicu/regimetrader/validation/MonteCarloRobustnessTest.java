package com.chicu.regimetrader.validation;

import com.chicu.regimetrader.backtest.BacktestMetrics;
import com.chicu.regimetrader.backtest.PerformanceMetrics;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MonteCarloRobustnessTest {

    private static final int BPY = 2_190;

    private static double[] returns(int n, long seed) {
        Random rnd = new Random(seed);
        double[] r = new double[n];
        for (int i = 0; i < n; i++) {
            r[i] = 0.0005 + rnd.nextGaussian() * 0.01;
        }
        return r;
    }

    @Test
    void bootstrap_shouldBeReproducibleForSameSeed() {
        MonteCarloRobustness mc = new MonteCarloRobustness(BPY);
        double[] r = returns(300, 7);

        MonteCarloResult a = mc.bootstrap(r, 200, 10, 42L);
        MonteCarloResult b = mc.bootstrap(r, 200, 10, 42L);
        MonteCarloResult c = mc.bootstrap(r, 200, 10, 43L);

        assertArrayEquals(a.sharpeRatios(), b.sharpeRatios());
        assertArrayEquals(a.totalReturns(), b.totalReturns());
        assertFalse(java.util.Arrays.equals(a.sharpeRatios(), c.sharpeRatios()), "другой seed: другая выборка");
        assertEquals(200, a.simulations());
    }

    @Test
    void bootstrap_withBlockEqualToLength_shouldReproduceOriginalPath() {
        MonteCarloRobustness mc = new MonteCarloRobustness(BPY);
        double[] r = returns(50, 1);
        double expectedSharpe = PerformanceMetrics.sharpe(r, BPY);

        // блок больше истории сжимается до n: единственный старт 0
        MonteCarloResult res = mc.bootstrap(r, 5, 500, 3L);

        for (double s : res.sharpeRatios()) {
            assertEquals(expectedSharpe, s, 1e-12);
        }
        assertEquals(res.sharpeP5(), res.sharpeP95(), 1e-12);
    }

    @Test
    void bootstrap_shouldPreserveCompoundedReturn_forConstantReturns() {
        MonteCarloRobustness mc = new MonteCarloRobustness(BPY);
        double[] r = new double[100];
        java.util.Arrays.fill(r, 0.001);

        MonteCarloResult res = mc.bootstrap(r, 20, 7, 9L);

        double expected = Math.pow(1.001, 100) - 1.0;
        assertEquals(expected, res.returnMean(), 1e-9);
        assertEquals(0.0, res.maxDrawdownP95(), 1e-12);
    }

    @Test
    void bootstrap_shouldRejectEmptyReturns() {
        MonteCarloRobustness mc = new MonteCarloRobustness(BPY);

        assertThrows(IllegalArgumentException.class, () -> mc.bootstrap(new double[0], 10, 5, 1L));
        assertThrows(IllegalArgumentException.class, () -> mc.bootstrap(null, 10, 5, 1L));
    }

    @Test
    void perturbParameters_shouldStayWithinBandAndKeepKeys() {
        Map<String, Double> base = new LinkedHashMap<>();
        base.put("volTarget", 0.15);
        base.put("maxPositionPct", 0.2);

        List<Map<String, Double>> sets = MonteCarloRobustness.perturbParameters(base, 0.1, 50, 11L);

        assertEquals(50, sets.size());
        for (Map<String, Double> p : sets) {
            assertEquals(base.keySet(), p.keySet());
            assertTrue(p.get("volTarget") >= 0.15 * 0.9 - 1e-12 && p.get("volTarget") <= 0.15 * 1.1 + 1e-12);
            assertTrue(p.get("maxPositionPct") >= 0.18 - 1e-12 && p.get("maxPositionPct") <= 0.22 + 1e-12);
        }
        assertEquals(sets, MonteCarloRobustness.perturbParameters(base, 0.1, 50, 11L), "детерминизм по seed");
        assertThrows(IllegalArgumentException.class, () -> MonteCarloRobustness.perturbParameters(base, 1.0, 5, 1L));
    }

    @Test
    void perturbationTest_shouldCountFailedRunsAsZeroAndComputeCollapse() {
        MonteCarloRobustness mc = new MonteCarloRobustness(BPY);
        Map<String, Double> base = Map.of("volTarget", 0.15);

        // Sharpe пропорционален volTarget, кроме прогонов выше 0.16: они падают
        PerturbationReport report = mc.perturbationTest(base, 0.2, 40, 5L, params -> {
            double v = params.get("volTarget");
            if (v > 0.16) {
                return BacktestMetrics.fail("too aggressive");
            }
            return BacktestMetrics.builder().ok(true).sharpe(v * 10).totalReturn(v).build();
        });

        assertEquals(1.5, report.baseSharpe(), 1e-12);
        assertEquals(40, report.perturbedSharpes().length);
        boolean anyFailed = false;
        for (int i = 0; i < 40; i++) {
            if (report.perturbedParams().get(i).get("volTarget") > 0.16) {
                anyFailed = true;
                assertEquals(0.0, report.perturbedSharpes()[i]);
            }
        }
        assertTrue(anyFailed, "при ±20% часть прогонов должна выйти за 0.16");
        assertEquals(report.perturbedSharpeP5() / 1.5, report.collapseRatio(), 1e-12);
    }

    @Test
    void perturbationTest_shouldReturnNanCollapse_whenBaseSharpeNotPositive() {
        MonteCarloRobustness mc = new MonteCarloRobustness(BPY);

        PerturbationReport report = mc.perturbationTest(Map.of("x", 1.0), 0.1, 5, 1L,
                p -> BacktestMetrics.builder().ok(true).sharpe(-0.5).totalReturn(-0.1).build());

        assertTrue(Double.isNaN(report.collapseRatio()));
    }
}
