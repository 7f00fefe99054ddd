package com.chicu.regimetrader.validation;

import com.chicu.regimetrader.backtest.BacktestMetrics;
import com.chicu.regimetrader.backtest.PerformanceMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

/**
 * Устойчивость результата: блочный бутстреп доходностей и возмущение параметров.
 */
@Slf4j
public final class MonteCarloRobustness {

    private final int barsPerYear;

    public MonteCarloRobustness(int barsPerYear) {
        if (barsPerYear < 1) {
            throw new IllegalArgumentException("barsPerYear must be >= 1, got " + barsPerYear);
        }
        this.barsPerYear = barsPerYear;
    }

    /**
     * Блочный бутстреп с возвращением: блоки подряд идущих доходностей,
     * начала равномерно из [0, n - blockSize], склейка обрезается до n.
     * blockSize > n сжимается до n.
     */
    public MonteCarloResult bootstrap(double[] returns, int simulations, int blockSize, long seed) {
        if (returns == null || returns.length == 0) {
            throw new IllegalArgumentException("returns must not be empty");
        }
        if (simulations < 1 || blockSize < 1) {
            throw new IllegalArgumentException("simulations and blockSize must be >= 1");
        }
        int n = returns.length;
        int block = Math.min(blockSize, n);
        int maxStart = n - block;

        Random rnd = new Random(seed);
        double[] sharpes = new double[simulations];
        double[] totals = new double[simulations];
        double[] drawdowns = new double[simulations];
        double[] sim = new double[n];

        for (int s = 0; s < simulations; s++) {
            int filled = 0;
            while (filled < n) {
                int start = rnd.nextInt(maxStart + 1);
                int len = Math.min(block, n - filled);
                System.arraycopy(returns, start, sim, filled, len);
                filled += len;
            }

            double[] equity = new double[n + 1];
            equity[0] = 1.0;
            for (int i = 0; i < n; i++) {
                equity[i + 1] = equity[i] * (1.0 + sim[i]);
            }

            sharpes[s] = PerformanceMetrics.sharpe(sim, barsPerYear);
            totals[s] = equity[n] - 1.0;
            drawdowns[s] = PerformanceMetrics.maxDrawdown(equity);
        }

        MonteCarloResult result = new MonteCarloResult(sharpes, totals, drawdowns, simulations);
        log.info("🎲 MonteCarlo: sims={} block={} sharpe mean={} p5={} p95={} return p5={}",
                simulations, block,
                String.format("%.3f", result.sharpeMean()),
                String.format("%.3f", result.sharpeP5()),
                String.format("%.3f", result.sharpeP95()),
                String.format("%.4f", result.returnP5()));
        return result;
    }

    /**
     * Наборы параметров, где каждое значение умножено на (1 + U(-pct, pct)).
     */
    public static List<Map<String, Double>> perturbParameters(Map<String, Double> base, double pct, int count, long seed) {
        if (!(pct >= 0.0 && pct < 1.0)) {
            throw new IllegalArgumentException("pct must be in [0,1), got " + pct);
        }
        if (base == null || base.isEmpty() || count <= 0) {
            return List.of();
        }
        Random rnd = new Random(seed);
        List<Map<String, Double>> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Double> params = new LinkedHashMap<>();
            for (Map.Entry<String, Double> e : base.entrySet()) {
                double factor = pct == 0.0 ? 1.0 : 1.0 + rnd.nextDouble(-pct, pct);
                params.put(e.getKey(), e.getValue() * factor);
            }
            out.add(params);
        }
        return out;
    }

    /**
     * Базовый прогон и count прогонов с возмущёнными параметрами через переданный runner.
     * Неуспешные прогоны ({@code ok=false}) идут в распределение как Sharpe 0 и return 0.
     */
    public PerturbationReport perturbationTest(Map<String, Double> base,
                                               double pct,
                                               int count,
                                               long seed,
                                               Function<Map<String, Double>, BacktestMetrics> runner) {
        BacktestMetrics baseline = runner.apply(base);
        List<Map<String, Double>> sets = perturbParameters(base, pct, count, seed);

        double[] sharpes = new double[sets.size()];
        double[] returns = new double[sets.size()];
        for (int i = 0; i < sets.size(); i++) {
            BacktestMetrics m = runner.apply(sets.get(i));
            sharpes[i] = m.ok() ? m.sharpe() : 0.0;
            returns[i] = m.ok() ? m.totalReturn() : 0.0;
        }

        double baseSharpe = baseline.ok() ? baseline.sharpe() : 0.0;
        double collapse = baseSharpe > 0.0 && sharpes.length > 0
                ? Percentiles.of(sharpes, 5.0) / baseSharpe
                : Double.NaN;

        log.info("🧪 Perturbation: runs={} pct={} baseSharpe={} collapseRatio={}",
                sets.size(), pct, String.format("%.3f", baseSharpe), String.format("%.3f", collapse));

        return new PerturbationReport(Map.copyOf(base), baseSharpe, baseline.ok() ? baseline.totalReturn() : 0.0,
                sets, sharpes, returns, collapse);
    }
}
