package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.validation.MonteCarloResult;

import java.util.List;
import java.util.Locale;

/**
 * Стратегия против бенчмарка на одной истории, плюс бутстреп доходностей стратегии.
 *
 * @param monteCarlo null, если доходностей нет (прогон не состоялся)
 */
public record BacktestComparison(
        BacktestResult strategy,
        BacktestResult benchmark,
        MonteCarloResult monteCarlo
) {

    public String report() {
        StringBuilder sb = new StringBuilder();
        sb.append(BacktestReport.format(strategy.metrics())).append('\n');
        sb.append(BacktestReport.compare(List.of(strategy.metrics(), benchmark.metrics())));
        if (monteCarlo != null) {
            sb.append(String.format(Locale.ROOT,
                    "MonteCarlo (%d sims): Sharpe mean=%.3f p5=%.3f p95=%.3f, Return p5=%.2f%%, MaxDD p95=%.2f%%%n",
                    monteCarlo.simulations(), monteCarlo.sharpeMean(), monteCarlo.sharpeP5(), monteCarlo.sharpeP95(),
                    monteCarlo.returnP5() * 100.0, monteCarlo.maxDrawdownP95() * 100.0));
        }
        return sb.toString();
    }
}
