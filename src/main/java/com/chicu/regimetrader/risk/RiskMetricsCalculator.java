package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.portfolio.PortfolioSnapshot;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Расчёт {@link RiskMetrics} из последних снимков.
 * Волатильность и Sharpe по log-доходностям капитала, годовые через sqrt(barsPerYear).
 */
public class RiskMetricsCalculator {

    static final int MIN_POINTS_FOR_SHARPE = 5;

    private final int barsPerYear;

    public RiskMetricsCalculator(int barsPerYear) {
        if (barsPerYear <= 0) {
            throw new IllegalArgumentException("barsPerYear must be > 0");
        }
        this.barsPerYear = barsPerYear;
    }

    public RiskMetrics compute(List<PortfolioSnapshot> recent,
                               double concentrationPct,
                               boolean killSwitchActive,
                               LiveSlippageEstimator slippage,
                               Instant now) {

        double current = recent.isEmpty() ? 0.0 : recent.get(recent.size() - 1).drawdownPct();
        double maxDd = recent.stream().mapToDouble(PortfolioSnapshot::drawdownPct).max().orElse(0.0);

        double[] r = logReturns(recent);
        double vol = 0.0;
        Double sharpe = null;
        if (r.length >= 2) {
            double mean = mean(r);
            double sd = stdev(r, mean);
            vol = sd * Math.sqrt(barsPerYear);
            if (recent.size() >= MIN_POINTS_FOR_SHARPE) {
                sharpe = sd > 0.0 ? mean / sd * Math.sqrt(barsPerYear) : 0.0;
            }
        }

        return RiskMetrics.builder()
                .timestamp(now)
                .currentDrawdownPct(current)
                .maxDrawdownPct(maxDd)
                .portfolioVol(vol)
                .sharpeRatio(sharpe)
                .concentrationPct(concentrationPct)
                .killSwitchActive(killSwitchActive)
                .slippageMeanBps(slippage == null ? 0.0 : slippage.meanBps())
                .slippageP95Bps(slippage == null ? 0.0 : slippage.p95Bps())
                .build();
    }

    private static double[] logReturns(List<PortfolioSnapshot> s) {
        if (s.size() < 2) {
            return new double[0];
        }
        double[] out = new double[s.size() - 1];
        int n = 0;
        for (int i = 1; i < s.size(); i++) {
            double prev = s.get(i - 1).equity();
            double cur = s.get(i).equity();
            if (prev > 0.0 && cur > 0.0) {
                out[n++] = Math.log(cur / prev);
            }
        }
        return Arrays.copyOf(out, n);
    }

    private static double mean(double[] x) {
        double s = 0.0;
        for (double v : x) s += v;
        return s / x.length;
    }

    private static double stdev(double[] x, double mean) {
        double s = 0.0;
        for (double v : x) s += (v - mean) * (v - mean);
        return Math.sqrt(s / (x.length - 1));
    }
}
