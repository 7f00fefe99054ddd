package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.risk.KillSwitch;
import com.chicu.regimetrader.risk.LiveSlippageEstimator;
import com.chicu.regimetrader.risk.RiskChecker;
import com.chicu.regimetrader.risk.RiskMetrics;
import com.chicu.regimetrader.risk.RiskMetricsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Health-тик: пересчёт риск-панели по зафиксированным снимкам.
 * Идёт чаще тика решений и не трогает незавершённые изменения портфеля.
 */
@Slf4j
@Service
public class RiskMetricsService {

    private final RegimeTraderProperties properties;
    private final PortfolioState portfolio;
    private final RiskChecker riskChecker;
    private final KillSwitch killSwitch;
    private final PersistenceStore store;
    private final LiveSlippageEstimator slippage;
    private final CoreStatusService status;
    private final Clock clock;
    private final RiskMetricsCalculator calculator;

    public RiskMetricsService(RegimeTraderProperties properties,
                              PortfolioState portfolio,
                              RiskChecker riskChecker,
                              KillSwitch killSwitch,
                              PersistenceStore store,
                              LiveSlippageEstimator slippage,
                              CoreStatusService status,
                              Clock clock) {
        this.properties = properties;
        this.portfolio = portfolio;
        this.riskChecker = riskChecker;
        this.killSwitch = killSwitch;
        this.store = store;
        this.slippage = slippage;
        this.status = status;
        this.clock = clock;
        this.calculator = new RiskMetricsCalculator(properties.getUniverse().getBarsPerYear());
    }

    public RiskMetrics healthTick() {
        Instant now = Instant.now(clock);
        List<PortfolioSnapshot> recent = store.recentSnapshots(properties.getRisk().getVolLookbackBars());

        RiskMetrics metrics = calculator.compute(
                recent,
                riskChecker.maxConcentration(portfolio),
                killSwitch.isTripped(),
                slippage,
                now
        );
        store.appendRiskMetrics(metrics);
        status.recordRiskMetrics(metrics);

        log.info("🩺 risk dd={} maxDd={} vol={} sharpe={} conc={} kill={} slip(mean/p95)={}/{}bps",
                fmt(metrics.currentDrawdownPct()), fmt(metrics.maxDrawdownPct()), fmt(metrics.portfolioVol()),
                metrics.sharpeRatio() == null ? "n/a" : fmt(metrics.sharpeRatio()),
                fmt(metrics.concentrationPct()), metrics.killSwitchActive(),
                fmt(metrics.slippageMeanBps()), fmt(metrics.slippageP95Bps()));
        return metrics;
    }

    private static String fmt(double v) {
        return String.format("%.4f", v);
    }
}
