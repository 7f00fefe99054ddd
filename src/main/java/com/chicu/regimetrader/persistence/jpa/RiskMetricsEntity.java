package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.risk.RiskMetrics;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "risk_metrics",
        indexes = @Index(name = "idx_risk_metrics_ts", columnList = "computed_at")
)
public class RiskMetricsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    @Column(name = "current_drawdown_pct", nullable = false)
    private double currentDrawdownPct;

    @Column(name = "max_drawdown_pct", nullable = false)
    private double maxDrawdownPct;

    @Column(name = "portfolio_vol", nullable = false)
    private double portfolioVol;

    // null = недостаточно истории
    @Column(name = "sharpe_ratio")
    private Double sharpeRatio;

    @Column(name = "concentration_pct", nullable = false)
    private double concentrationPct;

    @Column(name = "kill_switch_active", nullable = false)
    private boolean killSwitchActive;

    @Column(name = "slippage_mean_bps", nullable = false)
    private double slippageMeanBps;

    @Column(name = "slippage_p95_bps", nullable = false)
    private double slippageP95Bps;

    public static RiskMetricsEntity from(RiskMetrics m) {
        return RiskMetricsEntity.builder()
                .computedAt(m.timestamp())
                .currentDrawdownPct(m.currentDrawdownPct())
                .maxDrawdownPct(m.maxDrawdownPct())
                .portfolioVol(m.portfolioVol())
                .sharpeRatio(m.sharpeRatio())
                .concentrationPct(m.concentrationPct())
                .killSwitchActive(m.killSwitchActive())
                .slippageMeanBps(m.slippageMeanBps())
                .slippageP95Bps(m.slippageP95Bps())
                .build();
    }

    public RiskMetrics toDomain() {
        return RiskMetrics.builder()
                .timestamp(computedAt)
                .currentDrawdownPct(currentDrawdownPct)
                .maxDrawdownPct(maxDrawdownPct)
                .portfolioVol(portfolioVol)
                .sharpeRatio(sharpeRatio)
                .concentrationPct(concentrationPct)
                .killSwitchActive(killSwitchActive)
                .slippageMeanBps(slippageMeanBps)
                .slippageP95Bps(slippageP95Bps)
                .build();
    }
}
