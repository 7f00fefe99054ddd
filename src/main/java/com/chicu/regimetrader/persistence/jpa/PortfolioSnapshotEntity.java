package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
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
        name = "portfolio_snapshot",
        indexes = @Index(name = "idx_portfolio_snapshot_ts", columnList = "snapshot_ts")
)
public class PortfolioSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "snapshot_ts", nullable = false)
    private Instant timestamp;

    @Column(name = "equity", nullable = false)
    private double equity;

    @Column(name = "cash", nullable = false)
    private double cash;

    @Column(name = "positions_value", nullable = false)
    private double positionsValue;

    @Column(name = "unrealized_pnl", nullable = false)
    private double unrealizedPnl;

    @Column(name = "realized_pnl", nullable = false)
    private double realizedPnl;

    @Column(name = "drawdown_pct", nullable = false)
    private double drawdownPct;

    public static PortfolioSnapshotEntity from(PortfolioSnapshot s) {
        return PortfolioSnapshotEntity.builder()
                .timestamp(s.timestamp())
                .equity(s.equity())
                .cash(s.cash())
                .positionsValue(s.positionsValue())
                .unrealizedPnl(s.unrealizedPnl())
                .realizedPnl(s.realizedPnl())
                .drawdownPct(s.drawdownPct())
                .build();
    }

    public PortfolioSnapshot toDomain() {
        return new PortfolioSnapshot(timestamp, equity, cash, positionsValue, unrealizedPnl, realizedPnl, drawdownPct);
    }
}
