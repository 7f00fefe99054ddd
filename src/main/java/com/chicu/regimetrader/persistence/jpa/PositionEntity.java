package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.portfolio.Position;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Одна строка на символ. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "position")
public class PositionEntity {

    @Id
    @Column(name = "symbol", length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "side", nullable = false, length = 8)
    private Direction side;

    @Column(name = "quantity", nullable = false)
    private double quantity;

    @Column(name = "avg_entry_price", nullable = false)
    private double avgEntryPrice;

    @Column(name = "mark_price", nullable = false)
    private double markPrice;

    @Column(name = "unrealized_pnl", nullable = false)
    private double unrealizedPnl;

    @Column(name = "realized_pnl", nullable = false)
    private double realizedPnl;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void apply(Position p) {
        this.symbol = p.symbol();
        this.side = p.side();
        this.quantity = p.quantity();
        this.avgEntryPrice = p.avgEntryPrice();
        this.markPrice = p.markPrice();
        this.unrealizedPnl = p.unrealizedPnl();
        this.realizedPnl = p.realizedPnl();
        this.updatedAt = Instant.now();
    }

    public Position toDomain() {
        return new Position(symbol, side, quantity, avgEntryPrice, markPrice, unrealizedPnl, realizedPnl);
    }
}
