package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderStatus;
import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.order.Order;
import com.chicu.regimetrader.persistence.OrderRecord;
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
        name = "trade_order",
        indexes = {
                @Index(name = "idx_trade_order_symbol_status", columnList = "symbol, status")
        }
)
public class OrderEntity {

    @Id
    @Column(name = "id", length = 40)
    private String id;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "exchange", length = 32)
    private String exchange;

    @Enumerated(EnumType.STRING)
    @Column(name = "side", nullable = false, length = 8)
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, length = 8)
    private OrderType type;

    @Column(name = "quantity", nullable = false)
    private double quantity;

    @Column(name = "limit_price")
    private Double limitPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OrderStatus status;

    @Column(name = "filled_qty", nullable = false)
    private double filledQty;

    @Column(name = "avg_fill_price", nullable = false)
    private double avgFillPrice;

    @Column(name = "fees", nullable = false)
    private double fees;

    @Column(name = "reject_reason", length = 256)
    private String rejectReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void apply(Order o) {
        this.id = o.getId();
        this.symbol = o.getSymbol();
        this.exchange = o.getExchange();
        this.side = o.getSide();
        this.type = o.getType();
        this.quantity = o.getQuantity();
        this.limitPrice = o.getLimitPrice();
        this.status = o.getStatus();
        this.filledQty = o.getFilledQty();
        this.avgFillPrice = o.getAvgFillPrice();
        this.fees = o.getFees();
        this.rejectReason = o.getRejectReason();
        this.createdAt = o.getCreatedAt();
        this.updatedAt = o.getUpdatedAt();
    }

    public OrderRecord toRecord() {
        return new OrderRecord(id, symbol, exchange, side, type, quantity, limitPrice, status,
                filledQty, avgFillPrice, fees, rejectReason, createdAt, updatedAt);
    }
}
