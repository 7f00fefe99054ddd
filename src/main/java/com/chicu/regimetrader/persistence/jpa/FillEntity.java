package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.portfolio.Fill;
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
        name = "order_fill",
        indexes = @Index(name = "idx_order_fill_order", columnList = "order_id")
)
public class FillEntity {

    /** orderId#seq: ключ дедупликации. */
    @Id
    @Column(name = "fill_id", length = 48)
    private String fillId;

    @Column(name = "order_id", nullable = false, length = 40)
    private String orderId;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "side", nullable = false, length = 8)
    private OrderSide side;

    @Column(name = "quantity", nullable = false)
    private double quantity;

    @Column(name = "price", nullable = false)
    private double price;

    @Column(name = "fees", nullable = false)
    private double fees;

    @Column(name = "filled_at", nullable = false)
    private Instant filledAt;

    public static FillEntity from(Fill f) {
        return FillEntity.builder()
                .fillId(f.fillId())
                .orderId(f.orderId())
                .symbol(f.symbol())
                .side(f.side())
                .quantity(f.quantity())
                .price(f.price())
                .fees(f.fees())
                .filledAt(f.timestamp())
                .build();
    }
}
