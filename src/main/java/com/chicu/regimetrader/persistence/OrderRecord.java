package com.chicu.regimetrader.persistence;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderStatus;
import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.order.Order;

import java.time.Instant;

/** Неизменяемая копия ордера для хранилища. */
public record OrderRecord(
        String id,
        String symbol,
        String exchange,
        OrderSide side,
        OrderType type,
        double quantity,
        Double limitPrice,
        OrderStatus status,
        double filledQty,
        double avgFillPrice,
        double fees,
        String rejectReason,
        Instant createdAt,
        Instant updatedAt
) {

    public static OrderRecord of(Order o) {
        return new OrderRecord(
                o.getId(), o.getSymbol(), o.getExchange(), o.getSide(), o.getType(),
                o.getQuantity(), o.getLimitPrice(), o.getStatus(),
                o.getFilledQty(), o.getAvgFillPrice(), o.getFees(), o.getRejectReason(),
                o.getCreatedAt(), o.getUpdatedAt()
        );
    }
}
