package com.chicu.regimetrader.provider;

import com.chicu.regimetrader.common.enums.OrderStatus;

import java.time.Instant;

/**
 * Снимок статуса ордера на бирже. filledQty и fees: накопительные.
 */
public record OrderStatusReport(
        String orderId,
        OrderStatus status,
        double filledQty,
        double avgFillPrice,
        double fees,
        Instant reportedAt
) {
}
