package com.chicu.regimetrader.provider;

import com.chicu.regimetrader.common.enums.OrderStatus;
import com.chicu.regimetrader.order.Order;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Биржевой адаптер не подключён.
 * В PAPER-режиме не используется; в LIVE любой submit отклоняется.
 */
@Slf4j
@Service
public class UnavailableExecutionAdapter implements ExecutionAdapter {

    @Override
    public String exchangeName() {
        return "NONE";
    }

    @Override
    public ExecutionAck submit(Order order) {
        log.warn("⚠️ ExecutionAdapter не подключён, ордер {} отклонён", order.getId());
        return ExecutionAck.rejected("execution adapter unavailable");
    }

    @Override
    public OrderStatusReport poll(String orderId) {
        return new OrderStatusReport(orderId, OrderStatus.REJECTED, 0.0, 0.0, 0.0, Instant.now());
    }

    @Override
    public boolean cancel(String orderId) {
        return false;
    }
}
