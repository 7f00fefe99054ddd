package com.chicu.regimetrader.common.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Жизненный цикл ордера:
 * <pre>
 * PENDING → SUBMITTED → FILLED
 *                     → PARTIAL → FILLED | CANCELLED
 *                     → REJECTED
 * </pre>
 * PENDING может быть отклонён или отменён до отправки.
 */
public enum OrderStatus {
    PENDING,
    SUBMITTED,
    PARTIAL,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedNext().contains(next);
    }

    private Set<OrderStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(SUBMITTED, REJECTED, CANCELLED);
            case SUBMITTED -> EnumSet.of(PARTIAL, FILLED, CANCELLED, REJECTED);
            case PARTIAL -> EnumSet.of(PARTIAL, FILLED, CANCELLED);
            case FILLED, CANCELLED, REJECTED -> EnumSet.noneOf(OrderStatus.class);
        };
    }
}
