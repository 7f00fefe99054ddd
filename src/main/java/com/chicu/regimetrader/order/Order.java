package com.chicu.regimetrader.order;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderStatus;
import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.common.exception.IdempotencyViolationException;
import com.chicu.regimetrader.portfolio.Fill;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Ордер и его машина состояний (см. {@link OrderStatus}).
 * filledQty только растёт и никогда не превышает quantity.
 * Не потокобезопасен сам по себе: владельцы ({@link OrderBook}, бэктест) синхронизируют доступ.
 */
@Getter
@ToString
public class Order {

    private static final double EPS = 1e-9;

    private final String id;
    private final String symbol;
    private final String exchange;
    private final OrderSide side;
    private final OrderType type;
    private final double quantity;
    private final Double limitPrice;
    /** Цена, от которой считается проскальзывание (close на момент решения). */
    private final double expectedPrice;
    private final Instant createdAt;

    private OrderStatus status = OrderStatus.PENDING;
    private double filledQty;
    private double avgFillPrice;
    private double fees;
    private Instant updatedAt;
    private String exchangeOrderId;
    private String rejectReason;
    private int fillSeq;

    @Builder
    public Order(String id,
                 String symbol,
                 String exchange,
                 OrderSide side,
                 OrderType type,
                 double quantity,
                 Double limitPrice,
                 double expectedPrice,
                 Instant createdAt) {

        this.id = Objects.requireNonNull(id, "id");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.exchange = exchange;
        this.side = Objects.requireNonNull(side, "side");
        this.type = type == null ? OrderType.MARKET : type;
        if (!(quantity > 0.0) || !Double.isFinite(quantity)) {
            throw new IllegalArgumentException("order quantity must be > 0, got " + quantity);
        }
        if (this.type == OrderType.LIMIT && (limitPrice == null || !(limitPrice > 0.0))) {
            throw new IllegalArgumentException("limit order requires limitPrice > 0");
        }
        this.quantity = quantity;
        this.limitPrice = limitPrice;
        this.expectedPrice = expectedPrice;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public double remainingQty() {
        return Math.max(0.0, quantity - filledQty);
    }

    public boolean isOpen() {
        return !status.isTerminal();
    }

    // ===== transitions =====

    public void submit(String exchangeOrderId, Instant ts) {
        transition(OrderStatus.SUBMITTED, ts);
        this.exchangeOrderId = exchangeOrderId;
    }

    public void reject(String reason, Instant ts) {
        transition(OrderStatus.REJECTED, ts);
        this.rejectReason = reason;
    }

    public void cancel(Instant ts) {
        transition(OrderStatus.CANCELLED, ts);
    }

    /**
     * Зафиксировать исполнение. Возвращает Fill со следующим порядковым fillId.
     *
     * @throws IllegalStateException         ордер не в SUBMITTED/PARTIAL
     * @throws IdempotencyViolationException исполнение превысило бы quantity
     */
    public Fill recordFill(double qty, double price, double fillFees, Instant ts) {
        if (status != OrderStatus.SUBMITTED && status != OrderStatus.PARTIAL) {
            throw new IllegalStateException("order " + id + " cannot be filled in status " + status);
        }
        if (filledQty + qty > quantity * (1.0 + EPS) + EPS) {
            throw new IdempotencyViolationException(String.format(
                    "overfill on %s: filled=%.10f + %.10f > qty=%.10f", id, filledQty, qty, quantity));
        }
        Fill fill = new Fill(Fill.fillId(id, fillSeq + 1), id, symbol, side, qty, price, fillFees, ts);

        double newFilled = filledQty + qty;
        avgFillPrice = (avgFillPrice * filledQty + price * qty) / newFilled;
        filledQty = newFilled;
        fees += fillFees;
        fillSeq++;

        OrderStatus next = remainingQty() <= quantity * EPS ? OrderStatus.FILLED : OrderStatus.PARTIAL;
        transition(next, ts);
        return fill;
    }

    private void transition(OrderStatus next, Instant ts) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("illegal order transition " + status + " -> " + next + " for " + id);
        }
        status = next;
        updatedAt = ts;
    }
}
