package com.chicu.regimetrader.portfolio;

import com.chicu.regimetrader.common.enums.OrderSide;

import java.time.Instant;
import java.util.Objects;

/**
 * Исполнение (полное или частичное) ордера.
 * fillId = orderId#seq: ключ дедупликации.
 */
public record Fill(
        String fillId,
        String orderId,
        String symbol,
        OrderSide side,
        double quantity,
        double price,
        double fees,
        Instant timestamp
) {

    public Fill {
        Objects.requireNonNull(fillId, "fillId");
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        if (!(quantity > 0.0) || !Double.isFinite(quantity)) {
            throw new IllegalArgumentException("fill quantity must be > 0, got " + quantity);
        }
        if (!(price > 0.0) || !Double.isFinite(price)) {
            throw new IllegalArgumentException("fill price must be > 0, got " + price);
        }
        if (fees < 0.0 || !Double.isFinite(fees)) {
            throw new IllegalArgumentException("fees must be >= 0, got " + fees);
        }
    }

    public static String fillId(String orderId, int sequence) {
        return orderId + "#" + sequence;
    }

    public double notional() {
        return quantity * price;
    }

    /** Сравнение содержимого без учёта fillId (для поиска конфликтующих дублей). */
    public boolean sameContentAs(Fill other) {
        return orderId.equals(other.orderId)
                && symbol.equals(other.symbol)
                && side == other.side
                && Double.compare(quantity, other.quantity) == 0
                && Double.compare(price, other.price) == 0
                && Double.compare(fees, other.fees) == 0;
    }
}
