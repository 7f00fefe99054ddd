package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.Regime;
import lombok.Builder;

/**
 * Предложение ордера после сайзинга.
 *
 * @param quantity              всегда ≥ 0, направление в side
 * @param notionalPctOfEquity   доля капитала целевой позиции, ≤ maxPositionPct
 * @param referencePrice        цена, по которой считался размер
 */
@Builder(toBuilder = true)
public record SizedOrderIntent(
        String symbol,
        OrderSide side,
        double quantity,
        double notionalPctOfEquity,
        double signalStrength,
        Regime signalRegime,
        double referencePrice
) {

    public double notional() {
        return quantity * referencePrice;
    }

    public boolean isEmpty() {
        return !(quantity > 0.0);
    }

    public double signedQuantity() {
        return side == null ? 0.0 : side.sign() * quantity;
    }
}
