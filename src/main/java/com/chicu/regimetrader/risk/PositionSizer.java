package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.signal.FusedSignal;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Volatility targeting.
 *
 * <pre>
 * raw      = volTarget / max(realizedVol, volFloor) * |strength|
 * sized    = raw * confidence
 * capped   = min(sized, maxPositionPct)
 * quantity = capped * equity / price
 * </pre>
 */
@Slf4j
public class PositionSizer {

    private final double volTarget;
    private final double volFloor;
    private final double maxPositionPct;
    private final boolean allowShort;

    public PositionSizer(RegimeTraderProperties.Risk risk) {
        this(risk.getVolTarget(), risk.getVolFloor(), risk.getMaxPositionPct(), risk.isAllowShort());
    }

    public PositionSizer(double volTarget, double volFloor, double maxPositionPct, boolean allowShort) {
        if (!(volTarget > 0.0) || !(volFloor > 0.0)) {
            throw new IllegalArgumentException("volTarget and volFloor must be > 0");
        }
        if (!(maxPositionPct > 0.0 && maxPositionPct <= 1.0)) {
            throw new IllegalArgumentException("maxPositionPct must be in (0,1], got " + maxPositionPct);
        }
        this.volTarget = volTarget;
        this.volFloor = volFloor;
        this.maxPositionPct = maxPositionPct;
        this.allowShort = allowShort;
    }

    /**
     * Целевая позиция по сигналу (абсолютная, не дельта).
     * Нулевое количество при FLAT, нечисловой волатильности, price ≤ 0 или equity ≤ 0.
     */
    public SizedOrderIntent size(FusedSignal signal, double realizedVol, double equity, double price) {
        SizedOrderIntent.SizedOrderIntentBuilder b = SizedOrderIntent.builder()
                .symbol(signal.symbol())
                .side(OrderSide.forDirection(signal.direction()))
                .signalStrength(signal.strength())
                .signalRegime(signal.regime())
                .referencePrice(price);

        if (!(price > 0.0) || !Double.isFinite(price)) {
            log.warn("⚠️ Sizer: некорректная цена {} для {}, размер 0", price, signal.symbol());
            return b.quantity(0.0).notionalPctOfEquity(0.0).build();
        }
        if (!(equity > 0.0) || Double.isNaN(realizedVol) || signal.direction() == Direction.FLAT) {
            return b.quantity(0.0).notionalPctOfEquity(0.0).build();
        }

        double pct = targetPct(Math.abs(signal.strength()), signal.confidence(), realizedVol);
        return b.quantity(pct * equity / price).notionalPctOfEquity(pct).build();
    }

    /** Доля капитала в [0, maxPositionPct]. */
    public double targetPct(double absStrength, double confidence, double realizedVol) {
        double vol = Math.max(realizedVol, volFloor);
        double raw = volTarget / vol * absStrength;
        double sized = raw * Math.max(0.0, Math.min(1.0, confidence));
        return Math.max(0.0, Math.min(sized, maxPositionPct));
    }

    /**
     * Ордер, переводящий текущую позицию к целевой.
     * <ul>
     *     <li>LONG: докупается только разница до цели, лишнее не продаётся;</li>
     *     <li>SHORT без allowShort: существующий лонг продаётся до нуля;</li>
     *     <li>SHORT с allowShort: разница до целевого шорта;</li>
     *     <li>FLAT: держим.</li>
     * </ul>
     */
    public Optional<SizedOrderIntent> rebalance(SizedOrderIntent target, Direction direction, double currentSignedQty) {
        double delta;
        double targetPct;
        switch (direction) {
            case LONG -> {
                delta = Math.max(0.0, target.quantity() - Math.max(0.0, currentSignedQty));
                if (currentSignedQty < 0.0) {
                    delta = target.quantity() - currentSignedQty;
                }
                targetPct = target.notionalPctOfEquity();
            }
            case SHORT -> {
                if (allowShort) {
                    delta = -Math.max(0.0, target.quantity() + Math.min(0.0, currentSignedQty));
                    if (currentSignedQty > 0.0) {
                        delta = -(currentSignedQty + target.quantity());
                    }
                    targetPct = target.notionalPctOfEquity();
                } else {
                    delta = currentSignedQty > 0.0 ? -currentSignedQty : 0.0;
                    targetPct = 0.0;
                }
            }
            default -> {
                return Optional.empty();
            }
        }
        if (!(Math.abs(delta) > 0.0)) {
            return Optional.empty();
        }
        return Optional.of(target.toBuilder()
                .side(delta > 0 ? OrderSide.BUY : OrderSide.SELL)
                .quantity(Math.abs(delta))
                .notionalPctOfEquity(targetPct)
                .build());
    }
}
