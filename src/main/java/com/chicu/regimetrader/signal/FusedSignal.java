package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.common.enums.Regime;
import com.chicu.regimetrader.common.enums.SignalSource;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Итог слияния источников.
 * direction == FLAT тогда и только тогда, когда |strength| ≤ порога направления.
 *
 * @param components score по каждому источнику; отсутствующий источник = 0.0
 */
@Builder
public record FusedSignal(
        String symbol,
        Direction direction,
        double strength,
        double confidence,
        Regime regime,
        Map<SignalSource, Double> components,
        Instant timestamp
) {

    public FusedSignal {
        components = components == null ? Map.of() : Map.copyOf(components);
    }

    public boolean isActionable() {
        return direction != Direction.FLAT;
    }
}
