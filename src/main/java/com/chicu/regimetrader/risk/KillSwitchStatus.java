package com.chicu.regimetrader.risk;

import lombok.Builder;

import java.time.Instant;

/**
 * Сохраняемое состояние kill switch. Одна запись, переживает рестарт.
 *
 * @param resetEquity капитал в момент ручного reset: новый базовый пик
 */
@Builder(toBuilder = true)
public record KillSwitchStatus(
        KillSwitchState state,
        Instant trippedAt,
        Double drawdownAtTrip,
        Double peakEquityAtTrip,
        Double equityAtTrip,
        Instant resetAt,
        String resetBy,
        String resetNote,
        Double resetEquity,
        Instant updatedAt
) {

    public static KillSwitchStatus armed() {
        return KillSwitchStatus.builder()
                .state(KillSwitchState.ARMED)
                .build();
    }

    public boolean isTripped() {
        return state == KillSwitchState.TRIPPED;
    }
}
