package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.risk.KillSwitch;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * /actuator/health: DOWN, пока kill switch TRIPPED или зафиксирован сбой инварианта.
 */
@Component("tradingCore")
@RequiredArgsConstructor
public class KillSwitchHealthIndicator implements HealthIndicator {

    private final KillSwitch killSwitch;
    private final CoreStatusService status;

    @Override
    public Health health() {
        KillSwitchStatus s = killSwitch.status();
        Health.Builder b = s.isTripped() ? Health.down() : Health.up();
        b.withDetail("killSwitch", s.state().name());
        if (s.isTripped()) {
            b.withDetail("trippedAt", String.valueOf(s.trippedAt()));
            b.withDetail("drawdownAtTrip", String.valueOf(s.drawdownAtTrip()));
        }
        status.invariantFailure().ifPresent(msg -> {
            b.down();
            b.withDetail("invariantFailure", msg);
        });
        status.lastTickAt().ifPresent(t -> b.withDetail("lastTickAt", t.toString()));
        return b.build();
    }
}
