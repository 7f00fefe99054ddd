package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.risk.KillSwitch;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Операторская сторона kill switch: чтение состояния и ручной reset.
 * После reset пик капитала переносится на текущий капитал, иначе следующий снимок снова сработает.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KillSwitchService {

    private final KillSwitch killSwitch;
    private final PortfolioState portfolio;
    private final Clock clock;

    public KillSwitchStatus status() {
        return killSwitch.status();
    }

    public KillSwitchStatus reset(String operator, String note) {
        double equity = portfolio.equity();
        if (killSwitch.reset(operator, note, equity, Instant.now(clock))) {
            portfolio.rebaselinePeak(equity);
        } else {
            log.info("ℹ️ Kill switch reset requested by '{}' but it is already ARMED", operator);
        }
        return killSwitch.status();
    }
}
