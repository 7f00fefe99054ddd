package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.order.OrderManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Регистрация периодических задач live/paper режима.
 * Выключено, пока regimetrader.scheduler.enabled != true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveScheduling {

    public static final String DECISION_TICK = "decision-tick";
    public static final String HEALTH_TICK = "health-tick";
    public static final String ORDER_POLL = "order-poll";
    public static final String RETRAIN = "retrain";

    private final RegimeTraderProperties properties;
    private final SchedulerService scheduler;
    private final TradingLoop tradingLoop;
    private final RiskMetricsService riskMetricsService;
    private final OrderManager orderManager;
    private final RetrainService retrainService;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        RegimeTraderProperties.Scheduler s = properties.getScheduler();
        if (!s.isEnabled()) {
            log.info("⏸ Live scheduling disabled (regimetrader.scheduler.enabled=false)");
            return;
        }

        scheduler.scheduleAtFixedRate(RETRAIN, () -> retrainService.retrainNow("scheduled"), 0, s.getRetrainIntervalSec());
        scheduler.scheduleAtFixedRate(DECISION_TICK, tradingLoop::tick, 0, s.getDecisionIntervalSec());
        scheduler.scheduleAtFixedRate(HEALTH_TICK, riskMetricsService::healthTick, s.getHealthIntervalSec(), s.getHealthIntervalSec());
        if (orderManager.mode() == OrderManager.Mode.LIVE) {
            scheduler.scheduleAtFixedRate(ORDER_POLL, orderManager::pollOpenOrders,
                    s.getOrderPollIntervalSec(), s.getOrderPollIntervalSec());
        }
        log.info("🚀 Live scheduling started: symbols={} mode={}",
                properties.getUniverse().getSymbols(), orderManager.mode());
    }
}
