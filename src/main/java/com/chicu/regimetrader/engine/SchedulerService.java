package com.chicu.regimetrader.engine;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Планировщик периодических задач по строковому ключу.
 * Только крутит Runnable по таймеру, про символы и портфель не знает.
 */
public interface SchedulerService {

    /**
     * @param key           уникальный ключ задачи (decision-tick, health-tick, ...)
     * @param initialDelaySec задержка первого запуска
     */
    ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long initialDelaySec, long intervalSec);

    void cancel(String key);

    boolean isActive(String key);

    Optional<Instant> getStartedAt(String key);
}
