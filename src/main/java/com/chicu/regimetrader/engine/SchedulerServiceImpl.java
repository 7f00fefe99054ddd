package com.chicu.regimetrader.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class SchedulerServiceImpl implements SchedulerService {

    /**
     * Отдельный поток на каждую задачу: долгий decision-тик не должен задерживать health-тик.
     * daemon=true, чтобы не блокировать завершение приложения.
     */
    private final ScheduledExecutorService executor =
            Executors.newScheduledThreadPool(4, r -> {
                Thread t = new Thread(r);
                t.setDaemon(true);
                t.setName("CoreScheduler-" + t.getId());
                return t;
            });

    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private final Map<String, Instant> startedAt = new ConcurrentHashMap<>();

    // ===== START =====
    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long initialDelaySec, long intervalSec) {
        if (intervalSec <= 0) {
            throw new IllegalArgumentException("intervalSec must be > 0");
        }

        cancel(key);

        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // исключение из scheduleAtFixedRate молча отменяет все следующие запуски
                log.error("❌ Scheduler: task '{}' failed: {}", key, e.getMessage(), e);
            }
        };

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                guarded, Math.max(0, initialDelaySec), intervalSec, TimeUnit.SECONDS);

        tasks.put(key, future);
        startedAt.put(key, Instant.now());

        log.info("⏱ Scheduler: started '{}' (interval={}s)", key, intervalSec);
        return future;
    }

    // ===== CANCEL =====
    @Override
    public void cancel(String key) {
        ScheduledFuture<?> future = tasks.remove(key);
        if (future != null) {
            future.cancel(false);
            log.info("🛑 Scheduler: cancelled task '{}'", key);
        }
        startedAt.remove(key);
    }

    // ===== STATUS =====
    @Override
    public boolean isActive(String key) {
        ScheduledFuture<?> future = tasks.get(key);
        return future != null && !future.isCancelled() && !future.isDone();
    }

    @Override
    public Optional<Instant> getStartedAt(String key) {
        return Optional.ofNullable(startedAt.get(key));
    }

    // ===== SHUTDOWN =====
    @PreDestroy
    public void shutdown() {
        log.info("💤 SchedulerServiceImpl shutting down…");
        executor.shutdownNow();
    }
}
