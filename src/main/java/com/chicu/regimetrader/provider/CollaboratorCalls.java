package com.chicu.regimetrader.provider;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Вызовы внешних коллабораторов (предиктор, сентимент) со своим таймаутом ядра,
 * независимым от таймаутов самих коллабораторов.
 * Таймаут или ошибка = источник отсутствует.
 */
@Slf4j
public class CollaboratorCalls {

    private final long timeoutMs;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "collaborator-call");
        t.setDaemon(true);
        return t;
    });

    public CollaboratorCalls(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.timeoutMs = timeoutMs;
    }

    public <T> Optional<T> withTimeout(String name, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return Optional.ofNullable(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏳ {}: нет ответа за {} ms, источник пропущен", name, timeoutMs);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("⚠️ {}: ошибка вызова, источник пропущен: {}", name, e.getCause().toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
