package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.risk.RiskMetrics;
import com.chicu.regimetrader.signal.FusedSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Последние известные решения/сигналы/метрики для read API и health.
 * Пишут тики, читают контроллер и health indicator.
 */
@Slf4j
@Service
public class CoreStatusService {

    private final Map<String, Decision> lastDecisions = new ConcurrentHashMap<>();
    private final AtomicReference<RiskMetrics> lastMetrics = new AtomicReference<>();
    private final AtomicReference<String> invariantFailure = new AtomicReference<>();
    private volatile Instant lastTickAt;
    private volatile Instant lastSuppressedTickAt;

    public void recordDecision(Decision decision) {
        lastDecisions.put(decision.symbol(), decision);
    }

    public void recordTick(Instant at) {
        this.lastTickAt = at;
    }

    public void recordSuppressedTick(Instant at) {
        this.lastSuppressedTickAt = at;
    }

    public void recordRiskMetrics(RiskMetrics metrics) {
        lastMetrics.set(metrics);
    }

    public void recordInvariantFailure(String message) {
        invariantFailure.set(message);
        log.error("💥 Invariant failure recorded: {}", message);
    }

    public Optional<FusedSignal> signal(String symbol) {
        return Optional.ofNullable(lastDecisions.get(symbol)).map(Decision::signal);
    }

    public Map<String, FusedSignal> signals() {
        Map<String, FusedSignal> out = new TreeMap<>();
        lastDecisions.forEach((k, v) -> out.put(k, v.signal()));
        return out;
    }

    public Optional<Decision> decision(String symbol) {
        return Optional.ofNullable(lastDecisions.get(symbol));
    }

    public Optional<RiskMetrics> riskMetrics() {
        return Optional.ofNullable(lastMetrics.get());
    }

    public Optional<String> invariantFailure() {
        return Optional.ofNullable(invariantFailure.get());
    }

    public Optional<Instant> lastTickAt() {
        return Optional.ofNullable(lastTickAt);
    }

    public Optional<Instant> lastSuppressedTickAt() {
        return Optional.ofNullable(lastSuppressedTickAt);
    }
}
