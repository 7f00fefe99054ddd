package com.chicu.regimetrader.backtest;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder(toBuilder = true)
public record BacktestMetrics(

        // статус выполнения
        boolean ok,
        String reason,

        // идентификация
        String strategy,
        String symbol,
        Instant startAt,
        Instant endAt,
        int bars,

        // доходность
        double totalReturn,
        double annualizedReturn,
        double sharpe,
        double sortino,
        double calmar,

        // риск
        double maxDrawdown,
        int maxDrawdownDurationBars,

        // сделки
        int totalTrades,
        int wins,
        int losses,
        double hitRate,
        double profitFactor,
        double annualTurnover,
        double totalFees,

        // отказы риска по причинам (диагностика)
        Map<String, Integer> rejections
) {

    // -----------------------------------------------------
    // Factories
    // -----------------------------------------------------

    public static BacktestMetrics fail(String reason) {
        return BacktestMetrics.builder()
                .ok(false)
                .reason(reason)
                .rejections(Map.of())
                .build();
    }
}
