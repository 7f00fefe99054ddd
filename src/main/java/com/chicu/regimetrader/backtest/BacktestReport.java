package com.chicu.regimetrader.backtest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;

/**
 * Текстовый и JSON-отчёт по метрикам бэктеста.
 */
@UtilityClass
public class BacktestReport {

    private static final String LINE = "=".repeat(50);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String format(BacktestMetrics m) {
        if (!m.ok()) {
            return LINE + "\nBACKTEST FAILED: " + m.reason() + "\n" + LINE;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(LINE).append('\n');
        sb.append(String.format(Locale.ROOT, "BACKTEST REPORT: %s %s%n", m.strategy(), m.symbol()));
        sb.append(String.format(Locale.ROOT, "Period: %s .. %s (%d bars)%n", m.startAt(), m.endAt(), m.bars()));
        sb.append(LINE).append('\n');
        row(sb, "Total Return", pct(m.totalReturn()));
        row(sb, "Annualized Return", pct(m.annualizedReturn()));
        row(sb, "Sharpe Ratio", num(m.sharpe()));
        row(sb, "Sortino Ratio", num(m.sortino()));
        row(sb, "Calmar Ratio", num(m.calmar()));
        row(sb, "Max Drawdown", pct(m.maxDrawdown()));
        row(sb, "Max DD Duration (bars)", String.valueOf(m.maxDrawdownDurationBars()));
        row(sb, "Hit Rate", pct(m.hitRate()));
        row(sb, "Profit Factor", num(m.profitFactor()));
        row(sb, "Total Trades", String.valueOf(m.totalTrades()));
        row(sb, "Annual Turnover", num(m.annualTurnover()));
        row(sb, "Total Fees", num(m.totalFees()));
        if (m.rejections() != null && !m.rejections().isEmpty()) {
            row(sb, "Risk Rejections", m.rejections().toString());
        }
        sb.append(LINE);
        return sb.toString();
    }

    /** Стратегия против бенчмарков в одной таблице. */
    public String compare(List<BacktestMetrics> runs) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-24s %10s %8s %8s %6s%n", "Strategy", "Return", "Sharpe", "MaxDD", "Trades"));
        for (BacktestMetrics m : runs) {
            sb.append(String.format(Locale.ROOT, "%-24s %10s %8s %8s %6d%n",
                    m.strategy(), pct(m.totalReturn()), num(m.sharpe()), pct(m.maxDrawdown()), m.totalTrades()));
        }
        return sb.toString();
    }

    public String toJson(BacktestMetrics metrics) {
        try {
            return MAPPER.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize backtest metrics", e);
        }
    }

    private void row(StringBuilder sb, String name, String value) {
        sb.append(String.format(Locale.ROOT, "%-25s %s%n", name + ":", value));
    }

    private String pct(double v) {
        return String.format(Locale.ROOT, "%.2f%%", v * 100.0);
    }

    private String num(double v) {
        if (Double.isInfinite(v)) {
            return v > 0 ? "inf" : "-inf";
        }
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
