package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.risk.SizedOrderIntent;

import java.util.Comparator;

/**
 * Событие очереди диспетчера. Сортировка: бар → тип → порядок постановки.
 *
 * @param intent  только для ORDER
 * @param orderId только для FILL
 */
public record BacktestEvent(
        int barIndex,
        EventType type,
        long seq,
        SizedOrderIntent intent,
        String orderId
) implements Comparable<BacktestEvent> {

    private static final Comparator<BacktestEvent> ORDER = Comparator
            .comparingInt(BacktestEvent::barIndex)
            .thenComparing(BacktestEvent::type)
            .thenComparingLong(BacktestEvent::seq);

    public static BacktestEvent barClose(int bar, long seq) {
        return new BacktestEvent(bar, EventType.BAR_CLOSE, seq, null, null);
    }

    public static BacktestEvent signal(int bar, long seq) {
        return new BacktestEvent(bar, EventType.SIGNAL, seq, null, null);
    }

    public static BacktestEvent order(int bar, long seq, SizedOrderIntent intent) {
        return new BacktestEvent(bar, EventType.ORDER, seq, intent, null);
    }

    public static BacktestEvent fill(int bar, long seq, String orderId) {
        return new BacktestEvent(bar, EventType.FILL, seq, null, orderId);
    }

    @Override
    public int compareTo(BacktestEvent other) {
        return ORDER.compare(this, other);
    }
}
