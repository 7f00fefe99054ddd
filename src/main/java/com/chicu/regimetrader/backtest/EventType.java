package com.chicu.regimetrader.backtest;

/**
 * Типы событий бэктеста. Порядок объявления = порядок обработки внутри одного бара.
 */
public enum EventType {
    BAR_CLOSE,
    SIGNAL,
    ORDER,
    FILL
}
