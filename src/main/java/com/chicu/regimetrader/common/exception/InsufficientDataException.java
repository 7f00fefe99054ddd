package com.chicu.regimetrader.common.exception;

/**
 * Слишком мало истории для fit/classify.
 * Восстановимая ошибка: цикл пропускается, предыдущий режим/сигнал сохраняется.
 */
public class InsufficientDataException extends TradingCoreException {

    private final int available;
    private final int required;

    public InsufficientDataException(String message, int available, int required) {
        super(message + " (available=" + available + ", required=" + required + ")");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
