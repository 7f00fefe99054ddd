package com.chicu.regimetrader.common.exception;

/** Базовое исключение ядра принятия решений. */
public class TradingCoreException extends RuntimeException {

    public TradingCoreException(String message) {
        super(message);
    }

    public TradingCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
