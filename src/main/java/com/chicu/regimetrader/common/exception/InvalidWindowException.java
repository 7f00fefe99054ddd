package com.chicu.regimetrader.common.exception;

/** Окна walk-forward не помещаются в историю: прогон оценки невозможен. */
public class InvalidWindowException extends TradingCoreException {

    public InvalidWindowException(String message) {
        super(message);
    }
}
