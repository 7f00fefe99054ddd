package com.chicu.regimetrader.common.exception;

/**
 * Нарушение инварианта идемпотентности fill'ов.
 * Никогда не глушится: это баг, а не штатная ситуация.
 */
public class IdempotencyViolationException extends TradingCoreException {

    public IdempotencyViolationException(String message) {
        super(message);
    }
}
