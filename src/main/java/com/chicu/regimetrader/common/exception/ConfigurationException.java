package com.chicu.regimetrader.common.exception;

/**
 * Неверная конфигурация (сумма весов != 1, число состояний HMM != 3 и т.п.).
 * Бросается только на старте, никогда во время принятия решений.
 */
public class ConfigurationException extends TradingCoreException {

    public ConfigurationException(String message) {
        super(message);
    }
}
