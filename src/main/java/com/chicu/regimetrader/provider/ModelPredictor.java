package com.chicu.regimetrader.provider;

/**
 * Внешний квантильный предиктор (gradient boosting). Обучение: вне ядра.
 */
public interface ModelPredictor {

    Prediction predict(String symbol, MarketFeatures features);
}
