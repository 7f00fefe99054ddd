package com.chicu.regimetrader.provider;

import com.chicu.regimetrader.validation.WalkForwardSplit;

/**
 * Внешнее обучение квантильной модели на одном walk-forward фолде.
 *
 * @return метрика валидации на тестовом окне фолда (чем больше, тем лучше)
 */
public interface ModelTrainer {

    double train(String symbol, WalkForwardSplit fold);
}
