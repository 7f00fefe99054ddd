package com.chicu.regimetrader.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Заглушка ML.
 * Чтобы приложение СТАРТОВАЛО, пока не подключена реальная модель.
 * Возвращает "нейтрально" с вырожденными квантилями.
 */
@Slf4j
@Service
public class ModelPredictorStub implements ModelPredictor {

    @Override
    public Prediction predict(String symbol, MarketFeatures features) {
        Prediction out = new Prediction(0, 0, 0, 0, 0, 1, 0.5);
        if (log.isDebugEnabled()) {
            log.debug("[ModelPredictor][STUB] symbol={} -> {}", symbol, out);
        }
        return out;
    }
}
