package com.chicu.regimetrader.provider;

import com.chicu.regimetrader.validation.WalkForwardSplit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Заглушка тренера: фолды перебираются, модель не обучается.
 */
@Slf4j
@Service
public class NoopModelTrainer implements ModelTrainer {

    @Override
    public double train(String symbol, WalkForwardSplit fold) {
        log.debug("[Trainer][STUB] symbol={} fold={}", symbol, fold);
        return 0.0;
    }
}
