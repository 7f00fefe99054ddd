package com.chicu.regimetrader.provider;

import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

/**
 * Сентимент не подключён: источник всегда отсутствует.
 */
@Service
public class NoopSentimentProvider implements SentimentProvider {

    @Override
    public OptionalDouble getScore(String symbol) {
        return OptionalDouble.empty();
    }
}
