package com.chicu.regimetrader.provider;

import java.util.OptionalDouble;

/**
 * Сентимент по символу в [-1, 1], уже дедуплицированный и с затуханием.
 * Пустой результат = источник отсутствует (вес перераспределяется).
 */
public interface SentimentProvider {

    OptionalDouble getScore(String symbol);
}
