package com.chicu.regimetrader.market;

import java.util.List;

/**
 * Поставщик закрытых баров для live/paper цикла.
 * Хранилище и загрузка свечей: вне ядра.
 */
public interface MarketDataProvider {

    /**
     * Последние закрытые бары, по возрастанию времени.
     * Пустой список = данных нет, цикл по символу пропускается.
     */
    List<Bar> recentBars(String symbol, int limit);
}
