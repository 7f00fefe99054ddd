package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.market.Bar;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.provider.MarketFeatures;

import java.util.List;

/**
 * Что видит стратегия на баре {@code index}: только прошлое и текущий закрытый бар.
 *
 * @param history         бары 0..index
 * @param featureHistory  признаки 0..index
 */
public record BarContext(
        String symbol,
        int index,
        Bar bar,
        MarketFeatures features,
        List<Bar> history,
        List<MarketFeatures> featureHistory,
        PortfolioState portfolio
) {
}
