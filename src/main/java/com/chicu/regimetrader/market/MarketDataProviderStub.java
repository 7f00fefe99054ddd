package com.chicu.regimetrader.market;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Заглушка рыночных данных: чтобы контекст стартовал без подключённого хранилища свечей.
 */
@Slf4j
@Service
public class MarketDataProviderStub implements MarketDataProvider {

    @Override
    public List<Bar> recentBars(String symbol, int limit) {
        if (log.isDebugEnabled()) {
            log.debug("[MarketData][STUB] symbol={} limit={} -> empty", symbol, limit);
        }
        return List.of();
    }
}
