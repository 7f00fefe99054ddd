package com.chicu.regimetrader.smoke;

import com.chicu.regimetrader.backtest.BacktestService;
import com.chicu.regimetrader.engine.TradingLoop;
import com.chicu.regimetrader.order.OrderManager;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.persistence.jpa.JpaPersistenceStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ContextSmokeTest {

    @Autowired
    PersistenceStore store;

    @Autowired
    TradingLoop tradingLoop;

    @Autowired
    OrderManager orderManager;

    @Autowired
    BacktestService backtestService;

    @Test
    void coreBeansShouldBeWired() {
        assertInstanceOf(JpaPersistenceStore.class, store);
        assertNotNull(tradingLoop);
        assertNotNull(backtestService);
        assertEquals(OrderManager.Mode.PAPER, orderManager.mode(), "по умолчанию только paper");
    }
}
