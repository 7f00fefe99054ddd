package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.persistence.InMemoryPersistenceStore;
import com.chicu.regimetrader.portfolio.Fill;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.PortfolioState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RiskCheckerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private KillSwitch killSwitch;
    private RiskChecker checker;
    private PortfolioState portfolio;

    @BeforeEach
    void setUp() {
        killSwitch = new KillSwitch(0.15, new InMemoryPersistenceStore());
        checker = new RiskChecker(killSwitch, 10.0, 0.25, 0.30, Duration.ofMinutes(30));
        portfolio = new PortfolioState(100_000);
        portfolio.markPrice("BTCUSDT", 100.0);
        portfolio.markPrice("ETHUSDT", 10.0);
    }

    private static SizedOrderIntent buy(String symbol, double qty, double price) {
        return SizedOrderIntent.builder().symbol(symbol).side(OrderSide.BUY).quantity(qty).referencePrice(price).build();
    }

    private static SizedOrderIntent sell(String symbol, double qty, double price) {
        return SizedOrderIntent.builder().symbol(symbol).side(OrderSide.SELL).quantity(qty).referencePrice(price).build();
    }

    private void hold(String symbol, double qty, double price) {
        portfolio.applyFill(new Fill("RT-test-" + symbol + "#1", "RT-test-" + symbol, symbol, OrderSide.BUY, qty, price, 0.0, NOW));
    }

    @Test
    void withinLimits_shouldApprove() {
        RiskDecision d = checker.preTrade(buy("BTCUSDT", 200, 100), portfolio, NOW, NOW);

        assertTrue(d.approved());
    }

    @Test
    void killSwitch_shouldBeFirstCheck() {
        killSwitch.evaluate(new PortfolioSnapshot(NOW, 80_000, 80_000, 0, 0, 0, 0.2));

        // даже ордер ниже минимального размера получает KILL_SWITCH
        RiskDecision d = checker.preTrade(buy("BTCUSDT", 0.01, 100), portfolio, NOW, NOW);

        assertEquals(RejectReason.KILL_SWITCH, d.reason());
    }

    @Test
    void tooSmall_shouldRejectMinSize() {
        assertEquals(RejectReason.MIN_SIZE, checker.preTrade(buy("BTCUSDT", 0.05, 100), portfolio, NOW, NOW).reason());
    }

    @Test
    void aboveMaxPosition_shouldRejectPositionLimit() {
        RiskDecision d = checker.preTrade(buy("BTCUSDT", 300, 100), portfolio, NOW, NOW);

        assertEquals(RejectReason.POSITION_LIMIT, d.reason());
        assertNotNull(d.detail());
    }

    @Test
    void otherSymbolAboveConcentration_shouldRejectConcentrationLimit() {
        // ETH: 2400 * 14.6 ≈ 0.32 капитала после роста цены
        hold("ETHUSDT", 2_400, 10.0);
        portfolio.markPrice("ETHUSDT", 14.6);

        RiskDecision d = checker.preTrade(buy("BTCUSDT", 100, 100), portfolio, NOW, NOW);

        assertEquals(RejectReason.CONCENTRATION_LIMIT, d.reason());
    }

    @Test
    void reducingOrder_shouldBypassExposureLimits() {
        hold("BTCUSDT", 240, 100.0);
        portfolio.markPrice("BTCUSDT", 150.0);

        RiskDecision d = checker.preTrade(sell("BTCUSDT", 50, 150), portfolio, NOW, NOW);

        assertTrue(d.approved());
    }

    @Test
    void staleData_shouldReject() {
        RiskDecision d = checker.preTrade(buy("BTCUSDT", 10, 100), portfolio, NOW.minus(Duration.ofHours(1)), NOW);

        assertEquals(RejectReason.STALE_DATA, d.reason());
    }

    @Test
    void defaultStaleness_shouldBeThirtyMinutes() {
        RiskChecker fromDefaults = new RiskChecker(new RegimeTraderProperties().getRisk(), killSwitch);

        assertTrue(fromDefaults.preTrade(buy("BTCUSDT", 10, 100), portfolio, NOW.minus(Duration.ofMinutes(29)), NOW).approved());
        assertEquals(RejectReason.STALE_DATA,
                fromDefaults.preTrade(buy("BTCUSDT", 10, 100), portfolio, NOW.minus(Duration.ofMinutes(31)), NOW).reason());
    }

    @Test
    void postTradeBreach_shouldRestrictSymbol_untilCheckPasses() {
        hold("BTCUSDT", 240, 100.0);
        portfolio.markPrice("BTCUSDT", 130.0);

        assertTrue(checker.postTrade("BTCUSDT", portfolio).rejected());
        assertTrue(checker.isRestricted("BTCUSDT"));
        assertEquals(RejectReason.POSITION_LIMIT,
                checker.preTrade(buy("BTCUSDT", 1, 130), portfolio, NOW, NOW).reason());

        portfolio.markPrice("BTCUSDT", 100.0);
        assertTrue(checker.postTrade("BTCUSDT", portfolio).approved());
        assertFalse(checker.isRestricted("BTCUSDT"));
    }
}
