package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.provider.MarketFeatures;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalScorerTest {

    @Test
    void score_shouldCombineIndicators_contrarian() {
        // RSI 30 → +0.4, %B 0.25 → +0.5, vwapDev -0.01 → +0.2
        MarketFeatures f = new MarketFeatures(0.0, 0.5, 30.0, 1.0, 0.25, -0.01);

        OptionalDouble s = TechnicalScorer.score(f);

        assertTrue(s.isPresent());
        assertEquals(0.4 * 0.4 + 0.3 * 0.5 + 0.3 * 0.2, s.getAsDouble(), 1e-12);
    }

    @Test
    void score_shouldRenormalize_whenSomeIndicatorsMissing() {
        MarketFeatures f = new MarketFeatures(0.0, 0.5, 100.0, Double.NaN, Double.NaN, Double.NaN);

        assertEquals(-1.0, TechnicalScorer.score(f).getAsDouble(), 1e-12);
    }

    @Test
    void score_shouldBeAbsent_whenNoIndicators() {
        assertTrue(TechnicalScorer.score(MarketFeatures.regimeOnly(0.01, 0.3)).isEmpty());
        assertTrue(TechnicalScorer.score(null).isEmpty());
    }
}
