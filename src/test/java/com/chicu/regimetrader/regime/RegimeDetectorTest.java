package com.chicu.regimetrader.regime;

import com.chicu.regimetrader.common.enums.Regime;
import com.chicu.regimetrader.common.exception.ConfigurationException;
import com.chicu.regimetrader.common.exception.InsufficientDataException;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RegimeDetectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private static RegimeTraderProperties.RegimeProps props() {
        RegimeTraderProperties.RegimeProps p = new RegimeTraderProperties.RegimeProps();
        p.setMinTrainingBars(100);
        p.setClassifyWindow(30);
        return p;
    }

    /** Сегменты по 60 баров с чётко разделённой волатильностью: 0.1 / 0.5 / 1.5. */
    private static List<FeatureVector> segment(double vol, int n, Random rnd) {
        List<FeatureVector> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new FeatureVector(rnd.nextGaussian() * vol * 0.01, vol + rnd.nextGaussian() * vol * 0.02));
        }
        return out;
    }

    private static List<FeatureVector> history(Random rnd) {
        List<FeatureVector> h = new ArrayList<>();
        for (int round = 0; round < 4; round++) {
            h.addAll(segment(0.1, 60, rnd));
            h.addAll(segment(0.5, 60, rnd));
            h.addAll(segment(1.5, 60, rnd));
        }
        return h;
    }

    @Test
    void constructor_shouldRejectStateCountOtherThanThree() {
        RegimeTraderProperties.RegimeProps p = props();
        p.setStates(4);

        assertThrows(ConfigurationException.class, () -> new RegimeDetector(p));
    }

    @Test
    void classify_shouldFailBeforeFit() {
        RegimeDetector detector = new RegimeDetector(props());

        assertFalse(detector.isFitted());
        assertThrows(InsufficientDataException.class,
                () -> detector.classify("BTCUSDT", NOW, List.of(new FeatureVector(0.0, 0.1))));
    }

    @Test
    void fit_shouldFail_whenTooFewFiniteBars() {
        RegimeDetector detector = new RegimeDetector(props());
        List<FeatureVector> h = new ArrayList<>(segment(0.1, 90, new Random(1)));
        for (int i = 0; i < 20; i++) {
            h.add(new FeatureVector(Double.NaN, 0.1));
        }

        InsufficientDataException ex = assertThrows(InsufficientDataException.class, () -> detector.fit(h));
        assertTrue(ex.getMessage().contains("not enough bars"));
    }

    @Test
    void mapping_shouldFollowVolatilityOrder() {
        RegimeDetector detector = new RegimeDetector(props());
        detector.fit(history(new Random(7)));

        Map<Regime, double[]> means = detector.regimeMeans();

        assertEquals(3, means.size());
        assertTrue(means.get(Regime.TRENDING)[1] < means.get(Regime.MEAN_REVERTING)[1]);
        assertTrue(means.get(Regime.MEAN_REVERTING)[1] < means.get(Regime.CHOPPY)[1]);
    }

    @Test
    void classify_shouldLabelLowVolTrendingAndHighVolChoppy() {
        Random rnd = new Random(11);
        RegimeDetector detector = new RegimeDetector(props());
        detector.fit(history(rnd));

        RegimeState calm = detector.classify("BTCUSDT", NOW, segment(0.1, 30, rnd));
        RegimeState wild = detector.classify("BTCUSDT", NOW, segment(1.5, 30, rnd));

        assertEquals(Regime.TRENDING, calm.regime());
        assertEquals(Regime.CHOPPY, wild.regime());
        assertTrue(wild.confidence() > 0.5);
        double total = wild.probabilities().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, total, 1e-6, "апостериор по режимам суммируется в 1");
    }

    @Test
    void fit_shouldBeDeterministicForSameSeed() {
        List<FeatureVector> h = history(new Random(3));
        RegimeDetector a = new RegimeDetector(props());
        RegimeDetector b = new RegimeDetector(props());
        a.fit(h);
        b.fit(h);

        List<FeatureVector> window = h.subList(h.size() - 30, h.size());
        assertEquals(a.classify("X", NOW, window), b.classify("X", NOW, window));
    }

    @Test
    void refit_shouldRederiveLabelsFromVolatility_onShiftedHistory() {
        Random rnd = new Random(21);
        RegimeDetector detector = new RegimeDetector(props());

        detector.fit(history(rnd));
        assertVolatilityOrdered(detector.regimeMeans());

        // другой уровень волатильности и обратный порядок сегментов: индексы состояний HMM меняются
        List<FeatureVector> shifted = new ArrayList<>();
        for (int round = 0; round < 4; round++) {
            shifted.addAll(segment(3.0, 60, rnd));
            shifted.addAll(segment(1.0, 60, rnd));
            shifted.addAll(segment(0.3, 60, rnd));
        }
        detector.fit(shifted);

        Map<Regime, double[]> means = detector.regimeMeans();
        assertVolatilityOrdered(means);
        assertTrue(means.get(Regime.CHOPPY)[1] > 2.0, "CHOPPY = самый волатильный кластер новой истории");
        assertEquals(Regime.CHOPPY, detector.classify("BTCUSDT", NOW, segment(3.0, 30, rnd)).regime());
        assertEquals(Regime.TRENDING, detector.classify("BTCUSDT", NOW, segment(0.3, 30, rnd)).regime());
    }

    private static void assertVolatilityOrdered(Map<Regime, double[]> means) {
        assertEquals(3, means.size());
        assertTrue(means.get(Regime.TRENDING)[1] < means.get(Regime.MEAN_REVERTING)[1]);
        assertTrue(means.get(Regime.MEAN_REVERTING)[1] < means.get(Regime.CHOPPY)[1]);
    }
}
