package com.chicu.regimetrader.signal;

import com.chicu.regimetrader.provider.Prediction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceMapperTest {

    private final ConfidenceMapper mapper = new ConfidenceMapper(0.2, 1.5, 0.5);

    @Test
    void fromIqr_shouldRescaleLinearly_andClip() {
        assertEquals(1.0, mapper.fromIqr(0.2), 1e-12);
        assertEquals(0.0, mapper.fromIqr(1.5), 1e-12);
        assertEquals(0.5, mapper.fromIqr(0.85), 1e-12);
        assertEquals(1.0, mapper.fromIqr(0.05), "узкий интервал обрезается до 1");
        assertEquals(0.0, mapper.fromIqr(3.0), "широкий интервал обрезается до 0");
    }

    @Test
    void confidenceFor_shouldFallBack_whenPredictorUnavailable() {
        assertEquals(0.5, mapper.confidenceFor(null));
    }

    @Test
    void confidenceFor_shouldUseLabelConfidence_whenQuantilesDegenerate() {
        Prediction flat = new Prediction(0.01, 0.01, 0.01, 0.01, 0.01, 2, 0.8);

        assertEquals(0.8, mapper.confidenceFor(flat), 1e-12);
    }

    @Test
    void confidenceFor_shouldUseIqr_otherwise() {
        Prediction p = new Prediction(-1.0, -0.3, 0.0, 0.55, 1.0, 2, 0.9);

        assertEquals(0.5, mapper.confidenceFor(p), 1e-12);
        assertEquals(1.0, p.directionalScore());
    }
}
