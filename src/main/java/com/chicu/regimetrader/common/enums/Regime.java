package com.chicu.regimetrader.common.enums;

/** Режим рынка, который отдаёт RegimeDetector. */
public enum Regime {
    TRENDING,
    MEAN_REVERTING,
    CHOPPY
}
