package com.chicu.regimetrader.common.enums;

/** Направление сигнала / позиции. FLAT = нет позиции или нет решения. */
public enum Direction {
    LONG,
    SHORT,
    FLAT;

    public static Direction ofSign(double value) {
        if (value > 0) return LONG;
        if (value < 0) return SHORT;
        return FLAT;
    }
}
