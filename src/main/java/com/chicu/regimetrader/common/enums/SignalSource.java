package com.chicu.regimetrader.common.enums;

/** Источники сигналов для fusion. Порядок фиксирован: technical, ml, sentiment. */
public enum SignalSource {
    TECHNICAL,
    ML,
    SENTIMENT
}
