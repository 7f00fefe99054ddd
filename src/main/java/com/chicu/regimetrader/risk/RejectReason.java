package com.chicu.regimetrader.risk;

/** Причина отказа риск-проверки. Порядок = порядок проверок. */
public enum RejectReason {
    KILL_SWITCH,
    MIN_SIZE,
    POSITION_LIMIT,
    CONCENTRATION_LIMIT,
    STALE_DATA
}
