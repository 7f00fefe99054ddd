package com.chicu.regimetrader.common.enums;

/** MARKET исполняется как taker, LIMIT как maker. */
public enum OrderType {
    MARKET,
    LIMIT
}
