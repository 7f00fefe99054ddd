package com.chicu.regimetrader.common.enums;

public enum OrderSide {
    BUY,
    SELL;

    public int sign() {
        return this == BUY ? 1 : -1;
    }

    public static OrderSide forDirection(Direction direction) {
        return direction == Direction.SHORT ? SELL : BUY;
    }
}
