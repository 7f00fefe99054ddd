package com.chicu.regimetrader.market;

import java.time.Instant;
import java.util.Objects;

/**
 * OHLCV бар. Неизменяемый, упорядочен по времени внутри символа.
 * timestamp: время открытия бара.
 */
public record Bar(
        Instant timestamp,
        String symbol,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public Bar {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(symbol, "symbol");
    }

    public static Bar of(Instant ts, String symbol, double close, double volume) {
        return new Bar(ts, symbol, close, close, close, close, volume);
    }

    public double dollarVolume() {
        return close * volume;
    }
}
