package com.chicu.regimetrader.backtest;

/**
 * Результат симуляции исполнения на одном баре.
 */
public record SimulatedFill(double quantity, double price, double fees) {

    public double notional() {
        return quantity * price;
    }
}
