package com.chicu.regimetrader.order;

import com.chicu.regimetrader.common.exception.IdempotencyViolationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр открытых ордеров + per-symbol in-flight флаг.
 * Пока по символу есть неподтверждённый/незакрытый ордер, новый тик решений по нему не запускает.
 * Терминальные ордера уходят из реестра через {@link #close(Order)}; их id помнятся
 * в ограниченном окне последних закрытых.
 */
public class OrderBook {

    static final int CLOSED_IDS_RETAINED = 10_000;

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Set<String> inFlightSymbols = ConcurrentHashMap.newKeySet();
    private final Set<String> closedIds = Collections.newSetFromMap(Collections.synchronizedMap(
            new LinkedHashMap<>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > CLOSED_IDS_RETAINED;
                }
            }));

    /** @throws IdempotencyViolationException id уже выдавался */
    public void register(Order order) {
        if (closedIds.contains(order.getId()) || orders.putIfAbsent(order.getId(), order) != null) {
            throw new IdempotencyViolationException("order id reused: " + order.getId());
        }
    }

    /**
     * Убрать терминальный ордер из реестра и освободить символ.
     *
     * @throws IllegalStateException ордер ещё открыт
     */
    public void close(Order order) {
        if (order.isOpen()) {
            throw new IllegalStateException("order " + order.getId() + " is still open: " + order.getStatus());
        }
        orders.remove(order.getId());
        closedIds.add(order.getId());
        inFlightSymbols.remove(order.getSymbol());
    }

    public Optional<Order> get(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public List<Order> open() {
        return orders.values().stream()
                .filter(Order::isOpen)
                .toList();
    }

    /** @return false, если по символу уже есть ордер в полёте */
    public boolean tryAcquire(String symbol) {
        return inFlightSymbols.add(symbol);
    }

    public void release(String symbol) {
        inFlightSymbols.remove(symbol);
    }

    public boolean isInFlight(String symbol) {
        return inFlightSymbols.contains(symbol);
    }

    public int size() {
        return orders.size();
    }
}
