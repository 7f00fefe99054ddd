package com.chicu.regimetrader.provider;

import com.chicu.regimetrader.order.Order;

/**
 * Биржевой адаптер. Только сообщает факты: машиной состояний ордера владеет ядро.
 */
public interface ExecutionAdapter {

    String exchangeName();

    ExecutionAck submit(Order order);

    OrderStatusReport poll(String orderId);

    boolean cancel(String orderId);
}
