package com.chicu.regimetrader.provider;

public record ExecutionAck(
        boolean accepted,
        String exchangeOrderId,
        String reason
) {

    public static ExecutionAck accepted(String exchangeOrderId) {
        return new ExecutionAck(true, exchangeOrderId, null);
    }

    public static ExecutionAck rejected(String reason) {
        return new ExecutionAck(false, null, reason);
    }
}
