package com.chicu.regimetrader.risk;

/**
 * Результат риск-проверки. Отказ: штатный поток управления, не исключение.
 */
public record RiskDecision(
        boolean approved,
        RejectReason reason,
        String detail
) {

    private static final RiskDecision APPROVED = new RiskDecision(true, null, null);

    public static RiskDecision approve() {
        return APPROVED;
    }

    public static RiskDecision reject(RejectReason reason, String detail) {
        return new RiskDecision(false, reason, detail);
    }

    public boolean rejected() {
        return !approved;
    }
}
