package com.chicu.regimetrader.risk;

import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.portfolio.PortfolioState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pre-trade и post-trade проверки.
 *
 * <p>Pre-trade, по порядку, первая неудача = отказ:
 * kill switch (всегда первым), min notional, лимит позиции, концентрация, свежесть данных.
 * Сокращающий экспозицию ордер лимиты позиции/концентрации не проверяет.</p>
 *
 * <p>Post-trade пересчитывает лимиты после fill'а. Нарушение не откатывает сделку,
 * но запрещает наращивать позицию по символу, пока следующая post-trade проверка не пройдёт.</p>
 */
@Slf4j
public class RiskChecker {

    private static final double LIMIT_EPS = 1e-9;

    private final KillSwitch killSwitch;
    private final double minTradeUsd;
    private final double maxPositionPct;
    private final double maxConcentrationPct;
    private final Duration staleness;

    private final Map<String, RejectReason> restricted = new ConcurrentHashMap<>();

    public RiskChecker(RegimeTraderProperties.Risk risk, KillSwitch killSwitch) {
        this(killSwitch, risk.getMinTradeUsd(), risk.getMaxPositionPct(), risk.getMaxConcentrationPct(),
                Duration.ofMinutes(risk.getStalenessMinutes()));
    }

    public RiskChecker(KillSwitch killSwitch,
                       double minTradeUsd,
                       double maxPositionPct,
                       double maxConcentrationPct,
                       Duration staleness) {
        this.killSwitch = Objects.requireNonNull(killSwitch, "killSwitch");
        this.minTradeUsd = minTradeUsd;
        this.maxPositionPct = maxPositionPct;
        this.maxConcentrationPct = maxConcentrationPct;
        this.staleness = staleness;
    }

    public KillSwitch killSwitch() {
        return killSwitch;
    }

    /**
     * @param dataTimestamp время бара/признаков, на которых принято решение
     * @param now           текущее время по часам вызывающего (в бэктесте = время бара)
     */
    public RiskDecision preTrade(SizedOrderIntent intent, PortfolioState portfolio, Instant dataTimestamp, Instant now) {
        if (killSwitch.isTripped()) {
            return RiskDecision.reject(RejectReason.KILL_SWITCH, "kill switch is TRIPPED");
        }

        double notional = intent.notional();
        if (!(notional >= minTradeUsd)) {
            return RiskDecision.reject(RejectReason.MIN_SIZE,
                    String.format("notional %.2f < min %.2f", notional, minTradeUsd));
        }

        String symbol = intent.symbol();
        double price = intent.referencePrice();
        double current = portfolio.quantity(symbol);
        double resulting = current + intent.signedQuantity();
        boolean reducing = Math.abs(resulting) < Math.abs(current) && Math.signum(resulting) != -Math.signum(current);

        if (!reducing) {
            double equity = portfolio.equity();
            if (!(equity > 0.0)) {
                return RiskDecision.reject(RejectReason.POSITION_LIMIT, "non-positive equity " + equity);
            }

            RejectReason restriction = restricted.get(symbol);
            if (restriction != null) {
                return RiskDecision.reject(restriction, "symbol restricted after post-trade breach");
            }

            double positionPct = Math.abs(resulting) * price / equity;
            if (positionPct > maxPositionPct + LIMIT_EPS) {
                return RiskDecision.reject(RejectReason.POSITION_LIMIT,
                        String.format("position %.4f > max %.4f", positionPct, maxPositionPct));
            }

            double concentration = maxConcentration(portfolio, symbol, resulting * price, equity);
            if (concentration > maxConcentrationPct + LIMIT_EPS) {
                return RiskDecision.reject(RejectReason.CONCENTRATION_LIMIT,
                        String.format("concentration %.4f > max %.4f", concentration, maxConcentrationPct));
            }
        }

        if (dataTimestamp == null || Duration.between(dataTimestamp, now).compareTo(staleness) > 0) {
            return RiskDecision.reject(RejectReason.STALE_DATA,
                    "market data at " + dataTimestamp + " older than " + staleness + " (now " + now + ")");
        }

        return RiskDecision.approve();
    }

    /**
     * Повторная проверка лимитов по фактическому состоянию после fill'а.
     */
    public RiskDecision postTrade(String symbol, PortfolioState portfolio) {
        double equity = portfolio.equity();
        if (!(equity > 0.0)) {
            restricted.put(symbol, RejectReason.POSITION_LIMIT);
            log.warn("⚠️ Post-trade: equity {} ≤ 0, символ {} ограничен", equity, symbol);
            return RiskDecision.reject(RejectReason.POSITION_LIMIT, "non-positive equity");
        }

        Map<String, Double> exposures = portfolio.exposures();
        double positionPct = Math.abs(exposures.getOrDefault(symbol, 0.0)) / equity;
        if (positionPct > maxPositionPct + LIMIT_EPS) {
            restricted.put(symbol, RejectReason.POSITION_LIMIT);
            log.warn("⚠️ Post-trade breach {}: position {} > {}", symbol,
                    String.format("%.4f", positionPct), maxPositionPct);
            return RiskDecision.reject(RejectReason.POSITION_LIMIT, "post-trade position breach");
        }

        double concentration = exposures.values().stream()
                .mapToDouble(v -> Math.abs(v) / equity)
                .max()
                .orElse(0.0);
        if (concentration > maxConcentrationPct + LIMIT_EPS) {
            restricted.put(symbol, RejectReason.CONCENTRATION_LIMIT);
            log.warn("⚠️ Post-trade breach {}: concentration {} > {}", symbol,
                    String.format("%.4f", concentration), maxConcentrationPct);
            return RiskDecision.reject(RejectReason.CONCENTRATION_LIMIT, "post-trade concentration breach");
        }

        if (restricted.remove(symbol) != null) {
            log.info("✅ Post-trade: ограничение по {} снято", symbol);
        }
        return RiskDecision.approve();
    }

    public boolean isRestricted(String symbol) {
        return restricted.containsKey(symbol);
    }

    public double maxConcentration(PortfolioState portfolio) {
        double equity = portfolio.equity();
        if (!(equity > 0.0)) {
            return 0.0;
        }
        return portfolio.exposures().values().stream()
                .mapToDouble(v -> Math.abs(v) / equity)
                .max()
                .orElse(0.0);
    }

    private static double maxConcentration(PortfolioState portfolio, String symbol, double resultingExposure, double equity) {
        Map<String, Double> exposures = portfolio.exposures();
        exposures.put(symbol, resultingExposure);
        return exposures.values().stream()
                .mapToDouble(v -> Math.abs(v) / equity)
                .max()
                .orElse(0.0);
    }
}
