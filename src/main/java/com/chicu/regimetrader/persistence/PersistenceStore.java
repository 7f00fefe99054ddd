package com.chicu.regimetrader.persistence;

import com.chicu.regimetrader.order.Order;
import com.chicu.regimetrader.portfolio.Fill;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.Position;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import com.chicu.regimetrader.risk.RiskMetrics;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Хранилище состояния ядра. Таблицы/колонки: деталь реализации.
 * Бэктест работает на {@link InMemoryPersistenceStore}, live: на JPA.
 */
public interface PersistenceStore {

    void appendSnapshot(PortfolioSnapshot snapshot);

    void upsertPosition(Position position);

    void saveOrder(Order order);

    void appendFill(Fill fill);

    void appendRiskMetrics(RiskMetrics metrics);

    /** Должно быть durable к моменту возврата. */
    void saveKillSwitch(KillSwitchStatus status);

    Optional<KillSwitchStatus> loadKillSwitch();

    OptionalDouble maxEquity();

    OptionalDouble maxEquitySince(Instant since);

    Optional<PortfolioSnapshot> latestSnapshot();

    /** Последние снимки, по возрастанию времени. */
    List<PortfolioSnapshot> recentSnapshots(int limit);

    Optional<RiskMetrics> latestRiskMetrics();

    List<Position> positions();

    Optional<OrderRecord> findOrder(String orderId);

    boolean hasFill(String fillId);
}
