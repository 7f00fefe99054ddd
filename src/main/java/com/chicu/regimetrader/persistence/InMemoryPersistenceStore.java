package com.chicu.regimetrader.persistence;

import com.chicu.regimetrader.order.Order;
import com.chicu.regimetrader.portfolio.Fill;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.Position;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import com.chicu.regimetrader.risk.RiskMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * In-memory хранилище: бэктесты и тесты. Без durability.
 */
public class InMemoryPersistenceStore implements PersistenceStore {

    private final List<PortfolioSnapshot> snapshots = new ArrayList<>();
    private final Map<String, Position> positions = new TreeMap<>();
    private final Map<String, OrderRecord> orders = new LinkedHashMap<>();
    private final Map<String, Fill> fills = new LinkedHashMap<>();
    private final List<RiskMetrics> riskMetrics = new ArrayList<>();
    private KillSwitchStatus killSwitch;

    @Override
    public synchronized void appendSnapshot(PortfolioSnapshot snapshot) {
        snapshots.add(snapshot);
    }

    @Override
    public synchronized void upsertPosition(Position position) {
        positions.put(position.symbol(), position);
    }

    @Override
    public synchronized void saveOrder(Order order) {
        orders.put(order.getId(), OrderRecord.of(order));
    }

    @Override
    public synchronized void appendFill(Fill fill) {
        fills.putIfAbsent(fill.fillId(), fill);
    }

    @Override
    public synchronized void appendRiskMetrics(RiskMetrics metrics) {
        riskMetrics.add(metrics);
    }

    @Override
    public synchronized void saveKillSwitch(KillSwitchStatus status) {
        this.killSwitch = status;
    }

    @Override
    public synchronized Optional<KillSwitchStatus> loadKillSwitch() {
        return Optional.ofNullable(killSwitch);
    }

    @Override
    public synchronized OptionalDouble maxEquity() {
        return snapshots.stream().mapToDouble(PortfolioSnapshot::equity).max();
    }

    @Override
    public synchronized OptionalDouble maxEquitySince(Instant since) {
        return snapshots.stream()
                .filter(s -> !s.timestamp().isBefore(since))
                .mapToDouble(PortfolioSnapshot::equity)
                .max();
    }

    @Override
    public synchronized Optional<PortfolioSnapshot> latestSnapshot() {
        return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
    }

    @Override
    public synchronized List<PortfolioSnapshot> recentSnapshots(int limit) {
        int from = Math.max(0, snapshots.size() - limit);
        return List.copyOf(snapshots.subList(from, snapshots.size()));
    }

    @Override
    public synchronized Optional<RiskMetrics> latestRiskMetrics() {
        return riskMetrics.isEmpty() ? Optional.empty() : Optional.of(riskMetrics.get(riskMetrics.size() - 1));
    }

    @Override
    public synchronized List<Position> positions() {
        return List.copyOf(positions.values());
    }

    @Override
    public synchronized Optional<OrderRecord> findOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public synchronized boolean hasFill(String fillId) {
        return fills.containsKey(fillId);
    }

    public synchronized List<PortfolioSnapshot> snapshots() {
        return List.copyOf(snapshots);
    }

    public synchronized List<Fill> fills() {
        return List.copyOf(fills.values());
    }
}
