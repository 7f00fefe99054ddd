package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.order.Order;
import com.chicu.regimetrader.persistence.OrderRecord;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.Fill;
import com.chicu.regimetrader.portfolio.PortfolioSnapshot;
import com.chicu.regimetrader.portfolio.Position;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import com.chicu.regimetrader.risk.RiskMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Хранилище live/paper режима поверх Spring Data JPA.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaPersistenceStore implements PersistenceStore {

    private final PortfolioSnapshotRepository snapshotRepository;
    private final PositionRepository positionRepository;
    private final OrderRepository orderRepository;
    private final FillRepository fillRepository;
    private final RiskMetricsRepository riskMetricsRepository;
    private final KillSwitchStateRepository killSwitchRepository;

    @Override
    @Transactional
    public void appendSnapshot(PortfolioSnapshot snapshot) {
        snapshotRepository.save(PortfolioSnapshotEntity.from(snapshot));
    }

    @Override
    @Transactional
    public void upsertPosition(Position position) {
        PositionEntity e = positionRepository.findById(position.symbol()).orElseGet(PositionEntity::new);
        e.apply(position);
        positionRepository.save(e);
    }

    @Override
    @Transactional
    public void saveOrder(Order order) {
        OrderEntity e = orderRepository.findById(order.getId()).orElseGet(OrderEntity::new);
        e.apply(order);
        orderRepository.save(e);
    }

    @Override
    @Transactional
    public void appendFill(Fill fill) {
        if (fillRepository.existsById(fill.fillId())) {
            log.debug("[Store] fill {} already stored", fill.fillId());
            return;
        }
        fillRepository.save(FillEntity.from(fill));
    }

    @Override
    @Transactional
    public void appendRiskMetrics(RiskMetrics metrics) {
        riskMetricsRepository.save(RiskMetricsEntity.from(metrics));
    }

    /**
     * Отдельная транзакция: срабатывание фиксируется независимо от внешней.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void saveKillSwitch(KillSwitchStatus status) {
        KillSwitchStateEntity e = killSwitchRepository.findById(KillSwitchStateEntity.SINGLETON_ID)
                .orElseGet(KillSwitchStateEntity::new);
        e.apply(status);
        killSwitchRepository.saveAndFlush(e);
        log.info("💾 kill_switch_state ← {}", status.state());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<KillSwitchStatus> loadKillSwitch() {
        return killSwitchRepository.findById(KillSwitchStateEntity.SINGLETON_ID)
                .map(KillSwitchStateEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public OptionalDouble maxEquity() {
        return snapshotRepository.findMaxEquity()
                .map(OptionalDouble::of)
                .orElseGet(OptionalDouble::empty);
    }

    @Override
    @Transactional(readOnly = true)
    public OptionalDouble maxEquitySince(Instant since) {
        return snapshotRepository.findMaxEquitySince(since)
                .map(OptionalDouble::of)
                .orElseGet(OptionalDouble::empty);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PortfolioSnapshot> latestSnapshot() {
        return snapshotRepository.findTopByOrderByTimestampDescIdDesc()
                .map(PortfolioSnapshotEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PortfolioSnapshot> recentSnapshots(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<PortfolioSnapshot> out = new ArrayList<>();
        for (PortfolioSnapshotEntity e : snapshotRepository.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, limit))) {
            out.add(e.toDomain());
        }
        Collections.reverse(out);
        return out;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RiskMetrics> latestRiskMetrics() {
        return riskMetricsRepository.findTopByOrderByComputedAtDescIdDesc()
                .map(RiskMetricsEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> positions() {
        return positionRepository.findAll().stream()
                .map(PositionEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderRecord> findOrder(String orderId) {
        return orderRepository.findById(orderId).map(OrderEntity::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasFill(String fillId) {
        return fillRepository.existsById(fillId);
    }
}
