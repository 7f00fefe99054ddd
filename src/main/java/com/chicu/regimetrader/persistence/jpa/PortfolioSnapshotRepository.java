package com.chicu.regimetrader.persistence.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PortfolioSnapshotRepository extends JpaRepository<PortfolioSnapshotEntity, Long> {

    @Query("select max(s.equity) from PortfolioSnapshotEntity s")
    Optional<Double> findMaxEquity();

    @Query("select max(s.equity) from PortfolioSnapshotEntity s where s.timestamp >= :since")
    Optional<Double> findMaxEquitySince(@Param("since") Instant since);

    Optional<PortfolioSnapshotEntity> findTopByOrderByTimestampDescIdDesc();

    List<PortfolioSnapshotEntity> findAllByOrderByTimestampDescIdDesc(Pageable pageable);
}
