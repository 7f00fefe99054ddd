package com.chicu.regimetrader.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RiskMetricsRepository extends JpaRepository<RiskMetricsEntity, Long> {

    Optional<RiskMetricsEntity> findTopByOrderByComputedAtDescIdDesc();
}
