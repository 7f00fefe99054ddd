package com.chicu.regimetrader.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface KillSwitchStateRepository extends JpaRepository<KillSwitchStateEntity, Long> {
}
