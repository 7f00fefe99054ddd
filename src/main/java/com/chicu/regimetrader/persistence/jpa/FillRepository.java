package com.chicu.regimetrader.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FillRepository extends JpaRepository<FillEntity, String> {

    List<FillEntity> findByOrderIdOrderByFilledAtAsc(String orderId);
}
