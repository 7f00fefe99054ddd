package com.chicu.regimetrader.persistence.jpa;

import com.chicu.regimetrader.common.enums.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface OrderRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByStatusInOrderByCreatedAtAsc(Collection<OrderStatus> statuses);
}
