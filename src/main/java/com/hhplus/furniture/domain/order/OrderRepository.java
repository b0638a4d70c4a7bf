package com.hhplus.furniture.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * OrderRepository - 주문 저장소 포트
 */
public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long orderId);

    List<Order> findByUserId(Long userId);

    List<Order> findAll();
}
