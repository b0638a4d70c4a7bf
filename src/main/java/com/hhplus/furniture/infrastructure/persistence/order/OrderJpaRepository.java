package com.hhplus.furniture.infrastructure.persistence.order;

import com.hhplus.furniture.domain.order.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Order JPA Repository
 *
 * orderItems는 LAZY이므로 항목이 필요한 조회는 fetch join을 사용한다.
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems " +
           "WHERE o.userId = :userId " +
           "ORDER BY o.orderId ASC")
    List<Order> findByUserIdWithItems(@Param("userId") Long userId);

    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems " +
           "ORDER BY o.orderId ASC")
    List<Order> findAllWithItems();
}
