package com.hhplus.furniture.application.order;

import com.hhplus.furniture.application.order.dto.OrderInfo;
import com.hhplus.furniture.application.order.dto.OrderStatusChange;
import com.hhplus.furniture.domain.order.Order;
import com.hhplus.furniture.domain.order.OrderNotFoundException;
import com.hhplus.furniture.domain.order.OrderRepository;
import com.hhplus.furniture.domain.order.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 상태 관리 및 조회
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;

    public OrderService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * 주문 상태를 한 단계 진행한다 (매니저).
     *
     * @throws OrderNotFoundException 주문이 없는 경우
     * @throws com.hhplus.furniture.domain.order.InvalidOrderStatusException 이미 DELIVERED인 경우
     */
    @Transactional
    public OrderStatusChange advanceStatus(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        OrderStatus previous = order.getOrderStatus();
        OrderStatus current = order.advance();
        orderRepository.save(order);

        log.info("[OrderService] 주문 상태 변경: orderId={}, {} -> {}", orderId, previous, current);
        return new OrderStatusChange(orderId, previous, current);
    }

    @Transactional(readOnly = true)
    public List<OrderInfo> findAll() {
        return orderRepository.findAll().stream()
                .map(OrderInfo::from)
                .collect(Collectors.toList());
    }

    /**
     * 사용자 주문 이력 (주문 순)
     */
    @Transactional(readOnly = true)
    public List<OrderInfo> history(Long userId) {
        return orderRepository.findByUserId(userId).stream()
                .map(OrderInfo::from)
                .collect(Collectors.toList());
    }
}
