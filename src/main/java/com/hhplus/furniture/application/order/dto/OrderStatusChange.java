package com.hhplus.furniture.application.order.dto;

import com.hhplus.furniture.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class OrderStatusChange {

    private final Long orderId;
    private final OrderStatus previousStatus;
    private final OrderStatus currentStatus;
}
