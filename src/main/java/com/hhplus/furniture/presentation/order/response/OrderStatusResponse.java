package com.hhplus.furniture.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.order.dto.OrderStatusChange;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("previous_status")
    private String previousStatus;

    @JsonProperty("status")
    private String status;

    public static OrderStatusResponse from(OrderStatusChange change) {
        return new OrderStatusResponse(change.getOrderId(),
                change.getPreviousStatus().name(), change.getCurrentStatus().name());
    }
}
