package com.hhplus.furniture.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.order.dto.OrderInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("user_email")
    private String userEmail;

    @JsonProperty("status")
    private String status;

    @JsonProperty("coupon_id")
    private Long couponId;

    @JsonProperty("credit_used")
    private BigDecimal creditUsed;

    @JsonProperty("total_price")
    private BigDecimal totalPrice;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("items")
    private List<OrderItemResponse> items;

    public static OrderResponse from(OrderInfo info) {
        return OrderResponse.builder()
                .orderId(info.getOrderId())
                .userEmail(info.getBuyerEmail())
                .status(info.getStatus())
                .couponId(info.getCouponId())
                .creditUsed(info.getCreditUsed())
                .totalPrice(info.getTotalPrice())
                .createdAt(info.getCreatedAt())
                .items(info.getItems().stream()
                        .map(OrderItemResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderItemResponse {

        @JsonProperty("item_id")
        private Long itemId;

        @JsonProperty("name")
        private String name;

        @JsonProperty("quantity")
        private int quantity;

        @JsonProperty("unit_price")
        private BigDecimal unitPrice;

        @JsonProperty("subtotal")
        private BigDecimal subtotal;

        static OrderItemResponse from(OrderInfo.Item item) {
            return new OrderItemResponse(item.getCatalogItemId(), item.getProductName(), item.getQuantity(),
                    item.getUnitPrice(), item.getSubtotal());
        }
    }
}
