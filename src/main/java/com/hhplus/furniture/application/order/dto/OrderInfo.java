package com.hhplus.furniture.application.order.dto;

import com.hhplus.furniture.domain.order.Order;
import com.hhplus.furniture.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 조회 결과 (트랜잭션 안에서 항목까지 변환)
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderInfo {

    private final Long orderId;
    private final Long userId;
    private final String buyerEmail;
    private final String status;
    private final Long couponId;
    private final BigDecimal creditUsed;
    private final BigDecimal totalPrice;
    private final LocalDateTime createdAt;
    private final List<Item> items;

    public static OrderInfo from(Order order) {
        return OrderInfo.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .buyerEmail(order.getBuyerEmail())
                .status(order.getOrderStatus().name())
                .couponId(order.getCouponId())
                .creditUsed(order.getCreditUsed())
                .totalPrice(order.getTotalPrice())
                .createdAt(order.getCreatedAt())
                .items(order.getOrderItems().stream()
                        .map(Item::from)
                        .collect(Collectors.toList()))
                .build();
    }

    @Getter
    @AllArgsConstructor
    public static class Item {
        private final Long catalogItemId;
        private final String productName;
        private final int quantity;
        private final BigDecimal unitPrice;
        private final BigDecimal subtotal;

        static Item from(OrderItem item) {
            return new Item(item.getCatalogItemId(), item.getProductName(), item.getQuantity(),
                    item.getUnitPrice(), item.getSubtotal());
        }
    }
}
