package com.hhplus.furniture.domain.order;

import com.hhplus.furniture.domain.catalog.PricePolicy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * OrderItem - 주문 항목 (주문 시점의 상품명/단가 스냅샷)
 *
 * 핵심 비즈니스 규칙:
 * - 수량은 1 이상
 * - 단가는 0 이상
 * - 소계 = 단가 × 수량
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @Column(name = "catalog_item_id", nullable = false)
    private Long catalogItemId;

    @Column(name = "product_name", nullable = false, length = 500)
    private String productName;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "subtotal", nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static OrderItem createOrderItem(Long catalogItemId, String productName, Integer quantity, BigDecimal unitPrice) {
        if (catalogItemId == null) {
            throw new IllegalArgumentException("카탈로그 상품 ID는 필수입니다");
        }
        if (quantity == null || quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("단가는 0 이상이어야 합니다");
        }

        return OrderItem.builder()
                .catalogItemId(catalogItemId)
                .productName(productName)
                .quantity(quantity)
                .unitPrice(PricePolicy.money(unitPrice))
                .subtotal(PricePolicy.money(unitPrice.multiply(BigDecimal.valueOf(quantity))))
                .createdAt(LocalDateTime.now())
                .build();
    }
}
