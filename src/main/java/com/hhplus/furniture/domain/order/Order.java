package com.hhplus.furniture.domain.order;

import com.hhplus.furniture.domain.catalog.PricePolicy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티 (완료된 장바구니의 영구 기록)
 *
 * 핵심 비즈니스 규칙:
 * - 주문 금액은 생성 시 확정되며 이후 변경되지 않는다
 * - 주문 생성 시 최소 1개 이상의 항목 필요
 * - 상태는 PENDING → SHIPPED → DELIVERED 순서로 한 단계씩만 진행
 * - 삭제되지 않는다
 */
@Entity
@Table(name = "orders", indexes = @Index(name = "idx_orders_user_id", columnList = "user_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "buyer_email", nullable = false, length = 25)
    private String buyerEmail;

    @Column(name = "order_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus;

    @Column(name = "coupon_id")
    private Long couponId;

    @Column(name = "credit_used", nullable = false, precision = 12, scale = 2)
    private BigDecimal creditUsed;

    @Column(name = "total_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(cascade = CascadeType.PERSIST, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드. 주문은 PENDING 상태로 생성된다.
     *
     * @param totalPrice 쿠폰/크레딧 적용 후 결제 금액
     */
    public static Order createOrder(Long userId, String buyerEmail, Long couponId,
                                    BigDecimal creditUsed, BigDecimal totalPrice, List<OrderItem> items) {
        if (userId == null || buyerEmail == null) {
            throw new IllegalArgumentException("주문자 정보는 필수입니다");
        }
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("주문 항목은 최소 1개 이상이어야 합니다");
        }
        if (totalPrice == null || totalPrice.signum() < 0) {
            throw new IllegalArgumentException("주문 금액은 음수가 될 수 없습니다");
        }
        if (creditUsed == null || creditUsed.signum() < 0) {
            throw new IllegalArgumentException("사용 크레딧은 음수가 될 수 없습니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return Order.builder()
                .userId(userId)
                .buyerEmail(buyerEmail)
                .orderStatus(OrderStatus.PENDING)
                .couponId(couponId)
                .creditUsed(PricePolicy.money(creditUsed))
                .totalPrice(PricePolicy.money(totalPrice))
                .orderItems(new ArrayList<>(items))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 상태를 한 단계 진행한다.
     *
     * @throws InvalidOrderStatusException DELIVERED 상태인 경우 (상태는 바뀌지 않음)
     */
    public OrderStatus advance() {
        if (this.orderStatus.isFinal()) {
            throw new InvalidOrderStatusException(this.orderId,
                    "더 이상 진행할 수 없습니다. 현재 상태: " + this.orderStatus.name());
        }
        this.orderStatus = this.orderStatus.next();
        this.updatedAt = LocalDateTime.now();
        return this.orderStatus;
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    public int getTotalQuantity() {
        return orderItems.stream()
                .mapToInt(OrderItem::getQuantity)
                .sum();
    }
}
