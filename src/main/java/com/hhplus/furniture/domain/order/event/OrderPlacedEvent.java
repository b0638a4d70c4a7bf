package com.hhplus.furniture.domain.order.event;

import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 접수 이벤트. 결제 트랜잭션 커밋 후 외부로 전달된다.
 */
@Getter
@ToString
public class OrderPlacedEvent extends ApplicationEvent {

    private final Long orderId;
    private final Long userId;
    private final String buyerEmail;
    private final BigDecimal totalPrice;
    private final int totalQuantity;
    private final LocalDateTime occurredAt;

    public OrderPlacedEvent(Long orderId, Long userId, String buyerEmail, BigDecimal totalPrice, int totalQuantity) {
        super(orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.buyerEmail = buyerEmail;
        this.totalPrice = totalPrice;
        this.totalQuantity = totalQuantity;
        this.occurredAt = LocalDateTime.now();
    }
}
