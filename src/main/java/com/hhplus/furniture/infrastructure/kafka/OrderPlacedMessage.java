package com.hhplus.furniture.infrastructure.kafka;

import com.hhplus.furniture.domain.order.event.OrderPlacedEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Kafka로 전송되는 주문 접수 메시지 (JSON)
 *
 * ApplicationEvent는 source 필드를 가지므로 그대로 직렬화하지 않고 이 메시지로 옮긴다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OrderPlacedMessage {

    private Long orderId;
    private Long userId;
    private String buyerEmail;
    private BigDecimal totalPrice;
    private int totalQuantity;
    private LocalDateTime occurredAt;

    public static OrderPlacedMessage from(OrderPlacedEvent event) {
        return new OrderPlacedMessage(
                event.getOrderId(),
                event.getUserId(),
                event.getBuyerEmail(),
                event.getTotalPrice(),
                event.getTotalQuantity(),
                event.getOccurredAt()
        );
    }
}
