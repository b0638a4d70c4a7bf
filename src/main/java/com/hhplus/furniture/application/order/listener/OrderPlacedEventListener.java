package com.hhplus.furniture.application.order.listener;

import com.hhplus.furniture.domain.order.event.OrderPlacedEvent;
import com.hhplus.furniture.infrastructure.kafka.OrderEventProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 접수 이벤트를 결제 트랜잭션 커밋 후 Kafka로 전달한다.
 * 전달 실패는 주문에 영향을 주지 않고 로그만 남긴다.
 */
@Component
public class OrderPlacedEventListener {

    private static final Logger log = LoggerFactory.getLogger(OrderPlacedEventListener.class);

    private final OrderEventProducer orderEventProducer;

    public OrderPlacedEventListener(OrderEventProducer orderEventProducer) {
        this.orderEventProducer = orderEventProducer;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderPlaced(OrderPlacedEvent event) {
        try {
            orderEventProducer.publish(event);
        } catch (Exception e) {
            log.error("[OrderPlacedEventListener] 주문 이벤트 전달 실패: orderId={}, userId={}",
                    event.getOrderId(), event.getUserId(), e);
        }
    }
}
