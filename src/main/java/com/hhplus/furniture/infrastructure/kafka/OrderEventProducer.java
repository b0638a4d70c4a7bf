package com.hhplus.furniture.infrastructure.kafka;

import com.hhplus.furniture.domain.order.event.OrderPlacedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * OrderEventProducer - 주문 접수 이벤트를 Kafka 토픽으로 발행
 *
 * - Key: orderId → 같은 주문은 같은 파티션
 * - 전송 실패는 로그만 남긴다 (주문은 이미 커밋됨)
 */
@Service
public class OrderEventProducer {

    private static final Logger log = LoggerFactory.getLogger(OrderEventProducer.class);

    private final KafkaTemplate<String, OrderPlacedMessage> kafkaTemplate;
    private final String topicName;

    public OrderEventProducer(KafkaTemplate<String, OrderPlacedMessage> kafkaTemplate,
                              @Value("${furniture.kafka.order-topic}") String topicName) {
        this.kafkaTemplate = kafkaTemplate;
        this.topicName = topicName;
    }

    public CompletableFuture<SendResult<String, OrderPlacedMessage>> publish(OrderPlacedEvent event) {
        String key = String.valueOf(event.getOrderId());
        OrderPlacedMessage message = OrderPlacedMessage.from(event);

        log.info("[OrderEventProducer] Kafka 메시지 발행 시작 - topic={}, key={}, userId={}, total={}",
                topicName, key, event.getUserId(), event.getTotalPrice());

        CompletableFuture<SendResult<String, OrderPlacedMessage>> future =
                kafkaTemplate.send(topicName, key, message);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("[OrderEventProducer] Kafka 메시지 발행 성공 - topic={}, partition={}, offset={}, orderId={}",
                        result.getRecordMetadata().topic(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset(),
                        event.getOrderId());
            } else {
                log.error("[OrderEventProducer] Kafka 메시지 발행 실패 - topic={}, key={}, error={}",
                        topicName, key, ex.getMessage(), ex);
            }
        });
        return future;
    }
}
