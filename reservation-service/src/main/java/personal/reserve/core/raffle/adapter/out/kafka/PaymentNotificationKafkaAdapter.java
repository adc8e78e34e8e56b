package personal.reserve.core.raffle.adapter.out.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.reserve.core.config.ReservationProperties;
import personal.reserve.core.raffle.application.port.out.PaymentNotificationPort;
import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.util.List;

/**
 * Payment Notification Kafka Adapter (Adapter Layer)
 * 결제 확정 이벤트를 Kafka로 발행 (key = orderId)
 * 발행 실패는 로그만 남김 (이미 커밋된 결제 확정은 되돌리지 않음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentNotificationKafkaAdapter implements PaymentNotificationPort {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final ReservationProperties properties;

    @Override
    public void notifyPaymentConfirmed(RaffleOrder order, List<Integer> ticketNumbers) {
        String topic = properties.notification().paymentConfirmedTopic();
        String key = String.valueOf(order.id());

        String payload;
        try {
            payload = objectMapper.writeValueAsString(PaymentConfirmedEvent.of(order, ticketNumbers));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize payment confirmation: orderId={}", order.id(), e);
            return;
        }

        log.debug("Publishing payment confirmation: topic={}, key={}", topic, key);
        kafkaTemplate.send(topic, key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish payment confirmation: topic={}, orderId={}", topic, order.id(), ex);
                    } else {
                        log.info("Payment confirmation published: topic={}, orderId={}", topic, order.id());
                    }
                });
    }
}
