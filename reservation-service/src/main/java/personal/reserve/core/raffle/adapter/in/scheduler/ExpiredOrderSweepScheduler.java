package personal.reserve.core.raffle.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.reserve.core.config.ReservationProperties;
import personal.reserve.core.raffle.application.port.in.ExpireOrdersUseCase;

/**
 * Expired Order Sweep Scheduler
 * 결제 시간이 지난 주문을 주기적으로 만료 처리 (reservation.sweep.enabled=true 일 때만 등록)
 * 예약 경로의 lazy sweep이 정합성을 보장하므로 이 스케줄러는 재고 회수를 앞당기는 역할만 함
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "reservation.sweep", name = "enabled", havingValue = "true")
public class ExpiredOrderSweepScheduler {

    private final ExpireOrdersUseCase expireOrdersUseCase;
    private final ReservationProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: application.yml의 reservation.sweep.interval-ms
     * 기본값: 60초
     */
    @Scheduled(fixedDelayString = "${reservation.sweep.interval-ms:60000}")
    public void sweepExpiredOrders() {
        try {
            Timer.Sample sample = Timer.start(meterRegistry);

            int expired = expireOrdersUseCase.expireOverdueOrders(properties.sweep().batchSize());

            sample.stop(Timer.builder("scheduler.order.sweep.duration")
                    .description("Time taken to expire overdue raffle orders")
                    .register(meterRegistry));

            if (expired > 0) {
                Counter.builder("scheduler.order.sweep.expired")
                        .description("Number of raffle orders expired by the sweep")
                        .register(meterRegistry)
                        .increment(expired);

                log.info("Order sweep completed: expired={}", expired);
            }
        } catch (Exception e) {
            log.error("Order sweep failed", e);
        }
    }
}
