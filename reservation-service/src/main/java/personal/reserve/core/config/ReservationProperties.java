package personal.reserve.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Reservation 설정 Properties
 * application.yml의 reservation.* 설정을 바인딩
 * 테넌트 설정(Tenant.settings)에 값이 없을 때 사용하는 기본값
 */
@ConfigurationProperties(prefix = "reservation")
public record ReservationProperties(
        @DefaultValue("UTC") String timeZone,
        @DefaultValue Appointment appointment,
        @DefaultValue Raffle raffle,
        @DefaultValue Sweep sweep,
        @DefaultValue Notification notification
) {
    public record Appointment(
            @DefaultValue("9") int businessStartHour,
            @DefaultValue("18") int businessEndHour,
            @DefaultValue("30") int slotIntervalMinutes,
            @DefaultValue("30") int nextSlotSearchDays
    ) {}

    public record Raffle(
            @DefaultValue("15") int reservationTimeoutMinutes,
            @DefaultValue("1") int minTicketsPerOrder,
            @DefaultValue("50") int maxTicketsPerOrder,
            @DefaultValue("1000") int ticketGenerationBatchSize
    ) {}

    /**
     * 주기(reservation.sweep.interval-ms)는 스케줄러의 @Scheduled 플레이스홀더가 직접 읽음
     */
    public record Sweep(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("100") int batchSize
    ) {}

    public record Notification(
            @DefaultValue("raffle.order.paid") String paymentConfirmedTopic
    ) {}
}
