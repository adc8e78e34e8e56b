package personal.reserve.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Reservation Service Application
 * 예약(Appointment) 및 추첨 티켓(Raffle) 할당 코어를 포함하는 서비스
 */
@EnableScheduling  // 만료 주문 정리 스케줄러 (reservation.sweep.enabled=true 일 때만 등록)
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.reserve.core",
        "personal.reserve.common"  // common 모듈의 GlobalExceptionHandler 스캔
    }
)
public class ReservationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
