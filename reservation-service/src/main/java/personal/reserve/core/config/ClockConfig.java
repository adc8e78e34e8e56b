package personal.reserve.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 시간 소스 설정
 * 모든 만료/가용성 판단은 이 Clock 기준 (테스트에서 교체 가능)
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(ReservationProperties properties) {
        return Clock.system(ZoneId.of(properties.timeZone()));
    }
}
