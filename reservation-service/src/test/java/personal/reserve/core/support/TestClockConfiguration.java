package personal.reserve.core.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import personal.reserve.core.config.ReservationProperties;

import java.time.ZoneId;

/**
 * 테스트에서 시간을 앞당길 수 있도록 기본 Clock을 MutableClock으로 대체
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestClockConfiguration {

    @Bean
    @Primary
    public MutableClock mutableClock(ReservationProperties properties) {
        return new MutableClock(ZoneId.of(properties.timeZone()));
    }
}
