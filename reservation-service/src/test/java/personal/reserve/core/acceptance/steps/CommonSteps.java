package personal.reserve.core.acceptance.steps;

import io.cucumber.java.Before;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.reserve.common.exception.BusinessException;
import personal.reserve.core.acceptance.support.ReservationTestContext;
import personal.reserve.core.support.MutableClock;
import personal.reserve.core.support.ReservationDataSeeder;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 공통 스텝: 시나리오 초기화, 시간 경과, 오류 검증
 */
@Slf4j
@RequiredArgsConstructor
public class CommonSteps {

    private final ReservationDataSeeder seeder;
    private final ReservationTestContext context;
    private final MutableClock clock;

    @Before
    public void setUp() {
        log.info(">>> Before: 시나리오 초기화");
        seeder.clearAllData();
        clock.reset();
        context.reset();
    }

    @When("{int}분이 지난다")
    public void 분이_지난다(int minutes) {
        log.info(">>> When: {}분 경과", minutes);
        clock.advance(Duration.ofMinutes(minutes));
    }

    @Then("요청이 {string} 오류로 거부된다")
    public void 요청이_오류로_거부된다(String errorCode) {
        log.info(">>> Then: {} 오류 확인", errorCode);
        assertThat(context.getLastError())
                .as("마지막 요청은 실패해야 함")
                .isInstanceOf(BusinessException.class);
        assertThat(((BusinessException) context.getLastError()).getErrorCode().name()).isEqualTo(errorCode);
    }
}
