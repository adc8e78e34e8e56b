package personal.reserve.core.appointment.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.reserve.common.exception.BusinessException;
import personal.reserve.core.tenant.domain.model.BusinessHours;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SlotGenerator 단위 테스트")
class SlotGeneratorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);

    private final SlotGenerator slotGenerator = new SlotGenerator();

    @Test
    @DisplayName("영업 시간 안에서 간격마다 후보를 만들고, 종료 시각을 넘는 슬롯은 제외한다")
    void candidates_WithinBusinessHours() {
        // given
        BusinessHours hours = new BusinessHours(9, 12, 30);

        // when
        List<LocalDateTime> slots = slotGenerator.candidates(hours, DAY, 60);

        // then
        assertThat(slots).containsExactly(
                DAY.atTime(9, 0), DAY.atTime(9, 30), DAY.atTime(10, 0), DAY.atTime(10, 30), DAY.atTime(11, 0));
    }

    @Test
    @DisplayName("소요 시간이 영업 시간보다 길면 후보가 없다")
    void candidates_DurationLongerThanWindow() {
        assertThat(slotGenerator.candidates(new BusinessHours(9, 10, 30), DAY, 90)).isEmpty();
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 후보를 만든다")
    void candidates_Deterministic() {
        BusinessHours hours = new BusinessHours(9, 18, 30);

        assertThat(slotGenerator.candidates(hours, DAY, 30))
                .isEqualTo(slotGenerator.candidates(hours, DAY, 30))
                .hasSize(18);
    }

    @Test
    @DisplayName("소요 시간이 0 이하이면 예외가 발생한다")
    void candidates_InvalidDuration() {
        assertThatThrownBy(() -> slotGenerator.candidates(new BusinessHours(9, 18, 30), DAY, 0))
                .isInstanceOf(BusinessException.class);
    }
}
