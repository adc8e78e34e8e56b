package personal.reserve.core.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.common.exception.TransientInfrastructureException;
import personal.reserve.core.appointment.domain.exception.SlotUnavailableException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StoreFailures 단위 테스트")
class StoreFailuresTest {

    @Test
    @DisplayName("정상 결과는 그대로 반환한다")
    void translate_PassThrough() {
        assertThat(StoreFailures.translate("op", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("락 획득 실패는 LOCK_TIMEOUT 인프라 예외로 변환한다")
    void translate_LockFailure() {
        assertThatThrownBy(() -> StoreFailures.translate("reserve", () -> {
            throw new CannotAcquireLockException("Lock wait timeout exceeded");
        }))
                .isInstanceOf(TransientInfrastructureException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.LOCK_TIMEOUT);
    }

    @Test
    @DisplayName("유니크 제약 경합은 STORE_FAILURE 인프라 예외로 변환한다")
    void translate_IntegrityViolation() {
        assertThatThrownBy(() -> StoreFailures.translate("createAppointment", () -> {
            throw new DataIntegrityViolationException("Duplicate entry");
        }))
                .isInstanceOf(TransientInfrastructureException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.STORE_FAILURE);
    }

    @Test
    @DisplayName("비즈니스 예외는 변환하지 않는다")
    void translate_BusinessException() {
        assertThatThrownBy(() -> StoreFailures.translate("createAppointment", () -> {
            throw new SlotUnavailableException();
        }))
                .isInstanceOf(SlotUnavailableException.class);
    }
}
