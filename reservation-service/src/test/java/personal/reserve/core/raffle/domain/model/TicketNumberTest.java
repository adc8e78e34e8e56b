package personal.reserve.core.raffle.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.reserve.common.exception.BusinessException;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TicketNumber 도메인 모델 테스트")
class TicketNumberTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    @Test
    @DisplayName("예약하면 주문과 만료 시각이 함께 기록된다")
    void reserve() {
        // when
        TicketNumber reserved = TicketNumber.available(1L, 7).reserve(100L, NOW.plusMinutes(15));

        // then
        assertThat(reserved.status()).isEqualTo(TicketStatus.RESERVED);
        assertThat(reserved.reservedByOrderId()).isEqualTo(100L);
        assertThat(reserved.reservedUntil()).isEqualTo(NOW.plusMinutes(15));
    }

    @Test
    @DisplayName("해제하면 주문과 만료 시각이 모두 지워진다")
    void release() {
        // given
        TicketNumber reserved = TicketNumber.available(1L, 7).reserve(100L, NOW);

        // when
        TicketNumber released = reserved.release();

        // then
        assertThat(released.isAvailable()).isTrue();
        assertThat(released.reservedByOrderId()).isNull();
        assertThat(released.reservedUntil()).isNull();
    }

    @Test
    @DisplayName("판매 확정 시 주문은 유지하고 만료 시각만 지운다")
    void sell() {
        // when
        TicketNumber sold = TicketNumber.available(1L, 7).reserve(100L, NOW).sell();

        // then
        assertThat(sold.status()).isEqualTo(TicketStatus.SOLD);
        assertThat(sold.reservedByOrderId()).isEqualTo(100L);
        assertThat(sold.reservedUntil()).isNull();
    }

    @Test
    @DisplayName("예약 가능 상태가 아니면 예약할 수 없다")
    void reserve_NotAvailable() {
        TicketNumber reserved = TicketNumber.available(1L, 7).reserve(100L, NOW);

        assertThatThrownBy(() -> reserved.reserve(200L, NOW))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RESERVED");
    }

    @Test
    @DisplayName("RESERVED 상태는 주문과 만료 시각이 모두 있어야 한다")
    void reservedRequiresHold() {
        assertThatThrownBy(() -> new TicketNumber(1L, 1L, 7, TicketStatus.RESERVED, 100L, null))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("AVAILABLE 상태는 예약 정보를 가질 수 없다")
    void availableCannotHoldReservation() {
        assertThatThrownBy(() -> new TicketNumber(1L, 1L, 7, TicketStatus.AVAILABLE, 100L, null))
                .isInstanceOf(BusinessException.class);
    }
}
