package personal.reserve.core.raffle.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.reserve.core.raffle.application.port.out.OrderRepository;
import personal.reserve.core.raffle.application.port.out.OrderTicketRepository;
import personal.reserve.core.raffle.application.port.out.PaymentNotificationPort;
import personal.reserve.core.raffle.domain.exception.InvalidOrderStateException;
import personal.reserve.core.raffle.domain.exception.OrderNotFoundException;
import personal.reserve.core.raffle.domain.model.OrderStatus;
import personal.reserve.core.raffle.domain.model.RaffleOrder;
import personal.reserve.core.raffle.domain.service.OrderLifecycleManager;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderLifecycleService 단위 테스트")
class OrderLifecycleServiceTest {

    private static final Long ORDER_ID = 100L;
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    @Mock
    private OrderLifecycleManager lifecycleManager;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderTicketRepository orderTicketRepository;
    @Mock
    private PaymentNotificationPort paymentNotificationPort;
    @InjectMocks
    private OrderLifecycleService service;

    private RaffleOrder paidOrder() {
        return new RaffleOrder(ORDER_ID, 2L, 1L, 9L, 2, new BigDecimal("20.00"), "USD", OrderStatus.PAID,
                "proof-1", NOW.plusMinutes(10), NOW, NOW.minusMinutes(5));
    }

    @Test
    @DisplayName("결제 확정 후 번호 목록과 함께 알림을 보낸다")
    void confirmPaid_Notifies() {
        // given
        RaffleOrder paid = paidOrder();
        given(lifecycleManager.confirmPaid(ORDER_ID, "proof-1")).willReturn(paid);
        given(orderTicketRepository.findTicketNumbersByOrderId(ORDER_ID)).willReturn(List.of(3, 8));

        // when
        RaffleOrder result = service.confirmPaid(ORDER_ID, "proof-1");

        // then
        assertThat(result).isEqualTo(paid);
        verify(paymentNotificationPort).notifyPaymentConfirmed(paid, List.of(3, 8));
    }

    @Test
    @DisplayName("알림 실패는 결제 확정 결과에 영향을 주지 않는다")
    void confirmPaid_NotificationFailureSwallowed() {
        // given
        RaffleOrder paid = paidOrder();
        given(lifecycleManager.confirmPaid(ORDER_ID, "proof-1")).willReturn(paid);
        given(orderTicketRepository.findTicketNumbersByOrderId(ORDER_ID)).willReturn(List.of(3, 8));
        willThrow(new IllegalStateException("broker down"))
                .given(paymentNotificationPort).notifyPaymentConfirmed(any(), any());

        // when
        RaffleOrder result = service.confirmPaid(ORDER_ID, "proof-1");

        // then
        assertThat(result.status()).isEqualTo(OrderStatus.PAID);
    }

    @Test
    @DisplayName("결제 확정이 실패하면 알림을 보내지 않는다")
    void confirmPaid_FailureSkipsNotification() {
        // given
        given(lifecycleManager.confirmPaid(ORDER_ID, "proof-1"))
                .willThrow(new InvalidOrderStateException("Cannot confirm order with status: CANCELLED"));

        // when & then
        assertThatThrownBy(() -> service.confirmPaid(ORDER_ID, "proof-1"))
                .isInstanceOf(InvalidOrderStateException.class);
        verify(paymentNotificationPort, never()).notifyPaymentConfirmed(any(), any());
    }

    @Test
    @DisplayName("없는 주문의 번호 목록은 조회할 수 없다")
    void getTicketNumbers_NotFound() {
        // given
        given(orderRepository.findById(ORDER_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> service.getTicketNumbers(ORDER_ID))
                .isInstanceOf(OrderNotFoundException.class);
    }
}
