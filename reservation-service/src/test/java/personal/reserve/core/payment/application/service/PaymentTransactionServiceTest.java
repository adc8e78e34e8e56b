package personal.reserve.core.payment.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.reserve.core.payment.application.port.in.RecordPaymentTransactionCommand;
import personal.reserve.core.payment.application.port.out.PaymentTargetValidationPort;
import personal.reserve.core.payment.application.port.out.PaymentTransactionRepository;
import personal.reserve.core.payment.domain.exception.PaymentTargetNotFoundException;
import personal.reserve.core.payment.domain.model.PaymentProvider;
import personal.reserve.core.payment.domain.model.PaymentTarget;
import personal.reserve.core.payment.domain.model.PaymentTransaction;
import personal.reserve.core.payment.domain.model.PaymentTransactionStatus;
import personal.reserve.core.support.TestFixtures;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentTransactionService 단위 테스트")
class PaymentTransactionServiceTest {

    private static final Long TENANT_ID = 1L;
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    @Mock
    private PaymentTransactionRepository paymentTransactionRepository;
    @Mock
    private PaymentTargetValidationPort targetValidation;

    private PaymentTransactionService service;

    @BeforeEach
    void setUp() {
        service = new PaymentTransactionService(paymentTransactionRepository, targetValidation,
                TestFixtures.fixedClock(NOW));
    }

    @Test
    @DisplayName("PAID 거래는 확인 시각과 함께 기록된다")
    void recordTransaction_Paid() {
        // given
        PaymentTarget target = PaymentTarget.order(100L);
        given(targetValidation.exists(TENANT_ID, target)).willReturn(true);
        given(paymentTransactionRepository.save(any(PaymentTransaction.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        PaymentTransaction recorded = service.recordTransaction(new RecordPaymentTransactionCommand(
                TENANT_ID, PaymentProvider.BANCARD, "bc-123", new BigDecimal("20.00"), null,
                PaymentTransactionStatus.PAID, target, null));

        // then
        assertThat(recorded.currency()).isEqualTo("USD");
        assertThat(recorded.confirmedAt()).isEqualTo(NOW);
        assertThat(recorded.target().orderId()).isEqualTo(100L);
        assertThat(recorded.target().appointmentId()).isNull();
    }

    @Test
    @DisplayName("제공자와 상태를 생략하면 MANUAL, PENDING으로 기록한다")
    void recordTransaction_Defaults() {
        // given
        PaymentTarget target = PaymentTarget.appointment(5L);
        given(targetValidation.exists(TENANT_ID, target)).willReturn(true);
        given(paymentTransactionRepository.save(any(PaymentTransaction.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        PaymentTransaction recorded = service.recordTransaction(new RecordPaymentTransactionCommand(
                TENANT_ID, null, "cash-1", new BigDecimal("35.00"), "PYG", null, target, "paid at desk"));

        // then
        assertThat(recorded.provider()).isEqualTo(PaymentProvider.MANUAL);
        assertThat(recorded.status()).isEqualTo(PaymentTransactionStatus.PENDING);
        assertThat(recorded.confirmedAt()).isNull();
    }

    @Test
    @DisplayName("테넌트 안에 없는 대상에는 거래를 기록할 수 없다")
    void recordTransaction_TargetNotFound() {
        // given
        PaymentTarget target = PaymentTarget.order(404L);
        given(targetValidation.exists(TENANT_ID, target)).willReturn(false);

        // when & then
        assertThatThrownBy(() -> service.recordTransaction(new RecordPaymentTransactionCommand(
                TENANT_ID, PaymentProvider.BANCARD, "bc-9", BigDecimal.ONE, "USD", null, target, null)))
                .isInstanceOf(PaymentTargetNotFoundException.class)
                .hasMessageContaining("type=ORDER, id=404");
        verify(paymentTransactionRepository, never()).save(any());
    }
}
