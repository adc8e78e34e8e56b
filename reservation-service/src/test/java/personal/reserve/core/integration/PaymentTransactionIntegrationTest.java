package personal.reserve.core.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import personal.reserve.core.payment.application.port.in.RecordPaymentTransactionCommand;
import personal.reserve.core.payment.application.port.in.RecordPaymentTransactionUseCase;
import personal.reserve.core.payment.domain.exception.PaymentTargetNotFoundException;
import personal.reserve.core.payment.domain.model.PaymentProvider;
import personal.reserve.core.payment.domain.model.PaymentTarget;
import personal.reserve.core.payment.domain.model.PaymentTransaction;
import personal.reserve.core.payment.domain.model.PaymentTransactionStatus;
import personal.reserve.core.raffle.application.port.in.ReserveSpecificTicketsCommand;
import personal.reserve.core.raffle.application.port.in.ReserveTicketsUseCase;
import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("결제 거래 기록 통합 테스트")
class PaymentTransactionIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private RecordPaymentTransactionUseCase recordPaymentTransactionUseCase;

    @Autowired
    private ReserveTicketsUseCase reserveTicketsUseCase;

    @Test
    @DisplayName("주문 대상 결제 거래를 저장하고 외부 ID로 조회한다")
    void recordForOrder_PersistsAndFindsByExternalId() {
        // given
        Long tenantId = seeder.createTenant("pay-club");
        Long raffleId = seeder.createRaffleWithTickets(tenantId, 1, 5);
        RaffleOrder order = reserveTicketsUseCase.reserveSpecific(
                new ReserveSpecificTicketsCommand(raffleId, List.of(1, 2), 1L));

        // when
        PaymentTransaction saved = recordPaymentTransactionUseCase.recordTransaction(new RecordPaymentTransactionCommand(
                tenantId, PaymentProvider.BANCARD, "bc-9001", order.totalAmount(), "USD",
                PaymentTransactionStatus.PAID, PaymentTarget.order(order.id()), null));

        // then
        assertThat(saved.id()).isNotNull();
        assertThat(saved.confirmedAt()).isNotNull();
        List<PaymentTransaction> found = recordPaymentTransactionUseCase.findByExternalId(tenantId, "bc-9001");
        assertThat(found).hasSize(1);
        assertThat(found.get(0).target()).isEqualTo(PaymentTarget.order(order.id()));
        assertThat(found.get(0).amount()).isEqualByComparingTo(new BigDecimal("10.00"));
    }

    @Test
    @DisplayName("다른 테넌트의 주문을 대상으로 하면 거부된다")
    void orderOfAnotherTenant_Rejected() {
        // given
        Long tenantId = seeder.createTenant("pay-club");
        Long otherTenantId = seeder.createTenant("other-club");
        Long raffleId = seeder.createRaffleWithTickets(tenantId, 1, 5);
        RaffleOrder order = reserveTicketsUseCase.reserveSpecific(
                new ReserveSpecificTicketsCommand(raffleId, List.of(3), 1L));

        // when & then
        assertThatThrownBy(() -> recordPaymentTransactionUseCase.recordTransaction(new RecordPaymentTransactionCommand(
                otherTenantId, PaymentProvider.MANUAL, "manual-1", new BigDecimal("5.00"), "USD",
                PaymentTransactionStatus.PENDING, PaymentTarget.order(order.id()), null)))
                .isInstanceOf(PaymentTargetNotFoundException.class);
    }
}
