package personal.reserve.core.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import personal.reserve.core.appointment.application.port.in.AppointmentLifecycleUseCase;
import personal.reserve.core.appointment.application.port.in.CreateAppointmentCommand;
import personal.reserve.core.appointment.application.port.in.CreateAppointmentUseCase;
import personal.reserve.core.appointment.application.port.in.GetAvailabilityUseCase;
import personal.reserve.core.appointment.domain.exception.SlotUnavailableException;
import personal.reserve.core.appointment.domain.model.Appointment;
import personal.reserve.core.appointment.domain.model.AppointmentStatus;
import personal.reserve.core.appointment.domain.model.CustomerContact;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("예약 생성 동시성 통합 테스트")
class AppointmentBookingConcurrencyTest extends IntegrationTestSupport {

    @Autowired
    private CreateAppointmentUseCase createAppointmentUseCase;

    @Autowired
    private AppointmentLifecycleUseCase lifecycleUseCase;

    @Autowired
    private GetAvailabilityUseCase availabilityUseCase;

    private Long tenantId;
    private LocalDate tomorrow;

    @BeforeEach
    void setUp() {
        tenantId = seeder.createTenant("downtown-clinic");
        tomorrow = LocalDate.now(clock).plusDays(1);
    }

    @Test
    @DisplayName("같은 슬롯에 동시에 예약하면 정확히 하나만 생성된다")
    void sameSlot_OnlyOneAppointmentCreated() throws Exception {
        // given
        Long serviceId = seeder.createService(tenantId, 60, 0, 10);
        LocalDateTime slot = tomorrow.atTime(10, 0);
        int threads = 6;

        // when
        List<Outcome<Appointment>> outcomes = runConcurrently(threads, index ->
                createAppointmentUseCase.createAppointment(command(serviceId, "+1-555-010" + index, slot)));

        // then
        assertThat(outcomes).filteredOn(Outcome::succeeded).hasSize(1);
        assertThat(outcomes).filteredOn(outcome -> !outcome.succeeded())
                .hasSize(threads - 1)
                .allSatisfy(outcome -> assertThat(outcome.error()).isInstanceOf(SlotUnavailableException.class));
        assertThat(availabilityUseCase.getAvailableSlots(tenantId, serviceId, tomorrow, null))
                .doesNotContain(slot);
    }

    @Test
    @DisplayName("버퍼 시간 안에 겹치는 예약은 거부된다")
    void overlappingWithBuffer_Rejected() {
        // given
        Long serviceId = seeder.createService(tenantId, 60, 15, 10);
        createAppointmentUseCase.createAppointment(command(serviceId, "+1-555-0100", tomorrow.atTime(10, 0)));

        // when & then
        assertThatThrownBy(() -> createAppointmentUseCase.createAppointment(
                command(serviceId, "+1-555-0101", tomorrow.atTime(11, 0))))
                .isInstanceOf(SlotUnavailableException.class);

        Appointment later = createAppointmentUseCase.createAppointment(
                command(serviceId, "+1-555-0102", tomorrow.atTime(11, 30)));
        assertThat(later.status()).isEqualTo(AppointmentStatus.PENDING);
    }

    @Test
    @DisplayName("일일 예약 한도에 도달하면 같은 날 추가 예약이 거부된다")
    void dailyLimitReached_Rejected() {
        // given
        Long serviceId = seeder.createService(tenantId, 30, 0, 2);
        createAppointmentUseCase.createAppointment(command(serviceId, "+1-555-0200", tomorrow.atTime(9, 0)));
        createAppointmentUseCase.createAppointment(command(serviceId, "+1-555-0201", tomorrow.atTime(13, 0)));

        // when & then
        assertThatThrownBy(() -> createAppointmentUseCase.createAppointment(
                command(serviceId, "+1-555-0202", tomorrow.atTime(16, 0))))
                .isInstanceOf(SlotUnavailableException.class);
        assertThat(availabilityUseCase.isServiceAvailableOn(tenantId, serviceId, tomorrow)).isFalse();
    }

    @Test
    @DisplayName("취소된 예약의 슬롯은 다시 예약할 수 있다")
    void cancelledAppointment_FreesSlot() {
        // given
        Long serviceId = seeder.createService(tenantId, 60, 0, 10);
        LocalDateTime slot = tomorrow.atTime(14, 0);
        Appointment first = createAppointmentUseCase.createAppointment(command(serviceId, "+1-555-0300", slot));

        // when
        Appointment cancelled = lifecycleUseCase.cancel(tenantId, first.id(), "schedule conflict");
        Appointment second = createAppointmentUseCase.createAppointment(command(serviceId, "+1-555-0301", slot));

        // then
        assertThat(cancelled.status()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(cancelled.internalNotes()).contains("schedule conflict");
        assertThat(second.scheduledAt()).isEqualTo(slot);
    }

    @Test
    @DisplayName("같은 전화번호로 다시 예약하면 기존 고객을 재사용한다")
    void samePhone_ReusesCustomer() {
        // given
        Long serviceId = seeder.createService(tenantId, 30, 0, 10);

        // when
        Appointment first = createAppointmentUseCase.createAppointment(
                command(serviceId, "+1-555-0400", tomorrow.atTime(9, 0)));
        Appointment second = createAppointmentUseCase.createAppointment(
                command(serviceId, "+1-555-0400", tomorrow.atTime(15, 0)));

        // then
        assertThat(second.customerId()).isEqualTo(first.customerId());
    }

    @Test
    @DisplayName("새 전화번호로 서로 다른 서비스에 동시에 예약해도 모두 성공하고 고객은 하나만 생긴다")
    void newPhone_ConcurrentBookingsOnDifferentServices_AllSucceed() throws Exception {
        // given
        Long haircut = seeder.createService(tenantId, 30, 0, 10);
        Long coloring = seeder.createService(tenantId, 30, 0, 10);
        List<Long> services = List.of(haircut, coloring);

        for (int round = 0; round < 5; round++) {
            String phone = "+1-555-07" + round;
            LocalDateTime slot = tomorrow.atTime(9 + round, 0);

            // when
            List<Outcome<Appointment>> outcomes = runConcurrently(services.size(), index ->
                    createAppointmentUseCase.createAppointment(
                            command(services.get(index), phone, slot)));

            // then
            assertThat(outcomes).allSatisfy(outcome -> assertThat(outcome.error()).isNull());
            assertThat(outcomes).extracting(outcome -> outcome.value().customerId())
                    .containsOnly(outcomes.get(0).value().customerId());
        }
    }

    private CreateAppointmentCommand command(Long serviceId, String phone, LocalDateTime scheduledAt) {
        return new CreateAppointmentCommand(tenantId, serviceId,
                new CustomerContact("Jordan Lee", phone, "jordan@example.com"), scheduledAt, "first visit");
    }
}
