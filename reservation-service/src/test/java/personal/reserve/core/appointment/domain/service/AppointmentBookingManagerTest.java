package personal.reserve.core.appointment.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.reserve.core.appointment.application.port.in.CreateAppointmentCommand;
import personal.reserve.core.appointment.application.port.out.AppointmentRepository;
import personal.reserve.core.appointment.application.port.out.CustomerRepository;
import personal.reserve.core.appointment.application.port.out.ServiceOfferingRepository;
import personal.reserve.core.appointment.domain.exception.AppointmentNotFoundException;
import personal.reserve.core.appointment.domain.exception.InvalidBookingTimeException;
import personal.reserve.core.appointment.domain.exception.ServiceNotFoundException;
import personal.reserve.core.appointment.domain.exception.SlotUnavailableException;
import personal.reserve.core.appointment.domain.model.Appointment;
import personal.reserve.core.appointment.domain.model.AppointmentStatus;
import personal.reserve.core.appointment.domain.model.Customer;
import personal.reserve.core.appointment.domain.model.CustomerContact;
import personal.reserve.core.appointment.domain.model.PaymentStatus;
import personal.reserve.core.appointment.domain.model.ServiceOffering;
import personal.reserve.core.tenant.application.port.out.TenantRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AppointmentBookingManager 단위 테스트")
class AppointmentBookingManagerTest {

    private static final Long TENANT_ID = 1L;
    private static final Long SERVICE_ID = 10L;
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 8, 0);
    private static final LocalDateTime SCHEDULED_AT = LocalDateTime.of(2025, 3, 11, 10, 0);

    @Mock
    private ServiceOfferingRepository serviceOfferingRepository;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private TenantRepository tenantRepository;
    @Mock
    private SlotAvailabilityChecker slotAvailabilityChecker;

    private AppointmentBookingManager manager;
    private ServiceOffering service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        manager = new AppointmentBookingManager(serviceOfferingRepository, appointmentRepository,
                customerRepository, tenantRepository, slotAvailabilityChecker, clock);
        service = new ServiceOffering(SERVICE_ID, TENANT_ID, "Haircut", 45, new BigDecimal("25.00"), "USD",
                15, 8, 30, true);
    }

    private CreateAppointmentCommand command(LocalDateTime scheduledAt) {
        return new CreateAppointmentCommand(TENANT_ID, SERVICE_ID,
                new CustomerContact("Ana", "+595981000111", "ana@example.com"), scheduledAt, "first visit");
    }

    private Appointment confirmed(LocalDateTime scheduledAt) {
        return new Appointment(50L, TENANT_ID, SERVICE_ID, 3L, scheduledAt, 45,
                AppointmentStatus.CONFIRMED, PaymentStatus.PAID, new BigDecimal("25.00"), "USD",
                null, null, "tx-1", NOW, null, null, NOW);
    }

    @Test
    @DisplayName("예약 생성 성공 - 새 고객을 만들고 PENDING 예약을 저장한다")
    void create_Success_NewCustomer() {
        // given
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.of(service));
        given(slotAvailabilityChecker.isSlotAvailable(TENANT_ID, service, SCHEDULED_AT)).willReturn(true);
        given(customerRepository.findByPhone(TENANT_ID, "+595981000111")).willReturn(Optional.empty());
        given(customerRepository.findByPhoneForUpdate(TENANT_ID, "+595981000111")).willReturn(Optional.empty());
        given(customerRepository.save(any(Customer.class)))
                .willReturn(new Customer(3L, TENANT_ID, "Ana", "+595981000111", "ana@example.com", null));
        given(appointmentRepository.save(any(Appointment.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        Appointment result = manager.create(command(SCHEDULED_AT));

        // then
        assertThat(result.status()).isEqualTo(AppointmentStatus.PENDING);
        assertThat(result.customerId()).isEqualTo(3L);
        assertThat(result.totalAmount()).isEqualByComparingTo("25.00");
        assertThat(result.durationMinutes()).isEqualTo(45);
        assertThat(result.createdAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("새 고객은 서비스 행, 테넌트 행 순으로 잠근 뒤 재조회하고 생성한다")
    void create_NewCustomer_LocksTenantBeforeInsert() {
        // given
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.of(service));
        given(slotAvailabilityChecker.isSlotAvailable(TENANT_ID, service, SCHEDULED_AT)).willReturn(true);
        given(customerRepository.findByPhone(TENANT_ID, "+595981000111")).willReturn(Optional.empty());
        given(customerRepository.findByPhoneForUpdate(TENANT_ID, "+595981000111")).willReturn(Optional.empty());
        given(customerRepository.save(any(Customer.class)))
                .willReturn(new Customer(3L, TENANT_ID, "Ana", "+595981000111", "ana@example.com", null));
        given(appointmentRepository.save(any(Appointment.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        manager.create(command(SCHEDULED_AT));

        // then
        InOrder order = inOrder(serviceOfferingRepository, tenantRepository, customerRepository, appointmentRepository);
        order.verify(serviceOfferingRepository).findActiveByIdForUpdate(TENANT_ID, SERVICE_ID);
        order.verify(tenantRepository).findByIdForUpdate(TENANT_ID);
        order.verify(customerRepository).findByPhoneForUpdate(TENANT_ID, "+595981000111");
        order.verify(customerRepository).save(any(Customer.class));
        order.verify(appointmentRepository).save(any(Appointment.class));
    }

    @Test
    @DisplayName("잠금 후 재조회에서 다른 트랜잭션이 만든 고객을 찾으면 새로 만들지 않고 재사용한다")
    void create_NewCustomer_CreatedConcurrently_Reused() {
        // given
        Customer createdMeanwhile = new Customer(3L, TENANT_ID, "Ana", "+595981000111", "ana@example.com", null);
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.of(service));
        given(slotAvailabilityChecker.isSlotAvailable(TENANT_ID, service, SCHEDULED_AT)).willReturn(true);
        given(customerRepository.findByPhone(TENANT_ID, "+595981000111")).willReturn(Optional.empty());
        given(customerRepository.findByPhoneForUpdate(TENANT_ID, "+595981000111"))
                .willReturn(Optional.of(createdMeanwhile));
        given(appointmentRepository.save(any(Appointment.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        Appointment result = manager.create(command(SCHEDULED_AT));

        // then
        assertThat(result.customerId()).isEqualTo(3L);
        verify(customerRepository, never()).save(any());
    }

    @Test
    @DisplayName("기존 고객의 이름이 바뀌면 이름과 이메일을 갱신한다")
    void create_ExistingCustomer_NameChanged() {
        // given
        Customer existing = new Customer(3L, TENANT_ID, "Old Name", "+595981000111", null, null);
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.of(service));
        given(slotAvailabilityChecker.isSlotAvailable(TENANT_ID, service, SCHEDULED_AT)).willReturn(true);
        given(customerRepository.findByPhone(TENANT_ID, "+595981000111")).willReturn(Optional.of(existing));
        given(customerRepository.save(any(Customer.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        manager.create(command(SCHEDULED_AT));

        // then
        ArgumentCaptor<Customer> captor = ArgumentCaptor.forClass(Customer.class);
        verify(customerRepository).save(captor.capture());
        assertThat(captor.getValue().name()).isEqualTo("Ana");
        assertThat(captor.getValue().email()).isEqualTo("ana@example.com");
        assertThat(captor.getValue().id()).isEqualTo(3L);
    }

    @Test
    @DisplayName("기존 고객의 이름이 같으면 고객을 저장하지 않는다")
    void create_ExistingCustomer_Unchanged() {
        // given
        Customer existing = new Customer(3L, TENANT_ID, "Ana", "+595981000111", "old@example.com", null);
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.of(service));
        given(slotAvailabilityChecker.isSlotAvailable(TENANT_ID, service, SCHEDULED_AT)).willReturn(true);
        given(customerRepository.findByPhone(TENANT_ID, "+595981000111")).willReturn(Optional.of(existing));
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        manager.create(command(SCHEDULED_AT));

        // then
        verify(customerRepository, never()).save(any());
        verify(tenantRepository, never()).findByIdForUpdate(any());
    }

    @Test
    @DisplayName("예약 생성 실패 - 서비스 없음 또는 비활성")
    void create_ServiceNotFound() {
        // given
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> manager.create(command(SCHEDULED_AT)))
                .isInstanceOf(ServiceNotFoundException.class);
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("예약 생성 실패 - 과거 시각")
    void create_PastTime() {
        // given
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.of(service));

        // when & then
        assertThatThrownBy(() -> manager.create(command(NOW.minusHours(1))))
                .isInstanceOf(InvalidBookingTimeException.class)
                .hasMessage("Cannot book appointments in the past");
    }

    @Test
    @DisplayName("예약 생성 실패 - 슬롯 충돌")
    void create_SlotUnavailable() {
        // given
        given(serviceOfferingRepository.findActiveByIdForUpdate(TENANT_ID, SERVICE_ID)).willReturn(Optional.of(service));
        given(slotAvailabilityChecker.isSlotAvailable(TENANT_ID, service, SCHEDULED_AT)).willReturn(false);

        // when & then
        assertThatThrownBy(() -> manager.create(command(SCHEDULED_AT)))
                .isInstanceOf(SlotUnavailableException.class)
                .hasMessage("This time slot is not available");
        verify(customerRepository, never()).findByPhone(any(), any());
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("완료 처리 시 고객의 마지막 예약 시각을 갱신한다")
    void complete_TouchesCustomer() {
        // given
        LocalDateTime past = NOW.minusHours(3);
        Customer customer = new Customer(3L, TENANT_ID, "Ana", "+595981000111", null, null);
        given(appointmentRepository.findByIdForUpdate(TENANT_ID, 50L)).willReturn(Optional.of(confirmed(past)));
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(customerRepository.findById(TENANT_ID, 3L)).willReturn(Optional.of(customer));

        // when
        Appointment result = manager.complete(TENANT_ID, 50L);

        // then
        assertThat(result.status()).isEqualTo(AppointmentStatus.COMPLETED);
        verify(customerRepository).save(customer.recordAppointment(NOW));
    }

    @Test
    @DisplayName("상태 전이 실패 - 예약 없음")
    void cancel_NotFound() {
        // given
        given(appointmentRepository.findByIdForUpdate(TENANT_ID, 99L)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> manager.cancel(TENANT_ID, 99L, "reason"))
                .isInstanceOf(AppointmentNotFoundException.class);
    }
}
