package personal.reserve.core.appointment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.reserve.core.appointment.application.port.in.CreateAppointmentCommand;
import personal.reserve.core.appointment.application.port.out.AppointmentRepository;
import personal.reserve.core.appointment.application.port.out.CustomerRepository;
import personal.reserve.core.appointment.application.port.out.ServiceOfferingRepository;
import personal.reserve.core.appointment.domain.exception.AppointmentNotFoundException;
import personal.reserve.core.appointment.domain.exception.ServiceNotFoundException;
import personal.reserve.core.appointment.domain.exception.SlotUnavailableException;
import personal.reserve.core.appointment.domain.model.Appointment;
import personal.reserve.core.appointment.domain.model.Customer;
import personal.reserve.core.appointment.domain.model.CustomerContact;
import personal.reserve.core.appointment.domain.model.ServiceOffering;
import personal.reserve.core.tenant.application.port.out.TenantRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Appointment Domain Service (Transaction Manager)
 * 예약 생성과 상태 전이를 각각 하나의 트랜잭션으로 실행
 * 락 순서: 서비스 행 -> 테넌트 행(최초 고객일 때만) -> 예약 행
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentBookingManager {

    private final ServiceOfferingRepository serviceOfferingRepository;
    private final AppointmentRepository appointmentRepository;
    private final CustomerRepository customerRepository;
    private final TenantRepository tenantRepository;
    private final SlotAvailabilityChecker slotAvailabilityChecker;
    private final Clock clock;

    /**
     * 트랜잭션 내에서 예약 생성
     * 1. 서비스 행 잠금 (같은 서비스의 동시 생성 직렬화)
     * 2. 예약 시각 검증 (미래, 사전 예약 가능 기간 이내)
     * 3. 슬롯 가용성 검증 (충돌, 일일 한도)
     * 4. 고객 생성 또는 갱신 (tenant, phone), 신규 고객은 테넌트 행 잠금 후 재조회
     * 5. 예약 저장 (PENDING)
     */
    @Transactional
    public Appointment create(CreateAppointmentCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);

        ServiceOffering service = serviceOfferingRepository
                .findActiveByIdForUpdate(command.tenantId(), command.serviceId())
                .orElseThrow(() -> {
                    log.warn("Service not found or inactive: tenantId={}, serviceId={}",
                            command.tenantId(), command.serviceId());
                    return new ServiceNotFoundException(command.serviceId());
                });

        service.ensureBookableAt(command.scheduledAt(), now);

        if (!slotAvailabilityChecker.isSlotAvailable(command.tenantId(), service, command.scheduledAt())) {
            log.warn("Slot unavailable: serviceId={}, scheduledAt={}", service.id(), command.scheduledAt());
            throw new SlotUnavailableException();
        }

        Customer customer = upsertCustomer(command.tenantId(), command.customer());

        Appointment saved = appointmentRepository.save(
                Appointment.create(service, customer.id(), command.scheduledAt(), command.notes(), now));

        log.info("Appointment created: appointmentId={}, serviceId={}, customerId={}, scheduledAt={}",
                saved.id(), service.id(), customer.id(), saved.scheduledAt());
        return saved;
    }

    @Transactional
    public Appointment confirm(Long tenantId, Long appointmentId, String paymentTransactionId) {
        return transition(tenantId, appointmentId, (appointment, now) -> {
            Appointment confirmed = appointment.confirm(paymentTransactionId, now);
            touchCustomer(tenantId, confirmed.customerId(), now);
            return confirmed;
        });
    }

    @Transactional
    public Appointment cancel(Long tenantId, Long appointmentId, String reason) {
        return transition(tenantId, appointmentId, (appointment, now) -> appointment.cancel(reason, now));
    }

    @Transactional
    public Appointment complete(Long tenantId, Long appointmentId) {
        return transition(tenantId, appointmentId, (appointment, now) -> {
            Appointment completed = appointment.complete(now);
            touchCustomer(tenantId, completed.customerId(), completed.completedAt());
            return completed;
        });
    }

    @Transactional
    public Appointment markNoShow(Long tenantId, Long appointmentId) {
        return transition(tenantId, appointmentId, (appointment, now) -> appointment.markNoShow(now));
    }

    private Appointment transition(Long tenantId, Long appointmentId,
                                   BiFunction<Appointment, LocalDateTime, Appointment> change) {
        Appointment appointment = appointmentRepository.findByIdForUpdate(tenantId, appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));

        Appointment changed = change.apply(appointment, LocalDateTime.now(clock));
        Appointment saved = appointmentRepository.save(changed);

        log.info("Appointment transitioned: appointmentId={}, {} -> {}",
                appointmentId, appointment.status(), saved.status());
        return saved;
    }

    private Customer upsertCustomer(Long tenantId, CustomerContact contact) {
        Optional<Customer> found = customerRepository.findByPhone(tenantId, contact.phone());
        if (found.isEmpty()) {
            // 같은 번호의 동시 최초 예약은 테넌트 행에서 직렬화, 앞선 트랜잭션이 만든 고객을 재조회
            tenantRepository.findByIdForUpdate(tenantId);
            found = customerRepository.findByPhoneForUpdate(tenantId, contact.phone());
        }

        return found
                .map(existing -> {
                    Customer updated = existing.withContact(contact);
                    return updated.equals(existing) ? existing : customerRepository.save(updated);
                })
                .orElseGet(() -> {
                    log.info("Creating customer: tenantId={}", tenantId);
                    return customerRepository.save(Customer.create(tenantId, contact));
                });
    }

    private void touchCustomer(Long tenantId, Long customerId, LocalDateTime at) {
        customerRepository.findById(tenantId, customerId)
                .ifPresent(customer -> customerRepository.save(customer.recordAppointment(at)));
    }
}
