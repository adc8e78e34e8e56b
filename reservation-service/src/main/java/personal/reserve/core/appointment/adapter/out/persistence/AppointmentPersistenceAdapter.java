package personal.reserve.core.appointment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.appointment.application.port.out.AppointmentRepository;
import personal.reserve.core.appointment.domain.model.Appointment;
import personal.reserve.core.appointment.domain.model.AppointmentStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Appointment Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentPersistenceAdapter implements AppointmentRepository {

    private final JpaAppointmentRepository jpaAppointmentRepository;

    @Override
    public Optional<Appointment> findById(Long tenantId, Long appointmentId) {
        return jpaAppointmentRepository.findByIdAndTenantId(appointmentId, tenantId)
                .map(AppointmentEntity::toDomain);
    }

    @Override
    public Optional<Appointment> findByIdForUpdate(Long tenantId, Long appointmentId) {
        log.debug("Locking appointment: tenantId={}, appointmentId={}", tenantId, appointmentId);
        return jpaAppointmentRepository.findForUpdate(tenantId, appointmentId)
                .map(AppointmentEntity::toDomain);
    }

    @Override
    public List<LocalDateTime> findActiveStartTimes(Long tenantId, Long serviceId,
                                                    LocalDateTime from, LocalDateTime to) {
        return jpaAppointmentRepository.findScheduledTimes(
                tenantId, serviceId, AppointmentStatus.ACTIVE, from, to);
    }

    @Override
    public boolean existsById(Long tenantId, Long appointmentId) {
        return jpaAppointmentRepository.existsByIdAndTenantId(appointmentId, tenantId);
    }

    @Override
    public Appointment save(Appointment appointment) {
        log.debug("Saving appointment: appointmentId={}, status={}", appointment.id(), appointment.status());
        return jpaAppointmentRepository.save(AppointmentEntity.fromDomain(appointment)).toDomain();
    }
}
