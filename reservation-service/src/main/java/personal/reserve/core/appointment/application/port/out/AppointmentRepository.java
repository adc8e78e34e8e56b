package personal.reserve.core.appointment.application.port.out;

import personal.reserve.core.appointment.domain.model.Appointment;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Appointment Repository (Output Port)
 */
public interface AppointmentRepository {

    Optional<Appointment> findById(Long tenantId, Long appointmentId);

    /**
     * 예약 조회 (비관적 락)
     */
    Optional<Appointment> findByIdForUpdate(Long tenantId, Long appointmentId);

    /**
     * [from, to) 구간에 시작하는 활성(PENDING/CONFIRMED) 예약의 시작 시각 목록
     */
    List<LocalDateTime> findActiveStartTimes(Long tenantId, Long serviceId, LocalDateTime from, LocalDateTime to);

    boolean existsById(Long tenantId, Long appointmentId);

    Appointment save(Appointment appointment);
}
