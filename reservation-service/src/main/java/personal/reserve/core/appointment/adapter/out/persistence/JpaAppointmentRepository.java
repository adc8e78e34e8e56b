package personal.reserve.core.appointment.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.reserve.core.appointment.domain.model.AppointmentStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Appointment
 */
public interface JpaAppointmentRepository extends JpaRepository<AppointmentEntity, Long> {

    Optional<AppointmentEntity> findByIdAndTenantId(Long id, Long tenantId);

    boolean existsByIdAndTenantId(Long id, Long tenantId);

    /**
     * 예약 조회 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AppointmentEntity a WHERE a.id = :appointmentId AND a.tenantId = :tenantId")
    Optional<AppointmentEntity> findForUpdate(@Param("tenantId") Long tenantId,
                                              @Param("appointmentId") Long appointmentId);

    /**
     * [from, to) 구간에 시작하는 예약의 시작 시각
     */
    @Query("SELECT a.scheduledAt FROM AppointmentEntity a " +
            "WHERE a.tenantId = :tenantId AND a.serviceId = :serviceId " +
            "AND a.status IN :statuses " +
            "AND a.scheduledAt >= :from AND a.scheduledAt < :to " +
            "ORDER BY a.scheduledAt")
    List<LocalDateTime> findScheduledTimes(@Param("tenantId") Long tenantId,
                                           @Param("serviceId") Long serviceId,
                                           @Param("statuses") Collection<AppointmentStatus> statuses,
                                           @Param("from") LocalDateTime from,
                                           @Param("to") LocalDateTime to);
}
