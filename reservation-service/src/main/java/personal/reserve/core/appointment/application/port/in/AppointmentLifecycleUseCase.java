package personal.reserve.core.appointment.application.port.in;

import personal.reserve.core.appointment.domain.model.Appointment;

/**
 * Appointment Lifecycle UseCase (Input Port)
 * 예약 상태 전이: 확정, 취소, 완료, 노쇼
 */
public interface AppointmentLifecycleUseCase {

    Appointment getAppointment(Long tenantId, Long appointmentId);

    /**
     * PENDING -> CONFIRMED, 결제 상태 PAID, 고객의 마지막 예약 시각 갱신
     */
    Appointment confirm(Long tenantId, Long appointmentId, String paymentTransactionId);

    /**
     * PENDING/CONFIRMED -> CANCELLED
     */
    Appointment cancel(Long tenantId, Long appointmentId, String reason);

    /**
     * CONFIRMED -> COMPLETED (종료 시각 이후), 고객의 마지막 예약 시각 갱신
     */
    Appointment complete(Long tenantId, Long appointmentId);

    /**
     * CONFIRMED -> NO_SHOW (시작 시각 이후)
     */
    Appointment markNoShow(Long tenantId, Long appointmentId);
}
