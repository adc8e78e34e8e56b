package personal.reserve.core.appointment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.reserve.core.appointment.application.port.in.AppointmentLifecycleUseCase;
import personal.reserve.core.appointment.application.port.out.AppointmentRepository;
import personal.reserve.core.appointment.domain.exception.AppointmentNotFoundException;
import personal.reserve.core.appointment.domain.model.Appointment;
import personal.reserve.core.appointment.domain.service.AppointmentBookingManager;
import personal.reserve.core.support.StoreFailures;

/**
 * Appointment Lifecycle Service
 * 예약 상태 전이 진입점
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentLifecycleService implements AppointmentLifecycleUseCase {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentBookingManager bookingManager;

    @Override
    public Appointment getAppointment(Long tenantId, Long appointmentId) {
        return appointmentRepository.findById(tenantId, appointmentId)
                .orElseThrow(() -> {
                    log.warn("Appointment not found: tenantId={}, appointmentId={}", tenantId, appointmentId);
                    return new AppointmentNotFoundException(appointmentId);
                });
    }

    @Override
    public Appointment confirm(Long tenantId, Long appointmentId, String paymentTransactionId) {
        return StoreFailures.translate("confirmAppointment",
                () -> bookingManager.confirm(tenantId, appointmentId, paymentTransactionId));
    }

    @Override
    public Appointment cancel(Long tenantId, Long appointmentId, String reason) {
        return StoreFailures.translate("cancelAppointment",
                () -> bookingManager.cancel(tenantId, appointmentId, reason));
    }

    @Override
    public Appointment complete(Long tenantId, Long appointmentId) {
        return StoreFailures.translate("completeAppointment",
                () -> bookingManager.complete(tenantId, appointmentId));
    }

    @Override
    public Appointment markNoShow(Long tenantId, Long appointmentId) {
        return StoreFailures.translate("markNoShow",
                () -> bookingManager.markNoShow(tenantId, appointmentId));
    }
}
