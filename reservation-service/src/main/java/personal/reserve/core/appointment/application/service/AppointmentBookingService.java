package personal.reserve.core.appointment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.reserve.core.appointment.application.port.in.CreateAppointmentCommand;
import personal.reserve.core.appointment.application.port.in.CreateAppointmentUseCase;
import personal.reserve.core.appointment.domain.model.Appointment;
import personal.reserve.core.appointment.domain.service.AppointmentBookingManager;
import personal.reserve.core.support.StoreFailures;

/**
 * Appointment Booking Service
 * 단일 책임: 예약 생성 (트랜잭션은 AppointmentBookingManager가 담당)
 * 동일 전화번호의 첫 예약이 동시에 들어와 고객 유니크 제약에 걸리면 재시도 가능한 예외로 변환
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentBookingService implements CreateAppointmentUseCase {

    private final AppointmentBookingManager bookingManager;

    @Override
    public Appointment createAppointment(CreateAppointmentCommand command) {
        log.debug("Creating appointment: tenantId={}, serviceId={}, scheduledAt={}",
                command.tenantId(), command.serviceId(), command.scheduledAt());

        return StoreFailures.translate("createAppointment", () -> bookingManager.create(command));
    }
}
