package personal.reserve.core.appointment.application.port.in;

import personal.reserve.core.appointment.domain.model.Appointment;

/**
 * Create Appointment UseCase (Input Port)
 */
public interface CreateAppointmentUseCase {

    /**
     * 예약 생성
     * 서비스 행을 잠근 뒤 예약 시각과 슬롯 가용성을 검증하고, 고객을 전화번호 기준으로 생성/갱신
     *
     * @return 생성된 예약 (PENDING)
     */
    Appointment createAppointment(CreateAppointmentCommand command);
}
