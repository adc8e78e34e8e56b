package personal.reserve.core.appointment.domain.model;

import java.util.List;

/**
 * Appointment Status
 * PENDING -> CONFIRMED -> COMPLETED / NO_SHOW, PENDING/CONFIRMED -> CANCELLED
 */
public enum AppointmentStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    COMPLETED,
    NO_SHOW;

    /**
     * 슬롯을 점유하는 상태 (충돌 검사와 일일 한도 계산 대상)
     */
    public static final List<AppointmentStatus> ACTIVE = List.of(PENDING, CONFIRMED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
