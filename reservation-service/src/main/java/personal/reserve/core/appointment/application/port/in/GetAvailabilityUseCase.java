package personal.reserve.core.appointment.application.port.in;

import personal.reserve.core.appointment.domain.model.DailyAvailability;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Get Availability UseCase (Input Port)
 * 서비스 예약 가능 슬롯 조회
 */
public interface GetAvailabilityUseCase {

    /**
     * 특정 날짜의 예약 가능 슬롯 (시간순)
     *
     * @param durationMinutes 슬롯 생성에 사용할 소요 시간 (null이면 서비스 소요 시간)
     */
    List<LocalDateTime> getAvailableSlots(Long tenantId, Long serviceId, LocalDate date, Integer durationMinutes);

    /**
     * from(null이면 현재)이 속한 날부터 최대 reservation.appointment.next-slot-search-days 일 동안
     * 가장 먼저 가용 슬롯이 있는 날의 첫 슬롯
     */
    Optional<LocalDateTime> findNextAvailableSlot(Long tenantId, Long serviceId, LocalDateTime from);

    /**
     * [startDate, endDate] 일자별 가용성 요약
     */
    List<DailyAvailability> getAvailabilityCalendar(Long tenantId, Long serviceId,
                                                    LocalDate startDate, LocalDate endDate);

    boolean isServiceAvailableOn(Long tenantId, Long serviceId, LocalDate date);
}
