package personal.reserve.core.appointment.domain.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 특정 서비스의 활성(PENDING/CONFIRMED) 예약 시작 시각 스냅샷
 * 슬롯 충돌 검사와 일일 예약 한도 판단을 메모리에서 수행
 */
public record ServiceBookings(List<LocalDateTime> activeStarts) {

    public ServiceBookings {
        activeStarts = List.copyOf(activeStarts);
    }

    /**
     * 슬롯 가용 여부
     * 1. 후보 시각 - (소요 시간 + 버퍼) 이상, 후보 시각 + (소요 시간 + 버퍼) 미만에 시작하는 활성 예약이 없어야 함
     * 2. 같은 날(00:00 ~ 다음날 00:00) 활성 예약 수가 일일 한도 미만이어야 함
     */
    public boolean isAvailable(ServiceOffering service, LocalDateTime candidate) {
        return !overlaps(service, candidate) && countOn(candidate.toLocalDate()) < service.maxBookingsPerDay();
    }

    public boolean overlaps(ServiceOffering service, LocalDateTime candidate) {
        LocalDateTime from = candidate.minusMinutes(service.conflictReachMinutes());
        LocalDateTime to = candidate.plusMinutes(service.conflictReachMinutes());

        return activeStarts.stream()
                .anyMatch(start -> !start.isBefore(from) && start.isBefore(to));
    }

    public long countOn(LocalDate date) {
        LocalDateTime dayStart = date.atStartOfDay();
        LocalDateTime dayEnd = dayStart.plusDays(1);

        return activeStarts.stream()
                .filter(start -> !start.isBefore(dayStart) && start.isBefore(dayEnd))
                .count();
    }
}
