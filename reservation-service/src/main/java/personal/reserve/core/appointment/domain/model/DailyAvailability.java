package personal.reserve.core.appointment.domain.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 일자별 가용성 요약 (가용 슬롯 수, 활성 예약 수, 가용 슬롯 목록)
 */
public record DailyAvailability(
        LocalDate date,
        int availableCount,
        long bookedCount,
        List<LocalDateTime> slots
) {
    public static DailyAvailability of(LocalDate date, List<LocalDateTime> slots, long bookedCount) {
        return new DailyAvailability(date, slots.size(), bookedCount, List.copyOf(slots));
    }
}
