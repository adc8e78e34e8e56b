package personal.reserve.core.appointment.domain.service;

import org.springframework.stereotype.Component;
import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.tenant.domain.model.BusinessHours;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Slot Generator
 * 영업 시간 안에서 슬롯 간격마다 후보 시작 시각을 생성
 * 같은 입력이면 항상 같은 결과 (가용성 필터링은 SlotAvailabilityChecker 담당)
 */
@Component
public class SlotGenerator {

    /**
     * @return 시작 + 소요 시간이 영업 종료 시각을 넘지 않는 후보 슬롯 (시간순)
     */
    public List<LocalDateTime> candidates(BusinessHours hours, LocalDate date, int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duration must be positive");
        }

        LocalDateTime closesAt = hours.closesAt(date);
        List<LocalDateTime> slots = new ArrayList<>();

        LocalDateTime current = hours.opensAt(date);
        while (!current.plusMinutes(durationMinutes).isAfter(closesAt)) {
            slots.add(current);
            current = current.plusMinutes(hours.slotIntervalMinutes());
        }
        return slots;
    }
}
