package personal.reserve.core.appointment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.appointment.application.port.out.AppointmentRepository;
import personal.reserve.core.appointment.domain.model.ServiceBookings;
import personal.reserve.core.appointment.domain.model.ServiceOffering;
import personal.reserve.core.tenant.domain.model.BusinessHours;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Slot Availability Checker (Domain Service)
 * 기존 활성 예약과의 충돌 및 일일 예약 한도 검사
 *
 * 충돌 범위는 후보 쪽에만 버퍼를 더한다 (기존 예약 쪽 구간은 확장하지 않음).
 * 하루 단위 조회 한 번으로 그날의 모든 후보 슬롯을 판정한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotAvailabilityChecker {

    private final AppointmentRepository appointmentRepository;
    private final SlotGenerator slotGenerator;

    /**
     * 단일 시각의 예약 가능 여부 (예약 생성 시 서비스 락 안에서 호출)
     */
    public boolean isSlotAvailable(Long tenantId, ServiceOffering service, LocalDateTime scheduledAt) {
        ServiceBookings bookings = loadBookings(tenantId, service, scheduledAt.toLocalDate());
        boolean available = bookings.isAvailable(service, scheduledAt);

        log.debug("Slot availability checked: serviceId={}, scheduledAt={}, available={}",
                service.id(), scheduledAt, available);
        return available;
    }

    /**
     * 날짜의 가용 슬롯
     * 현재 시각 이후이면서 충돌이 없고 일일 한도를 넘지 않는 후보만 반환
     */
    public List<LocalDateTime> availableSlots(Long tenantId, ServiceOffering service, BusinessHours hours,
                                              LocalDate date, int durationMinutes, LocalDateTime now) {
        List<LocalDateTime> candidates = slotGenerator.candidates(hours, date, durationMinutes);
        if (candidates.isEmpty()) {
            return List.of();
        }

        ServiceBookings bookings = loadBookings(tenantId, service, date);
        return candidates.stream()
                .filter(slot -> slot.isAfter(now))
                .filter(slot -> bookings.isAvailable(service, slot))
                .toList();
    }

    /**
     * 날짜의 후보 슬롯이 충돌할 수 있는 모든 활성 예약을 조회
     * [그날 00:00 - 충돌 범위, 다음날 00:00 + 충돌 범위)
     */
    public ServiceBookings loadBookings(Long tenantId, ServiceOffering service, LocalDate date) {
        int reach = service.conflictReachMinutes();
        LocalDateTime from = date.atStartOfDay().minusMinutes(reach);
        LocalDateTime to = date.plusDays(1).atStartOfDay().plusMinutes(reach);

        return new ServiceBookings(appointmentRepository.findActiveStartTimes(tenantId, service.id(), from, to));
    }
}
