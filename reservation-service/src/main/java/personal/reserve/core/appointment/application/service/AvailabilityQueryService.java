package personal.reserve.core.appointment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.reserve.core.appointment.application.port.in.GetAvailabilityUseCase;
import personal.reserve.core.appointment.application.port.out.ServiceOfferingRepository;
import personal.reserve.core.appointment.domain.exception.ServiceNotFoundException;
import personal.reserve.core.appointment.domain.model.DailyAvailability;
import personal.reserve.core.appointment.domain.model.ServiceBookings;
import personal.reserve.core.appointment.domain.model.ServiceOffering;
import personal.reserve.core.appointment.domain.service.SlotAvailabilityChecker;
import personal.reserve.core.config.ReservationProperties;
import personal.reserve.core.tenant.application.port.in.GetTenantPolicyUseCase;
import personal.reserve.core.tenant.domain.model.BusinessHours;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Availability Query Service
 * 가용 슬롯, 다음 가용 슬롯, 가용성 달력 조회 (락 없음, 결과는 조회 시점 기준)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityQueryService implements GetAvailabilityUseCase {

    private final ServiceOfferingRepository serviceOfferingRepository;
    private final GetTenantPolicyUseCase tenantPolicy;
    private final SlotAvailabilityChecker slotAvailabilityChecker;
    private final ReservationProperties properties;
    private final Clock clock;

    @Override
    public List<LocalDateTime> getAvailableSlots(Long tenantId, Long serviceId, LocalDate date,
                                                 Integer durationMinutes) {
        ServiceOffering service = loadService(tenantId, serviceId);
        BusinessHours hours = tenantPolicy.getBusinessHours(tenantId);
        int duration = durationMinutes != null ? durationMinutes : service.durationMinutes();

        return slotAvailabilityChecker.availableSlots(
                tenantId, service, hours, date, duration, LocalDateTime.now(clock));
    }

    @Override
    public Optional<LocalDateTime> findNextAvailableSlot(Long tenantId, Long serviceId, LocalDateTime from) {
        ServiceOffering service = loadService(tenantId, serviceId);
        BusinessHours hours = tenantPolicy.getBusinessHours(tenantId);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate firstDate = (from != null ? from : now).toLocalDate();

        for (int dayOffset = 0; dayOffset < properties.appointment().nextSlotSearchDays(); dayOffset++) {
            List<LocalDateTime> slots = slotAvailabilityChecker.availableSlots(
                    tenantId, service, hours, firstDate.plusDays(dayOffset), service.durationMinutes(), now);
            if (!slots.isEmpty()) {
                return Optional.of(slots.get(0));
            }
        }

        log.debug("No available slot found: serviceId={}, from={}", serviceId, firstDate);
        return Optional.empty();
    }

    @Override
    public List<DailyAvailability> getAvailabilityCalendar(Long tenantId, Long serviceId,
                                                           LocalDate startDate, LocalDate endDate) {
        ServiceOffering service = loadService(tenantId, serviceId);
        BusinessHours hours = tenantPolicy.getBusinessHours(tenantId);
        LocalDateTime now = LocalDateTime.now(clock);

        List<DailyAvailability> calendar = new ArrayList<>();
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            List<LocalDateTime> slots = slotAvailabilityChecker.availableSlots(
                    tenantId, service, hours, date, service.durationMinutes(), now);
            ServiceBookings bookings = slotAvailabilityChecker.loadBookings(tenantId, service, date);

            calendar.add(DailyAvailability.of(date, slots, bookings.countOn(date)));
        }
        return calendar;
    }

    @Override
    public boolean isServiceAvailableOn(Long tenantId, Long serviceId, LocalDate date) {
        return !getAvailableSlots(tenantId, serviceId, date, null).isEmpty();
    }

    private ServiceOffering loadService(Long tenantId, Long serviceId) {
        return serviceOfferingRepository.findActiveById(tenantId, serviceId)
                .orElseThrow(() -> {
                    log.warn("Service not found or inactive: tenantId={}, serviceId={}", tenantId, serviceId);
                    return new ServiceNotFoundException(serviceId);
                });
    }
}
