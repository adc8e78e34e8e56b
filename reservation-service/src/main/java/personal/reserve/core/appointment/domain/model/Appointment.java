package personal.reserve.core.appointment.domain.model;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.appointment.domain.exception.InvalidAppointmentStateException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Appointment Domain Model
 * 서비스 + 고객 + 시각에 대한 예약 (불변)
 * 소요 시간과 금액은 생성 시점의 서비스 값을 복사해 두고 이후 재계산하지 않음
 */
public record Appointment(
        Long id,
        Long tenantId,
        Long serviceId,
        Long customerId,
        LocalDateTime scheduledAt,
        int durationMinutes,
        AppointmentStatus status,
        PaymentStatus paymentStatus,
        BigDecimal totalAmount,
        String currency,
        String customerNotes,
        String internalNotes,
        String paymentTransactionId,
        LocalDateTime confirmedAt,
        LocalDateTime cancelledAt,
        LocalDateTime completedAt,
        LocalDateTime createdAt
) {
    private static final DateTimeFormatter NOTE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String NOTE_SEPARATOR = "\n\n";

    public Appointment {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant ID cannot be null");
        }
        if (serviceId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service ID cannot be null");
        }
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (scheduledAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Scheduled time cannot be null");
        }
        if (status == null || paymentStatus == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment status cannot be null");
        }
        if (totalAmount == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Total amount cannot be null");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     * 서비스의 소요 시간, 가격, 통화를 복사
     *
     * @return 새로운 예약 (PENDING / 결제 PENDING)
     */
    public static Appointment create(ServiceOffering service, Long customerId, LocalDateTime scheduledAt,
                                     String customerNotes, LocalDateTime now) {
        return new Appointment(
                null,
                service.tenantId(),
                service.id(),
                customerId,
                scheduledAt,
                service.durationMinutes(),
                AppointmentStatus.PENDING,
                PaymentStatus.PENDING,
                service.price(),
                service.currency(),
                customerNotes,
                null,
                null,
                null,
                null,
                null,
                now);
    }

    public LocalDateTime endTime() {
        return scheduledAt.plusMinutes(durationMinutes);
    }

    public boolean isActive() {
        return status.isActive();
    }

    /**
     * 예약 확정 (PENDING -> CONFIRMED)
     * 결제 완료 처리, 외부 결제 거래 ID가 있으면 기록
     */
    public Appointment confirm(String transactionId, LocalDateTime now) {
        if (status != AppointmentStatus.PENDING) {
            throw new InvalidAppointmentStateException(
                    String.format("Cannot confirm an appointment with status: %s", status));
        }
        String recordedTransactionId = transactionId != null ? transactionId : paymentTransactionId;
        return new Appointment(id, tenantId, serviceId, customerId, scheduledAt, durationMinutes,
                AppointmentStatus.CONFIRMED, PaymentStatus.PAID, totalAmount, currency,
                customerNotes, internalNotes, recordedTransactionId,
                now, cancelledAt, completedAt, createdAt);
    }

    /**
     * 예약 취소 (PENDING/CONFIRMED -> CANCELLED)
     * 사유는 내부 메모 뒤에 추가 (기존 메모는 유지)
     */
    public Appointment cancel(String reason, LocalDateTime now) {
        if (!status.isActive()) {
            throw new InvalidAppointmentStateException(
                    String.format("Cannot cancel an appointment with status: %s", status));
        }
        String notes = reason == null || reason.isBlank()
                ? internalNotes
                : appendNote(internalNotes, "Cancelled: " + reason);
        return new Appointment(id, tenantId, serviceId, customerId, scheduledAt, durationMinutes,
                AppointmentStatus.CANCELLED, paymentStatus, totalAmount, currency,
                customerNotes, notes, paymentTransactionId,
                confirmedAt, now, completedAt, createdAt);
    }

    /**
     * 예약 완료 (CONFIRMED -> COMPLETED)
     * 종료 시각이 지나야 완료 처리 가능
     */
    public Appointment complete(LocalDateTime now) {
        if (status != AppointmentStatus.CONFIRMED) {
            throw new InvalidAppointmentStateException(
                    String.format("Only confirmed appointments can be completed. Current status: %s", status));
        }
        if (endTime().isAfter(now)) {
            throw new InvalidAppointmentStateException("Cannot complete an appointment that has not ended yet");
        }
        return new Appointment(id, tenantId, serviceId, customerId, scheduledAt, durationMinutes,
                AppointmentStatus.COMPLETED, paymentStatus, totalAmount, currency,
                customerNotes, internalNotes, paymentTransactionId,
                confirmedAt, cancelledAt, now, createdAt);
    }

    /**
     * 노쇼 처리 (CONFIRMED -> NO_SHOW)
     * 시작 시각이 지나야 처리 가능, 처리 시각을 내부 메모에 추가
     */
    public Appointment markNoShow(LocalDateTime now) {
        if (status != AppointmentStatus.CONFIRMED) {
            throw new InvalidAppointmentStateException(
                    String.format("Only confirmed appointments can be marked as no-show. Current status: %s", status));
        }
        if (scheduledAt.isAfter(now)) {
            throw new InvalidAppointmentStateException("Cannot mark a future appointment as no-show");
        }
        String notes = appendNote(internalNotes, "Marked as no-show on " + NOTE_TIMESTAMP.format(now));
        return new Appointment(id, tenantId, serviceId, customerId, scheduledAt, durationMinutes,
                AppointmentStatus.NO_SHOW, paymentStatus, totalAmount, currency,
                customerNotes, notes, paymentTransactionId,
                confirmedAt, cancelledAt, completedAt, createdAt);
    }

    private static String appendNote(String existing, String note) {
        if (existing == null || existing.isEmpty()) {
            return note;
        }
        return existing + NOTE_SEPARATOR + note;
    }
}
