package personal.reserve.core.appointment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.appointment.domain.model.Appointment;
import personal.reserve.core.appointment.domain.model.AppointmentStatus;
import personal.reserve.core.appointment.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Appointment JPA Entity
 * 예약 테이블 매핑
 */
@Entity
@Table(name = "appointments",
        indexes = {
                @Index(name = "idx_appointment_service_schedule",
                        columnList = "tenant_id, service_id, scheduled_at, status"),
                @Index(name = "idx_appointment_customer", columnList = "customer_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AppointmentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "scheduled_at", nullable = false)
    private LocalDateTime scheduledAt;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "customer_notes", length = 2000)
    private String customerNotes;

    @Column(name = "internal_notes", length = 4000)
    private String internalNotes;

    @Column(name = "payment_transaction_id", length = 100)
    private String paymentTransactionId;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static AppointmentEntity fromDomain(Appointment appointment) {
        AppointmentEntity entity = new AppointmentEntity();
        entity.id = appointment.id();
        entity.tenantId = appointment.tenantId();
        entity.serviceId = appointment.serviceId();
        entity.customerId = appointment.customerId();
        entity.scheduledAt = appointment.scheduledAt();
        entity.durationMinutes = appointment.durationMinutes();
        entity.status = appointment.status();
        entity.paymentStatus = appointment.paymentStatus();
        entity.totalAmount = appointment.totalAmount();
        entity.currency = appointment.currency();
        entity.customerNotes = appointment.customerNotes();
        entity.internalNotes = appointment.internalNotes();
        entity.paymentTransactionId = appointment.paymentTransactionId();
        entity.confirmedAt = appointment.confirmedAt();
        entity.cancelledAt = appointment.cancelledAt();
        entity.completedAt = appointment.completedAt();
        entity.createdAt = appointment.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Appointment toDomain() {
        return new Appointment(id, tenantId, serviceId, customerId, scheduledAt, durationMinutes,
                status, paymentStatus, totalAmount, currency, customerNotes, internalNotes,
                paymentTransactionId, confirmedAt, cancelledAt, completedAt, createdAt);
    }
}
