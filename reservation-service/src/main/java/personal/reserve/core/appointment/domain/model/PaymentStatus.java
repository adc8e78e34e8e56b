package personal.reserve.core.appointment.domain.model;

/**
 * Appointment Payment Status
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    REFUNDED
}
