package personal.reserve.core.payment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;
import personal.reserve.core.payment.domain.model.PaymentProvider;
import personal.reserve.core.payment.domain.model.PaymentTarget;
import personal.reserve.core.payment.domain.model.PaymentTransaction;
import personal.reserve.core.payment.domain.model.PaymentTransactionStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment Transaction JPA Entity
 * 결제 대상은 order_id / appointment_id 중 정확히 하나 (CHECK 제약)
 */
@Entity
@Table(name = "payment_transactions",
        indexes = {
                @Index(name = "idx_payment_tenant_created", columnList = "tenant_id, created_at"),
                @Index(name = "idx_payment_external_id", columnList = "external_id"),
                @Index(name = "idx_payment_order", columnList = "order_id"),
                @Index(name = "idx_payment_appointment", columnList = "appointment_id")
        })
@Check(constraints = "(order_id IS NOT NULL AND appointment_id IS NULL) "
        + "OR (order_id IS NULL AND appointment_id IS NOT NULL)")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentProvider provider;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentTransactionStatus status;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "appointment_id")
    private Long appointmentId;

    @Column(length = 4000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    public static PaymentTransactionEntity fromDomain(PaymentTransaction transaction) {
        PaymentTransactionEntity entity = new PaymentTransactionEntity();
        entity.id = transaction.id();
        entity.tenantId = transaction.tenantId();
        entity.provider = transaction.provider();
        entity.externalId = transaction.externalId();
        entity.amount = transaction.amount();
        entity.currency = transaction.currency();
        entity.status = transaction.status();
        entity.orderId = transaction.target().orderId();
        entity.appointmentId = transaction.target().appointmentId();
        entity.notes = transaction.notes();
        entity.createdAt = transaction.createdAt();
        entity.confirmedAt = transaction.confirmedAt();
        return entity;
    }

    public PaymentTransaction toDomain() {
        return new PaymentTransaction(id, tenantId, provider, externalId, amount, currency, status,
                PaymentTarget.fromColumns(orderId, appointmentId), notes, createdAt, confirmedAt);
    }
}
