package personal.reserve.core.raffle.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.raffle.domain.model.OrderStatus;
import personal.reserve.core.raffle.domain.model.RaffleOrder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raffle Order JPA Entity
 * 주문 테이블 매핑
 */
@Entity
@Table(name = "raffle_orders",
        indexes = {
                @Index(name = "idx_order_status_expires", columnList = "status, expires_at"),
                @Index(name = "idx_order_raffle", columnList = "raffle_id"),
                @Index(name = "idx_order_contact", columnList = "contact_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RaffleOrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id")
    private Long tenantId;

    @Column(name = "raffle_id", nullable = false)
    private Long raffleId;

    @Column(name = "contact_id", nullable = false)
    private Long contactId;

    @Column(name = "qty", nullable = false)
    private int quantity;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "payment_proof_id")
    private String paymentProofId;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static RaffleOrderEntity fromDomain(RaffleOrder order) {
        RaffleOrderEntity entity = new RaffleOrderEntity();
        entity.id = order.id();
        entity.tenantId = order.tenantId();
        entity.raffleId = order.raffleId();
        entity.contactId = order.contactId();
        entity.quantity = order.quantity();
        entity.totalAmount = order.totalAmount();
        entity.currency = order.currency();
        entity.status = order.status();
        entity.paymentProofId = order.paymentProofId();
        entity.expiresAt = order.expiresAt();
        entity.paidAt = order.paidAt();
        entity.createdAt = order.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public RaffleOrder toDomain() {
        return new RaffleOrder(id, tenantId, raffleId, contactId, quantity, totalAmount, currency,
                status, paymentProofId, expiresAt, paidAt, createdAt);
    }
}
