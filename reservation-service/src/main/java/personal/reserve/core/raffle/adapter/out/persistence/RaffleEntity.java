package personal.reserve.core.raffle.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.raffle.domain.model.Raffle;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raffle JPA Entity
 * 추첨 테이블 매핑
 */
@Entity
@Table(name = "raffles",
        indexes = @Index(name = "idx_raffle_active_created", columnList = "is_active, created_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RaffleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false)
    private String title;

    @Column(length = 4000)
    private String description;

    @Column(name = "ticket_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal ticketPrice;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "min_number", nullable = false)
    private int minNumber;

    @Column(name = "max_number", nullable = false)
    private int maxNumber;

    @Column(name = "draw_date")
    private LocalDateTime drawDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static RaffleEntity fromDomain(Raffle raffle) {
        RaffleEntity entity = new RaffleEntity();
        entity.id = raffle.id();
        entity.tenantId = raffle.tenantId();
        entity.title = raffle.title();
        entity.description = raffle.description();
        entity.ticketPrice = raffle.ticketPrice();
        entity.currency = raffle.currency();
        entity.active = raffle.active();
        entity.minNumber = raffle.minNumber();
        entity.maxNumber = raffle.maxNumber();
        entity.drawDate = raffle.drawDate();
        entity.createdAt = raffle.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Raffle toDomain() {
        return new Raffle(id, tenantId, title, description, ticketPrice, currency, active,
                minNumber, maxNumber, drawDate, createdAt);
    }
}
