package personal.reserve.core.appointment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.appointment.domain.model.ServiceOffering;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Service JPA Entity
 * 서비스 테이블 매핑
 */
@Entity
@Table(name = "services",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_service_tenant_name",
                columnNames = {"tenant_id", "name"}
        ),
        indexes = @Index(name = "idx_service_tenant_active", columnList = "tenant_id, is_active"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ServiceOfferingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false)
    private String name;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "buffer_time_minutes", nullable = false)
    private int bufferTimeMinutes;

    @Column(name = "max_bookings_per_day", nullable = false)
    private int maxBookingsPerDay;

    @Column(name = "advance_booking_days", nullable = false)
    private int advanceBookingDays;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static ServiceOfferingEntity fromDomain(ServiceOffering service) {
        ServiceOfferingEntity entity = new ServiceOfferingEntity();
        entity.id = service.id();
        entity.tenantId = service.tenantId();
        entity.name = service.name();
        entity.durationMinutes = service.durationMinutes();
        entity.price = service.price();
        entity.currency = service.currency();
        entity.bufferTimeMinutes = service.bufferTimeMinutes();
        entity.maxBookingsPerDay = service.maxBookingsPerDay();
        entity.advanceBookingDays = service.advanceBookingDays();
        entity.active = service.active();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public ServiceOffering toDomain() {
        return new ServiceOffering(id, tenantId, name, durationMinutes, price, currency,
                bufferTimeMinutes, maxBookingsPerDay, advanceBookingDays, active);
    }
}
