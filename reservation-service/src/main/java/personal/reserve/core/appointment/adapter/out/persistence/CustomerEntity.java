package personal.reserve.core.appointment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.appointment.domain.model.Customer;

import java.time.LocalDateTime;

/**
 * Customer JPA Entity
 * (tenant_id, phone) 유니크 제약으로 동시 최초 예약 시 중복 고객 생성을 막음
 */
@Entity
@Table(name = "customers",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_customer_tenant_phone",
                columnNames = {"tenant_id", "phone"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 30)
    private String phone;

    private String email;

    @Column(name = "last_appointment_at")
    private LocalDateTime lastAppointmentAt;

    public static CustomerEntity fromDomain(Customer customer) {
        CustomerEntity entity = new CustomerEntity();
        entity.id = customer.id();
        entity.tenantId = customer.tenantId();
        entity.name = customer.name();
        entity.phone = customer.phone();
        entity.email = customer.email();
        entity.lastAppointmentAt = customer.lastAppointmentAt();
        return entity;
    }

    public Customer toDomain() {
        return new Customer(id, tenantId, name, phone, email, lastAppointmentAt);
    }
}
