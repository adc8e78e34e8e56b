package personal.reserve.core.appointment.application.port.out;

import personal.reserve.core.appointment.domain.model.Customer;

import java.util.Optional;

/**
 * Customer Repository (Output Port)
 * 최초 고객 생성은 테넌트 행 잠금으로 직렬화하고, (tenant_id, phone) 유니크 제약이 최종 방어선
 */
public interface CustomerRepository {

    Optional<Customer> findById(Long tenantId, Long customerId);

    Optional<Customer> findByPhone(Long tenantId, String phone);

    Optional<Customer> findByPhoneForUpdate(Long tenantId, String phone);

    Customer save(Customer customer);
}
