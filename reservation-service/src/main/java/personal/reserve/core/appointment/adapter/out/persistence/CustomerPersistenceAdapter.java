package personal.reserve.core.appointment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.appointment.application.port.out.CustomerRepository;
import personal.reserve.core.appointment.domain.model.Customer;

import java.util.Optional;

/**
 * Customer Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerPersistenceAdapter implements CustomerRepository {

    private final JpaCustomerRepository jpaCustomerRepository;

    @Override
    public Optional<Customer> findById(Long tenantId, Long customerId) {
        return jpaCustomerRepository.findByIdAndTenantId(customerId, tenantId)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public Optional<Customer> findByPhone(Long tenantId, String phone) {
        log.debug("Finding customer by phone: tenantId={}", tenantId);
        return jpaCustomerRepository.findByTenantIdAndPhone(tenantId, phone)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public Optional<Customer> findByPhoneForUpdate(Long tenantId, String phone) {
        return jpaCustomerRepository.findByPhoneForUpdate(tenantId, phone)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public Customer save(Customer customer) {
        // IDENTITY 전략이라 신규 고객은 즉시 INSERT 되어 유니크 제약 위반이 여기서 드러남
        return jpaCustomerRepository.saveAndFlush(CustomerEntity.fromDomain(customer)).toDomain();
    }
}
