package personal.reserve.core.payment.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for Payment Transaction
 */
public interface JpaPaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, Long> {

    List<PaymentTransactionEntity> findByTenantIdAndExternalIdOrderByCreatedAtDesc(Long tenantId, String externalId);
}
