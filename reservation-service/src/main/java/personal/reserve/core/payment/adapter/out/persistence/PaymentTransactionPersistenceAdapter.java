package personal.reserve.core.payment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.payment.application.port.out.PaymentTransactionRepository;
import personal.reserve.core.payment.domain.model.PaymentTransaction;

import java.util.List;

/**
 * Payment Transaction Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentTransactionPersistenceAdapter implements PaymentTransactionRepository {

    private final JpaPaymentTransactionRepository jpaPaymentTransactionRepository;

    @Override
    public PaymentTransaction save(PaymentTransaction transaction) {
        log.debug("Saving payment transaction: externalId={}, target={}", transaction.externalId(), transaction.target());
        return jpaPaymentTransactionRepository.save(PaymentTransactionEntity.fromDomain(transaction)).toDomain();
    }

    @Override
    public List<PaymentTransaction> findByExternalId(Long tenantId, String externalId) {
        return jpaPaymentTransactionRepository.findByTenantIdAndExternalIdOrderByCreatedAtDesc(tenantId, externalId)
                .stream()
                .map(PaymentTransactionEntity::toDomain)
                .toList();
    }
}
