package personal.reserve.core.payment.application.port.out;

import personal.reserve.core.payment.domain.model.PaymentTransaction;

import java.util.List;

/**
 * Payment Transaction Repository (Output Port)
 */
public interface PaymentTransactionRepository {

    PaymentTransaction save(PaymentTransaction transaction);

    List<PaymentTransaction> findByExternalId(Long tenantId, String externalId);
}
