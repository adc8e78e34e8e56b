package personal.reserve.core.payment.application.port.in;

import personal.reserve.core.payment.domain.model.PaymentTransaction;

import java.util.List;

/**
 * Record Payment Transaction UseCase (Input Port)
 */
public interface RecordPaymentTransactionUseCase {

    /**
     * 결제 거래 기록, 대상이 테넌트 안에 존재해야 함
     *
     * @throws personal.reserve.core.payment.domain.exception.PaymentTargetNotFoundException 대상이 없을 때
     */
    PaymentTransaction recordTransaction(RecordPaymentTransactionCommand command);

    /**
     * 제공자 거래 ID로 조회 (최신순)
     */
    List<PaymentTransaction> findByExternalId(Long tenantId, String externalId);
}
