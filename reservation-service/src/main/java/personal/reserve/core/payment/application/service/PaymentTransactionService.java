package personal.reserve.core.payment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.reserve.core.payment.application.port.in.RecordPaymentTransactionCommand;
import personal.reserve.core.payment.application.port.in.RecordPaymentTransactionUseCase;
import personal.reserve.core.payment.application.port.out.PaymentTargetValidationPort;
import personal.reserve.core.payment.application.port.out.PaymentTransactionRepository;
import personal.reserve.core.payment.domain.exception.PaymentTargetNotFoundException;
import personal.reserve.core.payment.domain.model.PaymentTransaction;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Payment Transaction Service
 * 결제 거래 기록과 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentTransactionService implements RecordPaymentTransactionUseCase {

    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PaymentTargetValidationPort targetValidation;
    private final Clock clock;

    @Override
    @Transactional
    public PaymentTransaction recordTransaction(RecordPaymentTransactionCommand command) {
        if (!targetValidation.exists(command.tenantId(), command.target())) {
            log.warn("Payment target not found: tenantId={}, target={}", command.tenantId(), command.target());
            throw new PaymentTargetNotFoundException(command.target());
        }

        PaymentTransaction saved = paymentTransactionRepository.save(PaymentTransaction.record(
                command.tenantId(), command.provider(), command.externalId(), command.amount(),
                command.currency(), command.status(), command.target(), command.notes(),
                LocalDateTime.now(clock)));

        log.info("Payment transaction recorded: transactionId={}, provider={}, target={}, status={}",
                saved.id(), saved.provider(), saved.target(), saved.status());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentTransaction> findByExternalId(Long tenantId, String externalId) {
        return paymentTransactionRepository.findByExternalId(tenantId, externalId);
    }
}
