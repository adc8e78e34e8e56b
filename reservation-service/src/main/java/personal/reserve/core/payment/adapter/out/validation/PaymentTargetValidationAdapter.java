package personal.reserve.core.payment.adapter.out.validation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.reserve.core.appointment.application.port.out.AppointmentRepository;
import personal.reserve.core.payment.application.port.out.PaymentTargetValidationPort;
import personal.reserve.core.payment.domain.model.PaymentTarget;
import personal.reserve.core.raffle.application.port.out.OrderRepository;

import java.util.Objects;

/**
 * Payment Target Validation Adapter
 * 주문/예약 저장소를 통해 결제 대상의 존재와 테넌트 소속을 확인
 */
@Component
@RequiredArgsConstructor
public class PaymentTargetValidationAdapter implements PaymentTargetValidationPort {

    private final OrderRepository orderRepository;
    private final AppointmentRepository appointmentRepository;

    @Override
    public boolean exists(Long tenantId, PaymentTarget target) {
        return switch (target.type()) {
            case ORDER -> orderRepository.findById(target.id())
                    .map(order -> Objects.equals(order.tenantId(), tenantId))
                    .orElse(false);
            case APPOINTMENT -> appointmentRepository.existsById(tenantId, target.id());
        };
    }
}
