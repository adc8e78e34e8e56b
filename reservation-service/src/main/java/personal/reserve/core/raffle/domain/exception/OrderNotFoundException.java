package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Order Not Found Exception
 */
public class OrderNotFoundException extends ReservationException {
    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, String.format("Order not found: orderId=%d", orderId));
    }
}
