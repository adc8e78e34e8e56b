package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * No Reserved Tickets Exception
 * 결제 확정 시 주문에 예약된 티켓이 하나도 없을 때 발생
 */
public class NoReservedTicketsException extends ReservationException {
    public NoReservedTicketsException() {
        super(ErrorCode.NO_RESERVED_INVENTORY, "No tickets found for this order");
    }
}
