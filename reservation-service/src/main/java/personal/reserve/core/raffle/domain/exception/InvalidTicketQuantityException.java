package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Invalid Ticket Quantity Exception
 * 주문당 최소/최대 티켓 수량을 벗어난 요청
 */
public class InvalidTicketQuantityException extends ReservationException {

    public InvalidTicketQuantityException(String message) {
        super(ErrorCode.INVALID_QUANTITY, message);
    }

    public static InvalidTicketQuantityException belowMinimum(int minimum) {
        return new InvalidTicketQuantityException(String.format("Minimum %d ticket(s) required", minimum));
    }

    public static InvalidTicketQuantityException aboveMaximum(int maximum) {
        return new InvalidTicketQuantityException(String.format("Maximum %d tickets allowed", maximum));
    }
}
