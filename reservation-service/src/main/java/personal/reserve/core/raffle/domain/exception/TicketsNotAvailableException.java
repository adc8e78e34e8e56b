package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

import java.util.List;

/**
 * Tickets Not Available Exception
 * 요청한 번호 중 이미 예약되었거나 판매된 번호가 있을 때 발생
 */
public class TicketsNotAvailableException extends ReservationException {

    private final List<Integer> numbers;

    public TicketsNotAvailableException(List<Integer> numbers) {
        super(ErrorCode.TICKETS_NOT_AVAILABLE, "Tickets not available: " + InvalidTicketNumbersException.join(numbers));
        this.numbers = List.copyOf(numbers);
    }

    public List<Integer> getNumbers() {
        return numbers;
    }
}
