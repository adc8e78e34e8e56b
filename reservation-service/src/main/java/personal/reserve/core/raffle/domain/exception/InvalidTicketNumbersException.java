package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Invalid Ticket Numbers Exception
 * 범위를 벗어나거나 중복되었거나 존재하지 않는 번호
 */
public class InvalidTicketNumbersException extends ReservationException {

    public InvalidTicketNumbersException(String message) {
        super(ErrorCode.INVALID_TICKET_NUMBERS, message);
    }

    public static InvalidTicketNumbersException outOfRange(Collection<Integer> numbers) {
        return new InvalidTicketNumbersException("Invalid numbers: " + join(numbers));
    }

    public static InvalidTicketNumbersException duplicated() {
        return new InvalidTicketNumbersException("Duplicate numbers are not allowed");
    }

    public static InvalidTicketNumbersException notFound(Collection<Integer> numbers) {
        return new InvalidTicketNumbersException("Tickets not found: " + join(numbers));
    }

    static String join(Collection<Integer> numbers) {
        return numbers.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
