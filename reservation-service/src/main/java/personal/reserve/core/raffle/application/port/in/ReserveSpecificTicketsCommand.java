package personal.reserve.core.raffle.application.port.in;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

import java.util.List;
import java.util.Objects;

/**
 * Reserve Specific Tickets Command
 * 지정 번호 예약 커맨드
 */
public record ReserveSpecificTicketsCommand(
        Long raffleId,
        List<Integer> numbers,
        Long contactId
) {
    public ReserveSpecificTicketsCommand {
        if (raffleId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Raffle ID cannot be null");
        }
        if (numbers == null || numbers.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ticket numbers cannot be null");
        }
        if (contactId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Contact ID cannot be null");
        }
        numbers = List.copyOf(numbers);
    }
}
