package personal.reserve.core.raffle.application.port.in;

import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;

/**
 * Reserve Random Tickets Command
 * 무작위 번호 예약 커맨드
 */
public record ReserveRandomTicketsCommand(
        Long raffleId,
        int quantity,
        Long contactId
) {
    public ReserveRandomTicketsCommand {
        if (raffleId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Raffle ID cannot be null");
        }
        if (contactId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Contact ID cannot be null");
        }
    }
}
