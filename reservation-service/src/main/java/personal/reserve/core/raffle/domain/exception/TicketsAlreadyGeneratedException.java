package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Tickets Already Generated Exception
 * 티켓이 이미 생성된 추첨에 재생성을 요청한 경우
 */
public class TicketsAlreadyGeneratedException extends ReservationException {
    public TicketsAlreadyGeneratedException(String message) {
        super(ErrorCode.TICKETS_ALREADY_GENERATED, message);
    }
}
