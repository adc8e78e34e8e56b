package personal.reserve.core.raffle.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Raffle Not Found Exception
 * 추첨이 없거나 비활성 상태일 때 발생
 */
public class RaffleNotFoundException extends ReservationException {
    public RaffleNotFoundException() {
        super(ErrorCode.RAFFLE_NOT_FOUND, "Raffle not found or is not active");
    }
}
