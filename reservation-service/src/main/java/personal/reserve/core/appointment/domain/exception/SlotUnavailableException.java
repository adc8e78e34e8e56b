package personal.reserve.core.appointment.domain.exception;

import personal.reserve.common.exception.ErrorCode;

/**
 * Slot Unavailable Exception
 * 기존 예약과 겹치거나 일일 한도를 초과한 슬롯
 */
public class SlotUnavailableException extends BookingException {
    public SlotUnavailableException() {
        super(ErrorCode.SLOT_UNAVAILABLE, "This time slot is not available");
    }
}
