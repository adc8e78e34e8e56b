package personal.reserve.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT, "C007", "현재 상태에서 허용되지 않는 요청입니다."),

    // Tenant Domain (Txxx)
    TENANT_NOT_FOUND(HttpStatus.NOT_FOUND, "T001", "테넌트를 찾을 수 없습니다."),

    // Appointment Domain (Axxx)
    SERVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "A001", "서비스를 찾을 수 없거나 비활성 상태입니다."),
    INVALID_TIME_WINDOW(HttpStatus.BAD_REQUEST, "A002", "예약할 수 없는 시간입니다."),
    SLOT_UNAVAILABLE(HttpStatus.CONFLICT, "A003", "이미 예약된 시간대입니다."),
    APPOINTMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "A004", "예약을 찾을 수 없습니다."),

    // Raffle Domain (Rxxx)
    RAFFLE_NOT_FOUND(HttpStatus.NOT_FOUND, "R001", "추첨을 찾을 수 없거나 비활성 상태입니다."),
    INVALID_QUANTITY(HttpStatus.BAD_REQUEST, "R002", "주문 가능한 티켓 수량이 아닙니다."),
    INVALID_TICKET_NUMBERS(HttpStatus.BAD_REQUEST, "R003", "유효하지 않은 티켓 번호입니다."),
    TICKETS_NOT_AVAILABLE(HttpStatus.CONFLICT, "R004", "예약 불가능한 티켓입니다."),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "R005", "주문을 찾을 수 없습니다."),
    NO_RESERVED_INVENTORY(HttpStatus.CONFLICT, "R006", "주문에 예약된 티켓이 없습니다."),
    TICKETS_ALREADY_GENERATED(HttpStatus.CONFLICT, "R007", "이미 티켓이 생성된 추첨입니다."),
    CONCURRENT_RESERVATION(HttpStatus.CONFLICT, "R008", "동시 예약 충돌이 발생했습니다."),

    // Payment Domain (Pxxx)
    PAYMENT_TARGET_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "결제 대상을 찾을 수 없습니다."),

    // Infrastructure (Exxx)
    LOCK_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "E001", "요청이 몰려 처리하지 못했습니다. 잠시 후 다시 시도해 주세요."),
    STORE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "E002", "저장소 오류가 발생했습니다. 잠시 후 다시 시도해 주세요.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
