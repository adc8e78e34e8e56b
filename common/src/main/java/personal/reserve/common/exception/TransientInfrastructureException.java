package personal.reserve.common.exception;

/**
 * Transient Infrastructure Exception
 * 락 대기 시간 초과, 저장소 장애 등 일시적인 인프라 오류
 * 비즈니스 예외와 구분되며 호출자가 재시도 여부를 결정한다.
 */
public class TransientInfrastructureException extends RuntimeException {

    private final ErrorCode errorCode;

    public TransientInfrastructureException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
