package personal.reserve.core.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.common.exception.TransientInfrastructureException;

import java.util.function.Supplier;

/**
 * 저장소 장애를 재시도 가능한 인프라 예외로 변환
 * 트랜잭션 경계 바깥(커밋 이후)에서 호출해야 커밋 시점의 락/제약 위반도 변환된다.
 */
@Slf4j
public final class StoreFailures {

    private StoreFailures() {
    }

    public static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();

        } catch (TransientDataAccessException e) {
            log.warn("Lock wait failed: operation={}, cause={}", operation, e.getMessage());
            throw new TransientInfrastructureException(ErrorCode.LOCK_TIMEOUT,
                    operation + " could not acquire a lock in time", e);

        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent write conflict: operation={}, cause={}", operation, e.getMessage());
            throw new TransientInfrastructureException(ErrorCode.STORE_FAILURE,
                    operation + " conflicted with a concurrent write", e);
        }
    }
}
