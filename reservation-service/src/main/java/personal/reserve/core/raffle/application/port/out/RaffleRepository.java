package personal.reserve.core.raffle.application.port.out;

import personal.reserve.core.raffle.domain.model.Raffle;

import java.util.Optional;

/**
 * Raffle Repository (Output Port)
 */
public interface RaffleRepository {

    Optional<Raffle> findById(Long raffleId);

    /**
     * 활성 추첨 조회 (비관적 락)
     * 같은 추첨 재고에 대한 예약 시도를 직렬화
     */
    Optional<Raffle> findActiveByIdForUpdate(Long raffleId);

    /**
     * 추첨 조회 (비관적 락, 활성 여부 무관)
     * 주문 해제/확정/만료 및 티켓 생성 시 부모 행을 먼저 잠금
     */
    Optional<Raffle> findByIdForUpdate(Long raffleId);

    Raffle save(Raffle raffle);
}
