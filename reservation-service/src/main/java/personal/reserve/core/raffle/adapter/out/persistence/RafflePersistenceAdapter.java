package personal.reserve.core.raffle.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.reserve.core.raffle.application.port.out.RaffleRepository;
import personal.reserve.core.raffle.domain.model.Raffle;

import java.util.Optional;

/**
 * Raffle Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RafflePersistenceAdapter implements RaffleRepository {

    private final JpaRaffleRepository jpaRaffleRepository;

    @Override
    public Optional<Raffle> findById(Long raffleId) {
        return jpaRaffleRepository.findById(raffleId)
                .map(RaffleEntity::toDomain);
    }

    @Override
    public Optional<Raffle> findActiveByIdForUpdate(Long raffleId) {
        log.debug("Locking active raffle: raffleId={}", raffleId);
        return jpaRaffleRepository.findActiveForUpdate(raffleId)
                .map(RaffleEntity::toDomain);
    }

    @Override
    public Optional<Raffle> findByIdForUpdate(Long raffleId) {
        log.debug("Locking raffle: raffleId={}", raffleId);
        return jpaRaffleRepository.findForUpdate(raffleId)
                .map(RaffleEntity::toDomain);
    }

    @Override
    public Raffle save(Raffle raffle) {
        return jpaRaffleRepository.save(RaffleEntity.fromDomain(raffle)).toDomain();
    }
}
