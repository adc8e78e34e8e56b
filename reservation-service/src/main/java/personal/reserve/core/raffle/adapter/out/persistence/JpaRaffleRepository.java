package personal.reserve.core.raffle.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Raffle
 */
public interface JpaRaffleRepository extends JpaRepository<RaffleEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RaffleEntity r WHERE r.id = :raffleId AND r.active = true")
    Optional<RaffleEntity> findActiveForUpdate(@Param("raffleId") Long raffleId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RaffleEntity r WHERE r.id = :raffleId")
    Optional<RaffleEntity> findForUpdate(@Param("raffleId") Long raffleId);
}
