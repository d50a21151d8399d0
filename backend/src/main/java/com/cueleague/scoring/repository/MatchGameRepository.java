package com.cueleague.scoring.repository;

import com.cueleague.scoring.model.MatchGame;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchGameRepository extends JpaRepository<MatchGame, UUID> {

    List<MatchGame> findByMatchIdOrderByGameNumberAsc(UUID matchId);

    List<MatchGame> findByMatchIdAndTiebreakerOrderByGameNumberAsc(UUID matchId, boolean tiebreaker);

    Optional<MatchGame> findByMatchIdAndGameNumber(UUID matchId, Integer gameNumber);

    boolean existsByMatchId(UUID matchId);

    boolean existsByMatchIdAndTiebreakerTrue(UUID matchId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from MatchGame g where g.gameId = :gameId")
    Optional<MatchGame> findByGameIdForUpdate(@Param("gameId") UUID gameId);
}
