package com.cueleague.scoring.repository;

import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchStatus;
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
public interface MatchRepository extends JpaRepository<Match, UUID> {

    List<Match> findByStatusInOrderByUpdatedAtAsc(List<MatchStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Match m where m.matchId = :matchId")
    Optional<Match> findByMatchIdForUpdate(@Param("matchId") UUID matchId);
}
