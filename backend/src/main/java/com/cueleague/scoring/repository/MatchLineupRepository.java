package com.cueleague.scoring.repository;

import com.cueleague.scoring.model.MatchLineup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchLineupRepository extends JpaRepository<MatchLineup, UUID> {

    Optional<MatchLineup> findByMatchIdAndTeamId(UUID matchId, UUID teamId);

    List<MatchLineup> findByMatchId(UUID matchId);
}
