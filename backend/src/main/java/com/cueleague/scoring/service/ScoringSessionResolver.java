package com.cueleague.scoring.service;

import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.repository.MatchRepository;
import com.cueleague.scoring.web.ScoringException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Turns the identity provider's member and team into the session every
 * scoring call requires.
 */
@Service
@RequiredArgsConstructor
public class ScoringSessionResolver {

    private final MatchRepository matchRepository;

    @Transactional(readOnly = true)
    public ScoringSession resolve(UUID matchId, UUID memberId, UUID teamId) {
        if (memberId == null || teamId == null) {
            throw ScoringException.identityViolation("Member and team identity are required to score a match");
        }
        Match match = matchRepository.findById(matchId)
                .orElseThrow(() -> ScoringException.notFound("Match not found: " + matchId));
        TeamSide side = match.sideOf(teamId);
        if (side == null) {
            throw ScoringException.identityViolation("Your team is not playing in this match");
        }
        return new ScoringSession(memberId, teamId, side);
    }
}
