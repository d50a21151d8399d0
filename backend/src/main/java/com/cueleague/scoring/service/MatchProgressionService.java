package com.cueleague.scoring.service;

import com.cueleague.scoring.feed.MatchChangePublisher;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.repository.MatchGameRepository;
import com.cueleague.scoring.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Re-derives a match aggregate from its games after any game write: live
 * counts, outcome, status, tiebreaker escalation and verification reset.
 */
@Service
@RequiredArgsConstructor
public class MatchProgressionService {

    private final MatchRepository matchRepository;
    private final MatchGameRepository matchGameRepository;
    private final MatchOutcomeCalculator matchOutcomeCalculator;
    private final TiebreakerEscalator tiebreakerEscalator;
    private final MatchEndVerifier matchEndVerifier;
    private final ScoringResponseMapper scoringResponseMapper;
    private final MatchChangePublisher matchChangePublisher;

    /**
     * Caller must hold the match row lock. A completed match is reopened when
     * its games no longer add up to the verified aggregate.
     */
    public ProgressUpdate reconcile(Match match) {
        List<MatchGame> games = matchGameRepository.findByMatchIdOrderByGameNumberAsc(match.getMatchId());
        MatchOutcome outcome = matchOutcomeCalculator.calculate(match, games);
        List<MatchGame> createdTiebreakers = tiebreakerEscalator.escalateIfDeadlocked(match, games, outcome);
        boolean tiebreakerGamesExist = !createdTiebreakers.isEmpty()
                || games.stream().anyMatch(MatchGame::isTiebreaker);
        boolean matchChanged = matchEndVerifier.applyOutcome(match, outcome, tiebreakerGamesExist);

        if (!createdTiebreakers.isEmpty()) {
            matchChangePublisher.publishGamesCreated(
                    match.getMatchId(),
                    scoringResponseMapper.toGameViews(createdTiebreakers)
            );
            matchChanged = true;
        }
        if (matchChanged) {
            match.setUpdatedAt(OffsetDateTime.now());
            Match saved = matchRepository.saveAndFlush(match);
            matchChangePublisher.publishMatchUpdated(scoringResponseMapper.toMatchView(saved));
        }
        return new ProgressUpdate(outcome, createdTiebreakers, matchChanged);
    }

    @Transactional
    public boolean reconcile(UUID matchId) {
        Match match = matchRepository.findByMatchIdForUpdate(matchId).orElse(null);
        if (match == null) {
            return false;
        }
        return reconcile(match).matchChanged();
    }

    public record ProgressUpdate(
            MatchOutcome outcome,
            List<MatchGame> createdTiebreakers,
            boolean matchChanged
    ) {
    }
}
