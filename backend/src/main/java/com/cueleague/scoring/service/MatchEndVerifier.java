package com.cueleague.scoring.service;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.feed.MatchChangePublisher;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.MatchResult;
import com.cueleague.scoring.model.MatchStatus;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.repository.MatchGameRepository;
import com.cueleague.scoring.repository.MatchRepository;
import com.cueleague.scoring.web.ScoringException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Match-level sign-off: each team verifies the aggregate result independently
 * and the match completes once both have done so. There is no deny or vacate
 * at this level; vacating games that un-decide the result clears both
 * verifications instead.
 */
@Service
@RequiredArgsConstructor
public class MatchEndVerifier {

    private static final Logger log = LoggerFactory.getLogger(MatchEndVerifier.class);

    private final MatchRepository matchRepository;
    private final MatchGameRepository matchGameRepository;
    private final MatchOutcomeCalculator matchOutcomeCalculator;
    private final ScoringResponseMapper scoringResponseMapper;
    private final MatchChangePublisher matchChangePublisher;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Transactional
    public MatchScoringResponses.MatchTransitionResult verify(UUID matchId, ScoringSession session) {
        Objects.requireNonNull(session, "session is required");
        Match match = matchRepository.findByMatchIdForUpdate(matchId)
                .orElseThrow(() -> ScoringException.notFound("Match not found: " + matchId));
        if (match.sideOf(session.teamId()) != session.side()) {
            throw ScoringException.identityViolation("Your team is not the " + session.side().name().toLowerCase()
                    + " team of this match");
        }
        if (match.isTerminal()) {
            return unchanged(match, "Match is already completed");
        }

        List<MatchGame> games = matchGameRepository.findByMatchIdOrderByGameNumberAsc(matchId);
        MatchOutcome outcome = matchOutcomeCalculator.calculate(match, games);
        boolean reconciled = applyOutcome(match, outcome, games.stream().anyMatch(MatchGame::isTiebreaker));
        if (!outcome.result().isDecided()) {
            throw ScoringException.invalidTransition(
                    "Match result is not decided yet; finish scoring the remaining games before verifying"
            );
        }

        TeamSide side = session.side();
        if (match.verificationOf(side) != null) {
            if (reconciled) {
                save(match);
            }
            return unchanged(match, "Your team already verified this match; waiting for the other team");
        }

        OffsetDateTime now = OffsetDateTime.now();
        match.setVerificationOf(side, session.memberId());
        String message;
        if (match.getHomeVerifiedBy() != null && match.getAwayVerifiedBy() != null) {
            match.setStatus(MatchStatus.COMPLETED);
            match.setCompletedAt(now);
            message = "Match verified by both teams and completed";
            log.info("Match {} completed with result {} ({}-{})",
                    matchId, match.getMatchResult(), match.getHomeGamesWon(), match.getAwayGamesWon());
            applicationEventPublisher.publishEvent(toFinalizedEvent(match));
        } else {
            message = "Match verified; waiting for the other team";
            log.info("Match {} verified by {} team", matchId, side.name().toLowerCase());
        }
        Match saved = save(match);
        return new MatchScoringResponses.MatchTransitionResult(scoringResponseMapper.toMatchView(saved), true, message);
    }

    /**
     * Copies the derived outcome onto the match row. Any change of result or
     * winner discards both verifications, and any change at all reopens a
     * completed match. Returns whether the row changed.
     */
    public boolean applyOutcome(Match match, MatchOutcome outcome, boolean tiebreakerGamesExist) {
        boolean completed = match.isTerminal();
        boolean changed = false;

        int homePoints = pointsFor(outcome.homeGamesWon(), match.getHomeGamesToTie(), match.getHomeGamesToWin());
        int awayPoints = pointsFor(outcome.awayGamesWon(), match.getAwayGamesToTie(), match.getAwayGamesToWin());
        if (match.getHomeGamesWon() != outcome.homeGamesWon() || match.getAwayGamesWon() != outcome.awayGamesWon()
                || match.getHomePointsEarned() != homePoints || match.getAwayPointsEarned() != awayPoints) {
            match.setHomeGamesWon(outcome.homeGamesWon());
            match.setAwayGamesWon(outcome.awayGamesWon());
            match.setHomePointsEarned(homePoints);
            match.setAwayPointsEarned(awayPoints);
            changed = true;
        }

        if (match.getMatchResult() != outcome.result() || !Objects.equals(match.getWinnerTeamId(), outcome.winnerTeamId())) {
            MatchResult previous = match.getMatchResult();
            match.setMatchResult(outcome.result());
            match.setWinnerTeamId(outcome.winnerTeamId());
            if (match.getHomeVerifiedBy() != null || match.getAwayVerifiedBy() != null) {
                match.setHomeVerifiedBy(null);
                match.setAwayVerifiedBy(null);
                log.info("Match {} result changed from {} to {}; verifications cleared",
                        match.getMatchId(), previous, outcome.result());
            }
            changed = true;
        }

        if (completed) {
            if (!changed) {
                return false;
            }
            reopen(match, outcome);
        }

        MatchStatus status = resolveStatus(outcome, tiebreakerGamesExist);
        if (match.getStatus() != status) {
            match.setStatus(status);
            if (match.getStartedAt() == null) {
                match.setStartedAt(OffsetDateTime.now());
            }
            changed = true;
        }
        return changed;
    }

    private static void reopen(Match match, MatchOutcome outcome) {
        match.setCompletedAt(null);
        match.setHomeVerifiedBy(null);
        match.setAwayVerifiedBy(null);
        log.info("Completed match {} reopened after a vacate; result is now {} ({}-{})",
                match.getMatchId(), outcome.result(), outcome.homeGamesWon(), outcome.awayGamesWon());
    }

    static int pointsFor(int wins, Integer gamesToTie, Integer gamesToWin) {
        Integer baseline = gamesToTie != null ? gamesToTie : gamesToWin;
        return baseline == null ? 0 : wins - baseline;
    }

    private static MatchStatus resolveStatus(MatchOutcome outcome, boolean tiebreakerGamesExist) {
        if (outcome.result().isDecided()) {
            return MatchStatus.AWAITING_VERIFICATION;
        }
        if (outcome.tiebreakerRequired() && tiebreakerGamesExist) {
            return MatchStatus.TIEBREAKER;
        }
        return MatchStatus.IN_PROGRESS;
    }

    private Match save(Match match) {
        match.setUpdatedAt(OffsetDateTime.now());
        Match saved = matchRepository.saveAndFlush(match);
        matchChangePublisher.publishMatchUpdated(scoringResponseMapper.toMatchView(saved));
        return saved;
    }

    private MatchScoringResponses.MatchTransitionResult unchanged(Match match, String message) {
        log.debug("Verification of match {} left it unchanged: {}", match.getMatchId(), message);
        return new MatchScoringResponses.MatchTransitionResult(scoringResponseMapper.toMatchView(match), false, message);
    }

    private static MatchFinalizedEvent toFinalizedEvent(Match match) {
        return new MatchFinalizedEvent(
                match.getMatchId(),
                match.getHomeTeamId(),
                match.getAwayTeamId(),
                match.getMatchResult(),
                match.getWinnerTeamId(),
                match.getHomeGamesWon(),
                match.getAwayGamesWon(),
                match.getHomePointsEarned(),
                match.getAwayPointsEarned(),
                match.getHomeVerifiedBy(),
                match.getAwayVerifiedBy(),
                match.getCompletedAt()
        );
    }
}
