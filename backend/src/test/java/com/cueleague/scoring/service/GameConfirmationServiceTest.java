package com.cueleague.scoring.service;

import com.cueleague.scoring.ScoringFixtures;
import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.feed.MatchChangePublisher;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchFormat;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.repository.MatchGameRepository;
import com.cueleague.scoring.repository.MatchLineupRepository;
import com.cueleague.scoring.repository.MatchRepository;
import com.cueleague.scoring.web.ScoringErrorKind;
import com.cueleague.scoring.web.ScoringException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GameConfirmationServiceTest {

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private MatchGameRepository matchGameRepository;

    @Mock
    private MatchLineupRepository matchLineupRepository;

    @Mock
    private MatchProgressionService matchProgressionService;

    @Mock
    private MatchChangePublisher matchChangePublisher;

    private GameConfirmationService service;
    private Match match;
    private List<MatchGame> games;

    @BeforeEach
    void setUp() {
        ScoringRuntimeProperties properties = new ScoringRuntimeProperties();
        service = new GameConfirmationService(
                matchRepository,
                matchGameRepository,
                new GameConfirmationStateMachine(),
                new MatchOutcomeCalculator(properties),
                new TiebreakerEscalator(matchGameRepository, matchLineupRepository, properties),
                matchProgressionService,
                new ScoringResponseMapper(),
                matchChangePublisher
        );
        match = ScoringFixtures.match(MatchFormat.THREE_V_THREE);
        games = new ArrayList<>(ScoringFixtures.regulationGames(match));
        lenient().when(matchRepository.findByMatchIdForUpdate(match.getMatchId())).thenReturn(Optional.of(match));
        lenient().when(matchGameRepository.saveAndFlush(any(MatchGame.class))).thenAnswer(invocation -> {
            MatchGame saved = invocation.getArgument(0);
            saved.setVersion(saved.getVersion() + 1);
            return saved;
        });
    }

    @Test
    void proposeReturnsCommittedGameAndReconcilesMatch() {
        MatchGame game = lockable(games.get(0));

        MatchScoringResponses.GameTransitionResult result = service.propose(
                match.getMatchId(),
                game.getGameId(),
                ScoringFixtures.homeSession(),
                new ScoringRequests.ProposeResultRequest(
                        match.getHomeTeamId(), game.getHomePlayerId(), true, false, 0L
                )
        );

        assertTrue(result.changed());
        assertEquals(GameState.PROPOSED, result.game().state());
        assertEquals(1L, result.game().version());
        assertTrue(result.game().breakAndRun());
        verify(matchChangePublisher).publishGameUpdated(result.game());
        verify(matchProgressionService).reconcile(match);
    }

    @Test
    void staleExpectedVersionIsWriteConflict() {
        MatchGame game = lockable(games.get(0));
        game.setVersion(3L);

        ScoringException ex = assertThrows(ScoringException.class, () -> service.confirm(
                match.getMatchId(),
                game.getGameId(),
                ScoringFixtures.awaySession(),
                new ScoringRequests.GameActionRequest(2L)
        ));

        assertEquals(ScoringErrorKind.WRITE_CONFLICT, ex.getKind());
        assertTrue(ex.getKind().retryable());
        verify(matchGameRepository, never()).saveAndFlush(any());
    }

    @Test
    void noOpTransitionSkipsWriteAndPublish() {
        MatchGame game = lockable(ScoringFixtures.finalize(games.get(0), match, TeamSide.HOME));

        MatchScoringResponses.GameTransitionResult result = service.confirm(
                match.getMatchId(), game.getGameId(), ScoringFixtures.awaySession(), null
        );

        assertFalse(result.changed());
        assertEquals(GameState.FINALIZED, result.game().state());
        verify(matchGameRepository, never()).saveAndFlush(any());
        verify(matchChangePublisher, never()).publishGameUpdated(any());
        verify(matchProgressionService, never()).reconcile(any(Match.class));
    }

    @Test
    void rejectedTransitionLeavesRowUntouched() {
        MatchGame game = lockable(games.get(0));

        ScoringException ex = assertThrows(ScoringException.class, () -> service.deny(
                match.getMatchId(), game.getGameId(), ScoringFixtures.awaySession(),
                ScoringRequests.GameActionRequest.unversioned()
        ));

        assertEquals(ScoringErrorKind.INVALID_TRANSITION, ex.getKind());
        assertEquals(GameState.EMPTY, game.state());
        verify(matchGameRepository, never()).saveAndFlush(any());
    }

    @Test
    void gameFromAnotherMatchIsNotFound() {
        MatchGame foreign = games.get(0);
        foreign.setMatchId(UUID.randomUUID());
        when(matchGameRepository.findByGameIdForUpdate(foreign.getGameId())).thenReturn(Optional.of(foreign));

        ScoringException ex = assertThrows(ScoringException.class, () -> service.confirm(
                match.getMatchId(), foreign.getGameId(), ScoringFixtures.awaySession(), null
        ));

        assertEquals(ScoringErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void unusedTiebreakerSlotRejectsProposalOnceDecided() {
        for (int i = 0; i < games.size(); i++) {
            ScoringFixtures.finalize(games.get(i), match, i < 9 ? TeamSide.HOME : TeamSide.AWAY);
        }
        List<MatchGame> tiebreakers = ScoringFixtures.tiebreakerGames(match, 3);
        ScoringFixtures.finalize(tiebreakers.get(0), match, TeamSide.AWAY);
        ScoringFixtures.finalize(tiebreakers.get(1), match, TeamSide.AWAY);
        games.addAll(tiebreakers);
        MatchGame third = lockable(tiebreakers.get(2));
        when(matchGameRepository.findByMatchIdOrderByGameNumberAsc(match.getMatchId())).thenReturn(games);

        ScoringException ex = assertThrows(ScoringException.class, () -> service.propose(
                match.getMatchId(),
                third.getGameId(),
                ScoringFixtures.homeSession(),
                new ScoringRequests.ProposeResultRequest(
                        match.getHomeTeamId(), third.getHomePlayerId(), false, false, null
                )
        ));

        assertEquals(ScoringErrorKind.INVALID_TRANSITION, ex.getKind());
        assertEquals(21, third.getGameNumber());
        assertNull(third.getWinnerTeamId());
    }

    @Test
    void missingMatchIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(matchRepository.findByMatchIdForUpdate(missing)).thenReturn(Optional.empty());

        ScoringException ex = assertThrows(ScoringException.class, () -> service.requestVacate(
                missing, UUID.randomUUID(), ScoringFixtures.homeSession(), null
        ));

        assertEquals(ScoringErrorKind.NOT_FOUND, ex.getKind());
    }

    private MatchGame lockable(MatchGame game) {
        when(matchGameRepository.findByGameIdForUpdate(game.getGameId())).thenReturn(Optional.of(game));
        return game;
    }
}
