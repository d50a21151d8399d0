package com.cueleague.scoring.service;

import com.cueleague.scoring.ScoringFixtures;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchFormat;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.repository.MatchRepository;
import com.cueleague.scoring.web.ScoringErrorKind;
import com.cueleague.scoring.web.ScoringException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoringSessionResolverTest {

    @Mock
    private MatchRepository matchRepository;

    @InjectMocks
    private ScoringSessionResolver resolver;

    @Test
    void resolvesSideFromTeam() {
        Match match = ScoringFixtures.match(MatchFormat.THREE_V_THREE);
        when(matchRepository.findById(match.getMatchId())).thenReturn(Optional.of(match));

        ScoringSession session = resolver.resolve(
                match.getMatchId(),
                ScoringFixtures.AWAY_CAPTAIN_ID,
                ScoringFixtures.AWAY_TEAM_ID
        );

        assertEquals(TeamSide.AWAY, session.side());
        assertEquals(ScoringFixtures.AWAY_CAPTAIN_ID, session.memberId());
    }

    @Test
    void teamOutsideMatchIsIdentityViolation() {
        Match match = ScoringFixtures.match(MatchFormat.THREE_V_THREE);
        when(matchRepository.findById(match.getMatchId())).thenReturn(Optional.of(match));

        ScoringException thrown = assertThrows(
                ScoringException.class,
                () -> resolver.resolve(match.getMatchId(), UUID.randomUUID(), UUID.randomUUID())
        );

        assertEquals(ScoringErrorKind.IDENTITY_VIOLATION, thrown.getKind());
    }

    @Test
    void missingIdentityIsRejectedWithoutLookup() {
        ScoringException thrown = assertThrows(
                ScoringException.class,
                () -> resolver.resolve(UUID.randomUUID(), null, ScoringFixtures.HOME_TEAM_ID)
        );

        assertEquals(ScoringErrorKind.IDENTITY_VIOLATION, thrown.getKind());
        verify(matchRepository, never()).findById(any());
    }

    @Test
    void unknownMatchIsNotFound() {
        UUID matchId = UUID.randomUUID();
        when(matchRepository.findById(matchId)).thenReturn(Optional.empty());

        ScoringException thrown = assertThrows(
                ScoringException.class,
                () -> resolver.resolve(matchId, ScoringFixtures.HOME_CAPTAIN_ID, ScoringFixtures.HOME_TEAM_ID)
        );

        assertEquals(ScoringErrorKind.NOT_FOUND, thrown.getKind());
    }
}
