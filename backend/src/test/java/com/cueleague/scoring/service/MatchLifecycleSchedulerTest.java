package com.cueleague.scoring.service;

import com.cueleague.scoring.ScoringFixtures;
import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchFormat;
import com.cueleague.scoring.repository.MatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchLifecycleSchedulerTest {

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private MatchProgressionService matchProgressionService;

    private ScoringRuntimeProperties properties;
    private MatchLifecycleScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new ScoringRuntimeProperties();
        scheduler = new MatchLifecycleScheduler(properties, matchRepository, matchProgressionService);
    }

    @Test
    void disabledWorkerDoesNothing() {
        scheduler.processLifecycleTick();

        verifyNoInteractions(matchRepository, matchProgressionService);
    }

    @Test
    void reconcilesEveryOpenMatchEvenWhenOneFails() {
        properties.getWorker().setEnabled(true);
        Match first = ScoringFixtures.match(MatchFormat.THREE_V_THREE);
        Match second = ScoringFixtures.match(MatchFormat.FIVE_V_FIVE);
        when(matchRepository.findByStatusInOrderByUpdatedAtAsc(anyList())).thenReturn(List.of(first, second));
        when(matchProgressionService.reconcile(first.getMatchId()))
                .thenThrow(new CannotAcquireLockException("row locked"));
        when(matchProgressionService.reconcile(second.getMatchId())).thenReturn(true);

        scheduler.processLifecycleTick();

        verify(matchProgressionService).reconcile(first.getMatchId());
        verify(matchProgressionService).reconcile(second.getMatchId());
        verify(matchProgressionService, never()).reconcile(any(Match.class));
    }
}
