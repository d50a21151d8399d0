package com.cueleague.scoring.feed;

import com.cueleague.scoring.ScoringFixtures;
import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MatchChangePublisherTest {

    @Mock
    private MatchChangeFeed matchChangeFeed;

    private final ScoringResponseMapper mapper = new ScoringResponseMapper();

    private MatchChangePublisher publisher;
    private Match match;

    @BeforeEach
    void setUp() {
        publisher = new MatchChangePublisher(matchChangeFeed);
        match = ScoringFixtures.match(MatchFormat.THREE_V_THREE);
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void publishesImmediatelyOutsideTransaction() {
        MatchScoringResponses.MatchView view = mapper.toMatchView(match);

        publisher.publishMatchUpdated(view);

        ArgumentCaptor<MatchChangeEvent> captor = ArgumentCaptor.forClass(MatchChangeEvent.class);
        verify(matchChangeFeed).publish(captor.capture());
        assertEquals(MatchChangeType.MATCH_UPDATED, captor.getValue().type());
        assertEquals(view, captor.getValue().match());
    }

    @Test
    void defersPublishUntilAfterCommit() {
        TransactionSynchronizationManager.initSynchronization();
        MatchScoringResponses.GameView game = mapper.toGameView(ScoringFixtures.regulationGames(match).get(0));

        publisher.publishGameUpdated(game);

        verify(matchChangeFeed, never()).publish(any());
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        assertEquals(1, synchronizations.size());

        synchronizations.get(0).afterCommit();

        ArgumentCaptor<MatchChangeEvent> captor = ArgumentCaptor.forClass(MatchChangeEvent.class);
        verify(matchChangeFeed).publish(captor.capture());
        assertEquals(MatchChangeType.GAME_UPDATED, captor.getValue().type());
        assertEquals(List.of(game), captor.getValue().games());
    }

    @Test
    void emptyGameBatchIsNotPublished() {
        publisher.publishGamesCreated(match.getMatchId(), List.of());

        verify(matchChangeFeed, never()).publish(any());
    }
}
