package com.cueleague.scoring.feed;

import com.cueleague.scoring.dto.MatchScoringResponses;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.UUID;

/**
 * Hands change events to the feed once the surrounding transaction commits,
 * so subscribers never observe a write that is later rolled back.
 */
@Service
@RequiredArgsConstructor
public class MatchChangePublisher {

    private final MatchChangeFeed matchChangeFeed;

    public void publishGameUpdated(MatchScoringResponses.GameView game) {
        publish(MatchChangeEvent.gameUpdated(game));
    }

    public void publishGamesCreated(UUID matchId, List<MatchScoringResponses.GameView> games) {
        if (games.isEmpty()) {
            return;
        }
        publish(MatchChangeEvent.gamesCreated(matchId, games));
    }

    public void publishMatchUpdated(MatchScoringResponses.MatchView match) {
        publish(MatchChangeEvent.matchUpdated(match));
    }

    private void publish(MatchChangeEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    matchChangeFeed.publish(event);
                }
            });
            return;
        }
        matchChangeFeed.publish(event);
    }
}
