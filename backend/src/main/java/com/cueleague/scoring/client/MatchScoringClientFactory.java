package com.cueleague.scoring.client;

import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.cueleague.scoring.feed.MatchChangeFeed;
import com.cueleague.scoring.model.ScoringSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class MatchScoringClientFactory {

    private final ScoringGateway scoringGateway;
    private final MatchChangeFeed matchChangeFeed;
    private final ScoringRuntimeProperties scoringRuntimeProperties;

    public MatchScoringClient create(
            UUID matchId,
            ScoringSession session,
            PlayerDirectory playerDirectory,
            ScoringClientListener listener
    ) {
        return new MatchScoringClient(
                matchId,
                session,
                scoringGateway,
                matchChangeFeed,
                playerDirectory,
                listener,
                scoringRuntimeProperties.getClient().isAutoConfirm()
        );
    }
}
