package com.cueleague.scoring.feed;

import com.cueleague.scoring.dto.MatchScoringResponses;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Committed mutation of a match or its games. Game events carry the affected
 * rows; match events carry the match view.
 */
public record MatchChangeEvent(
        MatchChangeType type,
        UUID matchId,
        List<MatchScoringResponses.GameView> games,
        MatchScoringResponses.MatchView match,
        OffsetDateTime occurredAt
) {
    public MatchChangeEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(matchId, "matchId is required");
        games = games == null ? List.of() : List.copyOf(games);
    }

    public static MatchChangeEvent gameUpdated(MatchScoringResponses.GameView game) {
        return new MatchChangeEvent(MatchChangeType.GAME_UPDATED, game.matchId(), List.of(game), null, OffsetDateTime.now());
    }

    public static MatchChangeEvent gamesCreated(UUID matchId, List<MatchScoringResponses.GameView> games) {
        return new MatchChangeEvent(MatchChangeType.GAMES_CREATED, matchId, games, null, OffsetDateTime.now());
    }

    public static MatchChangeEvent matchUpdated(MatchScoringResponses.MatchView match) {
        return new MatchChangeEvent(MatchChangeType.MATCH_UPDATED, match.matchId(), List.of(), match, OffsetDateTime.now());
    }
}
