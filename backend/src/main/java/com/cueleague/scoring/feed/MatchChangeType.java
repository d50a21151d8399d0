package com.cueleague.scoring.feed;

public enum MatchChangeType {
    GAME_UPDATED,
    GAMES_CREATED,
    MATCH_UPDATED
}
