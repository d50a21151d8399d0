package com.cueleague.scoring.model;

public enum MatchResult {
    PENDING,
    HOME_WIN,
    AWAY_WIN,
    TIE;

    public boolean isDecided() {
        return this != PENDING;
    }
}
