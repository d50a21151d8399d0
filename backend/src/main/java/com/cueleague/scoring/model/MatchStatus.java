package com.cueleague.scoring.model;

public enum MatchStatus {
    SCHEDULED,
    IN_PROGRESS,
    TIEBREAKER,
    AWAITING_VERIFICATION,
    COMPLETED
}
