package com.cueleague.scoring.model;

import java.util.UUID;

/**
 * Caller identity for one scoring action: the acting member, the team they act for
 * and that team's side in the match.
 */
public record ScoringSession(
        UUID memberId,
        UUID teamId,
        TeamSide side
) {
    public ScoringSession {
        if (memberId == null) {
            throw new IllegalArgumentException("memberId is required");
        }
        if (teamId == null) {
            throw new IllegalArgumentException("teamId is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("side is required");
        }
    }
}
