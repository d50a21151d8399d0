package com.cueleague.scoring.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private UUID matchId;

    @Column(name = "home_team_id", nullable = false, updatable = false)
    private UUID homeTeamId;

    @Column(name = "away_team_id", nullable = false, updatable = false)
    private UUID awayTeamId;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", nullable = false, length = 32)
    private MatchFormat format = MatchFormat.THREE_V_THREE;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private MatchStatus status = MatchStatus.SCHEDULED;

    @Column(name = "home_games_to_win")
    private Integer homeGamesToWin;

    @Column(name = "away_games_to_win")
    private Integer awayGamesToWin;

    @Column(name = "home_games_to_tie")
    private Integer homeGamesToTie;

    @Column(name = "away_games_to_tie")
    private Integer awayGamesToTie;

    @Column(name = "home_games_to_lose")
    private Integer homeGamesToLose;

    @Column(name = "away_games_to_lose")
    private Integer awayGamesToLose;

    @Column(name = "home_games_won", nullable = false)
    private int homeGamesWon;

    @Column(name = "away_games_won", nullable = false)
    private int awayGamesWon;

    @Column(name = "home_points_earned", nullable = false)
    private int homePointsEarned;

    @Column(name = "away_points_earned", nullable = false)
    private int awayPointsEarned;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_result", nullable = false, length = 16)
    private MatchResult matchResult = MatchResult.PENDING;

    @Column(name = "winner_team_id")
    private UUID winnerTeamId;

    @Column(name = "home_verified_by")
    private UUID homeVerifiedBy;

    @Column(name = "away_verified_by")
    private UUID awayVerifiedBy;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "tiebreaker_started_at")
    private OffsetDateTime tiebreakerStartedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public UUID teamOf(TeamSide side) {
        return side == TeamSide.HOME ? homeTeamId : awayTeamId;
    }

    public TeamSide sideOf(UUID teamId) {
        if (homeTeamId.equals(teamId)) {
            return TeamSide.HOME;
        }
        if (awayTeamId.equals(teamId)) {
            return TeamSide.AWAY;
        }
        return null;
    }

    public UUID verificationOf(TeamSide side) {
        return side == TeamSide.HOME ? homeVerifiedBy : awayVerifiedBy;
    }

    public void setVerificationOf(TeamSide side, UUID memberId) {
        if (side == TeamSide.HOME) {
            homeVerifiedBy = memberId;
        } else {
            awayVerifiedBy = memberId;
        }
    }

    public boolean isTerminal() {
        return status == MatchStatus.COMPLETED;
    }
}
