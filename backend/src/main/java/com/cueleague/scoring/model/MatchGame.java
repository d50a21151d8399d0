package com.cueleague.scoring.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(
        name = "match_games",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_match_games_match_game_number",
                columnNames = {"match_id", "game_number"}
        )
)
public class MatchGame {

    @Id
    @Column(name = "game_id", nullable = false, updatable = false)
    private UUID gameId;

    @Column(name = "match_id", nullable = false, updatable = false)
    private UUID matchId;

    @Column(name = "game_number", nullable = false, updatable = false)
    private Integer gameNumber;

    @Column(name = "is_tiebreaker", nullable = false, updatable = false)
    private boolean tiebreaker;

    @Column(name = "home_player_id")
    private UUID homePlayerId;

    @Column(name = "away_player_id")
    private UUID awayPlayerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "home_action", nullable = false, length = 16)
    private GameAction homeAction;

    @Enumerated(EnumType.STRING)
    @Column(name = "away_action", nullable = false, length = 16)
    private GameAction awayAction;

    @Column(name = "winner_team_id")
    private UUID winnerTeamId;

    @Column(name = "winner_player_id")
    private UUID winnerPlayerId;

    @Column(name = "break_and_run", nullable = false)
    private boolean breakAndRun;

    @Column(name = "golden_break", nullable = false)
    private boolean goldenBreak;

    @Column(name = "confirmed_by_home")
    private UUID confirmedByHome;

    @Column(name = "confirmed_by_away")
    private UUID confirmedByAway;

    @Column(name = "confirmed_at")
    private OffsetDateTime confirmedAt;

    @Column(name = "vacate_requested_by")
    private UUID vacateRequestedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "vacate_requested_side", length = 8)
    private TeamSide vacateRequestedSide;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public GameState state() {
        if (winnerTeamId == null) {
            return GameState.EMPTY;
        }
        if (confirmedByHome == null || confirmedByAway == null) {
            return GameState.PROPOSED;
        }
        return vacateRequestedBy == null ? GameState.FINALIZED : GameState.VACATE_PENDING;
    }

    public UUID confirmationOf(TeamSide side) {
        return side == TeamSide.HOME ? confirmedByHome : confirmedByAway;
    }

    public void setConfirmationOf(TeamSide side, UUID memberId) {
        if (side == TeamSide.HOME) {
            confirmedByHome = memberId;
        } else {
            confirmedByAway = memberId;
        }
    }

    public UUID playerOf(TeamSide side) {
        return side == TeamSide.HOME ? homePlayerId : awayPlayerId;
    }

    /**
     * Side that carries the only confirmation of a proposed result, or null when
     * the game is not in {@link GameState#PROPOSED}.
     */
    public TeamSide proposingSide() {
        if (state() != GameState.PROPOSED) {
            return null;
        }
        if (confirmedByHome != null) {
            return TeamSide.HOME;
        }
        return confirmedByAway != null ? TeamSide.AWAY : null;
    }

    /**
     * Resets winner, modifiers, both confirmations and any vacate request in one step.
     */
    public void clearResult() {
        winnerTeamId = null;
        winnerPlayerId = null;
        breakAndRun = false;
        goldenBreak = false;
        confirmedByHome = null;
        confirmedByAway = null;
        confirmedAt = null;
        vacateRequestedBy = null;
        vacateRequestedSide = null;
    }
}
