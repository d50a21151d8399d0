package com.cueleague.scoring.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(
        name = "match_lineups",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_match_lineups_match_team",
                columnNames = {"match_id", "team_id"}
        )
)
public class MatchLineup {

    public static final int MAX_POSITIONS = 5;

    @Id
    @Column(name = "lineup_id", nullable = false, updatable = false)
    private UUID lineupId;

    @Column(name = "match_id", nullable = false, updatable = false)
    private UUID matchId;

    @Column(name = "team_id", nullable = false, updatable = false)
    private UUID teamId;

    @Column(name = "player1_id")
    private UUID player1Id;

    @Column(name = "player2_id")
    private UUID player2Id;

    @Column(name = "player3_id")
    private UUID player3Id;

    @Column(name = "player4_id")
    private UUID player4Id;

    @Column(name = "player5_id")
    private UUID player5Id;

    @Column(name = "player1_handicap")
    private Integer player1Handicap;

    @Column(name = "player2_handicap")
    private Integer player2Handicap;

    @Column(name = "player3_handicap")
    private Integer player3Handicap;

    @Column(name = "player4_handicap")
    private Integer player4Handicap;

    @Column(name = "player5_handicap")
    private Integer player5Handicap;

    @Column(name = "locked", nullable = false)
    private boolean locked;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public UUID playerAt(int position) {
        return switch (requirePosition(position)) {
            case 1 -> player1Id;
            case 2 -> player2Id;
            case 3 -> player3Id;
            case 4 -> player4Id;
            default -> player5Id;
        };
    }

    public void setPlayerAt(int position, UUID playerId) {
        switch (requirePosition(position)) {
            case 1 -> player1Id = playerId;
            case 2 -> player2Id = playerId;
            case 3 -> player3Id = playerId;
            case 4 -> player4Id = playerId;
            default -> player5Id = playerId;
        }
    }

    public Integer handicapAt(int position) {
        return switch (requirePosition(position)) {
            case 1 -> player1Handicap;
            case 2 -> player2Handicap;
            case 3 -> player3Handicap;
            case 4 -> player4Handicap;
            default -> player5Handicap;
        };
    }

    public void setHandicapAt(int position, Integer handicap) {
        switch (requirePosition(position)) {
            case 1 -> player1Handicap = handicap;
            case 2 -> player2Handicap = handicap;
            case 3 -> player3Handicap = handicap;
            case 4 -> player4Handicap = handicap;
            default -> player5Handicap = handicap;
        }
    }

    private static int requirePosition(int position) {
        if (position < 1 || position > MAX_POSITIONS) {
            throw new IllegalArgumentException("Lineup position must be between 1 and " + MAX_POSITIONS);
        }
        return position;
    }
}
