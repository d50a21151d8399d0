package com.cueleague.scoring.model;

public record GameMatchup(
        int gameNumber,
        int homePosition,
        int awayPosition,
        GameAction homeAction
) {
    public GameMatchup {
        if (gameNumber <= 0) {
            throw new IllegalArgumentException("gameNumber must be positive");
        }
        if (homePosition <= 0 || awayPosition <= 0) {
            throw new IllegalArgumentException("lineup positions start at 1");
        }
        if (homeAction == null) {
            throw new IllegalArgumentException("homeAction is required");
        }
    }

    public GameAction awayAction() {
        return homeAction.opposite();
    }
}
