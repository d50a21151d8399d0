package com.cueleague.scoring.model;

public enum GameAction {
    BREAKS,
    RACKS;

    public GameAction opposite() {
        return this == BREAKS ? RACKS : BREAKS;
    }
}
