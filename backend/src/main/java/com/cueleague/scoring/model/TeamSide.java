package com.cueleague.scoring.model;

public enum TeamSide {
    HOME,
    AWAY;

    public TeamSide opponent() {
        return this == HOME ? AWAY : HOME;
    }
}
