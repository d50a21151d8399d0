package com.cueleague.scoring.service;

/**
 * Result of applying one state machine action to a game row.
 */
public record GameTransition(
        boolean changed,
        String message
) {
    public static GameTransition applied(String message) {
        return new GameTransition(true, message);
    }

    public static GameTransition unchanged(String message) {
        return new GameTransition(false, message);
    }
}
