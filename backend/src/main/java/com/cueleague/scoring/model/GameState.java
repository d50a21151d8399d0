package com.cueleague.scoring.model;

/**
 * Agreement state of a single game, derived from the persisted confirmation columns.
 */
public enum GameState {
    EMPTY,
    PROPOSED,
    FINALIZED,
    VACATE_PENDING
}
