package com.cueleague.scoring.model;

public enum MatchFormat {
    THREE_V_THREE(3, 18),
    FIVE_V_FIVE(5, 25);

    private final int lineupSize;
    private final int regulationGameCount;

    MatchFormat(int lineupSize, int regulationGameCount) {
        this.lineupSize = lineupSize;
        this.regulationGameCount = regulationGameCount;
    }

    public int lineupSize() {
        return lineupSize;
    }

    public int regulationGameCount() {
        return regulationGameCount;
    }
}
