package com.cueleague.scoring.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed matchup order for each match format.
 * <p>
 * 3v3 is a double round robin: every player meets every opposing player twice,
 * once breaking and once racking. Home breaks in odd rounds.
 * 5v5 is a single round robin of five rounds where the away rotation shifts one
 * position per round and the break alternates by round.
 */
public final class GameOrder {

    private static final List<GameMatchup> THREE_V_THREE = List.of(
            new GameMatchup(1, 1, 1, GameAction.BREAKS),
            new GameMatchup(2, 2, 2, GameAction.BREAKS),
            new GameMatchup(3, 3, 3, GameAction.BREAKS),
            new GameMatchup(4, 1, 2, GameAction.RACKS),
            new GameMatchup(5, 2, 3, GameAction.RACKS),
            new GameMatchup(6, 3, 1, GameAction.RACKS),
            new GameMatchup(7, 1, 3, GameAction.BREAKS),
            new GameMatchup(8, 2, 1, GameAction.BREAKS),
            new GameMatchup(9, 3, 2, GameAction.BREAKS),
            new GameMatchup(10, 1, 1, GameAction.RACKS),
            new GameMatchup(11, 2, 2, GameAction.RACKS),
            new GameMatchup(12, 3, 3, GameAction.RACKS),
            new GameMatchup(13, 1, 2, GameAction.BREAKS),
            new GameMatchup(14, 2, 3, GameAction.BREAKS),
            new GameMatchup(15, 3, 1, GameAction.BREAKS),
            new GameMatchup(16, 1, 3, GameAction.RACKS),
            new GameMatchup(17, 2, 1, GameAction.RACKS),
            new GameMatchup(18, 3, 2, GameAction.RACKS)
    );

    private static final List<GameMatchup> FIVE_V_FIVE = buildFiveVFive();

    private GameOrder() {
    }

    public static List<GameMatchup> regulation(MatchFormat format) {
        return switch (format) {
            case THREE_V_THREE -> THREE_V_THREE;
            case FIVE_V_FIVE -> FIVE_V_FIVE;
        };
    }

    /**
     * Tiebreaker slot {@code k} (1-based) pairs lineup position k on both sides,
     * numbered directly after the regulation games. Home breaks in odd slots.
     */
    public static List<GameMatchup> tiebreaker(MatchFormat format, int gameCount) {
        if (gameCount <= 0 || gameCount > format.lineupSize()) {
            throw new IllegalArgumentException(
                    "Tiebreaker game count must be between 1 and " + format.lineupSize()
            );
        }
        int firstNumber = format.regulationGameCount() + 1;
        List<GameMatchup> games = new ArrayList<>(gameCount);
        for (int slot = 1; slot <= gameCount; slot++) {
            GameAction homeAction = slot % 2 == 1 ? GameAction.BREAKS : GameAction.RACKS;
            games.add(new GameMatchup(firstNumber + slot - 1, slot, slot, homeAction));
        }
        return List.copyOf(games);
    }

    public static boolean isTiebreakerNumber(MatchFormat format, int gameNumber) {
        return gameNumber > format.regulationGameCount();
    }

    private static List<GameMatchup> buildFiveVFive() {
        int size = MatchFormat.FIVE_V_FIVE.lineupSize();
        List<GameMatchup> games = new ArrayList<>(MatchFormat.FIVE_V_FIVE.regulationGameCount());
        int gameNumber = 1;
        for (int round = 0; round < size; round++) {
            GameAction homeAction = round % 2 == 0 ? GameAction.BREAKS : GameAction.RACKS;
            for (int slot = 0; slot < size; slot++) {
                int awayPosition = (slot + round) % size + 1;
                games.add(new GameMatchup(gameNumber++, slot + 1, awayPosition, homeAction));
            }
        }
        return List.copyOf(games);
    }
}
