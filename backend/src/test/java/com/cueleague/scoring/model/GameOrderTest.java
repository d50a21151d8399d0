package com.cueleague.scoring.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GameOrderTest {

    @Test
    void threeVThreeIsDoubleRoundRobinWithEachSideBreakingOnce() {
        List<GameMatchup> games = GameOrder.regulation(MatchFormat.THREE_V_THREE);

        assertEquals(18, games.size());
        Set<String> pairings = new HashSet<>();
        for (int i = 0; i < games.size(); i++) {
            GameMatchup matchup = games.get(i);
            assertEquals(i + 1, matchup.gameNumber());
            assertNotEquals(matchup.homeAction(), matchup.awayAction());
            assertTrue(pairings.add(matchup.homePosition() + ":" + matchup.awayPosition() + ":" + matchup.homeAction()));
        }
        assertEquals(18, pairings.size());
    }

    @Test
    void fiveVFiveMeetsEveryOpponentOnce() {
        List<GameMatchup> games = GameOrder.regulation(MatchFormat.FIVE_V_FIVE);

        assertEquals(25, games.size());
        Set<String> pairings = new HashSet<>();
        for (GameMatchup matchup : games) {
            assertTrue(pairings.add(matchup.homePosition() + ":" + matchup.awayPosition()));
        }
        assertEquals(GameAction.BREAKS, games.get(0).homeAction());
        assertEquals(GameAction.RACKS, games.get(5).homeAction());
    }

    @Test
    void tiebreakerGamesFollowRegulationAndPairMatchingPositions() {
        List<GameMatchup> tiebreakers = GameOrder.tiebreaker(MatchFormat.THREE_V_THREE, 3);

        assertEquals(3, tiebreakers.size());
        assertEquals(new GameMatchup(19, 1, 1, GameAction.BREAKS), tiebreakers.get(0));
        assertEquals(new GameMatchup(20, 2, 2, GameAction.RACKS), tiebreakers.get(1));
        assertEquals(new GameMatchup(21, 3, 3, GameAction.BREAKS), tiebreakers.get(2));
        assertTrue(GameOrder.isTiebreakerNumber(MatchFormat.THREE_V_THREE, 19));
        assertFalse(GameOrder.isTiebreakerNumber(MatchFormat.THREE_V_THREE, 18));
    }

    @Test
    void tiebreakerCountIsBoundedByLineupSize() {
        assertThrows(IllegalArgumentException.class, () -> GameOrder.tiebreaker(MatchFormat.THREE_V_THREE, 4));
        assertThrows(IllegalArgumentException.class, () -> GameOrder.tiebreaker(MatchFormat.THREE_V_THREE, 0));
        assertEquals(26, GameOrder.tiebreaker(MatchFormat.FIVE_V_FIVE, 5).get(0).gameNumber());
    }
}
