package com.pickem.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void fromResult_mapsSignOfResult() {
        assertEquals(Outcome.HOME, Outcome.fromResult(7));
        assertEquals(Outcome.AWAY, Outcome.fromResult(-3));
        assertEquals(Outcome.TIE, Outcome.fromResult(0));
        assertEquals(Outcome.NOT_FINISHED, Outcome.fromResult(null));
    }

    @Test
    void onlyNotFinishedIsNonFinal() {
        assertTrue(Outcome.HOME.isFinal());
        assertTrue(Outcome.TIE.isFinal());
        assertFalse(Outcome.NOT_FINISHED.isFinal());
    }

    @Test
    void applyResult_recomputesOutcomeWhenScoreIsCorrected() {
        Game game = new Game();
        game.setHomeTeamId("KC");
        game.setAwayTeamId("BAL");

        game.applyResult(24, 20, 4);
        assertEquals(Outcome.HOME, game.getOutcome());
        assertEquals(24, game.getHomeScore());

        game.applyResult(24, 27, -3);
        assertEquals(Outcome.AWAY, game.getOutcome());
        assertEquals(27, game.getAwayScore());

        game.applyResult(null, null, null);
        assertEquals(Outcome.NOT_FINISHED, game.getOutcome());
    }
}
