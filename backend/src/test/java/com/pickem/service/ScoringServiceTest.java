package com.pickem.service;

import com.pickem.model.Game;
import com.pickem.model.GameTypeScaling;
import com.pickem.model.GameTypeScalingId;
import com.pickem.model.Outcome;
import com.pickem.model.Wager;
import com.pickem.repository.GameRepository;
import com.pickem.repository.GameTypeScalingRepository;
import com.pickem.repository.WagerRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoringServiceTest {

    private static final long CHANNEL_ID = 100L;

    @Mock
    private WagerRepository wagerRepository;

    @Mock
    private GameRepository gameRepository;

    @Mock
    private GameTypeScalingRepository gameTypeScalingRepository;

    @InjectMocks
    private ScoringService scoringService;

    @Test
    void earnedPoints_usesChannelScalingFactorForCorrectChoice() {
        Game superBowl = game("2025_22_KC_PHI", "SB", Outcome.HOME);
        Wager wager = wager(1L, superBowl.getId(), Outcome.HOME);
        when(gameRepository.findById(superBowl.getId())).thenReturn(Optional.of(superBowl));
        when(gameTypeScalingRepository.findById(new GameTypeScalingId(CHANNEL_ID, "SB")))
                .thenReturn(Optional.of(scaling("SB", 3)));

        assertEquals(3, scoringService.earnedPoints(wager));
    }

    @Test
    void earnedPoints_isZeroForWrongChoiceOrUnfinishedGame() {
        Game finished = game("g1", "REG", Outcome.AWAY);
        Game unfinished = game("g2", "REG", Outcome.NOT_FINISHED);

        assertEquals(0, ScoringService.earnedPoints(wager(1L, "g1", Outcome.HOME), finished, 3));
        assertEquals(0, ScoringService.earnedPoints(wager(1L, "g2", Outcome.HOME), unfinished, 3));
        assertEquals(3, ScoringService.earnedPoints(wager(1L, "g1", Outcome.AWAY), finished, 3));
    }

    @Test
    void scalingFactor_defaultsToOneWithoutScalingRow() {
        when(gameTypeScalingRepository.findById(new GameTypeScalingId(CHANNEL_ID, "WC"))).thenReturn(Optional.empty());

        assertEquals(1, scoringService.scalingFactor(CHANNEL_ID, "WC"));
    }

    @Test
    void userTotals_sumsScaledPointsAndKeepsZeroScoreUsers() {
        Game regular = game("g1", "REG", Outcome.TIE);
        Game playoff = game("g2", "DIV", Outcome.HOME);
        when(wagerRepository.findByChannelId(CHANNEL_ID)).thenReturn(List.of(
                wager(1L, "g1", Outcome.TIE),
                wager(1L, "g2", Outcome.HOME),
                wager(2L, "g2", Outcome.HOME),
                wager(3L, "g1", Outcome.HOME)
        ));
        when(gameRepository.findAllById(anyCollection())).thenReturn(List.of(regular, playoff));
        when(gameTypeScalingRepository.findByChannelId(CHANNEL_ID)).thenReturn(List.of(scaling("DIV", 2)));

        Map<Long, Integer> totals = scoringService.userTotals(CHANNEL_ID);

        assertEquals(3, totals.get(1L));
        assertEquals(2, totals.get(2L));
        assertEquals(0, totals.get(3L));
    }

    @Test
    void rank_sharesPlacesBetweenTiedUsersAndSkipsAhead() {
        List<LeaderboardPlacement> placements = ScoringService.rank(Map.of(11L, 5, 10L, 5, 12L, 2, 13L, 0));

        assertEquals(3, placements.size());
        assertEquals(new LeaderboardPlacement(1, 5, List.of(10L, 11L)), placements.get(0));
        assertEquals(new LeaderboardPlacement(3, 2, List.of(12L)), placements.get(1));
        assertEquals(new LeaderboardPlacement(4, 0, List.of(13L)), placements.get(2));
    }

    @Test
    void rank_returnsEmptyListWithoutWagers() {
        assertTrue(ScoringService.rank(Map.of()).isEmpty());
    }

    private static Game game(String id, String gameTypeId, Outcome outcome) {
        Game game = new Game();
        game.setId(id);
        game.setHomeTeamId("KC");
        game.setAwayTeamId("PHI");
        game.setGameTypeId(gameTypeId);
        game.setOutcome(outcome);
        return game;
    }

    private static Wager wager(Long userId, String gameId, Outcome choice) {
        Wager wager = new Wager();
        wager.setUserId(userId);
        wager.setGameId(gameId);
        wager.setChannelId(CHANNEL_ID);
        wager.setChoice(choice);
        return wager;
    }

    private static GameTypeScaling scaling(String gameTypeId, int factor) {
        GameTypeScaling scaling = GameTypeScaling.withDefaultFactor(CHANNEL_ID, gameTypeId);
        scaling.setFactor(factor);
        return scaling;
    }
}
