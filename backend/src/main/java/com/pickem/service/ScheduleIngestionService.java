package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.Game;
import com.pickem.model.GameType;
import com.pickem.model.Outcome;
import com.pickem.model.Team;
import com.pickem.provider.ProviderException;
import com.pickem.provider.ScheduleProvider;
import com.pickem.provider.ScheduleProvider.ScheduleRow;
import com.pickem.repository.GameRepository;
import com.pickem.repository.GameTypeRepository;
import com.pickem.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Upserts canonical games from the schedule provider's season feed.
 * Re-ingesting a season is a pure upsert; results are recomputed on every pass
 * so corrected final scores propagate. Each row is written in its own transaction.
 */
@Service
@RequiredArgsConstructor
public class ScheduleIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleIngestionService.class);

    private final ScheduleProvider scheduleProvider;
    private final GameRepository gameRepository;
    private final TeamRepository teamRepository;
    private final GameTypeRepository gameTypeRepository;
    private final PickemRuntimeProperties runtimeProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public BatchReport ingestSeason(int season) {
        BatchReport report = new BatchReport("schedule-ingestion[" + season + "]");

        List<ScheduleRow> rows;
        try {
            rows = scheduleProvider.fetchSeasonSchedule(season);
        } catch (ProviderException e) {
            log.error("Failed to fetch schedule for season {}", season, e);
            return report.failed("season:" + season, e);
        }
        if (rows.isEmpty()) {
            log.debug("Schedule provider returned no rows for season {}", season);
            return report;
        }

        ZoneId scheduleZone = ZoneId.of(runtimeProperties.getIngestion().getScheduleZone());
        Set<String> teamIds = teamRepository.findAll().stream().map(Team::getId).collect(Collectors.toSet());
        Set<String> gameTypeIds = gameTypeRepository.findAll().stream().map(GameType::getId).collect(Collectors.toSet());
        Map<String, Game> existingGames = gameRepository.findAllById(
                        rows.stream().map(ScheduleRow::gameId).filter(Objects::nonNull).toList())
                .stream()
                .collect(Collectors.toMap(Game::getId, Function.identity()));

        Set<String> seen = new HashSet<>();
        for (ScheduleRow row : rows) {
            String key = row.gameId() != null ? row.gameId() : "<missing id>";
            try {
                ItemResult result = applyRow(row, scheduleZone, teamIds, gameTypeIds, existingGames, seen);
                report.add(result);
            } catch (RuntimeException e) {
                log.error("Failed to ingest schedule row {}", key, e);
                report.failed(key, e);
            }
        }

        report.logSummary(log);
        return report;
    }

    private ItemResult applyRow(
            ScheduleRow row,
            ZoneId scheduleZone,
            Set<String> teamIds,
            Set<String> gameTypeIds,
            Map<String, Game> existingGames,
            Set<String> seen
    ) {
        if (row.gameId() == null || row.gameId().isBlank()) {
            return ItemResult.failed("<missing id>", "schedule row has no game id");
        }
        String gameId = row.gameId();
        if (!seen.add(gameId)) {
            return ItemResult.skipped(gameId, "duplicate row in feed");
        }
        if (row.kickoff() == null) {
            return ItemResult.failed(gameId, "schedule row has no kickoff");
        }

        OffsetDateTime kickoffUtc = row.kickoff().atZone(scheduleZone).withZoneSameInstant(ZoneOffset.UTC).toOffsetDateTime();
        Integer homeScore = toNullableInt(row.homeScore());
        Integer awayScore = toNullableInt(row.awayScore());
        Integer result = toNullableInt(row.result());

        Game game = existingGames.get(gameId);
        if (game != null) {
            if (sameState(game, kickoffUtc, homeScore, awayScore, result)) {
                return ItemResult.ok(gameId, "unchanged");
            }
            game.setKickoff(kickoffUtc);
            game.applyResult(homeScore, awayScore, result);
            game.setUpdatedAt(OffsetDateTime.now(clock));
            persist(game);
            return ItemResult.ok(gameId, "updated");
        }

        if (Objects.equals(row.homeTeam(), row.awayTeam())) {
            return ItemResult.failed(gameId, "home and away team are both " + row.homeTeam());
        }
        if (!teamIds.contains(row.homeTeam())) {
            return ItemResult.skipped(gameId, "unknown home team " + row.homeTeam());
        }
        if (!teamIds.contains(row.awayTeam())) {
            return ItemResult.skipped(gameId, "unknown away team " + row.awayTeam());
        }
        if (!gameTypeIds.contains(row.gameType())) {
            return ItemResult.skipped(gameId, "unknown game type " + row.gameType());
        }

        Game created = new Game();
        created.setId(gameId);
        created.setHomeTeamId(row.homeTeam());
        created.setAwayTeamId(row.awayTeam());
        created.setGameTypeId(row.gameType());
        created.setKickoff(kickoffUtc);
        created.applyResult(homeScore, awayScore, result);
        created.setUpdatedAt(OffsetDateTime.now(clock));
        try {
            persist(created);
        } catch (DataIntegrityViolationException e) {
            log.info("Game {} was created by a concurrent ingestion run", gameId);
            return ItemResult.skipped(gameId, "created concurrently");
        }
        existingGames.put(gameId, created);
        return ItemResult.ok(gameId, "created");
    }

    private void persist(Game game) {
        transactionTemplate.executeWithoutResult(status -> gameRepository.saveAndFlush(game));
    }

    private static boolean sameState(
            Game game,
            OffsetDateTime kickoffUtc,
            Integer homeScore,
            Integer awayScore,
            Integer result
    ) {
        return game.getKickoff() != null
                && game.getKickoff().isEqual(kickoffUtc)
                && Objects.equals(game.getHomeScore(), homeScore)
                && Objects.equals(game.getAwayScore(), awayScore)
                && Objects.equals(game.getResult(), result)
                && game.getOutcome() == Outcome.fromResult(result);
    }

    /**
     * Provider feeds use NaN for scores of games that have not been played.
     */
    static Integer toNullableInt(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return (int) value;
    }
}
