package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.ApiSource;
import com.pickem.model.Game;
import com.pickem.model.GameIdentifier;
import com.pickem.model.TeamIdentifier;
import com.pickem.provider.EventProvider;
import com.pickem.provider.EventProvider.ExternalEvent;
import com.pickem.provider.EventProvider.ExternalTeam;
import com.pickem.provider.ProviderException;
import com.pickem.repository.GameIdentifierRepository;
import com.pickem.repository.GameRepository;
import com.pickem.repository.TeamIdentifierRepository;
import com.pickem.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a secondary provider's teams and events onto canonical records.
 * Canonical rows are never created or modified here; only identifier rows are added,
 * each in its own transaction. A mapping written concurrently by another run is skipped.
 */
@Service
@RequiredArgsConstructor
public class CrossSourceReconciler {

    private static final Logger log = LoggerFactory.getLogger(CrossSourceReconciler.class);

    private final TeamRepository teamRepository;
    private final GameRepository gameRepository;
    private final TeamIdentifierRepository teamIdentifierRepository;
    private final GameIdentifierRepository gameIdentifierRepository;
    private final PickemRuntimeProperties runtimeProperties;
    private final TransactionTemplate transactionTemplate;

    /**
     * Links the provider's teams to canonical teams by upper-cased abbreviation,
     * after applying the configured alias table.
     */
    public BatchReport reconcileTeams(EventProvider provider) {
        ApiSource source = provider.source();
        BatchReport report = new BatchReport("team-reconciliation[" + source + "]");

        List<ExternalTeam> externalTeams;
        try {
            externalTeams = provider.fetchTeams();
        } catch (ProviderException e) {
            log.error("Failed to fetch teams from {}", source, e);
            return report.failed("teams", e);
        }

        Set<String> claimedTeams = new HashSet<>();
        for (ExternalTeam externalTeam : externalTeams) {
            String key = source + ":" + externalTeam.externalId();
            try {
                report.add(reconcileTeam(source, externalTeam, key, claimedTeams));
            } catch (RuntimeException e) {
                log.error("Failed to reconcile team {}", key, e);
                report.failed(key, e);
            }
        }

        report.logSummary(log);
        return report;
    }

    private ItemResult reconcileTeam(ApiSource source, ExternalTeam externalTeam, String key, Set<String> claimedTeams) {
        if (externalTeam.externalId() == null || externalTeam.abbreviation() == null) {
            return ItemResult.failed(key, "external team is missing id or abbreviation");
        }
        if (teamIdentifierRepository.findBySourceAndExternalId(source, externalTeam.externalId()).isPresent()) {
            return ItemResult.skipped(key, "already mapped");
        }

        String code = canonicalTeamCode(externalTeam.abbreviation());
        if (!teamRepository.existsById(code)) {
            log.warn("Unresolved {} team {} ({})", source, externalTeam.externalId(), externalTeam.abbreviation());
            return ItemResult.skipped(key, "no canonical team for " + code);
        }
        if (!claimedTeams.add(code) || teamIdentifierRepository.existsByTeamIdAndSource(code, source)) {
            return ItemResult.skipped(key, "team " + code + " already mapped for " + source);
        }

        try {
            transactionTemplate.executeWithoutResult(status -> teamIdentifierRepository.saveAndFlush(
                    TeamIdentifier.of(source, externalTeam.externalId(), code)));
        } catch (DataIntegrityViolationException e) {
            log.info("Team mapping {} -> {} was written concurrently", key, code);
            return ItemResult.skipped(key, "already mapped");
        }
        return ItemResult.ok(key, code);
    }

    /**
     * Links the provider's events for a year to existing canonical games.
     * An event matches a game with the same two teams, in either home/away order,
     * whose kickoff lies within the configured window of the event's kickoff.
     */
    public BatchReport reconcileGames(EventProvider provider, int year) {
        ApiSource source = provider.source();
        BatchReport report = new BatchReport("game-reconciliation[" + source + ", " + year + "]");

        List<ExternalEvent> events;
        try {
            events = provider.fetchEvents(year);
        } catch (ProviderException e) {
            log.error("Failed to fetch {} events for {}", source, year, e);
            return report.failed("events:" + year, e);
        }
        if (events.isEmpty()) {
            return report;
        }

        Map<String, String> teamIdsByExternalRef = teamIdentifierRepository.findBySource(source).stream()
                .collect(Collectors.toMap(TeamIdentifier::getExternalId, TeamIdentifier::getTeamId));
        Duration window = Duration.ofHours(runtimeProperties.getReconciliation().getMatchWindowHours());
        Set<String> claimedGames = new HashSet<>();
        Set<String> seenEvents = new HashSet<>();

        for (ExternalEvent event : events) {
            String key = source + ":" + event.externalId();
            try {
                report.add(reconcileEvent(source, event, key, teamIdsByExternalRef, window, claimedGames, seenEvents));
            } catch (RuntimeException e) {
                log.error("Failed to reconcile event {}", key, e);
                report.failed(key, e);
            }
        }

        report.logSummary(log);
        return report;
    }

    private ItemResult reconcileEvent(
            ApiSource source,
            ExternalEvent event,
            String key,
            Map<String, String> teamIdsByExternalRef,
            Duration window,
            Set<String> claimedGames,
            Set<String> seenEvents
    ) {
        if (event.externalId() == null) {
            return ItemResult.failed(key, "event has no external id");
        }
        if (!seenEvents.add(event.externalId())
                || gameIdentifierRepository.existsBySourceAndExternalId(source, event.externalId())) {
            return ItemResult.skipped(key, "already mapped");
        }

        String homeTeamId = teamIdsByExternalRef.get(event.homeTeamRef());
        String awayTeamId = teamIdsByExternalRef.get(event.awayTeamRef());
        if (homeTeamId == null || awayTeamId == null) {
            log.warn("Unresolved team reference in {} event {} (home={}, away={})",
                    source, event.externalId(), event.homeTeamRef(), event.awayTeamRef());
            return ItemResult.skipped(key, "unresolved team reference "
                    + (homeTeamId == null ? event.homeTeamRef() : event.awayTeamRef()));
        }

        OffsetDateTime kickoff;
        try {
            kickoff = parseKickoff(event.kickoffIso());
        } catch (DateTimeParseException | NullPointerException e) {
            return ItemResult.failed(key, "unparseable kickoff " + event.kickoffIso());
        }

        Optional<Game> match = findMatchingGame(homeTeamId, awayTeamId, kickoff, window);
        if (match.isEmpty()) {
            match = findMatchingGame(awayTeamId, homeTeamId, kickoff, window);
        }
        if (match.isEmpty()) {
            log.warn("No canonical game for {} event {} ({} vs {} at {})",
                    source, event.externalId(), homeTeamId, awayTeamId, kickoff);
            return ItemResult.skipped(key, "unmatched");
        }

        Game game = match.get();
        if (!claimedGames.add(game.getId()) || gameIdentifierRepository.findByGameIdAndSource(game.getId(), source).isPresent()) {
            return ItemResult.skipped(key, "game " + game.getId() + " already mapped for " + source);
        }

        try {
            transactionTemplate.executeWithoutResult(status -> gameIdentifierRepository.saveAndFlush(
                    GameIdentifier.of(source, event.externalId(), game.getId())));
        } catch (DataIntegrityViolationException e) {
            log.info("Game mapping {} -> {} was written concurrently", key, game.getId());
            return ItemResult.skipped(key, "already mapped");
        }
        return ItemResult.ok(key, game.getId());
    }

    private Optional<Game> findMatchingGame(String homeTeamId, String awayTeamId, OffsetDateTime kickoff, Duration window) {
        return gameRepository.findByHomeTeamIdAndAwayTeamIdAndKickoffBetween(
                        homeTeamId,
                        awayTeamId,
                        kickoff.minus(window),
                        kickoff.plus(window))
                .stream()
                .min(Comparator.comparing(game -> Duration.between(game.getKickoff(), kickoff).abs()));
    }

    String canonicalTeamCode(String abbreviation) {
        String upper = abbreviation.trim().toUpperCase(Locale.ROOT);
        return runtimeProperties.getReconciliation().getTeamAliases().getOrDefault(upper, upper);
    }

    static OffsetDateTime parseKickoff(String kickoffIso) {
        try {
            return OffsetDateTime.parse(kickoffIso).withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return Instant.parse(kickoffIso).atOffset(ZoneOffset.UTC);
        }
    }
}
