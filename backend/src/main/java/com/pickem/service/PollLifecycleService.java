package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.Channel;
import com.pickem.model.Game;
import com.pickem.model.GameType;
import com.pickem.model.Outcome;
import com.pickem.model.Poll;
import com.pickem.model.Team;
import com.pickem.model.User;
import com.pickem.model.Wager;
import com.pickem.provider.ChatPlatformClient;
import com.pickem.provider.ChatPlatformClient.PollMessage;
import com.pickem.repository.ChannelRepository;
import com.pickem.repository.GameRepository;
import com.pickem.repository.GameTypeRepository;
import com.pickem.repository.PollRepository;
import com.pickem.repository.TeamRepository;
import com.pickem.repository.UserRepository;
import com.pickem.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Poll state machine for every (channel, game) pair:
 * PENDING -> CREATED -> OPEN -> CLOSED -> RESULTS_POSTED.
 * Each pass moves polls forward only and never deletes them.
 */
@Service
@RequiredArgsConstructor
public class PollLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(PollLifecycleService.class);

    private final PollRepository pollRepository;
    private final ChannelRepository channelRepository;
    private final GameRepository gameRepository;
    private final TeamRepository teamRepository;
    private final GameTypeRepository gameTypeRepository;
    private final WagerRepository wagerRepository;
    private final UserRepository userRepository;
    private final ScoringService scoringService;
    private final WagerLedgerReconciler wagerLedgerReconciler;
    private final LeaderboardPublisher leaderboardPublisher;
    private final PollMessageRenderer pollMessageRenderer;
    private final ChatPlatformClient chatPlatformClient;
    private final PickemRuntimeProperties runtimeProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * PENDING -> CREATED for every active channel and every game kicking off within the
     * creation window. Pairs that already have a poll are left untouched.
     */
    public BatchReport createPendingPolls() {
        BatchReport report = new BatchReport("poll-creation");
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime horizon = now.plusDays(runtimeProperties.getPoll().getCreationWindowDays());

        List<Channel> channels = channelRepository.findByActiveTrue();
        if (channels.isEmpty()) {
            return report;
        }
        List<Game> games = gameRepository.findByKickoffBetweenOrderByKickoffAsc(now, horizon);
        if (games.isEmpty()) {
            return report;
        }

        for (Channel channel : channels) {
            for (Game game : games) {
                String key = channel.getId() + "/" + game.getId();
                try {
                    Integer inserted = transactionTemplate.execute(
                            status -> pollRepository.insertIfAbsent(channel.getId(), game.getId(), now));
                    if (inserted != null && inserted > 0) {
                        report.ok(key);
                    } else {
                        report.skipped(key, "poll already exists");
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to create poll for channel {} and game {}", channel.getId(), game.getId(), e);
                    report.failed(key, e);
                }
            }
        }

        report.logSummary(log);
        return report;
    }

    /**
     * CREATED -> OPEN: publishes every unpublished poll of an active channel.
     * The message handle is stored only after the platform accepted the poll;
     * a failed publish leaves the poll CREATED for the next pass.
     */
    public BatchReport openCreatedPolls() {
        BatchReport report = new BatchReport("poll-publication");
        List<Poll> polls = pollRepository.findAwaitingPublication();
        if (polls.isEmpty()) {
            return report;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Map<Long, Channel> channels = channelRepository.findAllById(
                        polls.stream().map(Poll::getChannelId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Channel::getId, Function.identity()));
        Map<String, Game> games = loadGames(polls);
        Map<String, Team> teams = loadTeams(games.values());
        Map<String, String> gameTypeNames = gameTypeNames();

        List<Poll> publishable = new ArrayList<>();
        for (Poll poll : polls) {
            Game game = games.get(poll.getGameId());
            if (game != null && !game.getKickoff().isAfter(now)) {
                report.skipped(pollKey(poll), "kickoff already passed");
                continue;
            }
            publishable.add(poll);
        }

        if (runtimeProperties.getPoll().isAnnounceNewPolls()) {
            Set<Long> announcedChannels = new LinkedHashSet<>();
            for (Poll poll : publishable) {
                announcedChannels.add(poll.getChannelId());
            }
            for (Long channelId : announcedChannels) {
                Channel channel = channels.get(channelId);
                if (channel == null) {
                    continue;
                }
                try {
                    chatPlatformClient.sendMessage(channelId, pollMessageRenderer.renderAnnouncement(channel));
                } catch (RuntimeException e) {
                    log.error("Failed to announce new polls in channel {}", channelId, e);
                }
            }
        }

        for (Poll poll : publishable) {
            try {
                Channel channel = requireFound(channels.get(poll.getChannelId()), "channel", poll.getChannelId());
                Game game = requireFound(games.get(poll.getGameId()), "game", poll.getGameId());
                Team homeTeam = requireFound(teams.get(game.getHomeTeamId()), "team", game.getHomeTeamId());
                Team awayTeam = requireFound(teams.get(game.getAwayTeamId()), "team", game.getAwayTeamId());
                int factor = scoringService.scalingFactor(channel.getId(), game.getGameTypeId());
                Duration duration = Duration.between(now, game.getKickoff())
                        .plusMinutes(runtimeProperties.getPoll().getDurationGraceMinutes());

                PollMessage message = pollMessageRenderer.renderPoll(
                        channel,
                        game,
                        homeTeam,
                        awayTeam,
                        gameTypeNames.getOrDefault(game.getGameTypeId(), game.getGameTypeId()),
                        factor,
                        duration
                );
                long messageId = chatPlatformClient.publishPoll(message);
                boolean stored = Boolean.TRUE.equals(transactionTemplate.execute(status -> recordPublication(poll.getId(), messageId)));
                if (stored) {
                    pinQuietly(poll.getChannelId(), messageId);
                    report.ok(pollKey(poll));
                } else {
                    log.warn("Poll {} was published concurrently; message {} is a duplicate", poll.getId(), messageId);
                    report.skipped(pollKey(poll), "already published");
                }
            } catch (RuntimeException e) {
                log.error("Failed to publish poll {}", poll.getId(), e);
                report.failed(pollKey(poll), e);
            }
        }

        report.logSummary(log);
        return report;
    }

    private void pinQuietly(long channelId, long messageId) {
        try {
            chatPlatformClient.pinMessage(channelId, messageId);
        } catch (RuntimeException e) {
            log.warn("Failed to pin poll message {} in channel {}: {}", messageId, channelId, e.getMessage());
        }
    }

    private boolean recordPublication(Long pollId, long messageId) {
        Poll stored = pollRepository.findById(pollId).orElse(null);
        if (stored == null || stored.getMessageId() != null || stored.isClosed()) {
            return false;
        }
        stored.setMessageId(messageId);
        stored.setUpdatedAt(OffsetDateTime.now(clock));
        pollRepository.save(stored);
        return true;
    }

    /**
     * -> CLOSED for every poll whose game has kicked off. Ending the platform poll is
     * attempted, but the local close does not depend on it: kickoff is authoritative.
     * Closed polls that were published get one last wager sync.
     */
    public BatchReport closeDuePolls() {
        BatchReport report = new BatchReport("poll-closing");
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Poll> duePolls = pollRepository.findDueForClosing(now);
        if (duePolls.isEmpty()) {
            return report;
        }

        for (Poll poll : duePolls) {
            if (poll.getMessageId() == null) {
                continue;
            }
            try {
                chatPlatformClient.closePoll(poll.getChannelId(), poll.getMessageId());
            } catch (RuntimeException e) {
                log.error("Failed to end platform poll for poll {}; closing locally anyway", poll.getId(), e);
            }
            try {
                chatPlatformClient.unpinMessage(poll.getChannelId(), poll.getMessageId());
            } catch (RuntimeException e) {
                log.warn("Failed to unpin poll message {} in channel {}: {}",
                        poll.getMessageId(), poll.getChannelId(), e.getMessage());
            }
        }

        List<Long> closedIds = new ArrayList<>();
        for (Poll poll : duePolls) {
            try {
                boolean closed = Boolean.TRUE.equals(transactionTemplate.execute(status -> closeLocally(poll.getId(), now)));
                if (closed) {
                    closedIds.add(poll.getId());
                    report.ok(pollKey(poll));
                } else {
                    report.skipped(pollKey(poll), "already closed");
                }
            } catch (RuntimeException e) {
                log.error("Failed to close poll {}", poll.getId(), e);
                report.failed(pollKey(poll), e);
            }
        }

        for (Poll poll : duePolls) {
            if (poll.getMessageId() != null && closedIds.contains(poll.getId())) {
                ItemResult sync = wagerLedgerReconciler.reconcileQuietly(poll.getId());
                if (sync.status() == ItemResult.Status.FAILED) {
                    log.warn("Final wager sync failed for poll {}: {}", poll.getId(), sync.detail());
                }
            }
        }

        report.logSummary(log);
        return report;
    }

    private boolean closeLocally(Long pollId, OffsetDateTime now) {
        Poll stored = pollRepository.findById(pollId).orElse(null);
        if (stored == null || stored.isClosed()) {
            return false;
        }
        stored.setClosed(true);
        stored.setUpdatedAt(now);
        pollRepository.save(stored);
        return true;
    }

    /**
     * CLOSED -> RESULTS_POSTED once the game has a final outcome. A failed post leaves
     * the poll for the next pass. Leaderboards are refreshed when anything was posted.
     */
    public BatchReport postResults() {
        BatchReport report = new BatchReport("result-posting");
        List<Poll> polls = pollRepository.findAwaitingResults(Outcome.NOT_FINISHED);
        if (polls.isEmpty()) {
            return report;
        }

        Map<String, Game> games = loadGames(polls);
        Map<String, Team> teams = loadTeams(games.values());
        Map<String, String> gameTypeNames = gameTypeNames();

        for (Poll poll : polls) {
            try {
                Game game = requireFound(games.get(poll.getGameId()), "game", poll.getGameId());
                if (poll.getMessageId() != null) {
                    Team homeTeam = requireFound(teams.get(game.getHomeTeamId()), "team", game.getHomeTeamId());
                    Team awayTeam = requireFound(teams.get(game.getAwayTeamId()), "team", game.getAwayTeamId());
                    String content = pollMessageRenderer.renderResult(
                            game,
                            homeTeam,
                            awayTeam,
                            gameTypeNames.getOrDefault(game.getGameTypeId(), game.getGameTypeId()),
                            scoringService.scalingFactor(poll.getChannelId(), game.getGameTypeId()),
                            correctPredictors(poll, game)
                    );
                    chatPlatformClient.replyToMessage(poll.getChannelId(), poll.getMessageId(), content);
                }
                transactionTemplate.executeWithoutResult(status -> markResultPosted(poll.getId()));
                report.add(ItemResult.ok(pollKey(poll), poll.getMessageId() == null ? "never published" : null));
            } catch (RuntimeException e) {
                log.error("Failed to post result for poll {}", poll.getId(), e);
                report.failed(pollKey(poll), e);
            }
        }

        report.logSummary(log);
        if (report.okCount() > 0) {
            leaderboardPublisher.publishAll();
        }
        return report;
    }

    private List<String> correctPredictors(Poll poll, Game game) {
        List<Wager> winners = wagerRepository.findByGameIdAndChannelIdAndChoice(game.getId(), poll.getChannelId(), game.getOutcome());
        if (winners.isEmpty()) {
            return List.of();
        }
        Map<Long, String> names = userRepository.findAllById(winners.stream().map(Wager::getUserId).toList()).stream()
                .collect(Collectors.toMap(User::getId, User::getUsername));
        List<String> mentions = new ArrayList<>();
        for (Wager wager : winners) {
            String fallback = names.getOrDefault(wager.getUserId(), String.valueOf(wager.getUserId()));
            try {
                mentions.add(chatPlatformClient.mentionUser(wager.getUserId(), fallback));
            } catch (RuntimeException e) {
                log.warn("Could not resolve user {} for mention: {}", wager.getUserId(), e.getMessage());
                mentions.add(fallback);
            }
        }
        return mentions;
    }

    private void markResultPosted(Long pollId) {
        Poll stored = pollRepository.findById(pollId)
                .orElseThrow(() -> new IllegalStateException("Poll " + pollId + " disappeared"));
        if (!stored.isClosed()) {
            throw new IllegalStateException("Poll " + pollId + " is not closed");
        }
        stored.setResultPosted(true);
        stored.setUpdatedAt(OffsetDateTime.now(clock));
        pollRepository.save(stored);
    }

    private Map<String, Game> loadGames(List<Poll> polls) {
        return gameRepository.findAllById(polls.stream().map(Poll::getGameId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(Game::getId, Function.identity()));
    }

    private Map<String, Team> loadTeams(Collection<Game> games) {
        Set<String> teamIds = new LinkedHashSet<>();
        for (Game game : games) {
            teamIds.add(game.getHomeTeamId());
            teamIds.add(game.getAwayTeamId());
        }
        return teamRepository.findAllById(teamIds).stream()
                .collect(Collectors.toMap(Team::getId, Function.identity()));
    }

    private Map<String, String> gameTypeNames() {
        return gameTypeRepository.findAll().stream()
                .collect(Collectors.toMap(GameType::getId, GameType::getName));
    }

    private static <T> T requireFound(T value, String kind, Object id) {
        if (value == null) {
            throw new IllegalStateException("Unknown " + kind + " " + id);
        }
        return value;
    }

    private static String pollKey(Poll poll) {
        return "poll:" + poll.getId();
    }
}
