package com.pickem.service;

import com.pickem.model.Game;
import com.pickem.model.Outcome;
import com.pickem.model.Poll;
import com.pickem.model.User;
import com.pickem.model.Wager;
import com.pickem.provider.ChatPlatformClient;
import com.pickem.provider.ChatPlatformClient.ObservedVote;
import com.pickem.repository.GameRepository;
import com.pickem.repository.PollRepository;
import com.pickem.repository.UserRepository;
import com.pickem.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps the persisted wagers of a poll's (game, channel) equal to the poll's current voters.
 * Each pass is a full set reconciliation, so repeated or missed passes converge.
 */
@Service
@RequiredArgsConstructor
public class WagerLedgerReconciler {

    private static final Logger log = LoggerFactory.getLogger(WagerLedgerReconciler.class);

    private final PollRepository pollRepository;
    private final GameRepository gameRepository;
    private final UserRepository userRepository;
    private final WagerRepository wagerRepository;
    private final ChatPlatformClient chatPlatformClient;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Reconciles every published poll that is still open. One failing poll does not stop the others.
     */
    public BatchReport reconcileOpenPolls() {
        BatchReport report = new BatchReport("wager-sync");
        for (Poll poll : pollRepository.findByClosedFalseAndMessageIdIsNotNull()) {
            report.add(reconcileQuietly(poll.getId()));
        }
        report.logSummary(log);
        return report;
    }

    ItemResult reconcileQuietly(Long pollId) {
        String key = "poll:" + pollId;
        try {
            ReconcileSummary summary = reconcilePoll(pollId);
            return summary.hasChanges() ? ItemResult.ok(key, summary.toString()) : ItemResult.skipped(key, "no changes");
        } catch (RuntimeException e) {
            log.error("Failed to sync wagers for poll {}", pollId, e);
            return ItemResult.failed(key, e);
        }
    }

    /**
     * Fetches the current voters of the poll and applies them to the ledger.
     *
     * @throws IllegalArgumentException if the poll does not exist
     * @throws IllegalStateException if the poll was never published or its game is missing
     */
    public ReconcileSummary reconcilePoll(Long pollId) {
        Poll poll = pollRepository.findById(pollId)
                .orElseThrow(() -> new IllegalArgumentException("Poll " + pollId + " not found"));
        if (poll.getMessageId() == null) {
            throw new IllegalStateException("Poll " + pollId + " has not been published");
        }
        Game game = gameRepository.findById(poll.getGameId())
                .orElseThrow(() -> new IllegalStateException("Poll " + pollId + " references unknown game " + poll.getGameId()));

        List<ObservedVote> votes = chatPlatformClient.fetchCurrentVoters(poll.getChannelId(), poll.getMessageId());
        ReconcileSummary summary = transactionTemplate.execute(status -> applyObservedVotes(poll, game, votes));
        if (summary != null && summary.hasChanges()) {
            log.info("Synced wagers for poll {} (game {}, channel {}): {}",
                    pollId, game.getId(), poll.getChannelId(), summary);
        }
        return summary;
    }

    /**
     * Makes the wager set of (game, channel) match the observed votes exactly:
     * upserts each observed voter's choice and deletes wagers of users no longer voting.
     */
    ReconcileSummary applyObservedVotes(Poll poll, Game game, List<ObservedVote> votes) {
        Map<Long, Outcome> observed = new LinkedHashMap<>();
        Map<Long, String> usernames = new LinkedHashMap<>();
        int ignored = 0;
        for (ObservedVote vote : votes) {
            Optional<Outcome> choice = PollOptions.outcomeAt(game.getGameTypeId(), vote.optionIndex());
            if (choice.isEmpty()) {
                log.warn("Ignoring vote by {} on poll {} for unknown option {}", vote.userId(), poll.getId(), vote.optionIndex());
                ignored++;
                continue;
            }
            observed.put(vote.userId(), choice.get());
            usernames.put(vote.userId(), vote.username());
        }

        ensureUsers(usernames);

        OffsetDateTime now = OffsetDateTime.now(clock);
        Map<Long, Wager> existing = wagerRepository.findByGameIdAndChannelId(game.getId(), poll.getChannelId()).stream()
                .collect(Collectors.toMap(Wager::getUserId, Function.identity(), (first, second) -> first));

        List<Wager> toSave = new ArrayList<>();
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        for (Map.Entry<Long, Outcome> entry : observed.entrySet()) {
            Wager wager = existing.get(entry.getKey());
            if (wager == null) {
                wager = new Wager();
                wager.setUserId(entry.getKey());
                wager.setGameId(game.getId());
                wager.setChannelId(poll.getChannelId());
                wager.setChoice(entry.getValue());
                wager.setUpdatedAt(now);
                toSave.add(wager);
                inserted++;
            } else if (wager.getChoice() != entry.getValue()) {
                wager.setChoice(entry.getValue());
                wager.setUpdatedAt(now);
                toSave.add(wager);
                updated++;
            } else {
                unchanged++;
            }
        }

        List<Wager> toDelete = existing.values().stream()
                .filter(wager -> !observed.containsKey(wager.getUserId()))
                .toList();

        if (!toSave.isEmpty()) {
            wagerRepository.saveAll(toSave);
        }
        if (!toDelete.isEmpty()) {
            wagerRepository.deleteAll(toDelete);
        }
        return new ReconcileSummary(inserted, updated, toDelete.size(), unchanged, ignored);
    }

    private void ensureUsers(Map<Long, String> usernames) {
        if (usernames.isEmpty()) {
            return;
        }
        Set<Long> known = userRepository.findAllById(usernames.keySet()).stream()
                .map(User::getId)
                .collect(Collectors.toSet());
        List<User> created = new ArrayList<>();
        usernames.forEach((userId, username) -> {
            if (!known.contains(userId)) {
                User user = new User();
                user.setId(userId);
                user.setUsername(username != null ? username : String.valueOf(userId));
                created.add(user);
            }
        });
        if (!created.isEmpty()) {
            userRepository.saveAll(created);
        }
    }

    public record ReconcileSummary(int inserted, int updated, int deleted, int unchanged, int ignoredVotes) {
        public boolean hasChanges() {
            return inserted > 0 || updated > 0 || deleted > 0;
        }
    }
}
