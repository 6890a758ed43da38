package com.pickem.service;

import com.pickem.model.Team;
import com.pickem.provider.ChatPlatformClient;
import com.pickem.provider.ProviderException;
import com.pickem.provider.ScheduleProvider;
import com.pickem.provider.ScheduleProvider.TeamDescription;
import com.pickem.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Refreshes canonical teams and their chat emojis from the schedule provider's team list.
 * The team code is the natural key and never changes; display fields are overwritten.
 */
@Service
@RequiredArgsConstructor
public class TeamIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TeamIngestionService.class);

    private final ScheduleProvider scheduleProvider;
    private final ChatPlatformClient chatPlatformClient;
    private final TeamRepository teamRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public BatchReport refreshTeams() {
        BatchReport report = new BatchReport("team-ingestion");

        List<TeamDescription> descriptions;
        try {
            descriptions = scheduleProvider.fetchTeamDescriptions();
        } catch (ProviderException e) {
            log.error("Failed to fetch team descriptions", e);
            return report.failed("teams", e);
        }

        for (TeamDescription description : descriptions) {
            String code = description.abbreviation() == null
                    ? null
                    : description.abbreviation().trim().toUpperCase(Locale.ROOT);
            if (code == null || code.isEmpty()) {
                report.add(ItemResult.failed("<missing code>", "team description has no abbreviation"));
                continue;
            }
            try {
                Long emojiId = resolveEmoji(code, description.logoUrl());
                transactionTemplate.executeWithoutResult(status -> upsertTeam(code, description, emojiId));
                report.ok(code);
            } catch (RuntimeException e) {
                log.error("Failed to refresh team {}", code, e);
                report.failed(code, e);
            }
        }

        report.logSummary(log);
        return report;
    }

    private Long resolveEmoji(String code, String logoUrl) {
        return chatPlatformClient.findApplicationEmoji(code)
                .orElseGet(() -> {
                    if (logoUrl == null || logoUrl.isBlank()) {
                        return null;
                    }
                    log.info("Creating emoji for team {}", code);
                    return chatPlatformClient.createApplicationEmoji(code, logoUrl);
                });
    }

    private void upsertTeam(String code, TeamDescription description, Long emojiId) {
        Team team = teamRepository.findById(code).orElseGet(() -> {
            Team created = new Team();
            created.setId(code);
            return created;
        });
        team.setName(description.name() != null ? description.name() : code);
        team.setLogo(description.logoUrl());
        team.setColor(description.color());
        if (emojiId != null) {
            team.setEmojiId(emojiId);
        }
        team.setUpdatedAt(OffsetDateTime.now(clock));
        teamRepository.save(team);
    }
}
