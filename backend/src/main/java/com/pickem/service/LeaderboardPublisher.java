package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.Channel;
import com.pickem.model.User;
import com.pickem.provider.ChatPlatformClient;
import com.pickem.provider.ChatPlatformException;
import com.pickem.repository.ChannelRepository;
import com.pickem.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Posts each active channel's leaderboard, editing the channel's existing
 * leaderboard message when there is one.
 */
@Service
@RequiredArgsConstructor
public class LeaderboardPublisher {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardPublisher.class);

    private final ChannelRepository channelRepository;
    private final UserRepository userRepository;
    private final ScoringService scoringService;
    private final PollMessageRenderer pollMessageRenderer;
    private final ChatPlatformClient chatPlatformClient;
    private final PickemRuntimeProperties runtimeProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public BatchReport publishAll() {
        BatchReport report = new BatchReport("leaderboard-publication");
        for (Channel channel : channelRepository.findByActiveTrue()) {
            String key = "channel:" + channel.getId();
            try {
                publishForChannel(channel);
                report.ok(key);
            } catch (RuntimeException e) {
                log.error("Failed to publish leaderboard for channel {}", channel.getId(), e);
                report.failed(key, e);
            }
        }
        report.logSummary(log);
        return report;
    }

    public void publishForChannel(Channel channel) {
        List<LeaderboardPlacement> placements = scoringService.leaderboard(channel.getId());
        List<Long> userIds = placements.stream().flatMap(placement -> placement.userIds().stream()).toList();
        Map<Long, String> names = userRepository.findAllById(userIds).stream()
                .collect(Collectors.toMap(User::getId, User::getUsername));
        String content = pollMessageRenderer.renderLeaderboard(
                placements,
                names,
                runtimeProperties.getLeaderboard().getTopPlaces()
        );

        Long existingMessageId = channel.getLeaderboardMessageId();
        if (existingMessageId != null) {
            try {
                chatPlatformClient.editMessage(channel.getId(), existingMessageId, content);
                return;
            } catch (ChatPlatformException e) {
                log.warn("Could not edit leaderboard message {} in channel {}, posting a new one: {}",
                        existingMessageId, channel.getId(), e.getMessage());
            }
        }

        long messageId = chatPlatformClient.sendMessage(channel.getId(), content);
        transactionTemplate.executeWithoutResult(status -> channelRepository.findById(channel.getId()).ifPresent(stored -> {
            stored.setLeaderboardMessageId(messageId);
            stored.setUpdatedAt(OffsetDateTime.now(clock));
            channelRepository.save(stored);
        }));
        channel.setLeaderboardMessageId(messageId);
    }
}
