package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.Channel;
import com.pickem.provider.ChatPlatformClient;
import com.pickem.provider.ChatPlatformException;
import com.pickem.repository.ChannelRepository;
import com.pickem.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeaderboardPublisherTest {

    private static final long CHANNEL_ID = 100L;

    @Mock
    private ChannelRepository channelRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ScoringService scoringService;

    @Mock
    private PollMessageRenderer pollMessageRenderer;

    @Mock
    private ChatPlatformClient chatPlatformClient;

    private LeaderboardPublisher leaderboardPublisher;

    @BeforeEach
    void setUp() {
        leaderboardPublisher = new LeaderboardPublisher(
                channelRepository,
                userRepository,
                scoringService,
                pollMessageRenderer,
                chatPlatformClient,
                new PickemRuntimeProperties(),
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                Clock.fixed(Instant.parse("2025-09-07T12:00:00Z"), ZoneOffset.UTC)
        );
        when(scoringService.leaderboard(CHANNEL_ID)).thenReturn(List.of());
        when(userRepository.findAllById(anyCollection())).thenReturn(List.of());
        when(pollMessageRenderer.renderLeaderboard(List.of(), Map.of(), 10)).thenReturn("**Leaderboard**");
    }

    @Test
    void publishForChannel_editsExistingLeaderboardMessage() {
        Channel channel = channel(800L);

        leaderboardPublisher.publishForChannel(channel);

        verify(chatPlatformClient).editMessage(CHANNEL_ID, 800L, "**Leaderboard**");
        verify(chatPlatformClient, never()).sendMessage(anyLong(), anyString());
    }

    @Test
    void publishForChannel_postsNewMessageWhenEditFails() {
        Channel channel = channel(800L);
        Channel stored = channel(800L);
        doThrow(new ChatPlatformException("message deleted"))
                .when(chatPlatformClient).editMessage(CHANNEL_ID, 800L, "**Leaderboard**");
        when(chatPlatformClient.sendMessage(CHANNEL_ID, "**Leaderboard**")).thenReturn(900L);
        when(channelRepository.findById(CHANNEL_ID)).thenReturn(Optional.of(stored));

        leaderboardPublisher.publishForChannel(channel);

        assertEquals(900L, stored.getLeaderboardMessageId());
        assertEquals(900L, channel.getLeaderboardMessageId());
        verify(channelRepository).save(stored);
    }

    @Test
    void publishForChannel_postsFirstLeaderboardMessage() {
        Channel channel = channel(null);
        when(chatPlatformClient.sendMessage(eq(CHANNEL_ID), anyString())).thenReturn(901L);
        when(channelRepository.findById(CHANNEL_ID)).thenReturn(Optional.of(channel));

        leaderboardPublisher.publishForChannel(channel);

        assertEquals(901L, channel.getLeaderboardMessageId());
    }

    private static Channel channel(Long leaderboardMessageId) {
        Channel channel = new Channel();
        channel.setId(CHANNEL_ID);
        channel.setName("nfl-picks");
        channel.setActive(true);
        channel.setLeaderboardMessageId(leaderboardMessageId);
        return channel;
    }
}
