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
import com.pickem.provider.ChatPlatformException;
import com.pickem.repository.ChannelRepository;
import com.pickem.repository.GameRepository;
import com.pickem.repository.GameTypeRepository;
import com.pickem.repository.PollRepository;
import com.pickem.repository.TeamRepository;
import com.pickem.repository.UserRepository;
import com.pickem.repository.WagerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollLifecycleServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 9, 7, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final long CHANNEL_ID = 100L;

    @Mock
    private PollRepository pollRepository;

    @Mock
    private ChannelRepository channelRepository;

    @Mock
    private GameRepository gameRepository;

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private GameTypeRepository gameTypeRepository;

    @Mock
    private WagerRepository wagerRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ScoringService scoringService;

    @Mock
    private WagerLedgerReconciler wagerLedgerReconciler;

    @Mock
    private LeaderboardPublisher leaderboardPublisher;

    @Mock
    private PollMessageRenderer pollMessageRenderer;

    @Mock
    private ChatPlatformClient chatPlatformClient;

    private PickemRuntimeProperties runtimeProperties;

    private PollLifecycleService pollLifecycleService;

    @BeforeEach
    void setUp() {
        runtimeProperties = new PickemRuntimeProperties();
        pollLifecycleService = new PollLifecycleService(
                pollRepository,
                channelRepository,
                gameRepository,
                teamRepository,
                gameTypeRepository,
                wagerRepository,
                userRepository,
                scoringService,
                wagerLedgerReconciler,
                leaderboardPublisher,
                pollMessageRenderer,
                chatPlatformClient,
                runtimeProperties,
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                Clock.fixed(Instant.from(NOW), ZoneOffset.UTC)
        );
    }

    @Test
    void createPendingPolls_treatsExistingPollAsNoOp() {
        Game first = game("2025_01_BAL_KC", NOW.plusDays(1));
        Game second = game("2025_01_MIA_BUF", NOW.plusDays(2));
        when(channelRepository.findByActiveTrue()).thenReturn(List.of(channel()));
        when(gameRepository.findByKickoffBetweenOrderByKickoffAsc(NOW, NOW.plusDays(7))).thenReturn(List.of(first, second));
        when(pollRepository.insertIfAbsent(CHANNEL_ID, first.getId(), NOW)).thenReturn(1);
        when(pollRepository.insertIfAbsent(CHANNEL_ID, second.getId(), NOW)).thenReturn(0);

        BatchReport report = pollLifecycleService.createPendingPolls();

        assertEquals(1, report.okCount());
        assertEquals("poll already exists", report.find(CHANNEL_ID + "/" + second.getId()).orElseThrow().detail());
        assertEquals(0, report.failedCount());
    }

    @Test
    void createPendingPolls_failingInsertDoesNotStopRemainingGames() {
        Game first = game("2025_01_BAL_KC", NOW.plusDays(1));
        Game second = game("2025_01_MIA_BUF", NOW.plusDays(2));
        when(channelRepository.findByActiveTrue()).thenReturn(List.of(channel()));
        when(gameRepository.findByKickoffBetweenOrderByKickoffAsc(NOW, NOW.plusDays(7))).thenReturn(List.of(first, second));
        when(pollRepository.insertIfAbsent(CHANNEL_ID, first.getId(), NOW))
                .thenThrow(new DataIntegrityViolationException("fk_poll_game"));
        when(pollRepository.insertIfAbsent(CHANNEL_ID, second.getId(), NOW)).thenReturn(1);

        BatchReport report = pollLifecycleService.createPendingPolls();

        assertEquals(ItemResult.Status.FAILED, report.find(CHANNEL_ID + "/" + first.getId()).orElseThrow().status());
        assertEquals(ItemResult.Status.OK, report.find(CHANNEL_ID + "/" + second.getId()).orElseThrow().status());
    }

    @Test
    void createPendingPolls_withoutActiveChannelsDoesNothing() {
        when(channelRepository.findByActiveTrue()).thenReturn(List.of());

        BatchReport report = pollLifecycleService.createPendingPolls();

        assertFalse(report.hasWork());
        verifyNoInteractions(gameRepository);
    }

    @Test
    void openCreatedPolls_publishesWithDurationUntilKickoffPlusGrace() {
        Poll poll = poll(1L, "2025_01_BAL_KC");
        Game game = game("2025_01_BAL_KC", NOW.plusDays(1));
        stubPublicationContext(poll, game);
        PollMessage message = new PollMessage(CHANNEL_ID, "content", "KC - BAL", List.of(), Duration.ofHours(25));
        when(pollMessageRenderer.renderAnnouncement(any(Channel.class))).thenReturn("New polls are incoming!");
        when(pollMessageRenderer.renderPoll(any(), any(), any(), any(), anyString(), anyInt(), eq(Duration.ofHours(25))))
                .thenReturn(message);
        when(chatPlatformClient.publishPoll(message)).thenReturn(777L);
        when(pollRepository.findById(1L)).thenReturn(Optional.of(poll));

        BatchReport report = pollLifecycleService.openCreatedPolls();

        assertEquals(1, report.okCount());
        assertEquals(777L, poll.getMessageId());
        verify(chatPlatformClient).sendMessage(CHANNEL_ID, "New polls are incoming!");
        verify(chatPlatformClient).pinMessage(CHANNEL_ID, 777L);
        verify(pollRepository).save(poll);
    }

    @Test
    void openCreatedPolls_pinFailureDoesNotFailPublication() {
        runtimeProperties.getPoll().setAnnounceNewPolls(false);
        Poll poll = poll(1L, "2025_01_BAL_KC");
        Game game = game("2025_01_BAL_KC", NOW.plusDays(1));
        stubPublicationContext(poll, game);
        when(pollMessageRenderer.renderPoll(any(), any(), any(), any(), anyString(), anyInt(), any()))
                .thenReturn(new PollMessage(CHANNEL_ID, "content", "KC - BAL", List.of(), Duration.ofHours(25)));
        when(chatPlatformClient.publishPoll(any())).thenReturn(777L);
        when(pollRepository.findById(1L)).thenReturn(Optional.of(poll));
        doThrow(new ChatPlatformException("missing permissions")).when(chatPlatformClient).pinMessage(CHANNEL_ID, 777L);

        BatchReport report = pollLifecycleService.openCreatedPolls();

        assertEquals(1, report.okCount());
        assertEquals(777L, poll.getMessageId());
    }

    @Test
    void openCreatedPolls_leavesPollCreatedWhenPublishFails() {
        runtimeProperties.getPoll().setAnnounceNewPolls(false);
        Poll poll = poll(1L, "2025_01_BAL_KC");
        Game game = game("2025_01_BAL_KC", NOW.plusDays(1));
        stubPublicationContext(poll, game);
        when(pollMessageRenderer.renderPoll(any(), any(), any(), any(), anyString(), anyInt(), any()))
                .thenReturn(new PollMessage(CHANNEL_ID, "content", "KC - BAL", List.of(), Duration.ofHours(25)));
        when(chatPlatformClient.publishPoll(any())).thenThrow(new ChatPlatformException("rate limited"));

        BatchReport report = pollLifecycleService.openCreatedPolls();

        assertEquals(1, report.failedCount());
        assertNull(poll.getMessageId());
        verify(pollRepository, never()).save(any());
        verify(chatPlatformClient, never()).sendMessage(anyLong(), anyString());
    }

    @Test
    void openCreatedPolls_skipsPollsWhoseGameAlreadyKickedOff() {
        runtimeProperties.getPoll().setAnnounceNewPolls(false);
        Poll poll = poll(1L, "2025_01_BAL_KC");
        Game game = game("2025_01_BAL_KC", NOW.minusMinutes(5));
        stubPublicationContext(poll, game);

        BatchReport report = pollLifecycleService.openCreatedPolls();

        assertEquals("kickoff already passed", report.find("poll:1").orElseThrow().detail());
        verify(chatPlatformClient, never()).publishPoll(any());
    }

    @Test
    void closeDuePolls_closesLocallyEvenWhenPlatformCloseFails() {
        Poll poll = poll(1L, "2025_01_BAL_KC");
        poll.setMessageId(555L);
        when(pollRepository.findDueForClosing(NOW)).thenReturn(List.of(poll));
        doThrow(new ChatPlatformException("gateway timeout")).when(chatPlatformClient).closePoll(CHANNEL_ID, 555L);
        when(pollRepository.findById(1L)).thenReturn(Optional.of(poll));
        when(wagerLedgerReconciler.reconcileQuietly(1L)).thenReturn(ItemResult.skipped("poll:1", "no changes"));

        BatchReport report = pollLifecycleService.closeDuePolls();

        assertEquals(1, report.okCount());
        assertTrue(poll.isClosed());
        verify(pollRepository).save(poll);
        verify(chatPlatformClient).unpinMessage(CHANNEL_ID, 555L);
        verify(wagerLedgerReconciler).reconcileQuietly(1L);
    }

    @Test
    void closeDuePolls_failingPollDoesNotStopTheOthers() {
        Poll failing = poll(1L, "g1");
        Poll closing = poll(2L, "g2");
        when(pollRepository.findDueForClosing(NOW)).thenReturn(List.of(failing, closing));
        when(pollRepository.findById(1L)).thenThrow(new QueryTimeoutException("statement timeout"));
        when(pollRepository.findById(2L)).thenReturn(Optional.of(closing));

        BatchReport report = pollLifecycleService.closeDuePolls();

        assertEquals(ItemResult.Status.FAILED, report.find("poll:1").orElseThrow().status());
        assertEquals(ItemResult.Status.OK, report.find("poll:2").orElseThrow().status());
        assertFalse(failing.isClosed());
        assertTrue(closing.isClosed());
        verify(pollRepository).save(closing);
    }

    @Test
    void closeDuePolls_closesUnpublishedPollWithoutPlatformCalls() {
        Poll poll = poll(1L, "2025_01_BAL_KC");
        when(pollRepository.findDueForClosing(NOW)).thenReturn(List.of(poll));
        when(pollRepository.findById(1L)).thenReturn(Optional.of(poll));

        pollLifecycleService.closeDuePolls();

        assertTrue(poll.isClosed());
        verifyNoInteractions(chatPlatformClient, wagerLedgerReconciler);
    }

    @Test
    void postResults_isolatesFailuresAndRefreshesLeaderboards() {
        Poll posted = closedPoll(1L, "g1", 501L);
        Poll failing = closedPoll(2L, "g2", 502L);
        Game first = finishedGame("g1");
        Game second = finishedGame("g2");
        when(pollRepository.findAwaitingResults(Outcome.NOT_FINISHED)).thenReturn(List.of(posted, failing));
        when(gameRepository.findAllById(anyCollection())).thenReturn(List.of(first, second));
        when(teamRepository.findAllById(anyCollection())).thenReturn(List.of(team("KC"), team("BAL")));
        when(gameTypeRepository.findAll()).thenReturn(List.of(regularSeason()));
        when(scoringService.scalingFactor(CHANNEL_ID, "REG")).thenReturn(1);
        Wager winner = new Wager();
        winner.setUserId(42L);
        when(wagerRepository.findByGameIdAndChannelIdAndChoice(anyString(), eq(CHANNEL_ID), eq(Outcome.HOME)))
                .thenReturn(List.of(winner));
        User user = new User();
        user.setId(42L);
        user.setUsername("alice");
        when(userRepository.findAllById(anyCollection())).thenReturn(List.of(user));
        when(chatPlatformClient.mentionUser(42L, "alice")).thenReturn("<@42>");
        when(pollMessageRenderer.renderResult(any(), any(), any(), anyString(), anyInt(), eq(List.of("<@42>"))))
                .thenReturn("GG <@42>");
        when(chatPlatformClient.replyToMessage(CHANNEL_ID, 501L, "GG <@42>")).thenReturn(601L);
        when(chatPlatformClient.replyToMessage(CHANNEL_ID, 502L, "GG <@42>")).thenThrow(new ChatPlatformException("down"));
        when(pollRepository.findById(1L)).thenReturn(Optional.of(posted));

        BatchReport report = pollLifecycleService.postResults();

        assertEquals(ItemResult.Status.OK, report.find("poll:1").orElseThrow().status());
        assertEquals(ItemResult.Status.FAILED, report.find("poll:2").orElseThrow().status());
        assertTrue(posted.isResultPosted());
        assertFalse(failing.isResultPosted());
        verify(leaderboardPublisher).publishAll();
    }

    @Test
    void postResults_marksNeverPublishedPollWithoutReplying() {
        Poll poll = closedPoll(1L, "g1", null);
        when(pollRepository.findAwaitingResults(Outcome.NOT_FINISHED)).thenReturn(List.of(poll));
        when(gameRepository.findAllById(anyCollection())).thenReturn(List.of(finishedGame("g1")));
        when(teamRepository.findAllById(anyCollection())).thenReturn(List.of(team("KC"), team("BAL")));
        when(gameTypeRepository.findAll()).thenReturn(List.of(regularSeason()));
        when(pollRepository.findById(1L)).thenReturn(Optional.of(poll));

        BatchReport report = pollLifecycleService.postResults();

        assertEquals("never published", report.find("poll:1").orElseThrow().detail());
        assertTrue(poll.isResultPosted());
        verify(chatPlatformClient, never()).replyToMessage(anyLong(), anyLong(), anyString());
    }

    @Test
    void postResults_withNothingAwaitingLeavesLeaderboardsAlone() {
        when(pollRepository.findAwaitingResults(Outcome.NOT_FINISHED)).thenReturn(List.of());

        pollLifecycleService.postResults();

        verifyNoInteractions(leaderboardPublisher, chatPlatformClient);
    }

    private void stubPublicationContext(Poll poll, Game game) {
        when(pollRepository.findAwaitingPublication()).thenReturn(List.of(poll));
        when(channelRepository.findAllById(anyCollection())).thenReturn(List.of(channel()));
        when(gameRepository.findAllById(anyCollection())).thenReturn(List.of(game));
        when(teamRepository.findAllById(anyCollection())).thenReturn(List.of(team("KC"), team("BAL")));
        when(gameTypeRepository.findAll()).thenReturn(List.of(regularSeason()));
        if (game.getKickoff().isAfter(NOW)) {
            when(scoringService.scalingFactor(CHANNEL_ID, "REG")).thenReturn(1);
        }
    }

    private static Channel channel() {
        Channel channel = new Channel();
        channel.setId(CHANNEL_ID);
        channel.setName("nfl-picks");
        channel.setRoleId(7L);
        channel.setActive(true);
        return channel;
    }

    private static Game game(String id, OffsetDateTime kickoff) {
        Game game = new Game();
        game.setId(id);
        game.setHomeTeamId("KC");
        game.setAwayTeamId("BAL");
        game.setGameTypeId("REG");
        game.setKickoff(kickoff);
        return game;
    }

    private static Game finishedGame(String id) {
        Game game = game(id, NOW.minusHours(4));
        game.applyResult(27, 20, 7);
        return game;
    }

    private static Poll poll(Long id, String gameId) {
        Poll poll = new Poll();
        poll.setId(id);
        poll.setChannelId(CHANNEL_ID);
        poll.setGameId(gameId);
        return poll;
    }

    private static Poll closedPoll(Long id, String gameId, Long messageId) {
        Poll poll = poll(id, gameId);
        poll.setMessageId(messageId);
        poll.setClosed(true);
        return poll;
    }

    private static Team team(String code) {
        Team team = new Team();
        team.setId(code);
        team.setName(code);
        return team;
    }

    private static GameType regularSeason() {
        GameType gameType = new GameType();
        gameType.setId("REG");
        gameType.setName("Regular Season");
        return gameType;
    }
}
