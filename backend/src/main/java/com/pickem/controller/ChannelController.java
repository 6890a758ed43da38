package com.pickem.controller;

import com.pickem.controller.dto.ChannelRequests;
import com.pickem.controller.dto.ChannelResponses;
import com.pickem.model.Channel;
import com.pickem.model.User;
import com.pickem.repository.UserRepository;
import com.pickem.service.ChannelService;
import com.pickem.service.GameTypeScalingService;
import com.pickem.service.LeaderboardPlacement;
import com.pickem.service.ScoringService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Channel registration, per-game-type scaling and leaderboards.
 */
@RestController
@RequestMapping("/api/channels")
public class ChannelController {

    private final ChannelService channelService;
    private final GameTypeScalingService gameTypeScalingService;
    private final ScoringService scoringService;
    private final UserRepository userRepository;

    public ChannelController(
            ChannelService channelService,
            GameTypeScalingService gameTypeScalingService,
            ScoringService scoringService,
            UserRepository userRepository) {
        this.channelService = channelService;
        this.gameTypeScalingService = gameTypeScalingService;
        this.scoringService = scoringService;
        this.userRepository = userRepository;
    }

    @GetMapping
    public ResponseEntity<List<ChannelResponses.ChannelSummary>> listChannels() {
        return ResponseEntity.ok(channelService.listChannels().stream()
                .map(ChannelResponses.ChannelSummary::from)
                .toList());
    }

    @PutMapping("/{channelId}")
    public ResponseEntity<ChannelResponses.ChannelSummary> upsertChannel(
            @PathVariable Long channelId,
            @Valid @RequestBody ChannelRequests.UpsertChannelRequest request
    ) {
        Channel channel = channelService.upsertChannel(
                channelId,
                request.name(),
                request.roleId(),
                request.active(),
                request.resolvedDeleteResultMessage()
        );
        return ResponseEntity.ok(ChannelResponses.ChannelSummary.from(channel));
    }

    @PutMapping("/{channelId}/scaling/{gameTypeId}")
    public ResponseEntity<ChannelResponses.ScalingSummary> setScaling(
            @PathVariable Long channelId,
            @PathVariable String gameTypeId,
            @Valid @RequestBody ChannelRequests.SetScalingRequest request
    ) {
        requireChannel(channelId);
        try {
            return ResponseEntity.ok(ChannelResponses.ScalingSummary.from(
                    gameTypeScalingService.setFactor(channelId, gameTypeId, request.factor())));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("/{channelId}/leaderboard")
    public ResponseEntity<ChannelResponses.Leaderboard> getLeaderboard(@PathVariable Long channelId) {
        requireChannel(channelId);
        List<LeaderboardPlacement> placements = scoringService.leaderboard(channelId);
        List<Long> userIds = placements.stream().flatMap(placement -> placement.userIds().stream()).toList();
        Map<Long, String> names = userRepository.findAllById(userIds).stream()
                .collect(Collectors.toMap(User::getId, User::getUsername));
        return ResponseEntity.ok(ChannelResponses.Leaderboard.from(channelId, placements, names));
    }

    private Channel requireChannel(Long channelId) {
        return channelService.findChannel(channelId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Channel not found: " + channelId));
    }
}
