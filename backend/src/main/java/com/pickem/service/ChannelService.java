package com.pickem.service;

import com.pickem.model.Channel;
import com.pickem.repository.ChannelRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ChannelService {

    private static final Logger log = LoggerFactory.getLogger(ChannelService.class);

    private final ChannelRepository channelRepository;
    private final GameTypeScalingService gameTypeScalingService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Channel> listChannels() {
        return channelRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Channel> findChannel(Long channelId) {
        return channelRepository.findById(channelId);
    }

    /**
     * Registers a channel or updates its settings. New channels get default scaling rows.
     */
    @Transactional
    public Channel upsertChannel(Long channelId, String name, Long roleId, boolean active, boolean deleteResultMessage) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<Channel> existing = channelRepository.findById(channelId);
        Channel channel = existing.orElseGet(() -> {
            Channel created = new Channel();
            created.setId(channelId);
            created.setCreatedAt(now);
            return created;
        });
        channel.setName(name);
        channel.setRoleId(roleId);
        channel.setActive(active);
        channel.setDeleteResultMessage(deleteResultMessage);
        channel.setUpdatedAt(now);
        Channel saved = channelRepository.save(channel);

        if (existing.isEmpty()) {
            log.info("Registered channel {} ({}), active={}", channelId, name, active);
            gameTypeScalingService.seedMissingScaling();
        }
        return saved;
    }
}
