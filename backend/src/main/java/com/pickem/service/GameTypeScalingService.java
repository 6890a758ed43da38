package com.pickem.service;

import com.pickem.model.Channel;
import com.pickem.model.GameType;
import com.pickem.model.GameTypeScaling;
import com.pickem.model.GameTypeScalingId;
import com.pickem.repository.ChannelRepository;
import com.pickem.repository.GameTypeRepository;
import com.pickem.repository.GameTypeScalingRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class GameTypeScalingService {

    private static final Logger log = LoggerFactory.getLogger(GameTypeScalingService.class);

    private final ChannelRepository channelRepository;
    private final GameTypeRepository gameTypeRepository;
    private final GameTypeScalingRepository gameTypeScalingRepository;

    /**
     * Adds a factor-1 scaling row for every channel and game type pair that has none.
     *
     * @return number of rows created
     */
    @Transactional
    public int seedMissingScaling() {
        List<GameType> gameTypes = gameTypeRepository.findAll();
        Set<GameTypeScalingId> existing = gameTypeScalingRepository.findAll().stream()
                .map(scaling -> new GameTypeScalingId(scaling.getChannelId(), scaling.getGameTypeId()))
                .collect(Collectors.toSet());

        List<GameTypeScaling> created = new ArrayList<>();
        for (Channel channel : channelRepository.findAll()) {
            for (GameType gameType : gameTypes) {
                if (!existing.contains(new GameTypeScalingId(channel.getId(), gameType.getId()))) {
                    created.add(GameTypeScaling.withDefaultFactor(channel.getId(), gameType.getId()));
                }
            }
        }
        if (!created.isEmpty()) {
            gameTypeScalingRepository.saveAll(created);
            log.info("Seeded {} game type scaling row(s)", created.size());
        }
        return created.size();
    }

    @Transactional
    public GameTypeScaling setFactor(Long channelId, String gameTypeId, int factor) {
        if (factor < 0) {
            throw new IllegalArgumentException("Scaling factor must not be negative");
        }
        if (!gameTypeRepository.existsById(gameTypeId)) {
            throw new IllegalArgumentException("Unknown game type " + gameTypeId);
        }
        GameTypeScaling scaling = gameTypeScalingRepository.findById(new GameTypeScalingId(channelId, gameTypeId))
                .orElseGet(() -> GameTypeScaling.withDefaultFactor(channelId, gameTypeId));
        scaling.setFactor(factor);
        return gameTypeScalingRepository.save(scaling);
    }
}
