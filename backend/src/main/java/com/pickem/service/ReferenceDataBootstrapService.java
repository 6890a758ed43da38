package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.GameType;
import com.pickem.model.GameTypeCatalog;
import com.pickem.repository.GameTypeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Ensures the game type catalogue and per-channel scaling rows exist on startup.
 */
@Component
public class ReferenceDataBootstrapService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataBootstrapService.class);

    private final GameTypeRepository gameTypeRepository;
    private final GameTypeScalingService gameTypeScalingService;
    private final TeamIngestionService teamIngestionService;
    private final PickemRuntimeProperties runtimeProperties;

    public ReferenceDataBootstrapService(
            GameTypeRepository gameTypeRepository,
            GameTypeScalingService gameTypeScalingService,
            TeamIngestionService teamIngestionService,
            PickemRuntimeProperties runtimeProperties) {
        this.gameTypeRepository = gameTypeRepository;
        this.gameTypeScalingService = gameTypeScalingService;
        this.teamIngestionService = teamIngestionService;
        this.runtimeProperties = runtimeProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        int seeded = 0;
        for (GameTypeCatalog entry : GameTypeCatalog.values()) {
            if (gameTypeRepository.existsById(entry.getId())) {
                continue;
            }
            GameType gameType = new GameType();
            gameType.setId(entry.getId());
            gameType.setName(entry.getDisplayName());
            gameTypeRepository.save(gameType);
            seeded++;
        }
        if (seeded > 0) {
            log.info("Bootstrapped {} game type(s)", seeded);
        } else {
            log.debug("Game type bootstrap skipped: catalogue already present");
        }

        gameTypeScalingService.seedMissingScaling();

        if (runtimeProperties.getIngestion().isRefreshTeamsOnStartup()) {
            teamIngestionService.refreshTeams();
        }
    }
}
