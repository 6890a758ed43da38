package com.pickem.config;

import com.pickem.model.ApiSource;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task toggles, timers and tuning knobs for the poll workflow.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pickem")
public class PickemRuntimeProperties {

    private Ingestion ingestion = new Ingestion();
    private Reconciliation reconciliation = new Reconciliation();
    private Poll poll = new Poll();
    private Leaderboard leaderboard = new Leaderboard();

    @Getter
    @Setter
    public static class Ingestion {
        private boolean enabled = true;
        private int season = 2025;

        /**
         * Zone the schedule provider reports local kickoff times in.
         */
        private String scheduleZone = "America/New_York";
        private boolean refreshTeamsOnStartup = false;
        private long initialDelayMs = 30_000;
        private long intervalMs = 300_000;
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = true;
        private ApiSource source = ApiSource.ESPN;
        private int year = 2025;
        private int matchWindowHours = 12;

        /**
         * External abbreviation (upper case) to canonical team code.
         */
        private Map<String, String> teamAliases = new LinkedHashMap<>();
        private long initialDelayMs = 60_000;
        private long intervalMs = 3_600_000;
    }

    @Getter
    @Setter
    public static class Poll {
        private boolean enabled = true;
        private int creationWindowDays = 7;
        private long durationGraceMinutes = 60;
        private boolean announceNewPolls = true;
        private long initialDelayMs = 5_000;
        private long lifecycleIntervalMs = 10_000;
        private long creationIntervalMs = 3_600_000;
        private long wagerSyncIntervalMs = 300_000;
    }

    @Getter
    @Setter
    public static class Leaderboard {
        private int topPlaces = 10;
    }
}
