package com.pickem.provider;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Schedule provider with a pre-cached slice of a season, used when no live feed is configured.
 */
@Component
public class MockScheduleProvider implements ScheduleProvider {

    private static final double NOT_PLAYED = Double.NaN;

    private static final List<TeamDescription> TEAMS = List.of(
            new TeamDescription("KC", "Kansas City Chiefs", "https://static.example.org/logos/kc.png", "#E31837"),
            new TeamDescription("BAL", "Baltimore Ravens", "https://static.example.org/logos/bal.png", "#241773"),
            new TeamDescription("PHI", "Philadelphia Eagles", "https://static.example.org/logos/phi.png", "#004C54"),
            new TeamDescription("DAL", "Dallas Cowboys", "https://static.example.org/logos/dal.png", "#003594"),
            new TeamDescription("BUF", "Buffalo Bills", "https://static.example.org/logos/buf.png", "#00338D"),
            new TeamDescription("MIA", "Miami Dolphins", "https://static.example.org/logos/mia.png", "#008E97"),
            new TeamDescription("WAS", "Washington Commanders", "https://static.example.org/logos/was.png", "#5A1414"),
            new TeamDescription("NYG", "New York Giants", "https://static.example.org/logos/nyg.png", "#0B2265")
    );

    private static final List<ScheduleRow> SCHEDULE = List.of(
            new ScheduleRow("2025_01_BAL_KC", "REG", "KC", "BAL",
                    LocalDateTime.of(2025, 9, 4, 20, 20), 27, 20, 7),
            new ScheduleRow("2025_01_DAL_PHI", "REG", "PHI", "DAL",
                    LocalDateTime.of(2025, 9, 7, 16, 25), 24, 20, 4),
            new ScheduleRow("2025_01_MIA_BUF", "REG", "BUF", "MIA",
                    LocalDateTime.of(2025, 9, 7, 13, 0), 20, 20, 0),
            new ScheduleRow("2025_02_NYG_WAS", "REG", "WAS", "NYG",
                    LocalDateTime.of(2025, 9, 14, 13, 0), 17, 21, -4),
            new ScheduleRow("2025_20_KC_BUF", "CON", "BUF", "KC",
                    LocalDateTime.of(2026, 1, 25, 18, 30), NOT_PLAYED, NOT_PLAYED, NOT_PLAYED),
            new ScheduleRow("2025_21_PHI_BAL", "SB", "BAL", "PHI",
                    LocalDateTime.of(2026, 2, 8, 18, 30), NOT_PLAYED, NOT_PLAYED, NOT_PLAYED)
    );

    @Override
    public List<ScheduleRow> fetchSeasonSchedule(int season) {
        String prefix = season + "_";
        return SCHEDULE.stream()
                .filter(row -> row.gameId().startsWith(prefix))
                .toList();
    }

    @Override
    public List<TeamDescription> fetchTeamDescriptions() {
        return TEAMS;
    }
}
