package com.pickem.provider;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Canonical schedule source. Its game ids become canonical game ids.
 */
public interface ScheduleProvider {

    List<ScheduleRow> fetchSeasonSchedule(int season);

    List<TeamDescription> fetchTeamDescriptions();

    /**
     * One scheduled game. Scores and result are {@code NaN} until the game is played.
     *
     * @param kickoff local kickoff time in the provider's schedule zone
     */
    record ScheduleRow(
            String gameId,
            String gameType,
            String homeTeam,
            String awayTeam,
            LocalDateTime kickoff,
            double homeScore,
            double awayScore,
            double result
    ) {
    }

    record TeamDescription(
            String abbreviation,
            String name,
            String logoUrl,
            String color
    ) {
    }
}
