package com.pickem.provider;

import com.pickem.model.ApiSource;

import java.util.List;

/**
 * Secondary provider whose teams and events are mapped onto canonical records.
 */
public interface EventProvider {

    ApiSource source();

    List<ExternalTeam> fetchTeams();

    List<ExternalEvent> fetchEvents(int year);

    record ExternalTeam(String externalId, String abbreviation) {
    }

    /**
     * @param kickoffIso ISO-8601 instant or offset date-time
     */
    record ExternalEvent(
            String externalId,
            String homeTeamRef,
            String awayTeamRef,
            String kickoffIso
    ) {
    }
}
