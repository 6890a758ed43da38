package com.pickem.provider;

import com.pickem.model.ApiSource;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Secondary event feed with pre-cached events. Team abbreviations follow the
 * provider's own conventions, so some need aliasing onto canonical codes.
 */
@Component
public class MockEspnEventProvider implements EventProvider {

    private static final List<ExternalTeam> TEAMS = List.of(
            new ExternalTeam("12", "KC"),
            new ExternalTeam("33", "BAL"),
            new ExternalTeam("21", "PHI"),
            new ExternalTeam("6", "DAL"),
            new ExternalTeam("2", "BUF"),
            new ExternalTeam("15", "MIA"),
            new ExternalTeam("28", "WSH"),
            new ExternalTeam("19", "NYG")
    );

    private static final List<ExternalEvent> EVENTS = List.of(
            new ExternalEvent("401772510", "12", "33", "2025-09-05T00:20Z"),
            new ExternalEvent("401772511", "21", "6", "2025-09-07T20:25Z"),
            // reported with home and away reversed relative to the schedule
            new ExternalEvent("401772512", "15", "2", "2025-09-07T17:00Z"),
            new ExternalEvent("401772613", "28", "19", "2025-09-14T17:00Z")
    );

    @Override
    public ApiSource source() {
        return ApiSource.ESPN;
    }

    @Override
    public List<ExternalTeam> fetchTeams() {
        return TEAMS;
    }

    @Override
    public List<ExternalEvent> fetchEvents(int year) {
        String prefix = year + "-";
        return EVENTS.stream()
                .filter(event -> event.kickoffIso().startsWith(prefix))
                .toList();
    }
}
