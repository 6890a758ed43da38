package com.pickem.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Canonical game record. The id is the schedule provider's game id.
 * Teams and game type are referenced by id only.
 */
@Getter
@Setter
@Entity
@Table(name = "game")
public class Game {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "home_team_id", nullable = false, length = 8)
    private String homeTeamId;

    @Column(name = "away_team_id", nullable = false, length = 8)
    private String awayTeamId;

    @Column(name = "gametype_id", nullable = false, length = 8)
    private String gameTypeId;

    @Column(name = "kickoff", nullable = false)
    private OffsetDateTime kickoff;

    @Column(name = "home_score")
    private Integer homeScore;

    @Column(name = "away_score")
    private Integer awayScore;

    @Column(name = "result")
    private Integer result;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private Outcome outcome = Outcome.NOT_FINISHED;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public void applyResult(Integer homeScore, Integer awayScore, Integer result) {
        this.homeScore = homeScore;
        this.awayScore = awayScore;
        this.result = result;
        this.outcome = Outcome.fromResult(result);
    }
}
