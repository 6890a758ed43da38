package com.pickem.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(
        name = "team_identifier",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_team_identifier_source_external", columnNames = {"source", "external_id"}),
                @UniqueConstraint(name = "uq_team_identifier_team_source", columnNames = {"team_id", "source"})
        }
)
public class TeamIdentifier {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private ApiSource source;

    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(name = "team_id", nullable = false, length = 8)
    private String teamId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public static TeamIdentifier of(ApiSource source, String externalId, String teamId) {
        TeamIdentifier identifier = new TeamIdentifier();
        identifier.setSource(source);
        identifier.setExternalId(externalId);
        identifier.setTeamId(teamId);
        return identifier;
    }
}
