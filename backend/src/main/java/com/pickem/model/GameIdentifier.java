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
        name = "game_identifier",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_game_identifier_source_external", columnNames = {"source", "external_id"}),
                @UniqueConstraint(name = "uq_game_identifier_game_source", columnNames = {"game_id", "source"})
        }
)
public class GameIdentifier {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private ApiSource source;

    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(name = "game_id", nullable = false, length = 64)
    private String gameId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public static GameIdentifier of(ApiSource source, String externalId, String gameId) {
        GameIdentifier identifier = new GameIdentifier();
        identifier.setSource(source);
        identifier.setExternalId(externalId);
        identifier.setGameId(gameId);
        return identifier;
    }
}
