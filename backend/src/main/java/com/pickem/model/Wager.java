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

/**
 * A participant's recorded prediction for one game in one channel.
 */
@Getter
@Setter
@Entity
@Table(
        name = "wager",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_wager_user_game_channel",
                columnNames = {"user_id", "game_id", "channel_id"}
        )
)
public class Wager {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "game_id", nullable = false, updatable = false, length = 64)
    private String gameId;

    @Column(name = "channel_id", nullable = false, updatable = false)
    private Long channelId;

    @Enumerated(EnumType.STRING)
    @Column(name = "choice", nullable = false, length = 16)
    private Outcome choice;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
