package com.pickem.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
        name = "poll",
        uniqueConstraints = @UniqueConstraint(name = "uq_poll_channel_game", columnNames = {"channel_id", "game_id"})
)
public class Poll {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false, updatable = false)
    private Long channelId;

    @Column(name = "game_id", nullable = false, updatable = false, length = 64)
    private String gameId;

    @Column(name = "message_id")
    private Long messageId;

    @Column(name = "closed", nullable = false)
    private boolean closed = false;

    @Column(name = "result_posted", nullable = false)
    private boolean resultPosted = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public PollState getState() {
        return PollState.of(this);
    }
}
