package com.pickem.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "team")
public class Team {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 8)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "logo", columnDefinition = "TEXT")
    private String logo;

    @Column(name = "color", length = 16)
    private String color;

    @Column(name = "emoji_id")
    private Long emojiId;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
