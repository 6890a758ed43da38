package com.pickem.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Point multiplier a channel grants for correct predictions on one game type.
 */
@Getter
@Setter
@Entity
@IdClass(GameTypeScalingId.class)
@Table(name = "gametype_scaling")
public class GameTypeScaling {

    public static final int DEFAULT_FACTOR = 1;

    @Id
    @Column(name = "channel_id", nullable = false, updatable = false)
    private Long channelId;

    @Id
    @Column(name = "gametype_id", nullable = false, updatable = false, length = 8)
    private String gameTypeId;

    @Column(name = "factor", nullable = false)
    private int factor = DEFAULT_FACTOR;

    public static GameTypeScaling withDefaultFactor(Long channelId, String gameTypeId) {
        GameTypeScaling scaling = new GameTypeScaling();
        scaling.setChannelId(channelId);
        scaling.setGameTypeId(gameTypeId);
        scaling.setFactor(DEFAULT_FACTOR);
        return scaling;
    }
}
