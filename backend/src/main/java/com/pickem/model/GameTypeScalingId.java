package com.pickem.model;

import java.io.Serializable;
import java.util.Objects;

public class GameTypeScalingId implements Serializable {

    private Long channelId;
    private String gameTypeId;

    public GameTypeScalingId() {
    }

    public GameTypeScalingId(Long channelId, String gameTypeId) {
        this.channelId = channelId;
        this.gameTypeId = gameTypeId;
    }

    public Long getChannelId() {
        return channelId;
    }

    public String getGameTypeId() {
        return gameTypeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameTypeScalingId that)) return false;
        return Objects.equals(channelId, that.channelId) && Objects.equals(gameTypeId, that.gameTypeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelId, gameTypeId);
    }
}
