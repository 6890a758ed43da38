package com.pickem.repository;

import com.pickem.model.GameTypeScaling;
import com.pickem.model.GameTypeScalingId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GameTypeScalingRepository extends JpaRepository<GameTypeScaling, GameTypeScalingId> {

    List<GameTypeScaling> findByChannelId(Long channelId);
}
