package com.pickem.repository;

import com.pickem.model.Outcome;
import com.pickem.model.Wager;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WagerRepository extends JpaRepository<Wager, Long> {

    List<Wager> findByGameIdAndChannelId(String gameId, Long channelId);

    List<Wager> findByGameIdAndChannelIdAndChoice(String gameId, Long channelId, Outcome choice);

    List<Wager> findByChannelId(Long channelId);
}
