package com.pickem.repository;

import com.pickem.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface GameRepository extends JpaRepository<Game, String> {

    List<Game> findByKickoffBetweenOrderByKickoffAsc(OffsetDateTime from, OffsetDateTime to);

    List<Game> findByHomeTeamIdAndAwayTeamIdAndKickoffBetween(
            String homeTeamId,
            String awayTeamId,
            OffsetDateTime from,
            OffsetDateTime to
    );
}
