package com.pickem.repository;

import com.pickem.model.Outcome;
import com.pickem.model.Poll;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface PollRepository extends JpaRepository<Poll, Long> {

    Optional<Poll> findByChannelIdAndGameId(Long channelId, String gameId);

    /**
     * Creates the poll row unless one already exists for the pair.
     *
     * @return 1 when a row was inserted, 0 when the pair already had a poll
     */
    @Modifying
    @Query(
            value = """
                    INSERT INTO poll (channel_id, game_id, closed, result_posted, created_at, updated_at)
                    VALUES (:channelId, :gameId, FALSE, FALSE, :now, :now)
                    ON CONFLICT (channel_id, game_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(
            @Param("channelId") Long channelId,
            @Param("gameId") String gameId,
            @Param("now") OffsetDateTime now
    );

    @Query("""
            select p from Poll p, Channel c, Game g
            where p.channelId = c.id
              and p.gameId = g.id
              and c.active = true
              and p.messageId is null
              and p.closed = false
            order by g.kickoff asc
            """)
    List<Poll> findAwaitingPublication();

    @Query("""
            select p from Poll p, Game g
            where p.gameId = g.id
              and p.closed = false
              and g.kickoff <= :now
            order by g.kickoff asc
            """)
    List<Poll> findDueForClosing(@Param("now") OffsetDateTime now);

    List<Poll> findByClosedFalseAndMessageIdIsNotNull();

    @Query("""
            select p from Poll p, Channel c, Game g
            where p.channelId = c.id
              and p.gameId = g.id
              and c.active = true
              and p.closed = true
              and p.resultPosted = false
              and g.outcome <> :notFinished
            order by g.kickoff asc
            """)
    List<Poll> findAwaitingResults(@Param("notFinished") Outcome notFinished);
}
