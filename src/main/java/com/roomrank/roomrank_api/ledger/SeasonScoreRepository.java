package com.roomrank.roomrank_api.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface SeasonScoreRepository extends JpaRepository<SeasonScore, Long> {

    Optional<SeasonScore> findBySeasonIdAndParticipantId(Long seasonId, Long participantId);

    List<SeasonScore> findBySeasonIdOrderByParticipantIdAsc(Long seasonId);

    /** Leaderboard order: total points, then rating, then id for a stable tiebreak. */
    @Query("""
        SELECT sc FROM SeasonScore sc
        WHERE sc.seasonId = :seasonId
        ORDER BY (sc.entryPoints + sc.winPoints) DESC, sc.rating DESC, sc.participantId ASC
        """)
    List<SeasonScore> findStandings(@Param("seasonId") Long seasonId);
}
