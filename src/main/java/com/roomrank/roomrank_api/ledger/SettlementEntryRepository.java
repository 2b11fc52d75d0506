package com.roomrank.roomrank_api.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface SettlementEntryRepository extends JpaRepository<SettlementEntry, Long> {

    List<SettlementEntry> findBySeasonIdAndSessionIdOrderByParticipantIdAsc(Long seasonId, Long sessionId);

    List<SettlementEntry> findBySeasonIdOrderByIdAsc(Long seasonId);

    /**
     * Settlements with a nonzero rating change, for any of the given participants,
     * in sessions ordered after (scheduledAt, sessionId) within the season.
     */
    @Query("""
        SELECT COUNT(e) FROM SettlementEntry e, GameSession s
        WHERE s.id = e.sessionId
        AND e.seasonId = :seasonId
        AND e.participantId IN :participantIds
        AND e.rateDelta <> 0
        AND (s.scheduledAt > :scheduledAt OR (s.scheduledAt = :scheduledAt AND s.id > :sessionId))
        """)
    long countLaterRatedSettlements(@Param("seasonId") Long seasonId,
                                    @Param("participantIds") Collection<Long> participantIds,
                                    @Param("scheduledAt") LocalDateTime scheduledAt,
                                    @Param("sessionId") Long sessionId);
}
