package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.GameSession;
import com.roomrank.roomrank_api.model.SessionStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface GameSessionRepository extends JpaRepository<GameSession, Long> {

    /**
     * Per-session mutual exclusion. Every lifecycle operation and per-session
     * settlement goes through this lock so "exactly one open match" holds.
     */
    @Query("SELECT s FROM GameSession s WHERE s.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    Optional<GameSession> findByIdForUpdate(@Param("id") Long id);

    /** Chronological replay order used by season recomputation. */
    List<GameSession> findBySeasonIdAndStatusOrderByScheduledAtAscIdAsc(Long seasonId, SessionStatus status);
}
