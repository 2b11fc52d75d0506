package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.EntryPool;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface EntryPoolRepository extends JpaRepository<EntryPool, Long> {

    Optional<EntryPool> findBySeasonIdAndWeekNumber(Long seasonId, int weekNumber);

    /** Serializes apply/withdraw/close on one pool so the admission sweep runs once. */
    @Query("SELECT p FROM EntryPool p WHERE p.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    Optional<EntryPool> findByIdForUpdate(@Param("id") Long id);
}
