package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.Participant;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    Optional<Participant> findByExternalId(String externalId);

    /**
     * Locks participant rows for a priority update.
     * Callers pass ids sorted ascending so concurrent sweeps cannot deadlock.
     */
    @Query("SELECT p FROM Participant p WHERE p.id IN :ids ORDER BY p.id ASC")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    List<Participant> findAllByIdWithLock(@Param("ids") List<Long> ids);
}
