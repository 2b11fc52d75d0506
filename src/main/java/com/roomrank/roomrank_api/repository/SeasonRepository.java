package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.Season;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface SeasonRepository extends JpaRepository<Season, Long> {

    Optional<Season> findByName(String name);

    List<Season> findByActiveTrue();

    /** Newest active season; there should only ever be one. */
    Optional<Season> findFirstByActiveTrueOrderByStartDateDescIdDesc();

    /**
     * Season-wide mutual exclusion for recomputation.
     * Lock timeout of 5 seconds prevents indefinite blocking.
     */
    @Query("SELECT s FROM Season s WHERE s.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    Optional<Season> findByIdForUpdate(@Param("id") Long id);
}
