package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MatchRepository extends JpaRepository<Match, Long> {

    List<Match> findBySessionIdOrderByMatchIndexAsc(Long sessionId);

    Optional<Match> findBySessionIdAndMatchIndex(Long sessionId, int matchIndex);

    /** Highest-index match; the next match gets index + 1. */
    Optional<Match> findFirstBySessionIdOrderByMatchIndexDesc(Long sessionId);

    /** Open (undecided) matches. The lifecycle keeps this list at size 0 or 1. */
    List<Match> findBySessionIdAndWinnerIsNullOrderByMatchIndexAsc(Long sessionId);

    /** Most recently decided match, for undo. */
    Optional<Match> findFirstBySessionIdAndWinnerIsNotNullOrderByMatchIndexDesc(Long sessionId);
}
