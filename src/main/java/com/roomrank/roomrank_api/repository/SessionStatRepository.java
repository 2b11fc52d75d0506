package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.SessionStat;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SessionStatRepository extends JpaRepository<SessionStat, Long> {

    List<SessionStat> findBySessionIdOrderByParticipantIdAsc(Long sessionId);

    Optional<SessionStat> findBySessionIdAndParticipantId(Long sessionId, Long participantId);
}
