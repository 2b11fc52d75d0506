package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.MemberStatus;
import com.roomrank.roomrank_api.model.SessionMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SessionMemberRepository extends JpaRepository<SessionMember, Long> {

    /** Roster in seat order. */
    List<SessionMember> findBySessionIdAndStatusOrderBySeatAscIdAsc(Long sessionId, MemberStatus status);

    Optional<SessionMember> findBySessionIdAndParticipantId(Long sessionId, Long participantId);
}
