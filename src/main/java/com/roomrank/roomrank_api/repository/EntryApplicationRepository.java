package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.EntryApplication;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface EntryApplicationRepository extends JpaRepository<EntryApplication, Long> {

    Optional<EntryApplication> findByPoolIdAndParticipantId(Long poolId, Long participantId);

    List<EntryApplication> findByPoolIdOrderBySubmittedAtAscIdAsc(Long poolId);
}
