package com.roomrank.roomrank_api.repository;

import com.roomrank.roomrank_api.model.SeasonRegistration;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SeasonRegistrationRepository extends JpaRepository<SeasonRegistration, Long> {

    boolean existsBySeasonIdAndParticipantId(Long seasonId, Long participantId);
}
