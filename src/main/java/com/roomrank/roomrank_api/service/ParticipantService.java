package com.roomrank.roomrank_api.service;

import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.model.Participant;
import com.roomrank.roomrank_api.model.SeasonRegistration;
import com.roomrank.roomrank_api.repository.ParticipantRepository;
import com.roomrank.roomrank_api.repository.SeasonRegistrationRepository;
import com.roomrank.roomrank_api.repository.SeasonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/** Participant directory: league registration and per-season eligibility. */
@Service
public class ParticipantService {

    private static final Logger log = LoggerFactory.getLogger(ParticipantService.class);

    private final ParticipantRepository participantRepository;
    private final SeasonRepository seasonRepository;
    private final SeasonRegistrationRepository registrationRepository;
    private final Clock clock;

    public ParticipantService(ParticipantRepository participantRepository,
                              SeasonRepository seasonRepository,
                              SeasonRegistrationRepository registrationRepository,
                              Clock clock) {
        this.participantRepository = participantRepository;
        this.seasonRepository = seasonRepository;
        this.registrationRepository = registrationRepository;
        this.clock = clock;
    }

    /**
     * Idempotent on externalId: a known participant only gets their display
     * name refreshed. Experience defaults to {@link Participant#DEFAULT_EXPERIENCE}.
     */
    @Transactional
    public Participant register(String externalId, String displayName, Double experience) {
        if (externalId == null || externalId.isBlank()) {
            throw new LeagueException(LeagueError.INVALID_ARGUMENT, "externalId is required");
        }
        String name = (displayName == null || displayName.isBlank()) ? externalId : displayName;

        return participantRepository.findByExternalId(externalId)
                .map(existing -> {
                    existing.setDisplayName(name);
                    return existing;
                })
                .orElseGet(() -> {
                    double xp = experience != null ? experience : Participant.DEFAULT_EXPERIENCE;
                    Participant created = participantRepository.save(
                            new Participant(externalId, name, xp, LocalDateTime.now(clock)));
                    log.info("Registered participant {} ({}) with experience {}", created.getId(), externalId, xp);
                    return created;
                });
    }

    /** Returns true if the participant was newly registered for the season. */
    @Transactional
    public boolean joinSeason(Long seasonId, Long participantId) {
        seasonRepository.findById(seasonId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SEASON_NOT_FOUND, "Season", seasonId));
        getParticipant(participantId);

        if (registrationRepository.existsBySeasonIdAndParticipantId(seasonId, participantId)) {
            return false;
        }
        registrationRepository.save(new SeasonRegistration(seasonId, participantId, LocalDateTime.now(clock)));
        log.info("Participant {} joined season {}", participantId, seasonId);
        return true;
    }

    @Transactional(readOnly = true)
    public boolean isEligible(Long seasonId, Long participantId) {
        return registrationRepository.existsBySeasonIdAndParticipantId(seasonId, participantId);
    }

    @Transactional(readOnly = true)
    public Participant getParticipant(Long participantId) {
        return participantRepository.findById(participantId)
                .orElseThrow(() -> LeagueException.notFound(
                        LeagueError.PARTICIPANT_NOT_FOUND, "Participant", participantId));
    }
}
