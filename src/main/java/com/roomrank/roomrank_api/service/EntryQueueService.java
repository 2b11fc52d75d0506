package com.roomrank.roomrank_api.service;

import com.roomrank.roomrank_api.config.LeagueProperties;
import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.ledger.SettlementLedger;
import com.roomrank.roomrank_api.model.ApplicationStatus;
import com.roomrank.roomrank_api.model.EntryApplication;
import com.roomrank.roomrank_api.model.EntryPool;
import com.roomrank.roomrank_api.model.GameSession;
import com.roomrank.roomrank_api.model.Participant;
import com.roomrank.roomrank_api.model.PoolStatus;
import com.roomrank.roomrank_api.model.SessionStatus;
import com.roomrank.roomrank_api.repository.EntryApplicationRepository;
import com.roomrank.roomrank_api.repository.EntryPoolRepository;
import com.roomrank.roomrank_api.repository.GameSessionRepository;
import com.roomrank.roomrank_api.repository.ParticipantRepository;
import com.roomrank.roomrank_api.repository.SeasonRegistrationRepository;
import com.roomrank.roomrank_api.repository.SeasonRepository;
import com.roomrank.roomrank_api.service.SessionLifecycleService.CancelRefillResult;
import com.roomrank.roomrank_api.service.SessionLifecycleService.SessionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly entry pools and the priority-based admission sweep.
 *
 * Closing a pool:
 * 1. Order confirmed applications by (priority desc, submittedAt asc).
 * 2. Admit the longest prefix that fills whole rooms.
 * 3. Admitted: priority reset to 0. Everyone else: priority + 1.
 * 4. Chunk the admitted into rooms (A, B, C, ...), each seated by rating desc.
 * Fewer applicants than one room cancels the pool and bumps everyone.
 */
@Service
public class EntryQueueService {

    private static final Logger log = LoggerFactory.getLogger(EntryQueueService.class);

    private final SeasonRepository seasonRepository;
    private final EntryPoolRepository poolRepository;
    private final EntryApplicationRepository applicationRepository;
    private final ParticipantRepository participantRepository;
    private final SeasonRegistrationRepository registrationRepository;
    private final GameSessionRepository sessionRepository;
    private final SessionLifecycleService lifecycle;
    private final SettlementLedger ledger;
    private final LeagueProperties properties;
    private final Clock clock;

    public EntryQueueService(SeasonRepository seasonRepository,
                             EntryPoolRepository poolRepository,
                             EntryApplicationRepository applicationRepository,
                             ParticipantRepository participantRepository,
                             SeasonRegistrationRepository registrationRepository,
                             GameSessionRepository sessionRepository,
                             SessionLifecycleService lifecycle,
                             SettlementLedger ledger,
                             LeagueProperties properties,
                             Clock clock) {
        this.seasonRepository = seasonRepository;
        this.poolRepository = poolRepository;
        this.applicationRepository = applicationRepository;
        this.participantRepository = participantRepository;
        this.registrationRepository = registrationRepository;
        this.sessionRepository = sessionRepository;
        this.lifecycle = lifecycle;
        this.ledger = ledger;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Open / apply / withdraw
    // =========================================================================

    /** Idempotent: returns the existing pool for (season, week) if there is one. */
    @Transactional
    public PoolView open(Long seasonId, int weekNumber) {
        if (weekNumber <= 0) {
            throw new LeagueException(LeagueError.INVALID_ARGUMENT, "Week number must be positive: " + weekNumber);
        }
        seasonRepository.findById(seasonId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SEASON_NOT_FOUND, "Season", seasonId));

        Optional<EntryPool> existing = poolRepository.findBySeasonIdAndWeekNumber(seasonId, weekNumber);
        if (existing.isPresent()) {
            log.debug("Pool for season {} week {} already exists ({})", seasonId, weekNumber, existing.get().getId());
            return toView(existing.get());
        }

        EntryPool pool = poolRepository.save(new EntryPool(seasonId, weekNumber, LocalDateTime.now(clock)));
        GameSession placeholder = lifecycle.createPendingSession(seasonId, weekNumber, pool.getId());
        pool.setPlaceholderSessionId(placeholder.getId());
        log.info("Pool {} opened for season {} week {}", pool.getId(), seasonId, weekNumber);
        return toView(pool);
    }

    /**
     * Adds a confirmed application, or reactivates a withdrawn one. Each
     * transition to confirmed earns entry points in the pool's season.
     */
    @Transactional
    public ApplicationView apply(Long poolId, Long participantId) {
        EntryPool pool = lockOpenPool(poolId);
        participantRepository.findById(participantId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.PARTICIPANT_NOT_FOUND, "Participant", participantId));
        if (!registrationRepository.existsBySeasonIdAndParticipantId(pool.getSeasonId(), participantId)) {
            throw new LeagueException(LeagueError.NOT_ELIGIBLE,
                    "Participant " + participantId + " is not registered for season " + pool.getSeasonId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        EntryApplication application = applicationRepository.findByPoolIdAndParticipantId(pool.getId(), participantId)
                .map(existing -> {
                    if (!existing.isConfirmed()) {
                        existing.reactivate(now);
                        ledger.awardEntryPoints(pool.getSeasonId(), participantId);
                        log.info("Participant {} reapplied to pool {}", participantId, pool.getId());
                    }
                    return existing;
                })
                .orElseGet(() -> {
                    EntryApplication created = applicationRepository.save(
                            new EntryApplication(pool.getId(), participantId, now));
                    ledger.awardEntryPoints(pool.getSeasonId(), participantId);
                    log.info("Participant {} applied to pool {}", participantId, pool.getId());
                    return created;
                });
        return ApplicationView.of(application);
    }

    /** No-op when the application is already withdrawn or never existed. Withdrawing revokes the entry points. */
    @Transactional
    public Optional<ApplicationView> withdraw(Long poolId, Long participantId) {
        EntryPool pool = lockOpenPool(poolId);
        return applicationRepository.findByPoolIdAndParticipantId(pool.getId(), participantId)
                .map(application -> {
                    if (application.isConfirmed()) {
                        application.cancel();
                        ledger.revokeEntryPoints(pool.getSeasonId(), participantId);
                        log.info("Participant {} withdrew from pool {}", participantId, pool.getId());
                    }
                    return ApplicationView.of(application);
                });
    }

    // =========================================================================
    // Close
    // =========================================================================

    @Transactional
    public CloseResult close(Long poolId) {
        EntryPool pool = lockOpenPool(poolId);
        int capacity = properties.roomCapacity();
        LocalDateTime now = LocalDateTime.now(clock);

        List<EntryApplication> confirmed = applicationRepository.findByPoolIdOrderBySubmittedAtAscIdAsc(pool.getId())
                .stream()
                .filter(EntryApplication::isConfirmed)
                .toList();
        Map<Long, Participant> participants = loadParticipants(confirmed);

        // 1. Priority desc, then earliest submission
        List<EntryApplication> ordered = new ArrayList<>(confirmed);
        ordered.sort(Comparator
                .comparingInt((EntryApplication a) -> -participants.get(a.getParticipantId()).getPriority())
                .thenComparing(EntryApplication::getSubmittedAt)
                .thenComparing(EntryApplication::getId));

        // 2. Whole rooms only
        int admitCount = (ordered.size() / capacity) * capacity;
        List<Long> admitted = ordered.subList(0, admitCount).stream().map(EntryApplication::getParticipantId).toList();
        List<Long> waitlisted = ordered.subList(admitCount, ordered.size()).stream().map(EntryApplication::getParticipantId).toList();

        // 3. Priority sweep
        admitted.forEach(id -> participants.get(id).resetPriority());
        waitlisted.forEach(id -> participants.get(id).bumpPriority());

        if (admitCount == 0) {
            pool.cancel(now);
            if (pool.getPlaceholderSessionId() != null) {
                lifecycle.cancelPending(pool.getPlaceholderSessionId());
            }
            log.info("Pool {} canceled: {} confirmed applicants, a room needs {}", pool.getId(), ordered.size(), capacity);
            return new CloseResult(pool.getId(), pool.getStatus(), List.of(), admitted, waitlisted);
        }

        pool.close(now);

        // 4. Rooms
        List<SessionView> rooms = new ArrayList<>();
        for (int start = 0, room = 0; start < admitCount; start += capacity, room++) {
            List<Long> chunk = new ArrayList<>(admitted.subList(start, start + capacity));
            chunk.sort(Comparator.comparingDouble(
                    (Long id) -> ledger.currentRating(pool.getSeasonId(), participants.get(id))).reversed());

            GameSession session = room == 0 ? placeholderOrNew(pool) : newRoomSession(pool);
            rooms.add(lifecycle.scheduleRoom(session.getId(), roomLabel(room), chunk));
        }

        log.info("Pool {} closed: {} admitted into {} room(s), {} waitlisted",
                pool.getId(), admitted.size(), rooms.size(), waitlisted.size());
        return new CloseResult(pool.getId(), pool.getStatus(), rooms, admitted, waitlisted);
    }

    // =========================================================================
    // Priority
    // =========================================================================

    @Transactional
    public void bumpPriority(Collection<Long> participantIds) {
        for (Participant participant : lockParticipants(participantIds)) {
            participant.bumpPriority();
        }
        log.info("Admission priority bumped for {} participant(s)", participantIds.size());
    }

    /** Abandons a room that could not be refilled and favors its remaining members next week. */
    @Transactional
    public CancelRefillResult cancelRoomAndRequeue(Long sessionId) {
        CancelRefillResult result = lifecycle.cancelRefill(sessionId);
        bumpPriority(result.remainingMemberIds());
        return result;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private EntryPool lockOpenPool(Long poolId) {
        EntryPool pool = poolRepository.findByIdForUpdate(poolId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.POOL_NOT_FOUND, "Pool", poolId));
        if (!pool.isOpen()) {
            log.warn("Pool {} is {}; request refused", poolId, pool.getStatus());
            throw new LeagueException(LeagueError.POOL_CLOSED, "Pool " + poolId + " is " + pool.getStatus());
        }
        return pool;
    }

    private Map<Long, Participant> loadParticipants(List<EntryApplication> applications) {
        List<Long> ids = applications.stream().map(EntryApplication::getParticipantId).toList();
        Map<Long, Participant> byId = new HashMap<>();
        for (Participant participant : lockParticipants(ids)) {
            byId.put(participant.getId(), participant);
        }
        for (Long id : ids) {
            if (!byId.containsKey(id)) {
                throw LeagueException.notFound(LeagueError.PARTICIPANT_NOT_FOUND, "Participant", id);
            }
        }
        return byId;
    }

    /** Priority is bumped from pool and session paths alike; rows are locked in id order. */
    private List<Participant> lockParticipants(Collection<Long> participantIds) {
        if (participantIds.isEmpty()) {
            return List.of();
        }
        return participantRepository.findAllByIdWithLock(participantIds.stream().distinct().sorted().toList());
    }

    private GameSession placeholderOrNew(EntryPool pool) {
        if (pool.getPlaceholderSessionId() != null) {
            Optional<GameSession> placeholder = sessionRepository.findById(pool.getPlaceholderSessionId())
                    .filter(s -> s.getStatus() == SessionStatus.PENDING);
            if (placeholder.isPresent()) {
                return placeholder.get();
            }
        }
        return newRoomSession(pool);
    }

    private GameSession newRoomSession(EntryPool pool) {
        return lifecycle.createPendingSession(pool.getSeasonId(), pool.getWeekNumber(), pool.getId());
    }

    /** 0 → "A", 25 → "Z", 26 → "AA". */
    static String roomLabel(int index) {
        StringBuilder label = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            label.insert(0, (char) ('A' + n % 26));
            n /= 26;
        }
        return label.toString();
    }

    private PoolView toView(EntryPool pool) {
        return new PoolView(pool.getId(), pool.getSeasonId(), pool.getWeekNumber(), pool.getStatus(),
                pool.getPlaceholderSessionId());
    }

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public record PoolView(Long poolId, Long seasonId, int weekNumber, PoolStatus status, Long placeholderSessionId) {}

    public record ApplicationView(Long poolId, Long participantId, ApplicationStatus status, LocalDateTime submittedAt) {
        static ApplicationView of(EntryApplication application) {
            return new ApplicationView(application.getPoolId(), application.getParticipantId(),
                    application.getStatus(), application.getSubmittedAt());
        }
    }

    /**
     * @param admitted   participant ids in admission order
     * @param waitlisted confirmed applicants left out; their priority was bumped
     */
    public record CloseResult(Long poolId, PoolStatus status, List<SessionView> rooms,
                              List<Long> admitted, List<Long> waitlisted) {}
}
