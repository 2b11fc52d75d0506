package com.roomrank.roomrank_api.service;

import com.roomrank.roomrank_api.config.LeagueProperties;
import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.ledger.SettlementLedger;
import com.roomrank.roomrank_api.ledger.SettlementLedger.SettlementResult;
import com.roomrank.roomrank_api.model.GameSession;
import com.roomrank.roomrank_api.model.Match;
import com.roomrank.roomrank_api.model.MemberStatus;
import com.roomrank.roomrank_api.model.SessionMember;
import com.roomrank.roomrank_api.model.SessionStat;
import com.roomrank.roomrank_api.model.SessionStatus;
import com.roomrank.roomrank_api.model.Team;
import com.roomrank.roomrank_api.repository.GameSessionRepository;
import com.roomrank.roomrank_api.repository.MatchRepository;
import com.roomrank.roomrank_api.repository.SeasonRegistrationRepository;
import com.roomrank.roomrank_api.repository.SessionMemberRepository;
import com.roomrank.roomrank_api.repository.SessionStatRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Match-sequencing state machine for one room.
 *
 * Every operation locks the session row first, so operations on the same room
 * are serialized and "at most one open match" holds. Rooms are independent of
 * each other. Settlement is delegated to the SettlementLedger; this service
 * never touches ratings or season points.
 *
 * Recording flow:
 * 1. Decide the open match and credit a win to everyone on the winning roster.
 * 2. If anyone reached the win threshold: settle, finish, no new match.
 * 3. Otherwise create the next balanced match so exactly one stays open.
 */
@Service
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    private final GameSessionRepository sessionRepository;
    private final SessionMemberRepository memberRepository;
    private final MatchRepository matchRepository;
    private final SessionStatRepository statRepository;
    private final SeasonRegistrationRepository registrationRepository;
    private final SettlementLedger ledger;
    private final EditSafetyGuard editSafetyGuard;
    private final LeagueProperties properties;
    private final Clock clock;

    public SessionLifecycleService(GameSessionRepository sessionRepository,
                                   SessionMemberRepository memberRepository,
                                   MatchRepository matchRepository,
                                   SessionStatRepository statRepository,
                                   SeasonRegistrationRepository registrationRepository,
                                   SettlementLedger ledger,
                                   EditSafetyGuard editSafetyGuard,
                                   LeagueProperties properties,
                                   Clock clock) {
        this.sessionRepository = sessionRepository;
        this.memberRepository = memberRepository;
        this.matchRepository = matchRepository;
        this.statRepository = statRepository;
        this.registrationRepository = registrationRepository;
        this.ledger = ledger;
        this.editSafetyGuard = editSafetyGuard;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Room creation (driven by the entry queue)
    // =========================================================================

    /** Placeholder room that stands in for a week while its pool is open. */
    @Transactional
    public GameSession createPendingSession(Long seasonId, int weekNumber, Long poolId) {
        GameSession session = sessionRepository.save(new GameSession(
                seasonId, weekNumber, poolId, properties.roomCapacity(),
                SessionStatus.PENDING, LocalDateTime.now(clock)));
        log.debug("Pending session {} created for season {} week {}", session.getId(), seasonId, weekNumber);
        return session;
    }

    /**
     * PENDING → SCHEDULED with a full roster (seat order = given order) and
     * the first match already drawn.
     */
    @Transactional
    public SessionView scheduleRoom(Long sessionId, String roomLabel, List<Long> participantIds) {
        GameSession session = lockSession(sessionId);
        if (session.getStatus() != SessionStatus.PENDING) {
            throw new LeagueException(LeagueError.SESSION_NOT_ACTIVE,
                    "Session " + sessionId + " is " + session.getStatus() + ", expected PENDING");
        }
        if (participantIds.size() != session.getCapacity()) {
            throw new LeagueException(LeagueError.INSUFFICIENT_PLAYERS,
                    "Room needs exactly " + session.getCapacity() + " players, got " + participantIds.size());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        int seat = 0;
        for (Long participantId : participantIds) {
            memberRepository.save(new SessionMember(session.getId(), participantId, seat++, now));
        }
        session.schedule(roomLabel, now);
        createNextMatchInternal(session);

        log.info("Room {} scheduled as session {} with {} members", roomLabel, session.getId(), participantIds.size());
        return describeInternal(session);
    }

    /** Pool canceled: the placeholder never becomes a room. */
    @Transactional
    public void cancelPending(Long sessionId) {
        GameSession session = lockSession(sessionId);
        if (session.getStatus() == SessionStatus.PENDING) {
            session.cancel();
            log.info("Pending session {} canceled", sessionId);
        }
    }

    // =========================================================================
    // Start
    // =========================================================================

    /**
     * SCHEDULED → LIVE. Repeated calls are expected, so a live or finished
     * session reports a no-op instead of failing.
     */
    @Transactional
    public StartResult start(Long sessionId) {
        GameSession session = lockSession(sessionId);

        switch (session.getStatus()) {
            case LIVE:
                return new StartResult(sessionId, StartOutcome.ALREADY_LIVE, "Session " + sessionId + " is already live");
            case FINISHED:
                return new StartResult(sessionId, StartOutcome.ALREADY_FINISHED, "Session " + sessionId + " has already finished");
            case PENDING:
            case CANCELED:
                throw new LeagueException(LeagueError.SESSION_NOT_ACTIVE,
                        "Session " + sessionId + " is " + session.getStatus() + " and cannot start");
            default:
                break;
        }

        requireFullRoster(session);
        startInternal(session);
        if (findOpenMatch(session).isEmpty()) {
            createNextMatchInternal(session);
        }
        log.info("Session {} started", sessionId);
        return new StartResult(sessionId, StartOutcome.STARTED, "Session " + sessionId + " started");
    }

    // =========================================================================
    // Matches
    // =========================================================================

    @Transactional
    public MatchView createNextMatch(Long sessionId) {
        GameSession session = lockSession(sessionId);
        return MatchView.of(createNextMatchInternal(session));
    }

    /**
     * Records the winner of the open match. {@code matchIndex} null means
     * "whichever match is open"; a given index must be the open one.
     */
    @Transactional
    public OutcomeResult recordOutcome(Long sessionId, Integer matchIndex, String winner, String stage) {
        Team team = Team.parse(winner);
        GameSession session = lockSession(sessionId);

        switch (session.getStatus()) {
            case FINISHED:
                throw new LeagueException(LeagueError.ALREADY_FINISHED, "Session " + sessionId + " has already finished");
            case PENDING:
            case CANCELED:
                throw new LeagueException(LeagueError.SESSION_NOT_ACTIVE,
                        "Session " + sessionId + " is " + session.getStatus());
            default:
                break;
        }

        Match match = resolveOpenMatch(session, matchIndex);

        // First result on a scheduled room starts it
        if (session.getStatus() == SessionStatus.SCHEDULED) {
            startInternal(session);
        }

        match.decide(team, stage, LocalDateTime.now(clock));
        for (Long participantId : match.roster(team)) {
            getOrCreateStat(session.getId(), participantId).recordWin();
        }
        log.info("Session {} match #{}: team {} wins", sessionId, match.getMatchIndex(), team);

        if (endingConditionMet(session)) {
            SettlementResult settlement = ledger.settle(session.getSeasonId(), session.getId());
            session.finish(LocalDateTime.now(clock));
            log.info("Session {} finished: win threshold {} reached", sessionId, properties.winThreshold());
            return new OutcomeResult(sessionId, MatchView.of(match), session.getStatus(), null, settlement, false, true);
        }

        Match next = createNextMatchInternal(session);
        return new OutcomeResult(sessionId, MatchView.of(match), session.getStatus(), MatchView.of(next), null, false, true);
    }

    /**
     * Rewrites the outcome of an already decided match. Same winner and stage
     * is a no-op. Wins move from the old winning roster (never below zero) to
     * the new one; settlement and status are then reconciled with the
     * corrected win counts.
     */
    @Transactional
    public OutcomeResult correctOutcome(Long sessionId, int matchIndex, String newWinner, String newStage) {
        Team team = Team.parse(newWinner);
        GameSession session = lockSession(sessionId);
        requireLiveOrFinished(session);

        Match match = matchRepository.findBySessionIdAndMatchIndex(session.getId(), matchIndex)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.MATCH_NOT_FOUND,
                        "Match #" + matchIndex + " in session", sessionId));
        if (match.isOpen()) {
            throw new LeagueException(LeagueError.MATCH_NOT_DECIDED,
                    "Match #" + matchIndex + " has no result yet; record it instead of correcting it");
        }

        String stage = newStage != null ? newStage : match.getStage();
        Team previous = match.getWinner();
        if (previous == team && Objects.equals(stage, match.getStage())) {
            log.debug("Correction of session {} match #{} changes nothing", sessionId, matchIndex);
            return new OutcomeResult(sessionId, MatchView.of(match), session.getStatus(),
                    findOpenMatch(session).map(MatchView::of).orElse(null), null, false, false);
        }

        editSafetyGuard.verifyEditable(session);

        if (previous != team) {
            for (Long participantId : match.roster(previous)) {
                getOrCreateStat(session.getId(), participantId).revokeWin();
            }
            for (Long participantId : match.roster(team)) {
                getOrCreateStat(session.getId(), participantId).recordWin();
            }
        }
        match.decide(team, stage, LocalDateTime.now(clock));
        log.info("Session {} match #{} corrected: {} -> {}", sessionId, matchIndex, previous, team);

        return reconcileAfterEdit(session, match);
    }

    /**
     * Takes back the most recent result: that match becomes the open match
     * again and the match drawn after it is discarded. A finished session is
     * unsettled and goes back to LIVE.
     */
    @Transactional
    public OutcomeResult undoLastOutcome(Long sessionId) {
        GameSession session = lockSession(sessionId);
        requireLiveOrFinished(session);

        Match last = matchRepository.findFirstBySessionIdAndWinnerIsNotNullOrderByMatchIndexDesc(session.getId())
                .orElseThrow(() -> new LeagueException(LeagueError.MATCH_NOT_DECIDED,
                        "Session " + sessionId + " has no decided match to undo"));

        editSafetyGuard.verifyEditable(session);

        for (Long participantId : last.roster(last.getWinner())) {
            getOrCreateStat(session.getId(), participantId).revokeWin();
        }
        discardOpenMatches(session);
        Team undone = last.getWinner();
        last.clearOutcome();

        boolean reopened = false;
        if (session.getStatus() == SessionStatus.FINISHED) {
            ledger.rollback(session.getSeasonId(), session.getId());
            session.reopen();
            reopened = true;
        }
        log.info("Session {} match #{} result (team {}) undone{}", sessionId, last.getMatchIndex(), undone,
                reopened ? "; session reopened" : "");
        return new OutcomeResult(sessionId, MatchView.of(last), session.getStatus(), MatchView.of(last), null, reopened, true);
    }

    // =========================================================================
    // Roster changes
    // =========================================================================

    /** Dropout before the room starts; leaves the room under capacity. */
    @Transactional
    public SessionView withdrawMember(Long sessionId, Long participantId) {
        GameSession session = lockSession(sessionId);
        if (session.getStatus() != SessionStatus.SCHEDULED) {
            throw new LeagueException(LeagueError.ROSTER_LOCKED,
                    "Members can only withdraw from a scheduled session; session " + sessionId
                            + " is " + session.getStatus());
        }

        SessionMember member = memberRepository.findBySessionIdAndParticipantId(session.getId(), participantId)
                .filter(SessionMember::isConfirmed)
                .orElseThrow(() -> new LeagueException(LeagueError.NOT_A_MEMBER,
                        "Participant " + participantId + " is not a member of session " + sessionId));

        member.withdraw();
        discardOpenMatches(session);
        statRepository.findBySessionIdAndParticipantId(session.getId(), participantId)
                .ifPresent(statRepository::delete);

        log.info("Participant {} withdrew from session {}", participantId, sessionId);
        return describeInternal(session);
    }

    /**
     * Adds a replacement to an under-capacity scheduled room, or to a room
     * canceled for a dropout that never started. Reaching capacity restores
     * SCHEDULED and draws the next match.
     */
    @Transactional
    public SessionView refill(Long sessionId, Long participantId) {
        GameSession session = lockSession(sessionId);
        boolean joinable = session.getStatus() == SessionStatus.SCHEDULED
                || (session.getStatus() == SessionStatus.CANCELED && !session.hasStarted() && session.getRoomLabel() != null);
        if (!joinable) {
            throw new LeagueException(LeagueError.SESSION_NOT_JOINABLE,
                    "Session " + sessionId + " (" + session.getStatus() + ") cannot take new members");
        }
        if (!registrationRepository.existsBySeasonIdAndParticipantId(session.getSeasonId(), participantId)) {
            throw new LeagueException(LeagueError.NOT_ELIGIBLE,
                    "Participant " + participantId + " is not registered for season " + session.getSeasonId());
        }

        List<SessionMember> members = confirmedMembers(session);
        Optional<SessionMember> existing = memberRepository.findBySessionIdAndParticipantId(session.getId(), participantId);
        if (existing.isPresent() && existing.get().isConfirmed()) {
            throw new LeagueException(LeagueError.ALREADY_MEMBER,
                    "Participant " + participantId + " is already in session " + sessionId);
        }
        if (members.size() >= session.getCapacity()) {
            throw new LeagueException(LeagueError.SESSION_FULL, "Session " + sessionId + " is full");
        }

        int seat = members.stream().mapToInt(SessionMember::getSeat).max().orElse(-1) + 1;
        LocalDateTime now = LocalDateTime.now(clock);
        if (existing.isPresent()) {
            existing.get().reactivate(seat, now);
        } else {
            memberRepository.save(new SessionMember(session.getId(), participantId, seat, now));
        }
        log.info("Participant {} joined session {} ({}/{})", participantId, sessionId, members.size() + 1, session.getCapacity());

        if (members.size() + 1 == session.getCapacity()) {
            if (session.getStatus() == SessionStatus.CANCELED) {
                session.restoreScheduled();
                log.info("Session {} refilled and rescheduled", sessionId);
            }
            if (findOpenMatch(session).isEmpty()) {
                createNextMatchInternal(session);
            }
        }
        return describeInternal(session);
    }

    /**
     * Abandons an under-capacity scheduled room. The returned members are the
     * ones the caller should favor in the next pool.
     */
    @Transactional
    public CancelRefillResult cancelRefill(Long sessionId) {
        GameSession session = lockSession(sessionId);
        if (session.getStatus() != SessionStatus.SCHEDULED) {
            throw new LeagueException(LeagueError.SESSION_NOT_JOINABLE,
                    "Only a scheduled session awaiting refill can be abandoned; session " + sessionId
                            + " is " + session.getStatus());
        }
        List<Long> remaining = confirmedMembers(session).stream().map(SessionMember::getParticipantId).toList();
        if (remaining.size() >= session.getCapacity()) {
            throw new LeagueException(LeagueError.INVALID_ARGUMENT,
                    "Session " + sessionId + " is full; nothing to abandon");
        }

        discardOpenMatches(session);
        session.cancel();
        log.info("Session {} canceled after failed refill; {} members to requeue", sessionId, remaining.size());
        return new CancelRefillResult(sessionId, remaining);
    }

    // =========================================================================
    // Reads
    // =========================================================================

    @Transactional(readOnly = true)
    public SessionView describe(Long sessionId) {
        GameSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SESSION_NOT_FOUND, "Session", sessionId));
        return describeInternal(session);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private GameSession lockSession(Long sessionId) {
        return sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SESSION_NOT_FOUND, "Session", sessionId));
    }

    private List<SessionMember> confirmedMembers(GameSession session) {
        return memberRepository.findBySessionIdAndStatusOrderBySeatAscIdAsc(session.getId(), MemberStatus.CONFIRMED);
    }

    private void requireFullRoster(GameSession session) {
        int count = confirmedMembers(session).size();
        if (count != session.getCapacity()) {
            throw new LeagueException(LeagueError.INSUFFICIENT_PLAYERS,
                    "Session " + session.getId() + " has " + count + " of " + session.getCapacity() + " players");
        }
    }

    private void requireLiveOrFinished(GameSession session) {
        if (session.getStatus() != SessionStatus.LIVE && session.getStatus() != SessionStatus.FINISHED) {
            throw new LeagueException(LeagueError.SESSION_NOT_ACTIVE,
                    "Session " + session.getId() + " is " + session.getStatus() + " and has no results to edit");
        }
    }

    /** Win counters start from zero when the room goes live. */
    private void startInternal(GameSession session) {
        session.start(LocalDateTime.now(clock));
        for (SessionMember member : confirmedMembers(session)) {
            getOrCreateStat(session.getId(), member.getParticipantId()).reset();
        }
    }

    private Match createNextMatchInternal(GameSession session) {
        if (session.getStatus() == SessionStatus.FINISHED) {
            throw new LeagueException(LeagueError.ALREADY_FINISHED, "Session " + session.getId() + " has already finished");
        }
        if (session.getStatus() == SessionStatus.PENDING || session.getStatus() == SessionStatus.CANCELED) {
            throw new LeagueException(LeagueError.SESSION_NOT_ACTIVE,
                    "Session " + session.getId() + " is " + session.getStatus());
        }
        if (findOpenMatch(session).isPresent()) {
            throw new LeagueException(LeagueError.OPEN_MATCH_EXISTS,
                    "Session " + session.getId() + " already has an undecided match");
        }

        List<SessionMember> members = confirmedMembers(session);
        if (members.size() != session.getCapacity()) {
            throw new LeagueException(LeagueError.INSUFFICIENT_PLAYERS,
                    "Session " + session.getId() + " has " + members.size() + " of " + session.getCapacity() + " players");
        }

        List<TeamBalancer.Seat> seats = new ArrayList<>(members.size());
        for (SessionMember member : members) {
            SessionStat stat = getOrCreateStat(session.getId(), member.getParticipantId());
            seats.add(new TeamBalancer.Seat(member.getParticipantId(), stat.getWins()));
        }
        TeamBalancer.Split split = TeamBalancer.split(seats);

        int nextIndex = matchRepository.findFirstBySessionIdOrderByMatchIndexDesc(session.getId())
                .map(m -> m.getMatchIndex() + 1)
                .orElse(1);

        Match match = matchRepository.save(new Match(
                session.getId(), nextIndex, split.teamA(), split.teamB(), LocalDateTime.now(clock)));
        log.debug("Session {} match #{} drawn (imbalance {})", session.getId(), nextIndex, split.imbalance());
        return match;
    }

    /**
     * After a correction: settle, unsettle or leave alone depending on whether
     * the session was finished and whether it still meets the ending condition.
     */
    private OutcomeResult reconcileAfterEdit(GameSession session, Match edited) {
        boolean wasFinished = session.getStatus() == SessionStatus.FINISHED;
        boolean meetsEnd = endingConditionMet(session);
        SettlementResult settlement = null;
        boolean reopened = false;

        if (wasFinished && !meetsEnd) {
            ledger.rollback(session.getSeasonId(), session.getId());
            session.reopen();
            discardOpenMatches(session);
            createNextMatchInternal(session);
            reopened = true;
            log.info("Session {} reopened: correction dropped everyone below {} wins",
                    session.getId(), properties.winThreshold());
        } else if (meetsEnd) {
            if (!wasFinished) {
                discardOpenMatches(session);
            }
            settlement = ledger.settle(session.getSeasonId(), session.getId());
            if (!wasFinished) {
                session.finish(LocalDateTime.now(clock));
                log.info("Session {} finished by correction", session.getId());
            }
        }

        MatchView open = findOpenMatch(session).map(MatchView::of).orElse(null);
        return new OutcomeResult(session.getId(), MatchView.of(edited), session.getStatus(), open, settlement, reopened, true);
    }

    private Match resolveOpenMatch(GameSession session, Integer matchIndex) {
        Optional<Match> open = findOpenMatch(session);
        if (matchIndex == null) {
            return open.orElseThrow(() -> new LeagueException(LeagueError.NO_OPEN_MATCH,
                    "Session " + session.getId() + " has no undecided match"));
        }
        if (open.isPresent() && open.get().getMatchIndex() == matchIndex) {
            return open.get();
        }
        if (matchRepository.findBySessionIdAndMatchIndex(session.getId(), matchIndex).isEmpty()) {
            throw LeagueException.notFound(LeagueError.MATCH_NOT_FOUND, "Match #" + matchIndex + " in session", session.getId());
        }
        throw new LeagueException(LeagueError.NO_OPEN_MATCH,
                "Match #" + matchIndex + " in session " + session.getId() + " is already decided; correct it instead");
    }

    private Optional<Match> findOpenMatch(GameSession session) {
        List<Match> open = matchRepository.findBySessionIdAndWinnerIsNullOrderByMatchIndexAsc(session.getId());
        return open.isEmpty() ? Optional.empty() : Optional.of(open.get(open.size() - 1));
    }

    private void discardOpenMatches(GameSession session) {
        List<Match> open = matchRepository.findBySessionIdAndWinnerIsNullOrderByMatchIndexAsc(session.getId());
        if (!open.isEmpty()) {
            matchRepository.deleteAll(open);
            // A replacement may reuse the index; the unique key must not see both rows
            matchRepository.flush();
            log.debug("Discarded {} undecided match(es) in session {}", open.size(), session.getId());
        }
    }

    private boolean endingConditionMet(GameSession session) {
        return statRepository.findBySessionIdOrderByParticipantIdAsc(session.getId()).stream()
                .anyMatch(stat -> stat.getWins() >= properties.winThreshold());
    }

    private SessionStat getOrCreateStat(Long sessionId, Long participantId) {
        return statRepository.findBySessionIdAndParticipantId(sessionId, participantId)
                .orElseGet(() -> statRepository.save(new SessionStat(sessionId, participantId)));
    }

    private SessionView describeInternal(GameSession session) {
        List<Long> members = confirmedMembers(session).stream().map(SessionMember::getParticipantId).toList();
        Map<Long, Integer> wins = new LinkedHashMap<>();
        for (Long participantId : members) {
            wins.put(participantId, 0);
        }
        for (SessionStat stat : statRepository.findBySessionIdOrderByParticipantIdAsc(session.getId())) {
            if (wins.containsKey(stat.getParticipantId())) {
                wins.put(stat.getParticipantId(), stat.getWins());
            }
        }
        MatchView open = findOpenMatch(session).map(MatchView::of).orElse(null);
        return new SessionView(session.getId(), session.getSeasonId(), session.getWeekNumber(), session.getRoomLabel(),
                session.getStatus(), session.getCapacity(), members, wins, open);
    }

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public enum StartOutcome { STARTED, ALREADY_LIVE, ALREADY_FINISHED }

    public record StartResult(Long sessionId, StartOutcome outcome, String message) {}

    public record MatchView(int matchIndex, List<Long> teamA, List<Long> teamB, Team winner, String stage) {
        static MatchView of(Match match) {
            return new MatchView(match.getMatchIndex(), List.copyOf(match.getTeamA()), List.copyOf(match.getTeamB()),
                    match.getWinner(), match.getStage());
        }
    }

    /**
     * Result of record / correct / undo.
     *
     * @param match       the match that was decided or edited
     * @param openMatch   the undecided match after the operation (null once finished)
     * @param settlement  present when the operation (re)settled the session
     * @param reopened    a finished session went back to LIVE
     * @param changed     false for a correction that matched the stored outcome
     */
    public record OutcomeResult(Long sessionId, MatchView match, SessionStatus status, MatchView openMatch,
                                SettlementResult settlement, boolean reopened, boolean changed) {
        public boolean finished() { return status == SessionStatus.FINISHED; }
    }

    public record SessionView(Long sessionId, Long seasonId, int weekNumber, String roomLabel, SessionStatus status,
                              int capacity, List<Long> members, Map<Long, Integer> wins, MatchView openMatch) {}

    public record CancelRefillResult(Long sessionId, List<Long> remainingMemberIds) {}
}
