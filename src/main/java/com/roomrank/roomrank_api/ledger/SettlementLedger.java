package com.roomrank.roomrank_api.ledger;

import com.roomrank.roomrank_api.config.LeagueProperties;
import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.model.GameSession;
import com.roomrank.roomrank_api.model.Match;
import com.roomrank.roomrank_api.model.Participant;
import com.roomrank.roomrank_api.model.SessionStat;
import com.roomrank.roomrank_api.model.SessionStatus;
import com.roomrank.roomrank_api.repository.GameSessionRepository;
import com.roomrank.roomrank_api.repository.MatchRepository;
import com.roomrank.roomrank_api.repository.ParticipantRepository;
import com.roomrank.roomrank_api.repository.SeasonRepository;
import com.roomrank.roomrank_api.repository.SessionStatRepository;
import com.roomrank.roomrank_api.service.RatingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Source of truth for how much rating and how many win points each session
 * contributed to each participant's season totals.
 *
 * Settlement is rollback-then-reapply: any entries already written for the
 * session are subtracted back out first, so settling twice or resettling after
 * a correction never double-counts.
 *
 * Every write to season totals runs under the season row lock, so
 * concurrent settlements sharing a participant serialize. Lock order is
 * always session, then season.
 *
 * Flow of {@link #settle}:
 * 1. Lock the session row, then the season row.
 * 2. Roll back existing entries for (season, session).
 * 3. Ensure a SeasonScore for every participant with a SessionStat (seeded if new).
 * 4. Snapshot ratings, compute the field average and the max win count.
 * 5. Compute every delta from the snapshot, then apply and write one entry each.
 */
@Service
public class SettlementLedger {

    private static final Logger log = LoggerFactory.getLogger(SettlementLedger.class);

    /** Participation credit per confirmed entry. */
    public static final double ENTRY_POINTS = 0.5;

    private final SeasonRepository seasonRepository;
    private final GameSessionRepository sessionRepository;
    private final SessionStatRepository statRepository;
    private final MatchRepository matchRepository;
    private final ParticipantRepository participantRepository;
    private final SeasonScoreRepository scoreRepository;
    private final SettlementEntryRepository entryRepository;
    private final LeagueProperties properties;
    private final Clock clock;

    public SettlementLedger(SeasonRepository seasonRepository,
                            GameSessionRepository sessionRepository,
                            SessionStatRepository statRepository,
                            MatchRepository matchRepository,
                            ParticipantRepository participantRepository,
                            SeasonScoreRepository scoreRepository,
                            SettlementEntryRepository entryRepository,
                            LeagueProperties properties,
                            Clock clock) {
        this.seasonRepository = seasonRepository;
        this.sessionRepository = sessionRepository;
        this.statRepository = statRepository;
        this.matchRepository = matchRepository;
        this.participantRepository = participantRepository;
        this.scoreRepository = scoreRepository;
        this.entryRepository = entryRepository;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Settle / rollback
    // =========================================================================

    /** Idempotent: settling an already-settled session replaces its entries. */
    @Transactional
    public SettlementResult settle(Long seasonId, Long sessionId) {
        GameSession session = lockSession(seasonId, sessionId);
        lockSeason(seasonId);

        int rolledBack = rollbackEntries(seasonId, session.getId());

        SortedMap<Long, Integer> wins = new TreeMap<>();
        for (SessionStat stat : statRepository.findBySessionIdOrderByParticipantIdAsc(session.getId())) {
            wins.put(stat.getParticipantId(), stat.getWins());
        }

        List<SettlementLine> lines = applySessionSettlement(seasonId, session.getId(), wins);
        log.info("Settled session {} in season {}: {} participants (replaced {} previous entries)",
                session.getId(), seasonId, lines.size(), rolledBack);
        return new SettlementResult(seasonId, session.getId(), lines);
    }

    /**
     * Subtracts the session's entries back out of the season totals and
     * deletes them. Returns the number of entries removed.
     */
    @Transactional
    public int rollback(Long seasonId, Long sessionId) {
        GameSession session = lockSession(seasonId, sessionId);
        lockSeason(seasonId);
        int removed = rollbackEntries(seasonId, session.getId());
        log.info("Rolled back {} settlement entries for session {} in season {}",
                removed, session.getId(), seasonId);
        return removed;
    }

    // =========================================================================
    // Season recomputation
    // =========================================================================

    /**
     * Rebuilds the whole season from raw match history: every entry is
     * deleted, every score goes back to its seed with zero win points, then
     * every finished or previously settled session is replayed in
     * (scheduledAt, id) order with win counts derived from match outcomes
     * alone. Entry points are left untouched.
     */
    @Transactional
    public RecomputeResult recomputeSeason(Long seasonId) {
        lockSeason(seasonId);

        List<SettlementEntry> existing = entryRepository.findBySeasonIdOrderByIdAsc(seasonId);
        List<GameSession> sessions = sessionsToReplay(seasonId, existing);
        entryRepository.deleteAll(existing);
        entryRepository.flush();

        List<SeasonScore> scores = scoreRepository.findBySeasonIdOrderByParticipantIdAsc(seasonId);
        for (SeasonScore score : scores) {
            score.resetToSeed();
        }

        int entriesWritten = 0;
        for (GameSession session : sessions) {
            SortedMap<Long, Integer> wins = winsFromMatches(session.getId());
            entriesWritten += applySessionSettlement(seasonId, session.getId(), wins).size();
        }

        log.info("Recomputed season {}: discarded {} entries, reset {} scores, replayed {} sessions, wrote {} entries",
                seasonId, existing.size(), scores.size(), sessions.size(), entriesWritten);
        return new RecomputeResult(seasonId, sessions.size(), existing.size(), entriesWritten);
    }

    // =========================================================================
    // Participation points
    // =========================================================================

    /** Credits one entry to the pool's season; creates the season score if needed. */
    @Transactional
    public double awardEntryPoints(Long seasonId, Long participantId) {
        lockSeason(seasonId);
        SeasonScore score = getOrCreateScore(seasonId, participantId);
        score.addEntryPoints(ENTRY_POINTS);
        log.info("Participant {} earned {} entry points in season {} (now {})",
                participantId, ENTRY_POINTS, seasonId, score.getEntryPoints());
        return score.getEntryPoints();
    }

    /** Takes back a withdrawn entry's points. No-op when the participant has no season score. */
    @Transactional
    public double revokeEntryPoints(Long seasonId, Long participantId) {
        lockSeason(seasonId);
        return scoreRepository.findBySeasonIdAndParticipantId(seasonId, participantId)
                .map(score -> {
                    score.addEntryPoints(-ENTRY_POINTS);
                    log.info("Participant {} lost {} entry points in season {} (now {})",
                            participantId, ENTRY_POINTS, seasonId, score.getEntryPoints());
                    return score.getEntryPoints();
                })
                .orElse(0.0);
    }

    // =========================================================================
    // Reads
    // =========================================================================

    /** Season rating if the participant has one, otherwise what they would be seeded at. */
    @Transactional(readOnly = true)
    public double currentRating(Long seasonId, Participant participant) {
        return scoreRepository.findBySeasonIdAndParticipantId(seasonId, participant.getId())
                .map(SeasonScore::getRating)
                .orElseGet(() -> RatingModel.seedRating(participant.getExperience()));
    }

    @Transactional(readOnly = true)
    public List<SettlementEntry> entriesFor(Long seasonId, Long sessionId) {
        return entryRepository.findBySeasonIdAndSessionIdOrderByParticipantIdAsc(seasonId, sessionId);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private GameSession lockSession(Long seasonId, Long sessionId) {
        GameSession session = sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SESSION_NOT_FOUND, "Session", sessionId));
        if (!session.getSeasonId().equals(seasonId)) {
            throw new LeagueException(LeagueError.SEASON_MISMATCH,
                    "Session " + sessionId + " belongs to season " + session.getSeasonId() + ", not " + seasonId);
        }
        return session;
    }

    private void lockSeason(Long seasonId) {
        seasonRepository.findByIdForUpdate(seasonId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SEASON_NOT_FOUND, "Season", seasonId));
    }

    /** Finished sessions plus any session that still carried entries, in replay order. */
    private List<GameSession> sessionsToReplay(Long seasonId, List<SettlementEntry> existing) {
        Map<Long, GameSession> byId = new LinkedHashMap<>();
        for (GameSession session : sessionRepository
                .findBySeasonIdAndStatusOrderByScheduledAtAscIdAsc(seasonId, SessionStatus.FINISHED)) {
            byId.put(session.getId(), session);
        }
        Set<Long> settledIds = new TreeSet<>();
        for (SettlementEntry entry : existing) {
            if (!byId.containsKey(entry.getSessionId())) {
                settledIds.add(entry.getSessionId());
            }
        }
        for (GameSession session : sessionRepository.findAllById(settledIds)) {
            byId.put(session.getId(), session);
        }

        List<GameSession> ordered = new ArrayList<>(byId.values());
        ordered.sort(Comparator.comparing(GameSession::getScheduledAt,
                        Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                .thenComparing(GameSession::getId));
        return ordered;
    }

    private int rollbackEntries(Long seasonId, Long sessionId) {
        List<SettlementEntry> entries =
                entryRepository.findBySeasonIdAndSessionIdOrderByParticipantIdAsc(seasonId, sessionId);
        if (entries.isEmpty()) {
            return 0;
        }
        for (SettlementEntry entry : entries) {
            SeasonScore score = scoreRepository
                    .findBySeasonIdAndParticipantId(seasonId, entry.getParticipantId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Settlement entry " + entry.getId() + " has no season score for participant "
                                    + entry.getParticipantId()));
            score.revert(entry.getWinDelta(), entry.getRateDelta());
        }
        // Flush the deletes before new rows with the same (season, session, participant) key are inserted
        entryRepository.deleteAll(entries);
        entryRepository.flush();
        return entries.size();
    }

    private SortedMap<Long, Integer> winsFromMatches(Long sessionId) {
        SortedMap<Long, Integer> wins = new TreeMap<>();
        for (Match match : matchRepository.findBySessionIdOrderByMatchIndexAsc(sessionId)) {
            for (Long participantId : match.getTeamA()) wins.putIfAbsent(participantId, 0);
            for (Long participantId : match.getTeamB()) wins.putIfAbsent(participantId, 0);
            if (match.getWinner() != null) {
                for (Long participantId : match.roster(match.getWinner())) {
                    wins.merge(participantId, 1, Integer::sum);
                }
            }
        }
        return wins;
    }

    private List<SettlementLine> applySessionSettlement(Long seasonId, Long sessionId,
                                                        SortedMap<Long, Integer> wins) {
        if (wins.isEmpty()) {
            return List.of();
        }

        Map<Long, SeasonScore> scores = new LinkedHashMap<>();
        for (Long participantId : wins.keySet()) {
            scores.put(participantId, getOrCreateScore(seasonId, participantId));
        }

        double avgRating = scores.values().stream().mapToDouble(SeasonScore::getRating).average().orElse(0.0);
        int maxWins = wins.values().stream().mapToInt(Integer::intValue).max().orElse(0);

        // Every delta reads the same pre-settlement snapshot
        Map<Long, Double> deltas = new LinkedHashMap<>();
        for (Map.Entry<Long, SeasonScore> e : scores.entrySet()) {
            deltas.put(e.getKey(), RatingModel.delta(
                    e.getValue().getRating(), wins.get(e.getKey()), avgRating, maxWins, properties.kFactor()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<SettlementLine> lines = new ArrayList<>();
        for (Map.Entry<Long, SeasonScore> e : scores.entrySet()) {
            Long participantId = e.getKey();
            SeasonScore score = e.getValue();
            int winDelta = wins.get(participantId);
            double rateDelta = deltas.get(participantId);
            double before = score.getRating();

            score.apply(winDelta, rateDelta);
            entryRepository.save(new SettlementEntry(seasonId, sessionId, participantId, winDelta, rateDelta, now));
            lines.add(new SettlementLine(participantId, winDelta, before, score.getRating(), rateDelta));
        }
        return lines;
    }

    /** New season scores start at the seed derived from lifetime experience. */
    private SeasonScore getOrCreateScore(Long seasonId, Long participantId) {
        return scoreRepository.findBySeasonIdAndParticipantId(seasonId, participantId)
                .orElseGet(() -> {
                    Participant participant = participantRepository.findById(participantId)
                            .orElseThrow(() -> LeagueException.notFound(
                                    LeagueError.PARTICIPANT_NOT_FOUND, "Participant", participantId));
                    double seed = RatingModel.seedRating(participant.getExperience());
                    return scoreRepository.save(new SeasonScore(seasonId, participantId, seed));
                });
    }

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public record SettlementLine(Long participantId, int winDelta,
                                 double ratingBefore, double ratingAfter, double rateDelta) {}

    public record SettlementResult(Long seasonId, Long sessionId, List<SettlementLine> lines) {

        public SettlementLine lineFor(Long participantId) {
            return lines.stream()
                    .filter(l -> l.participantId().equals(participantId))
                    .findFirst()
                    .orElse(null);
        }
    }

    public record RecomputeResult(Long seasonId, int sessionsReplayed, int entriesDiscarded, int entriesWritten) {}
}
