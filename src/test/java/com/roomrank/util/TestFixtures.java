package com.roomrank.util;

import com.roomrank.roomrank_api.model.Participant;
import com.roomrank.roomrank_api.model.Season;
import com.roomrank.roomrank_api.service.EntryQueueService.CloseResult;
import com.roomrank.roomrank_api.service.EntryQueueService.PoolView;
import com.roomrank.roomrank_api.service.SessionLifecycleService.MatchView;
import com.roomrank.roomrank_api.service.SessionLifecycleService.OutcomeResult;
import com.roomrank.roomrank_api.service.SessionLifecycleService.SessionView;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory methods for test data.
 * Never hardcode experience or rating values inline in tests.
 */
public class TestFixtures {

    public static final double DEFAULT_RATING = 1000.0;
    public static final LocalDateTime SEASON_START = LocalDateTime.of(2026, 1, 1, 0, 0);
    public static final LocalDateTime SEASON_END = LocalDateTime.of(2026, 6, 30, 0, 0);

    /** Experience that seeds exactly {@code rating} (inside the clamp range). */
    public static double experienceForSeed(double rating) {
        return rating + 1000.0;
    }

    // =========================================================================
    // Season / participant builders
    // =========================================================================

    public static Season buildSeason(InMemoryLeague league, String name) {
        return league.seasons.createSeason(name, SEASON_START, SEASON_END);
    }

    public static Participant buildParticipant(InMemoryLeague league, Season season, String externalId, double rating) {
        Participant participant = league.participants.register(externalId, externalId, experienceForSeed(rating));
        league.participants.joinSeason(season.getId(), participant.getId());
        return participant;
    }

    public static Participant buildParticipant(InMemoryLeague league, Season season, String externalId) {
        return buildParticipant(league, season, externalId, DEFAULT_RATING);
    }

    /** {@code count} registered participants named p1..pN, all at the default rating. */
    public static List<Participant> buildParticipants(InMemoryLeague league, Season season, int count) {
        List<Participant> participants = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            participants.add(buildParticipant(league, season, "p" + i));
        }
        return participants;
    }

    public static List<Long> ids(List<Participant> participants) {
        return participants.stream().map(Participant::getId).toList();
    }

    // =========================================================================
    // Room builders
    // =========================================================================

    /**
     * Opens a pool for the week, applies everyone one second apart and closes
     * it. Returns the close result so callers can pick rooms out of it.
     */
    public static CloseResult closePool(InMemoryLeague league, Season season, int week, List<Participant> applicants) {
        PoolView pool = league.entryQueue.open(season.getId(), week);
        for (Participant participant : applicants) {
            league.entryQueue.apply(pool.poolId(), participant.getId());
            league.clock.tick();
        }
        return league.entryQueue.close(pool.poolId());
    }

    /** A single scheduled room holding exactly {@code members}. */
    public static SessionView buildRoom(InMemoryLeague league, Season season, int week, List<Participant> members) {
        CloseResult result = closePool(league, season, week, members);
        if (result.rooms().size() != 1) {
            throw new IllegalStateException("Expected exactly one room, got " + result.rooms().size());
        }
        return result.rooms().get(0);
    }

    // =========================================================================
    // Match helpers
    // =========================================================================

    /** Records the open match as won by whichever team {@code participantId} is on. */
    public static OutcomeResult winFor(InMemoryLeague league, Long sessionId, Long participantId) {
        MatchView open = league.lifecycle.describe(sessionId).openMatch();
        if (open == null) {
            throw new IllegalStateException("Session " + sessionId + " has no open match");
        }
        String team = open.teamA().contains(participantId) ? "A" : "B";
        return league.lifecycle.recordOutcome(sessionId, null, team, "");
    }

    /** Lets {@code participantId} win until the session finishes. */
    public static OutcomeResult playUntilWinner(InMemoryLeague league, Long sessionId, Long participantId) {
        OutcomeResult result;
        do {
            result = winFor(league, sessionId, participantId);
        } while (!result.finished());
        return result;
    }
}
