package com.roomrank.roomrank_api;

import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.ledger.SeasonScore;
import com.roomrank.roomrank_api.ledger.SeasonScoreRepository;
import com.roomrank.roomrank_api.ledger.SettlementEntry;
import com.roomrank.roomrank_api.ledger.SettlementEntryRepository;
import com.roomrank.roomrank_api.ledger.SettlementLedger;
import com.roomrank.roomrank_api.ledger.SettlementLedger.RecomputeResult;
import com.roomrank.roomrank_api.model.Participant;
import com.roomrank.roomrank_api.model.PoolStatus;
import com.roomrank.roomrank_api.model.Season;
import com.roomrank.roomrank_api.model.SessionStatus;
import com.roomrank.roomrank_api.repository.ParticipantRepository;
import com.roomrank.roomrank_api.service.EntryQueueService;
import com.roomrank.roomrank_api.service.EntryQueueService.CloseResult;
import com.roomrank.roomrank_api.service.EntryQueueService.PoolView;
import com.roomrank.roomrank_api.service.LeaderboardService;
import com.roomrank.roomrank_api.service.ParticipantService;
import com.roomrank.roomrank_api.service.SeasonService;
import com.roomrank.roomrank_api.service.SessionLifecycleService;
import com.roomrank.roomrank_api.service.SessionLifecycleService.OutcomeResult;
import com.roomrank.roomrank_api.service.SessionLifecycleService.SessionView;
import com.roomrank.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end league flow against a real PostgreSQL via Testcontainers.
 * Rooms of 2, win threshold 2 (application-test.properties).
 *
 * Skipped when no Docker daemon is available.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class LeagueFlowIntegrationTest {

    private static final double EPS = 1e-6;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15");

    @DynamicPropertySource
    static void configureTestContainerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired private JdbcTemplate jdbcTemplate;
    @Autowired private SeasonService seasonService;
    @Autowired private ParticipantService participantService;
    @Autowired private EntryQueueService entryQueue;
    @Autowired private SessionLifecycleService lifecycle;
    @Autowired private SettlementLedger ledger;
    @Autowired private LeaderboardService leaderboard;
    @Autowired private SeasonScoreRepository scoreRepository;
    @Autowired private SettlementEntryRepository entryRepository;
    @Autowired private ParticipantRepository participantRepository;

    private Season season;
    private Participant alice;
    private Participant bob;
    private Participant carol;

    @BeforeEach
    void resetState() {
        jdbcTemplate.execute(
                "TRUNCATE TABLE settlement_entries, season_scores, matches, session_stats, session_members, "
                        + "sessions, entry_applications, entry_pools, season_registrations, participants, seasons "
                        + "RESTART IDENTITY CASCADE");

        season = seasonService.createSeason("Spring 2026", TestFixtures.SEASON_START, TestFixtures.SEASON_END);
        alice = participantService.register("alice", "Alice", TestFixtures.experienceForSeed(1000.0));
        bob = participantService.register("bob", "Bob", TestFixtures.experienceForSeed(1000.0));
        carol = participantService.register("carol", "Carol", TestFixtures.experienceForSeed(1000.0));
        participantService.joinSeason(season.getId(), alice.getId());
        participantService.joinSeason(season.getId(), bob.getId());
        participantService.joinSeason(season.getId(), carol.getId());
    }

    private Long scheduleRoom(int week) {
        return scheduleRoom(week, alice, bob);
    }

    private Long scheduleRoom(int week, Participant first, Participant second) {
        PoolView pool = entryQueue.open(season.getId(), week);
        entryQueue.apply(pool.poolId(), first.getId());
        entryQueue.apply(pool.poolId(), second.getId());
        CloseResult result = entryQueue.close(pool.poolId());
        assertEquals(PoolStatus.CLOSED, result.status());
        return result.rooms().get(0).sessionId();
    }

    private String teamOf(Long sessionId, Participant participant) {
        SessionView view = lifecycle.describe(sessionId);
        return view.openMatch().teamA().contains(participant.getId()) ? "A" : "B";
    }

    private SeasonScore score(Participant participant) {
        return scoreRepository.findBySeasonIdAndParticipantId(season.getId(), participant.getId()).orElseThrow();
    }

    /** Runs every task at once on its own thread and rethrows the first failure. */
    private static void runConcurrently(List<Callable<?>> tasks) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch ready = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Callable<?> task : tasks) {
                futures.add(pool.submit(() -> {
                    ready.await();
                    return task.call();
                }));
            }
            ready.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void assertTotalsMatchLedger(Participant participant) {
        SeasonScore score = score(participant);
        double rateSum = 0.0;
        int winSum = 0;
        for (SettlementEntry entry : entryRepository.findBySeasonIdOrderByIdAsc(season.getId())) {
            if (entry.getParticipantId().equals(participant.getId())) {
                rateSum += entry.getRateDelta();
                winSum += entry.getWinDelta();
            }
        }
        assertEquals(score.getSeedRating() + rateSum, score.getRating(), EPS);
        assertEquals(winSum, score.getWinPoints());
    }

    @Test
    void fullSession_settlesWinnerAndLoser() {
        Long sessionId = scheduleRoom(1);

        lifecycle.start(sessionId);
        lifecycle.recordOutcome(sessionId, null, teamOf(sessionId, alice), "");
        OutcomeResult last = lifecycle.recordOutcome(sessionId, null, teamOf(sessionId, alice), "");

        assertTrue(last.finished());
        assertEquals(1010.0, score(alice).getRating(), EPS);
        assertEquals(990.0, score(bob).getRating(), EPS);
        assertEquals(2, score(alice).getWinPoints());
        assertEquals(2.5, score(alice).getTotalPoints(), EPS);
        assertEquals(2, entryRepository.findBySeasonIdAndSessionIdOrderByParticipantIdAsc(season.getId(), sessionId).size());
        assertEquals(alice.getId(), leaderboard.standings(season.getId()).get(0).participantId());
    }

    @Test
    void correction_reopensFinishedSessionAndRollsBack() {
        Long sessionId = scheduleRoom(1);
        lifecycle.recordOutcome(sessionId, null, teamOf(sessionId, alice), "");
        lifecycle.recordOutcome(sessionId, null, teamOf(sessionId, alice), "");

        String bobsTeam = lifecycle.describe(sessionId).members().get(0).equals(bob.getId()) ? "A" : "B";
        OutcomeResult corrected = lifecycle.correctOutcome(sessionId, 2, bobsTeam, null);

        assertTrue(corrected.reopened());
        assertEquals(SessionStatus.LIVE, lifecycle.describe(sessionId).status());
        assertEquals(1000.0, score(alice).getRating(), EPS);
        assertTrue(entryRepository.findBySeasonIdOrderByIdAsc(season.getId()).isEmpty());
    }

    @Test
    void recompute_matchesIncrementalTotals() {
        Long week1 = scheduleRoom(1);
        lifecycle.recordOutcome(week1, null, teamOf(week1, alice), "");
        lifecycle.recordOutcome(week1, null, teamOf(week1, alice), "");
        Long week2 = scheduleRoom(2);
        lifecycle.recordOutcome(week2, null, teamOf(week2, bob), "");
        lifecycle.recordOutcome(week2, null, teamOf(week2, bob), "");
        double aliceBefore = score(alice).getRating();
        double bobBefore = score(bob).getRating();

        RecomputeResult result = ledger.recomputeSeason(season.getId());

        assertEquals(2, result.sessionsReplayed());
        assertEquals(aliceBefore, score(alice).getRating(), EPS);
        assertEquals(bobBefore, score(bob).getRating(), EPS);

        LeagueException ex = assertThrows(LeagueException.class,
                () -> lifecycle.correctOutcome(week1, 1, "B", "x"));
        assertEquals(LeagueError.STALE_EDIT, ex.getError());
    }

    @Test
    void concurrentSettles_sharingAParticipant_keepTotalsEqualToEntries() throws Exception {
        Long week1 = scheduleRoom(1, alice, bob);
        lifecycle.recordOutcome(week1, null, teamOf(week1, alice), "");
        lifecycle.recordOutcome(week1, null, teamOf(week1, alice), "");
        Long week2 = scheduleRoom(2, alice, carol);
        lifecycle.recordOutcome(week2, null, teamOf(week2, carol), "");
        lifecycle.recordOutcome(week2, null, teamOf(week2, carol), "");

        List<Callable<?>> settles = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            settles.add(() -> ledger.settle(season.getId(), week1));
            settles.add(() -> ledger.settle(season.getId(), week2));
        }
        runConcurrently(settles);

        assertEquals(4, entryRepository.findBySeasonIdOrderByIdAsc(season.getId()).size());
        assertTotalsMatchLedger(alice);
        assertTotalsMatchLedger(bob);
        assertTotalsMatchLedger(carol);
        assertEquals(2, score(alice).getWinPoints());
    }

    @Test
    void concurrentPriorityBumps_areNotLost() throws Exception {
        List<Callable<?>> bumps = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            bumps.add(() -> {
                entryQueue.bumpPriority(List.of(alice.getId(), bob.getId()));
                return null;
            });
        }
        runConcurrently(bumps);

        assertEquals(6, participantRepository.findById(alice.getId()).orElseThrow().getPriority());
        assertEquals(6, participantRepository.findById(bob.getId()).orElseThrow().getPriority());
    }

    @Test
    void recompute_keepsSessionSettledWhileLive() {
        Long sessionId = scheduleRoom(1);
        lifecycle.recordOutcome(sessionId, null, teamOf(sessionId, alice), "");
        ledger.settle(season.getId(), sessionId);
        double aliceSettled = score(alice).getRating();

        ledger.recomputeSeason(season.getId());

        assertEquals(SessionStatus.LIVE, lifecycle.describe(sessionId).status());
        assertEquals(aliceSettled, score(alice).getRating(), EPS);
        assertEquals(2, entryRepository.findBySeasonIdAndSessionIdOrderByParticipantIdAsc(season.getId(), sessionId).size());
    }
}
