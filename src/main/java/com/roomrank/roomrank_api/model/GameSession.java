package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * A room: a fixed-capacity group of participants playing a sequence of
 * matches. Capacity is fixed when the session is created.
 */
@Getter
@Entity
@Table(name = "sessions")
public class GameSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(name = "week_number", nullable = false)
    private int weekNumber;

    @Column(name = "pool_id")
    private Long poolId;

    @Column(length = 8)
    private String roomLabel;

    @Column(nullable = false)
    private int capacity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionStatus status;

    /** Replay order for season recomputation is (scheduledAt, id). */
    @Column(nullable = false)
    private LocalDateTime scheduledAt;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    protected GameSession() {}

    public GameSession(Long seasonId, int weekNumber, Long poolId, int capacity,
                       SessionStatus status, LocalDateTime scheduledAt) {
        this.seasonId = seasonId;
        this.weekNumber = weekNumber;
        this.poolId = poolId;
        this.capacity = capacity;
        this.status = status;
        this.scheduledAt = scheduledAt;
    }

    public boolean hasStarted() { return startedAt != null; }

    // =========================================================================
    // Transitions (guards live in SessionLifecycleService)
    // =========================================================================

    public void schedule(String roomLabel, LocalDateTime at) {
        this.roomLabel = roomLabel;
        this.status = SessionStatus.SCHEDULED;
        this.scheduledAt = at;
    }

    public void restoreScheduled() { this.status = SessionStatus.SCHEDULED; }

    public void start(LocalDateTime at) {
        this.status = SessionStatus.LIVE;
        this.startedAt = at;
    }

    public void finish(LocalDateTime at) {
        this.status = SessionStatus.FINISHED;
        this.finishedAt = at;
    }

    public void reopen() {
        this.status = SessionStatus.LIVE;
        this.finishedAt = null;
    }

    public void cancel() { this.status = SessionStatus.CANCELED; }
}
