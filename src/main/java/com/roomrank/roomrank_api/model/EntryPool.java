package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Weekly sign-up window. One per (season, week). Admission is a one-shot
 * sweep performed when the pool is closed.
 */
@Getter
@Entity
@Table(name = "entry_pools",
        uniqueConstraints = @UniqueConstraint(columnNames = {"season_id", "week_number"}))
public class EntryPool {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(name = "week_number", nullable = false)
    private int weekNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PoolStatus status = PoolStatus.OPEN;

    /** The pending session that stands in for this week's rooms while the pool is open. */
    @Column(name = "placeholder_session_id")
    private Long placeholderSessionId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime resolvedAt;

    protected EntryPool() {}

    public EntryPool(Long seasonId, int weekNumber, LocalDateTime createdAt) {
        this.seasonId = seasonId;
        this.weekNumber = weekNumber;
        this.createdAt = createdAt;
    }

    public boolean isOpen() { return status == PoolStatus.OPEN; }

    public void setPlaceholderSessionId(Long placeholderSessionId) {
        this.placeholderSessionId = placeholderSessionId;
    }

    public void close(LocalDateTime at) {
        this.status = PoolStatus.CLOSED;
        this.resolvedAt = at;
    }

    public void cancel(LocalDateTime at) {
        this.status = PoolStatus.CANCELED;
        this.resolvedAt = at;
    }
}
