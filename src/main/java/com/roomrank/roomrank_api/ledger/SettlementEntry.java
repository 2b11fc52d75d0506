package com.roomrank.roomrank_api.ledger;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Exactly what one session contributed to one participant's season totals.
 * Never updated in place: a resettlement deletes the rows and writes new ones.
 */
@Getter
@Entity
@Table(name = "settlement_entries",
        uniqueConstraints = @UniqueConstraint(columnNames = {"season_id", "session_id", "participant_id"}))
public class SettlementEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(nullable = false)
    private int winDelta;

    @Column(nullable = false)
    private double rateDelta;

    @Column(nullable = false, updatable = false)
    private LocalDateTime calculatedAt;

    protected SettlementEntry() {}

    SettlementEntry(Long seasonId, Long sessionId, Long participantId,
                    int winDelta, double rateDelta, LocalDateTime calculatedAt) {
        this.seasonId = seasonId;
        this.sessionId = sessionId;
        this.participantId = participantId;
        this.winDelta = winDelta;
        this.rateDelta = rateDelta;
        this.calculatedAt = calculatedAt;
    }
}
