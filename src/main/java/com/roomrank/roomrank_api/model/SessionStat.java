package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

/** Running win counter for one participant inside one room. */
@Getter
@Entity
@Table(name = "session_stats",
        uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "participant_id"}))
public class SessionStat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(nullable = false)
    private int wins = 0;

    protected SessionStat() {}

    public SessionStat(Long sessionId, Long participantId) {
        this.sessionId = sessionId;
        this.participantId = participantId;
    }

    public void recordWin() { this.wins++; }

    /** Never goes below zero. */
    public void revokeWin() {
        if (this.wins > 0) this.wins--;
    }

    public void reset() { this.wins = 0; }
}
