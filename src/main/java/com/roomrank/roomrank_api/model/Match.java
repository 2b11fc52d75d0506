package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One game inside a session. Created with no winner ("open"); at most one
 * open match exists per session. Once decided, the outcome only changes
 * through an explicit correction or undo.
 */
@Getter
@Entity
@Table(name = "matches",
        uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "match_index"}))
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    /** 1-based, unique within the session. */
    @Column(name = "match_index", nullable = false)
    private int matchIndex;

    @Convert(converter = ParticipantIdListConverter.class)
    @Column(name = "team_a_ids", nullable = false, columnDefinition = "text")
    private List<Long> teamA = new ArrayList<>();

    @Convert(converter = ParticipantIdListConverter.class)
    @Column(name = "team_b_ids", nullable = false, columnDefinition = "text")
    private List<Long> teamB = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 1)
    private Team winner;

    @Column(nullable = false, length = 64)
    private String stage = "";

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime decidedAt;

    protected Match() {}

    public Match(Long sessionId, int matchIndex, List<Long> teamA, List<Long> teamB, LocalDateTime createdAt) {
        this.sessionId = sessionId;
        this.matchIndex = matchIndex;
        this.teamA = new ArrayList<>(teamA);
        this.teamB = new ArrayList<>(teamB);
        this.createdAt = createdAt;
    }

    public boolean isOpen() { return winner == null; }

    public List<Long> roster(Team team) {
        return team == Team.A ? List.copyOf(teamA) : List.copyOf(teamB);
    }

    public void decide(Team winner, String stage, LocalDateTime at) {
        this.winner = winner;
        this.stage = stage == null ? "" : stage;
        this.decidedAt = at;
    }

    public void clearOutcome() {
        this.winner = null;
        this.stage = "";
        this.decidedAt = null;
    }
}
