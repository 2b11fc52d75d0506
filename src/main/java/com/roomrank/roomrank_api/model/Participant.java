package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * League member. Season rating and points live in the ledger's SeasonScore;
 * this row only carries what outlives a season: the lifetime experience value
 * that seeds a new season rating, and the admission priority.
 */
@Getter
@Entity
@Table(name = "participants")
public class Participant {

    public static final double DEFAULT_EXPERIENCE = 2000.0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Identity in the calling layer (chat user id, account id). */
    @Column(name = "external_id", nullable = false, unique = true, length = 64)
    private String externalId;

    @Column(nullable = false, length = 64)
    private String displayName;

    @Column(nullable = false)
    private double experience = DEFAULT_EXPERIENCE;

    /** Admission boost: +1 per rejected pool, back to 0 when admitted. */
    @Column(nullable = false)
    private int priority = 0;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    protected Participant() {}

    public Participant(String externalId, String displayName, double experience, LocalDateTime createdAt) {
        this.externalId = externalId;
        this.displayName = displayName;
        this.experience = experience;
        this.createdAt = createdAt;
    }

    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public void bumpPriority() { this.priority++; }
    public void resetPriority() { this.priority = 0; }
}
