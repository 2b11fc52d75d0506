package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

/** Makes a participant eligible to apply to the season's entry pools. */
@Getter
@Entity
@Table(name = "season_registrations",
        uniqueConstraints = @UniqueConstraint(columnNames = {"season_id", "participant_id"}))
public class SeasonRegistration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime joinedAt;

    protected SeasonRegistration() {}

    public SeasonRegistration(Long seasonId, Long participantId, LocalDateTime joinedAt) {
        this.seasonId = seasonId;
        this.participantId = participantId;
        this.joinedAt = joinedAt;
    }
}
