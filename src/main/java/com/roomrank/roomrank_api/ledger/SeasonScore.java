package com.roomrank.roomrank_api.ledger;

import jakarta.persistence.*;
import lombok.Getter;

/**
 * A participant's season totals. Mutators are package-private: only the
 * SettlementLedger may change rating or win points, and every change it makes
 * is paired with a SettlementEntry.
 */
@Getter
@Entity
@Table(name = "season_scores",
        uniqueConstraints = @UniqueConstraint(columnNames = {"season_id", "participant_id"}))
public class SeasonScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    /** Rating the season started from; recomputation resets to it. */
    @Column(nullable = false)
    private double seedRating;

    @Column(nullable = false)
    private double rating;

    @Column(nullable = false)
    private int winPoints = 0;

    /** Participation points; not touched by settlement or recomputation. */
    @Column(nullable = false)
    private double entryPoints = 0.0;

    protected SeasonScore() {}

    SeasonScore(Long seasonId, Long participantId, double seedRating) {
        this.seasonId = seasonId;
        this.participantId = participantId;
        this.seedRating = seedRating;
        this.rating = seedRating;
    }

    public double getTotalPoints() { return entryPoints + winPoints; }

    void apply(int winDelta, double rateDelta) {
        this.winPoints += winDelta;
        this.rating += rateDelta;
    }

    void revert(int winDelta, double rateDelta) {
        this.winPoints -= winDelta;
        this.rating -= rateDelta;
    }

    void addEntryPoints(double points) {
        this.entryPoints += points;
    }

    void resetToSeed() {
        this.rating = seedRating;
        this.winPoints = 0;
    }
}
