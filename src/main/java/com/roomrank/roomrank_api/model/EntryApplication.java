package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

/** One participant's application to an entry pool. */
@Getter
@Entity
@Table(name = "entry_applications",
        uniqueConstraints = @UniqueConstraint(columnNames = {"pool_id", "participant_id"}))
public class EntryApplication {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pool_id", nullable = false)
    private Long poolId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ApplicationStatus status = ApplicationStatus.CONFIRMED;

    @Column(nullable = false)
    private LocalDateTime submittedAt;

    protected EntryApplication() {}

    public EntryApplication(Long poolId, Long participantId, LocalDateTime submittedAt) {
        this.poolId = poolId;
        this.participantId = participantId;
        this.submittedAt = submittedAt;
    }

    public boolean isConfirmed() { return status == ApplicationStatus.CONFIRMED; }

    /** Reapplying moves the applicant to the back of their priority tier. */
    public void reactivate(LocalDateTime at) {
        this.status = ApplicationStatus.CONFIRMED;
        this.submittedAt = at;
    }

    public void cancel() { this.status = ApplicationStatus.CANCELED; }
}
