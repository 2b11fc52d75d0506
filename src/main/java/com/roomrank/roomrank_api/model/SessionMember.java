package com.roomrank.roomrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Entity
@Table(name = "session_members",
        uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "participant_id"}))
public class SessionMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MemberStatus status = MemberStatus.CONFIRMED;

    /** Position in the room roster; the team balancer enumerates in this order. */
    @Column(nullable = false)
    private int seat;

    @Column(nullable = false)
    private LocalDateTime joinedAt;

    protected SessionMember() {}

    public SessionMember(Long sessionId, Long participantId, int seat, LocalDateTime joinedAt) {
        this.sessionId = sessionId;
        this.participantId = participantId;
        this.seat = seat;
        this.joinedAt = joinedAt;
    }

    public boolean isConfirmed() { return status == MemberStatus.CONFIRMED; }

    public void withdraw() { this.status = MemberStatus.WITHDRAWN; }

    public void reactivate(int seat, LocalDateTime at) {
        this.status = MemberStatus.CONFIRMED;
        this.seat = seat;
        this.joinedAt = at;
    }
}
