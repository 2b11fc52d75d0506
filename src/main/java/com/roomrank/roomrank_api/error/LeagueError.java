package com.roomrank.roomrank_api.error;

public enum LeagueError {

    // Lookups
    SEASON_NOT_FOUND(ErrorKind.NOT_FOUND),
    PARTICIPANT_NOT_FOUND(ErrorKind.NOT_FOUND),
    POOL_NOT_FOUND(ErrorKind.NOT_FOUND),
    SESSION_NOT_FOUND(ErrorKind.NOT_FOUND),
    MATCH_NOT_FOUND(ErrorKind.NOT_FOUND),

    // Lifecycle
    POOL_CLOSED(ErrorKind.INVALID_STATE),
    ALREADY_FINISHED(ErrorKind.INVALID_STATE),
    SESSION_NOT_JOINABLE(ErrorKind.INVALID_STATE),
    SESSION_NOT_ACTIVE(ErrorKind.INVALID_STATE),
    ROSTER_LOCKED(ErrorKind.INVALID_STATE),
    OPEN_MATCH_EXISTS(ErrorKind.INVALID_STATE),
    NO_OPEN_MATCH(ErrorKind.INVALID_STATE),
    MATCH_NOT_DECIDED(ErrorKind.INVALID_STATE),
    ALREADY_MEMBER(ErrorKind.INVALID_STATE),
    NOT_A_MEMBER(ErrorKind.INVALID_STATE),

    // Capacity
    INVALID_PARTY_SIZE(ErrorKind.CAPACITY_VIOLATION),
    INSUFFICIENT_PLAYERS(ErrorKind.CAPACITY_VIOLATION),
    SESSION_FULL(ErrorKind.CAPACITY_VIOLATION),

    STALE_EDIT(ErrorKind.STALE_EDIT),

    // Input
    INVALID_TEAM(ErrorKind.VALIDATION_ERROR),
    NOT_ELIGIBLE(ErrorKind.VALIDATION_ERROR),
    SEASON_MISMATCH(ErrorKind.VALIDATION_ERROR),
    INVALID_ARGUMENT(ErrorKind.VALIDATION_ERROR);

    private final ErrorKind kind;

    LeagueError(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
