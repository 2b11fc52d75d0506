package com.roomrank.roomrank_api.error;

/**
 * The only exception league services throw for business-rule failures.
 * Unchecked so that a {@code @Transactional} operation rolls back as a whole.
 */
public class LeagueException extends RuntimeException {

    private final LeagueError error;

    public LeagueException(LeagueError error, String message) {
        super(message);
        this.error = error;
    }

    public LeagueError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }

    public static LeagueException notFound(LeagueError error, String what, Object id) {
        return new LeagueException(error, what + " not found: " + id);
    }
}
