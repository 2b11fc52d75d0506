package com.roomrank.roomrank_api.model;

import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;

public enum Team {
    A,
    B;

    /** Accepts "a"/"A"/"b"/"B" (surrounding whitespace ignored). */
    public static Team parse(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase();
            if (normalized.equals("A")) return A;
            if (normalized.equals("B")) return B;
        }
        throw new LeagueException(LeagueError.INVALID_TEAM, "team must be A or B, got: " + value);
    }
}
