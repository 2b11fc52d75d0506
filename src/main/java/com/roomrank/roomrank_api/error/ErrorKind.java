package com.roomrank.roomrank_api.error;

/**
 * Coarse failure categories. The calling layer maps these to user-facing
 * messages; none of them is fatal to the process.
 */
public enum ErrorKind {
    /** Season, session, match, pool or participant absent. */
    NOT_FOUND,
    /** Operation not valid for the current lifecycle state. */
    INVALID_STATE,
    /** Wrong party size, pool under capacity, room full. */
    CAPACITY_VIOLATION,
    /** Correction refused because later settlements already consumed the ratings. */
    STALE_EDIT,
    /** Malformed input. */
    VALIDATION_ERROR
}
