package com.roomrank.roomrank_api.model;

/**
 * Room lifecycle.
 *
 * PENDING → SCHEDULED → LIVE → FINISHED
 * SCHEDULED → CANCELED (dropout not refilled)
 * CANCELED → SCHEDULED (refilled, only if never started)
 * FINISHED → LIVE (a correction or undo un-meets the ending condition)
 */
public enum SessionStatus {
    PENDING,
    SCHEDULED,
    LIVE,
    CANCELED,
    FINISHED
}
