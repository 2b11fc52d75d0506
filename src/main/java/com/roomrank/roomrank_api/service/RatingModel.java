package com.roomrank.roomrank_api.service;

/**
 * Pure rating math with no state and no Spring wiring.
 *
 * Formula (per participant, once per settled session):
 *   performance = wins / max(maxWins, 1) - 0.5
 *   diffTerm    = (avgRating - rating) / 400
 *   delta       = K * (performance + diffTerm)
 *
 * This compares each participant against the room's field average, not
 * pairwise against opponents, so it is not a true Elo update. Deltas across
 * a room only sum to zero when the win distribution happens to be symmetric.
 *
 * Seed rating (first appearance in a season):
 *   seed = clamp(experience - 1000, 1000, 2500)
 * Everything below the floor, including non-positive and non-finite results,
 * becomes 1000.
 */
public final class RatingModel {

    public static final double DEFAULT_K_FACTOR = 20.0;

    private static final double SEED_OFFSET = 1000.0;
    private static final double SEED_FLOOR = 1000.0;
    private static final double SEED_CEILING = 2500.0;

    private RatingModel() {}

    // =========================================================================
    // Delta
    // =========================================================================

    /**
     * Rating change for one participant after a session.
     *
     * @param rating     participant's rating before settlement
     * @param wins       participant's wins in the session
     * @param avgRating  mean pre-settlement rating of everyone in the session
     * @param maxWins    highest win count in the session (clamped to at least 1)
     * @param kFactor    scale of the change
     */
    public static double delta(double rating, int wins, double avgRating, int maxWins, double kFactor) {
        double performance = (double) wins / Math.max(maxWins, 1) - 0.5;
        double diffTerm = (avgRating - rating) / 400.0;
        return kFactor * (performance + diffTerm);
    }

    // =========================================================================
    // Seed
    // =========================================================================

    public static double seedRating(double experience) {
        double seed = experience - SEED_OFFSET;
        if (!Double.isFinite(seed) || seed < SEED_FLOOR) {
            return SEED_FLOOR;
        }
        return Math.min(seed, SEED_CEILING);
    }

    public static double seedFloor() {
        return SEED_FLOOR;
    }

    public static double seedCeiling() {
        return SEED_CEILING;
    }
}
