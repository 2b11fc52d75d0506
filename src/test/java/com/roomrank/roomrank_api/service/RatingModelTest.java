package com.roomrank.roomrank_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RatingModelTest {

    private static final double K = RatingModel.DEFAULT_K_FACTOR;
    private static final double EPS = 1e-9;

    // =========================================================================
    // 1 — Delta
    // =========================================================================

    @Nested
    @DisplayName("1 — Delta")
    class Delta {

        @Test
        @DisplayName("delta_whenTopScorerAtFieldAverage_gainsHalfK")
        void delta_whenTopScorerAtFieldAverage_gainsHalfK() {
            assertEquals(10.0, RatingModel.delta(1000, 10, 1000, 10, K), EPS);
        }

        @Test
        @DisplayName("delta_whenNoWinsAtFieldAverage_losesHalfK")
        void delta_whenNoWinsAtFieldAverage_losesHalfK() {
            assertEquals(-10.0, RatingModel.delta(1000, 0, 1000, 10, K), EPS);
        }

        @Test
        @DisplayName("delta_whenHalfOfMaxWins_performanceTermIsZero")
        void delta_whenHalfOfMaxWins_performanceTermIsZero() {
            assertEquals(0.0, RatingModel.delta(1200, 5, 1200, 10, K), EPS);
        }

        @Test
        @DisplayName("delta_whenBelowFieldAverage_diffTermAddsUp")
        void delta_whenBelowFieldAverage_diffTermAddsUp() {
            // performance 0, diffTerm (1400 - 1000) / 400 = 1
            assertEquals(20.0, RatingModel.delta(1000, 5, 1400, 10, K), EPS);
        }

        @Test
        @DisplayName("delta_whenAboveFieldAverage_diffTermPullsDown")
        void delta_whenAboveFieldAverage_diffTermPullsDown() {
            assertEquals(-5.0, RatingModel.delta(1100, 5, 1000, 10, K), EPS);
        }

        @Test
        @DisplayName("delta_whenNobodyWon_maxWinsClampedToOne")
        void delta_whenNobodyWon_maxWinsClampedToOne() {
            double delta = RatingModel.delta(1000, 0, 1000, 0, K);
            assertTrue(Double.isFinite(delta));
            assertEquals(-10.0, delta, EPS);
        }

        @Test
        @DisplayName("delta_scalesLinearlyWithK")
        void delta_scalesLinearlyWithK() {
            double base = RatingModel.delta(1050, 3, 1000, 4, 10.0);
            assertEquals(base * 3, RatingModel.delta(1050, 3, 1000, 4, 30.0), EPS);
        }
    }

    // =========================================================================
    // 2 — Seed
    // =========================================================================

    @Nested
    @DisplayName("2 — Seed")
    class Seed {

        @Test
        @DisplayName("seedRating_whenInRange_subtractsOffset")
        void seedRating_whenInRange_subtractsOffset() {
            assertEquals(1000.0, RatingModel.seedRating(2000.0), EPS);
            assertEquals(1600.0, RatingModel.seedRating(2600.0), EPS);
        }

        @Test
        @DisplayName("seedRating_whenBelowFloor_returnsFloor")
        void seedRating_whenBelowFloor_returnsFloor() {
            assertEquals(RatingModel.seedFloor(), RatingModel.seedRating(1500.0), EPS);
            assertEquals(RatingModel.seedFloor(), RatingModel.seedRating(0.0), EPS);
            assertEquals(RatingModel.seedFloor(), RatingModel.seedRating(-300.0), EPS);
        }

        @Test
        @DisplayName("seedRating_whenAboveCeiling_returnsCeiling")
        void seedRating_whenAboveCeiling_returnsCeiling() {
            assertEquals(RatingModel.seedCeiling(), RatingModel.seedRating(9000.0), EPS);
            assertEquals(2500.0, RatingModel.seedRating(3500.0), EPS);
        }

        @Test
        @DisplayName("seedRating_whenNotFinite_returnsFloor")
        void seedRating_whenNotFinite_returnsFloor() {
            assertEquals(RatingModel.seedFloor(), RatingModel.seedRating(Double.NaN), EPS);
            assertEquals(RatingModel.seedFloor(), RatingModel.seedRating(Double.POSITIVE_INFINITY), EPS);
            assertEquals(RatingModel.seedFloor(), RatingModel.seedRating(Double.NEGATIVE_INFINITY), EPS);
        }
    }
}
