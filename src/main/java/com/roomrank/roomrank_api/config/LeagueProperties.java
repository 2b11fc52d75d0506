package com.roomrank.roomrank_api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * League rules shared by the entry queue, the session lifecycle and the ledger.
 *
 * roomCapacity bounds the team balancer's exhaustive search (C(n, n/2) subsets),
 * so raising it past ~12 needs a different balancing algorithm.
 */
@ConfigurationProperties(prefix = "roomrank.league")
public record LeagueProperties(
        @DefaultValue("8") int roomCapacity,
        @DefaultValue("10") int winThreshold,
        @DefaultValue("20.0") double kFactor) {

    public LeagueProperties {
        if (roomCapacity <= 0 || roomCapacity % 2 != 0) {
            throw new IllegalArgumentException("room-capacity must be a positive even number: " + roomCapacity);
        }
        if (winThreshold <= 0) {
            throw new IllegalArgumentException("win-threshold must be positive: " + winThreshold);
        }
    }
}
