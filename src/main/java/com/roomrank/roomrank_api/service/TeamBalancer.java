package com.roomrank.roomrank_api.service;

import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a room into two equal teams with the smallest difference in session
 * wins.
 *
 * Exhaustive: every size-n/2 subset is scored, C(n, n/2) in total (70 for a
 * room of 8, 924 for 12, 12870 for 16). Only viable because room capacity is
 * small; re-evaluate before raising it.
 *
 * Subsets are enumerated in lexicographic index order and the first one that
 * reaches the minimum wins, so the result is deterministic for a given seat
 * order. Team A is always the chosen subset.
 */
public final class TeamBalancer {

    private TeamBalancer() {}

    public record Seat(Long participantId, int wins) {}

    public record Split(List<Long> teamA, List<Long> teamB, int imbalance) {}

    public static Split split(List<Seat> seats) {
        int n = seats == null ? 0 : seats.size();
        if (n <= 0 || n % 2 != 0) {
            throw new LeagueException(LeagueError.INVALID_PARTY_SIZE,
                    "Team split needs a positive even number of players, got " + n);
        }

        int half = n / 2;
        int total = 0;
        for (Seat seat : seats) {
            total += seat.wins();
        }

        int[] subset = new int[half];
        for (int i = 0; i < half; i++) {
            subset[i] = i;
        }

        int[] best = subset.clone();
        int bestDiff = Integer.MAX_VALUE;

        while (true) {
            int sum = 0;
            for (int index : subset) {
                sum += seats.get(index).wins();
            }
            int diff = Math.abs(total - 2 * sum);
            if (diff < bestDiff) {
                bestDiff = diff;
                best = subset.clone();
                if (diff == 0) break; // nothing later can be strictly better
            }

            // Advance to the next combination in lexicographic order
            int i = half - 1;
            while (i >= 0 && subset[i] == i + n - half) {
                i--;
            }
            if (i < 0) break;
            subset[i]++;
            for (int j = i + 1; j < half; j++) {
                subset[j] = subset[j - 1] + 1;
            }
        }

        boolean[] inA = new boolean[n];
        for (int index : best) {
            inA[index] = true;
        }
        List<Long> teamA = new ArrayList<>(half);
        List<Long> teamB = new ArrayList<>(half);
        for (int i = 0; i < n; i++) {
            (inA[i] ? teamA : teamB).add(seats.get(i).participantId());
        }
        return new Split(List.copyOf(teamA), List.copyOf(teamB), bestDiff);
    }
}
