package com.roomrank.roomrank_api.service;

import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.ledger.SeasonScore;
import com.roomrank.roomrank_api.ledger.SeasonScoreRepository;
import com.roomrank.roomrank_api.model.Participant;
import com.roomrank.roomrank_api.repository.ParticipantRepository;
import com.roomrank.roomrank_api.repository.SeasonRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Read-only season standings. Ranks are 1-based; ties still get distinct ranks. */
@Service
public class LeaderboardService {

    private final SeasonRepository seasonRepository;
    private final SeasonScoreRepository scoreRepository;
    private final ParticipantRepository participantRepository;

    public LeaderboardService(SeasonRepository seasonRepository,
                              SeasonScoreRepository scoreRepository,
                              ParticipantRepository participantRepository) {
        this.seasonRepository = seasonRepository;
        this.scoreRepository = scoreRepository;
        this.participantRepository = participantRepository;
    }

    @Transactional(readOnly = true)
    public List<Standing> standings(Long seasonId) {
        seasonRepository.findById(seasonId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SEASON_NOT_FOUND, "Season", seasonId));

        List<SeasonScore> scores = scoreRepository.findStandings(seasonId);
        Map<Long, String> names = new HashMap<>();
        for (Participant participant : participantRepository.findAllById(
                scores.stream().map(SeasonScore::getParticipantId).toList())) {
            names.put(participant.getId(), participant.getDisplayName());
        }

        List<Standing> standings = new ArrayList<>(scores.size());
        int rank = 1;
        for (SeasonScore score : scores) {
            standings.add(new Standing(rank++, score.getParticipantId(),
                    names.getOrDefault(score.getParticipantId(), "(uid:" + score.getParticipantId() + ")"),
                    score.getTotalPoints(), score.getEntryPoints(), score.getWinPoints(), score.getRating()));
        }
        return standings;
    }

    public record Standing(int rank, Long participantId, String displayName,
                           double totalPoints, double entryPoints, int winPoints, double rating) {}
}
