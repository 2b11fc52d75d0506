package com.roomrank.roomrank_api.service;

import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.model.Season;
import com.roomrank.roomrank_api.repository.SeasonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Season registry. Callers resolve the active season here and pass its id
 * into every league operation.
 */
@Service
public class SeasonService {

    private static final Logger log = LoggerFactory.getLogger(SeasonService.class);

    private final SeasonRepository seasonRepository;

    public SeasonService(SeasonRepository seasonRepository) {
        this.seasonRepository = seasonRepository;
    }

    /** Creates a new active season; any previously active season is deactivated. */
    @Transactional
    public Season createSeason(String name, LocalDateTime startDate, LocalDateTime endDate) {
        if (name == null || name.isBlank()) {
            throw new LeagueException(LeagueError.INVALID_ARGUMENT, "Season name is required");
        }
        if (startDate == null || endDate == null || !endDate.isAfter(startDate)) {
            throw new LeagueException(LeagueError.INVALID_ARGUMENT, "Season end must be after its start");
        }
        if (seasonRepository.findByName(name).isPresent()) {
            throw new LeagueException(LeagueError.INVALID_ARGUMENT, "Season already exists: " + name);
        }

        for (Season previous : seasonRepository.findByActiveTrue()) {
            previous.deactivate();
            log.info("Season {} ({}) deactivated", previous.getId(), previous.getName());
        }

        Season season = seasonRepository.save(new Season(name, startDate, endDate));
        log.info("Season {} ({}) created and active", season.getId(), season.getName());
        return season;
    }

    @Transactional(readOnly = true)
    public Season findActiveSeason() {
        return seasonRepository.findFirstByActiveTrueOrderByStartDateDescIdDesc()
                .orElseThrow(() -> new LeagueException(LeagueError.SEASON_NOT_FOUND, "No active season"));
    }

    @Transactional(readOnly = true)
    public Optional<Season> findByName(String name) {
        return seasonRepository.findByName(name);
    }

    @Transactional(readOnly = true)
    public Season getSeason(Long seasonId) {
        return seasonRepository.findById(seasonId)
                .orElseThrow(() -> LeagueException.notFound(LeagueError.SEASON_NOT_FOUND, "Season", seasonId));
    }
}
