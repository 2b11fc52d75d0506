package com.roomrank.roomrank_api.service;

import com.roomrank.roomrank_api.error.LeagueError;
import com.roomrank.roomrank_api.error.LeagueException;
import com.roomrank.roomrank_api.ledger.SettlementEntryRepository;
import com.roomrank.roomrank_api.model.GameSession;
import com.roomrank.roomrank_api.model.SessionStat;
import com.roomrank.roomrank_api.repository.SessionStatRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Refuses to edit a session's outcomes once any of its participants has a
 * rated settlement in a later session (scheduledAt, then id) of the same
 * season: that later settlement already read the rating this edit would change.
 *
 * Conservative by construction. It does not know which later settlement
 * actually depended on which rating; an explicit dependency ledger would be
 * needed for that, and {@code SettlementLedger#recomputeSeason} is the way to
 * repair history after an intentional retroactive change.
 */
@Component
public class EditSafetyGuard {

    private static final Logger log = LoggerFactory.getLogger(EditSafetyGuard.class);

    private final SessionStatRepository statRepository;
    private final SettlementEntryRepository entryRepository;

    public EditSafetyGuard(SessionStatRepository statRepository, SettlementEntryRepository entryRepository) {
        this.statRepository = statRepository;
        this.entryRepository = entryRepository;
    }

    public void verifyEditable(GameSession session) {
        List<Long> participantIds = statRepository.findBySessionIdOrderByParticipantIdAsc(session.getId())
                .stream()
                .map(SessionStat::getParticipantId)
                .toList();
        if (participantIds.isEmpty()) {
            return;
        }

        long later = entryRepository.countLaterRatedSettlements(
                session.getSeasonId(), participantIds, session.getScheduledAt(), session.getId());
        if (later > 0) {
            log.warn("Edit of session {} refused: {} later rated settlements for its participants",
                    session.getId(), later);
            throw new LeagueException(LeagueError.STALE_EDIT,
                    "Session " + session.getId() + " can no longer be edited: " + later
                            + " later settlement(s) already used these ratings");
        }
    }
}
