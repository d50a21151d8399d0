package com.cueleague.scoring.service;

import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchStatus;
import com.cueleague.scoring.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Periodically re-derives the aggregate of every open match. Repairs matches
 * whose rows were edited outside the scoring endpoints.
 */
@Service
@RequiredArgsConstructor
public class MatchLifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(MatchLifecycleScheduler.class);
    private static final List<MatchStatus> OPEN_STATUSES = List.of(
            MatchStatus.IN_PROGRESS,
            MatchStatus.TIEBREAKER,
            MatchStatus.AWAITING_VERIFICATION
    );

    private final ScoringRuntimeProperties scoringRuntimeProperties;
    private final MatchRepository matchRepository;
    private final MatchProgressionService matchProgressionService;

    @Scheduled(
            fixedRateString = "${scoring.worker.poll-interval-ms:30000}",
            initialDelayString = "${scoring.worker.initial-delay-ms:5000}"
    )
    public void processLifecycleTick() {
        if (!scoringRuntimeProperties.getWorker().isEnabled()) {
            return;
        }

        int reconciled = 0;
        int failed = 0;
        for (Match match : matchRepository.findByStatusInOrderByUpdatedAtAsc(OPEN_STATUSES)) {
            try {
                if (matchProgressionService.reconcile(match.getMatchId())) {
                    reconciled++;
                }
            } catch (DataAccessException ex) {
                failed++;
                log.warn("Failed to reconcile match {}: {}", match.getMatchId(), ex.getMessage());
            }
        }

        if (reconciled > 0 || failed > 0) {
            log.info("Scoring worker tick: matchesReconciled={}, matchesFailed={}", reconciled, failed);
        } else {
            log.debug("Scoring worker tick completed with no state changes");
        }
    }
}
